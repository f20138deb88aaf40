/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.hexgrid.geometry;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumeration of hexes along lines, rings, filled ranges and spirals.
 *
 * @author hal.hildebrand
 */
public final class HexTraversal {

    /** Rings start at center + radius * this direction, then walk the directions in index order */
    private static final HexDirection RING_START = HexDirection.SOUTH_WEST;

    private HexTraversal() {
    }

    /**
     * The hexes on the straight line between two hexes, both endpoints included. Both endpoints are nudged by
     * {@link FractionalHex#NUDGE} before sampling so samples on a cell edge round consistently. The result is lazy and
     * may be iterated any number of times.
     *
     * @return distance + 1 hexes, each adjacent to the previous
     */
    public static Iterable<Hex> line(Hex from, Hex to) {
        Hex.requireOperand(from, "draw a line from");
        Hex.requireOperand(to, "draw a line to");
        return () -> new LineIterator(from, to);
    }

    public static Stream<Hex> lineStream(Hex from, Hex to) {
        return StreamSupport.stream(line(from, to).spliterator(), false);
    }

    /**
     * The hexes at exactly the given distance from the center.
     *
     * @return 6 * radius hexes, or just the center for radius 0
     * @throws InvalidRadiusException if the radius is negative
     */
    public static List<Hex> ring(Hex center, int radius) {
        requireRadius(radius);
        Hex.requireOperand(center, "ring");
        if (radius == 0) {
            return List.of(center);
        }
        var result = new ArrayList<Hex>(6 * radius);
        var hex = center.add(RING_START.vector().multiply(radius));
        for (var direction : HexDirection.values()) {
            for (int step = 0; step < radius; step++) {
                result.add(hex);
                hex = hex.neighbor(direction);
            }
        }
        return result;
    }

    /**
     * All hexes within the given distance of the center, ordered by q then r.
     *
     * @return 3 * radius * (radius + 1) + 1 hexes
     * @throws InvalidRadiusException if the radius is negative
     */
    public static List<Hex> range(Hex center, int radius) {
        requireRadius(radius);
        Hex.requireOperand(center, "range");
        var result = new ArrayList<Hex>(3 * radius * (radius + 1) + 1);
        for (int dq = -radius; dq <= radius; dq++) {
            int low = Math.max(-radius, -dq - radius);
            int high = Math.min(radius, -dq + radius);
            for (int dr = low; dr <= high; dr++) {
                result.add(Hex.of(center.q() + dq, center.r() + dr));
            }
        }
        return result;
    }

    /**
     * Rings 0 through radius, concatenated.
     *
     * @throws InvalidRadiusException if the radius is negative
     */
    public static List<Hex> spiral(Hex center, int radius) {
        requireRadius(radius);
        var result = new ArrayList<Hex>(3 * radius * (radius + 1) + 1);
        for (int k = 0; k <= radius; k++) {
            result.addAll(ring(center, k));
        }
        return result;
    }

    /**
     * The hexes within firstRadius of first and within secondRadius of second, ordered by q then r. Empty when the
     * ranges do not overlap.
     */
    public static List<Hex> intersectRanges(Hex first, int firstRadius, Hex second, int secondRadius) {
        requireRadius(firstRadius);
        requireRadius(secondRadius);
        Hex.requireOperand(first, "intersect");
        Hex.requireOperand(second, "intersect");
        int qMin = Math.max(first.q() - firstRadius, second.q() - secondRadius);
        int qMax = Math.min(first.q() + firstRadius, second.q() + secondRadius);
        int rMin = Math.max(first.r() - firstRadius, second.r() - secondRadius);
        int rMax = Math.min(first.r() + firstRadius, second.r() + secondRadius);
        int sMin = Math.max(first.s() - firstRadius, second.s() - secondRadius);
        int sMax = Math.min(first.s() + firstRadius, second.s() + secondRadius);
        var result = new ArrayList<Hex>();
        for (int q = qMin; q <= qMax; q++) {
            int low = Math.max(rMin, -q - sMax);
            int high = Math.min(rMax, -q - sMin);
            for (int r = low; r <= high; r++) {
                result.add(Hex.of(q, r));
            }
        }
        return result;
    }

    /**
     * The closed outline through the given corners: lines between consecutive corners and from the last back to the
     * first, without duplicates, in drawing order.
     */
    public static List<Hex> outline(List<Hex> corners) {
        if (corners == null) {
            throw new UnsupportedOperandException("Cannot outline a null corner list");
        }
        var result = new LinkedHashSet<Hex>();
        int n = corners.size();
        if (n == 1) {
            result.add(Hex.requireOperand(corners.get(0), "outline"));
        }
        for (int i = 0; n > 1 && i < n; i++) {
            for (var hex : line(corners.get(i), corners.get((i + 1) % n))) {
                result.add(hex);
            }
        }
        return new ArrayList<>(result);
    }

    static void requireRadius(int radius) {
        if (radius < 0) {
            throw new InvalidRadiusException("Radius must not be negative, got: " + radius);
        }
    }

    private static final class LineIterator implements Iterator<Hex> {
        private final FractionalHex start;
        private final FractionalHex end;
        private final int          steps;
        private       int          i;

        private LineIterator(Hex from, Hex to) {
            this.start = from.toFractional().nudged();
            this.end = to.toFractional().nudged();
            this.steps = from.distanceTo(to);
        }

        @Override
        public boolean hasNext() {
            return i <= steps;
        }

        @Override
        public Hex next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            double t = (double) i++ / Math.max(steps, 1);
            return FractionalHex.lerp(start, end, t).round();
        }
    }
}
