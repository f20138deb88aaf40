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

package com.hellblazer.hexgrid.map;

import com.hellblazer.hexgrid.geometry.Hex;
import com.hellblazer.hexgrid.geometry.HexAxis;
import com.hellblazer.hexgrid.geometry.HexTraversal;
import com.hellblazer.hexgrid.geometry.InvalidRadiusException;
import com.hellblazer.hexgrid.layout.Orientation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Generators for the canonical map shapes. Each returns its hexes in a fixed order without duplicates, so maps built
 * from them iterate reproducibly.
 *
 * @author hal.hildebrand
 */
public final class HexShapes {

    private HexShapes() {
    }

    /**
     * The filled hexagon of the radius around the center, in spiral order. {@code hexagon(origin, 2)} holds 19
     * hexes.
     */
    public static List<Hex> hexagon(Hex center, int radius) {
        return hexagon(center, radius, false);
    }

    /**
     * @param hollow only the outermost ring
     */
    public static List<Hex> hexagon(Hex center, int radius, boolean hollow) {
        return hollow ? HexTraversal.ring(center, radius) : HexTraversal.spiral(center, radius);
    }

    public static List<Hex> rectangle(int width, int height) {
        return rectangle(width, height, Orientation.POINTY, false);
    }

    public static List<Hex> rectangle(int width, int height, Orientation orientation) {
        return rectangle(width, height, orientation, false);
    }

    /**
     * A rectangle of width columns and height rows on screen, with its first cell at the origin.
     *
     * @throws InvalidRadiusException if either dimension is negative
     */
    public static List<Hex> rectangle(int width, int height, Orientation orientation, boolean hollow) {
        requireSize(width);
        requireSize(height);
        if (width == 0 || height == 0) {
            return List.of();
        }
        return rectangle(0, width - 1, 0, height - 1, orientation, hollow);
    }

    /**
     * A rectangle in offset coordinates: columns left through right, rows top through bottom. Pointy-top
     * rectangles are built row by row, flat-top ones column by column; custom orientations are treated as pointy.
     */
    public static List<Hex> rectangle(int left, int right, int top, int bottom, Orientation orientation,
                                      boolean hollow) {
        if (left > right || top > bottom) {
            throw new IllegalArgumentException(
            String.format("Empty rectangle: columns [%d, %d], rows [%d, %d]", left, right, top, bottom));
        }
        var result = new LinkedHashSet<Hex>();
        if (orientation.isFlat()) {
            for (int q = left; q <= right; q++) {
                int offset = Math.floorDiv(q, 2);
                boolean edge = q == left || q == right;
                for (int r = top - offset; r <= bottom - offset; r++) {
                    if (!hollow || edge || r == top - offset || r == bottom - offset) {
                        result.add(Hex.of(q, r));
                    }
                }
            }
        } else {
            for (int r = top; r <= bottom; r++) {
                int offset = Math.floorDiv(r, 2);
                boolean edge = r == top || r == bottom;
                for (int q = left - offset; q <= right - offset; q++) {
                    if (!hollow || edge || q == left - offset || q == right - offset) {
                        result.add(Hex.of(q, r));
                    }
                }
            }
        }
        return new ArrayList<>(result);
    }

    public static List<Hex> square(int size) {
        return rectangle(size, size);
    }

    public static List<Hex> square(int size, Orientation orientation, boolean hollow) {
        return rectangle(size, size, orientation, hollow);
    }

    public static List<Hex> parallelogram(HexAxis first, int firstMin, int firstMax, HexAxis second, int secondMin,
                                          int secondMax) {
        return parallelogram(first, firstMin, firstMax, second, secondMin, secondMax, false);
    }

    /**
     * The hexes whose first axis coordinate lies in [firstMin, firstMax] and second in [secondMin, secondMax].
     *
     * @param hollow only the four sides
     * @throws IllegalArgumentException if the axes are the same or a range is empty
     */
    public static List<Hex> parallelogram(HexAxis first, int firstMin, int firstMax, HexAxis second, int secondMin,
                                          int secondMax, boolean hollow) {
        if (first == second) {
            throw new IllegalArgumentException("Parallelogram axes must be distinct, got " + first + " twice");
        }
        if (firstMin > firstMax || secondMin > secondMax) {
            throw new IllegalArgumentException(
            String.format("Empty parallelogram: %s[%d, %d], %s[%d, %d]", first, firstMin, firstMax, second,
                          secondMin, secondMax));
        }
        var result = new LinkedHashSet<Hex>();
        for (int a = firstMin; a <= firstMax; a++) {
            boolean edge = a == firstMin || a == firstMax;
            for (int b = secondMin; b <= secondMax; b++) {
                if (!hollow || edge || b == secondMin || b == secondMax) {
                    result.add(Hex.withAxes(first, a, second, b));
                }
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * The parallelogram spanning -size through size on both axes, centered on the origin.
     */
    public static List<Hex> parallelogram(HexAxis first, HexAxis second, int size) {
        requireSize(size);
        return parallelogram(first, -size, size, second, -size, size);
    }

    /**
     * The rhombus with sides of size + 1 hexes and one corner at the origin.
     */
    public static List<Hex> rhombus(HexAxis first, HexAxis second, int size) {
        requireSize(size);
        return parallelogram(first, 0, size, second, 0, size);
    }

    /**
     * The triangle with corners (0, 0), (size, 0) and (0, size) in axial coordinates.
     */
    public static List<Hex> triangle(int size) {
        requireSize(size);
        var result = new ArrayList<Hex>((size + 1) * (size + 2) / 2);
        for (int q = 0; q <= size; q++) {
            for (int r = 0; r <= size - q; r++) {
                result.add(Hex.of(q, r));
            }
        }
        return result;
    }

    /**
     * The triangle with corners (size, 0), (0, size) and (size, size) in axial coordinates.
     */
    public static List<Hex> invertedTriangle(int size) {
        requireSize(size);
        var result = new ArrayList<Hex>((size + 1) * (size + 2) / 2);
        for (int q = 0; q <= size; q++) {
            for (int r = size - q; r <= size; r++) {
                result.add(Hex.of(q, r));
            }
        }
        return result;
    }

    /**
     * The closed outline through the corners.
     */
    public static List<Hex> polygon(List<Hex> corners) {
        return HexTraversal.outline(corners);
    }

    static void requireSize(int size) {
        if (size < 0) {
            throw new InvalidRadiusException("Shape size must not be negative, got: " + size);
        }
    }
}
