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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Inclusive minimum and maximum of each cube coordinate over a set of hexes. The region it describes is a hexagon
 * with possibly unequal sides.
 *
 * @author hal.hildebrand
 */
public record HexBounds(int minQ, int maxQ, int minR, int maxR, int minS, int maxS) {

    public HexBounds {
        if (minQ > maxQ || minR > maxR || minS > maxS) {
            throw new IllegalArgumentException(
            String.format("Empty bounds q[%d, %d] r[%d, %d] s[%d, %d]", minQ, maxQ, minR, maxR, minS, maxS));
        }
    }

    /**
     * @return the bounds of the hexes, or empty if there are none
     */
    public static Optional<HexBounds> of(Iterable<Hex> hexes) {
        int minQ = Integer.MAX_VALUE, minR = Integer.MAX_VALUE, minS = Integer.MAX_VALUE;
        int maxQ = Integer.MIN_VALUE, maxR = Integer.MIN_VALUE, maxS = Integer.MIN_VALUE;
        boolean any = false;
        for (var hex : hexes) {
            any = true;
            minQ = Math.min(minQ, hex.q());
            maxQ = Math.max(maxQ, hex.q());
            minR = Math.min(minR, hex.r());
            maxR = Math.max(maxR, hex.r());
            minS = Math.min(minS, hex.s());
            maxS = Math.max(maxS, hex.s());
        }
        return any ? Optional.of(new HexBounds(minQ, maxQ, minR, maxR, minS, maxS)) : Optional.empty();
    }

    public boolean contains(Hex hex) {
        return hex.q() >= minQ && hex.q() <= maxQ && hex.r() >= minR && hex.r() <= maxR && hex.s() >= minS
        && hex.s() <= maxS;
    }

    /**
     * @return every hex inside the bounds, ordered by q then r
     */
    public List<Hex> hexes() {
        var result = new ArrayList<Hex>();
        for (int q = minQ; q <= maxQ; q++) {
            int low = Math.max(minR, -q - maxS);
            int high = Math.min(maxR, -q - minS);
            for (int r = low; r <= high; r++) {
                result.add(Hex.of(q, r));
            }
        }
        return result;
    }

    public HexBounds union(HexBounds other) {
        return new HexBounds(Math.min(minQ, other.minQ), Math.max(maxQ, other.maxQ), Math.min(minR, other.minR),
                             Math.max(maxR, other.maxR), Math.min(minS, other.minS), Math.max(maxS, other.maxS));
    }

    /**
     * @return these bounds grown by the margin on every side
     */
    public HexBounds expand(int margin) {
        return new HexBounds(minQ - margin, maxQ + margin, minR - margin, maxR + margin, minS - margin,
                             maxS + margin);
    }
}
