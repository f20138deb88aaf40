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

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;

import java.util.ArrayList;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hex Property-Based Tests")
class HexPropertyTest {

    @Property
    @Label("Results of arithmetic satisfy the zero sum invariant")
    void zeroSumIsPreserved(@ForAll("hexes") Hex a, @ForAll("hexes") Hex b, @ForAll @IntRange(min = -50, max = 50) int k) {
        for (var hex : new Hex[] { a.add(b), a.subtract(b), a.multiply(k), a.negate(), a.rotateLeft(k),
                                   a.reflect(HexAxis.R) }) {
            assertEquals(0, hex.q() + hex.r() + hex.s());
        }
    }

    @Property
    @Label("Origin is the additive identity")
    void additiveIdentity(@ForAll("hexes") Hex a) {
        assertEquals(a, a.add(Hex.ORIGIN));
        assertEquals(Hex.ORIGIN, a.subtract(a));
        assertEquals(Hex.ORIGIN, a.add(a.negate()));
    }

    @Property
    @Label("Addition is commutative and associative")
    void additionLaws(@ForAll("hexes") Hex a, @ForAll("hexes") Hex b, @ForAll("hexes") Hex c) {
        assertEquals(a.add(b), b.add(a));
        assertEquals(a.add(b).add(c), a.add(b.add(c)));
    }

    @Property
    @Label("Six rotations return to the start")
    void rotationClosure(@ForAll("hexes") Hex a, @ForAll int n) {
        assertEquals(a, a.rotateLeft(6));
        assertEquals(a, a.rotateRight(6));
        assertEquals(a.rotateLeft(n), a.rotateLeft(Math.floorMod(n, 6)));
        assertEquals(a, a.rotateLeft(n).rotateRight(n));
        assertEquals(a.length(), a.rotateLeft(n).length());
    }

    @Property
    @Label("Closed form rotation agrees with repeated single steps")
    void rotationSteps(@ForAll("hexes") Hex a, @ForAll @IntRange(min = 0, max = 12) int n) {
        var left = a;
        var right = a;
        for (int i = 0; i < n; i++) {
            left = left.rotateLeft();
            right = right.rotateRight();
        }
        assertEquals(left, a.rotateLeft(n));
        assertEquals(right, a.rotateRight(n));
    }

    @Property
    @Label("Reflection is an involution")
    void reflectionInvolution(@ForAll("hexes") Hex a, @ForAll HexAxis axis) {
        assertEquals(a, a.reflect(axis).reflect(axis));
        assertEquals(a.coordinate(axis), a.reflect(axis).coordinate(axis));
    }

    @Property
    @Label("Distance is a metric")
    void distanceIsMetric(@ForAll("hexes") Hex a, @ForAll("hexes") Hex b, @ForAll("hexes") Hex c) {
        assertEquals(a.distanceTo(b), b.distanceTo(a));
        assertTrue(a.distanceTo(b) >= 0);
        assertEquals(0, a.distanceTo(a));
        assertTrue(a.distanceTo(c) <= a.distanceTo(b) + b.distanceTo(c));
    }

    @Property
    @Label("Rounding recovers the nearest hex")
    void roundingRecoversHex(@ForAll("hexes") Hex a, @ForAll @DoubleRange(min = -0.24, max = 0.24) double dq,
                             @ForAll @DoubleRange(min = -0.24, max = 0.24) double dr) {
        var perturbed = new FractionalHex(a.q() + dq, a.r() + dr, a.s() - dq - dr);
        assertEquals(a, perturbed.round());
    }

    @Property(tries = 50)
    @Label("Rings and ranges have the expected cardinality")
    void ringAndRangeCardinality(@ForAll("hexes") Hex center, @ForAll @IntRange(min = 0, max = 15) int k) {
        var ring = center.ring(k);
        assertEquals(k == 0 ? 1 : 6 * k, ring.size());
        assertEquals(ring.size(), new HashSet<>(ring).size());
        assertEquals(3 * k * (k + 1) + 1, center.range(k).size());
    }

    @Property(tries = 100)
    @Label("Lines join their endpoints through adjacent hexes")
    void lineIsContiguous(@ForAll("smallHexes") Hex a, @ForAll("smallHexes") Hex b) {
        var line = new ArrayList<Hex>();
        a.lineTo(b).forEach(line::add);
        assertEquals(a.distanceTo(b) + 1, line.size());
        assertEquals(a, line.get(0));
        assertEquals(b, line.get(line.size() - 1));
        for (int i = 1; i < line.size(); i++) {
            assertTrue(line.get(i - 1).isNeighbor(line.get(i)));
        }
    }

    @Provide
    Arbitrary<Hex> hexes() {
        var coordinates = Arbitraries.integers().between(-1000, 1000);
        return Combinators.combine(coordinates, coordinates).as(Hex::of);
    }

    @Provide
    Arbitrary<Hex> smallHexes() {
        var coordinates = Arbitraries.integers().between(-30, 30);
        return Combinators.combine(coordinates, coordinates).as(Hex::of);
    }
}
