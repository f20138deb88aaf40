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
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HexMap Property-Based Tests")
class HexMapPropertyTest {

    @Property
    @Label("Stored values are found until removed")
    void putGetRemove(@ForAll("hexLists") List<Hex> hexes, @ForAll int value) {
        var map = HexMap.<Integer>empty();
        for (var hex : hexes) {
            map.put(hex, value);
        }
        assertEquals(new HashSet<>(hexes).size(), map.size());
        for (var hex : hexes) {
            assertEquals(value, map.get(hex));
        }
        for (var hex : hexes) {
            map.remove(hex);
            assertFalse(map.contains(hex));
            assertThrows(HexNotFoundException.class, () -> map.get(hex));
        }
        assertTrue(map.isEmpty());
    }

    @Property
    @Label("Union and intersection sizes obey inclusion-exclusion")
    void inclusionExclusion(@ForAll("hexLists") List<Hex> first, @ForAll("hexLists") List<Hex> second) {
        var a = HexMap.of(first, "a");
        var b = HexMap.of(second, "b");
        var union = a.union(b);
        var intersection = a.intersection(b);
        assertEquals(a.size() + b.size() - intersection.size(), union.size());
        assertEquals(union.size() - intersection.size(), a.symmetricDifference(b).size());
        assertEquals(a.size() - intersection.size(), a.difference(b).size());
        assertEquals(union.hexes(), b.union(a).hexes());
        assertEquals(intersection.hexes(), b.intersection(a).hexes());
    }

    @Property
    @Label("Shifting there and back is the identity")
    void shiftInverse(@ForAll("hexLists") List<Hex> hexes, @ForAll @IntRange(min = -50, max = 50) int q,
                      @ForAll @IntRange(min = -50, max = 50) int r) {
        var map = HexMap.of(hexes, 1);
        var offset = Hex.of(q, r);
        assertEquals(map, map.shifted(offset).shifted(offset.negate()));
        map.bounds().ifPresent(bounds -> {
            var shifted = map.shifted(offset).bounds().orElseThrow();
            assertEquals(bounds.minQ() + q, shifted.minQ());
            assertEquals(bounds.maxR() + r, shifted.maxR());
        });
    }

    @Property
    @Label("Every stored hex lies within the bounds")
    void boundsContainAll(@ForAll("hexLists") List<Hex> hexes) {
        var map = HexMap.of(hexes, 0);
        map.bounds().ifPresent(bounds -> {
            for (var hex : map.hexes()) {
                assertTrue(bounds.contains(hex));
            }
            assertEquals(map.size(), map.within(bounds).size());
        });
        assertEquals(hexes.isEmpty(), map.bounds().isEmpty());
    }

    @Provide
    Arbitrary<List<Hex>> hexLists() {
        var coordinates = Arbitraries.integers().between(-6, 6);
        return Combinators.combine(coordinates, coordinates).as(Hex::of).list().ofMaxSize(40);
    }
}
