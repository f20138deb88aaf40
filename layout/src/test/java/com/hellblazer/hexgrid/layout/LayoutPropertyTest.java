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

package com.hellblazer.hexgrid.layout;

import com.hellblazer.hexgrid.geometry.Hex;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Layout Property-Based Tests")
class LayoutPropertyTest {

    @Property
    @Label("Pixel conversion round trips under both orientations")
    void pixelRoundTrip(@ForAll("hexes") Hex hex, @ForAll("regular") Orientation orientation,
                        @ForAll @DoubleRange(min = 1.0, max = 100.0) double sizeX,
                        @ForAll @DoubleRange(min = 1.0, max = 100.0) double sizeY,
                        @ForAll @DoubleRange(min = -1000.0, max = 1000.0) double originX,
                        @ForAll @DoubleRange(min = -1000.0, max = 1000.0) double originY) {
        var layout = Layout.builder()
                           .withOrientation(orientation)
                           .withSize(sizeX, sizeY)
                           .withOrigin(originX, originY)
                           .build();
        var point = layout.toPoint(hex);
        assertEquals(hex, layout.toHex(point.x, point.y));
        assertTrue(hex.toFractional().approximately(layout.toFractionalHex(point), 1e-6));
    }

    @Property
    @Label("Neighbor centers are one spacing apart")
    void neighborSpacing(@ForAll("hexes") Hex hex, @ForAll("regular") Orientation orientation) {
        var layout = Layout.builder().withOrientation(orientation).withSize(10).build();
        var center = layout.toPoint(hex);
        for (var neighbor : hex.neighbors()) {
            assertEquals(10 * Math.sqrt(3.0), center.distance(layout.toPoint(neighbor)), 1e-6);
        }
    }

    @Provide
    Arbitrary<Hex> hexes() {
        var coordinates = Arbitraries.integers().between(-500, 500);
        return Combinators.combine(coordinates, coordinates).as(Hex::of);
    }

    @Provide
    Arbitrary<Orientation> regular() {
        return Arbitraries.of(Orientation.POINTY, Orientation.FLAT);
    }
}
