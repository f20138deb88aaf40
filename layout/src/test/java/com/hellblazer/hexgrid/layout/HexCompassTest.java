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
import com.hellblazer.hexgrid.geometry.HexDirection;
import com.hellblazer.hexgrid.geometry.InvalidDirectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hellblazer.hexgrid.layout.ClockFaceTest.angularDifference;
import static com.hellblazer.hexgrid.layout.ClockFaceTest.screenAngle;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HexCompassTest {

    @Test
    public void testPoints() {
        assertEquals(List.of(CompassPoint.NE, CompassPoint.E, CompassPoint.SE, CompassPoint.SW, CompassPoint.W,
                             CompassPoint.NW), HexCompass.of(Orientation.POINTY).points());
        assertEquals(List.of(CompassPoint.N, CompassPoint.NE, CompassPoint.SE, CompassPoint.S, CompassPoint.SW,
                             CompassPoint.NW), HexCompass.of(Orientation.FLAT).points());
        assertSame(HexCompass.POINTY, HexCompass.of(Orientation.custom(1, 0, 0, 1, 0)));
    }

    @Test
    public void testDirections() {
        var pointy = HexCompass.POINTY;
        assertEquals(HexDirection.EAST, pointy.at(CompassPoint.E));
        assertEquals(new Hex(0, -1, 1), pointy.at(CompassPoint.NW).vector());
        assertEquals(new Hex(0, 1, -1), pointy.at(CompassPoint.SE).vector());
        assertThrows(InvalidDirectionException.class, () -> pointy.at(CompassPoint.N));
        assertFalse(pointy.has(CompassPoint.S));

        var flat = HexCompass.FLAT;
        assertEquals(new Hex(0, -1, 1), flat.at(CompassPoint.N).vector());
        assertEquals(new Hex(1, 0, -1), flat.at(CompassPoint.SE).vector());
        assertEquals(new Hex(-1, 0, 1), flat.at(CompassPoint.NW).vector());
        assertThrows(InvalidDirectionException.class, () -> flat.at(CompassPoint.E));
        assertThrows(InvalidDirectionException.class, () -> flat.at(CompassPoint.W));

        assertEquals(Hex.of(3, -4), flat.neighbor(Hex.of(3, -3), CompassPoint.N));
        for (var direction : HexDirection.values()) {
            assertEquals(direction, flat.at(flat.pointOf(direction)));
            assertEquals(direction, pointy.at(pointy.pointOf(direction)));
        }
    }

    @Test
    @DisplayName("Compass labels point the way the neighbors are drawn")
    public void testLabelsMatchScreenGeometry() {
        for (var orientation : List.of(Orientation.POINTY, Orientation.FLAT)) {
            var layout = Layout.builder().withOrientation(orientation).withSize(7).build();
            var compass = HexCompass.of(orientation);
            for (var point : compass.points()) {
                double nominal = point.ordinal() * 45.0;
                double drawn = screenAngle(layout, compass.at(point).vector());
                assertTrue(angularDifference(nominal, drawn) <= 15.0 + 1e-9,
                           orientation + " " + point + " drawn at " + drawn);
            }
        }
    }
}
