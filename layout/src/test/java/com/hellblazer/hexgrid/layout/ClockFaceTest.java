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
import com.hellblazer.hexgrid.geometry.HexClock;
import com.hellblazer.hexgrid.geometry.InvalidDirectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ClockFaceTest {

    /**
     * Screen angle of a vector, degrees clockwise from straight up; pixel y grows downward.
     */
    static double screenAngle(Layout layout, Hex vector) {
        var from = layout.toPoint(Hex.ORIGIN);
        var to = layout.toPoint(vector);
        double degrees = Math.toDegrees(Math.atan2(to.x - from.x, from.y - to.y));
        return degrees < 0 ? degrees + 360.0 : degrees;
    }

    static double angularDifference(double a, double b) {
        double d = Math.abs(a - b) % 360.0;
        return d > 180.0 ? 360.0 - d : d;
    }

    @Test
    public void testFaceHours() {
        assertEquals(3, ClockFace.faceHour(3, Orientation.POINTY));
        assertEquals(4, ClockFace.faceHour(3, Orientation.FLAT));
        assertEquals(1, ClockFace.faceHour(12, Orientation.FLAT));
        assertEquals(12, ClockFace.hourAtFace(1, Orientation.FLAT));
        assertEquals(5, ClockFace.faceHour(5, Orientation.custom(1, 0, 0, 1, 0)));
        assertEquals(5, ClockFace.hourAtFace(5, Orientation.custom(1, 0, 0, 1, 0)));
        assertEquals(12, ClockFace.hourAtFace(12, Orientation.POINTY));
        assertThrows(InvalidDirectionException.class, () -> ClockFace.faceHour(0, Orientation.POINTY));
        assertThrows(InvalidDirectionException.class, () -> ClockFace.hourAtFace(13, Orientation.FLAT));
    }

    @Test
    public void testFaceInverse() {
        for (var orientation : List.of(Orientation.POINTY, Orientation.FLAT)) {
            for (int hour = 1; hour <= 12; hour++) {
                int face = ClockFace.faceHour(hour, orientation);
                assertEquals(hour, ClockFace.hourAtFace(face, orientation));
                assertEquals(HexClock.hour(hour), ClockFace.atFace(face, orientation));
            }
        }
    }

    @Test
    @DisplayName("Face hours match where the vectors are drawn")
    public void testFaceMatchesScreenGeometry() {
        for (var orientation : List.of(Orientation.POINTY, Orientation.FLAT)) {
            var layout = Layout.builder().withOrientation(orientation).withSize(10).withOrigin(50, 50).build();
            for (int hour = 1; hour <= 12; hour++) {
                int face = ClockFace.faceHour(hour, orientation);
                double angle = screenAngle(layout, HexClock.hour(hour));
                assertEquals(0.0, angularDifference(face * 30.0, angle), 1e-9,
                             orientation + " hour " + hour + " drawn at " + angle);
            }
        }
    }

    @Test
    public void testNeighborAtFace() {
        var hex = Hex.of(2, -3);
        assertEquals(hex.neighbor(0), ClockFace.neighborAtFace(hex, 3, Orientation.POINTY));
        assertEquals(hex.neighbor(0), ClockFace.neighborAtFace(hex, 4, Orientation.FLAT));
        assertEquals(hex.clockNeighbor(12), ClockFace.neighborAtFace(hex, 1, Orientation.FLAT));
    }
}
