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
import java.util.List;

/**
 * Clock addressing of the twelve cells around a hex. Odd hours name the six adjacent cells ({@link HexDirection}),
 * even hours the six diagonal cells ({@link HexDiagonal}). The mapping from hour to vector does not depend on the
 * layout; how the hours appear on screen is the layout's concern.
 *
 * @author hal.hildebrand
 */
public final class HexClock {

    public static final int HOURS = 12;

    private HexClock() {
    }

    /**
     * @param hour 1 through 12
     * @return the offset vector at that hour
     * @throws InvalidDirectionException if the hour is outside 1-12
     */
    public static Hex hour(int hour) {
        if (hour < 1 || hour > HOURS) {
            throw new InvalidDirectionException("Clock hour must be 1-12, got: " + hour);
        }
        return isDirect(hour) ? HexDirection.atHour(hour).vector() : HexDiagonal.atHour(hour).vector();
    }

    /**
     * @return true if the hour names an adjacent cell rather than a diagonal one
     */
    public static boolean isDirect(int hour) {
        return (hour & 1) == 1;
    }

    /**
     * Answer the hour of a unit direction or diagonal vector
     *
     * @throws InvalidDirectionException if the vector is neither
     */
    public static int hourOf(Hex vector) {
        for (var direction : HexDirection.values()) {
            if (direction.vector().equals(vector)) {
                return direction.hour();
            }
        }
        for (var diagonal : HexDiagonal.values()) {
            if (diagonal.vector().equals(vector)) {
                return diagonal.hour();
            }
        }
        throw new InvalidDirectionException("Not a clock vector: " + vector);
    }

    /**
     * Normalize any integer onto the clock, so 0 is 12, 13 is 1 and -1 is 11.
     */
    public static int normalize(int hour) {
        int h = Math.floorMod(hour, HOURS);
        return h == 0 ? HOURS : h;
    }

    /**
     * @return the twelve vectors, hours 1 through 12
     */
    public static List<Hex> vectors() {
        var result = new ArrayList<Hex>(HOURS);
        for (int h = 1; h <= HOURS; h++) {
            result.add(hour(h));
        }
        return result;
    }
}
