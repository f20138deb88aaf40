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

import java.util.List;

/**
 * The six unit cube vectors leading to the directly adjacent cells, in counterclockwise order starting with
 * {@code (1, 0, -1)}.
 * <p>
 * Each direction is addressable by its ordinal index (0-5) and by its odd clock hour. The index to vector mapping is
 * independent of any layout; the constant names describe where the vector points on a pointy-top layout. A flat-top
 * layout shows the same vectors one clock hour further clockwise.
 *
 * @author hal.hildebrand
 */
public enum HexDirection {
    EAST(1, 0, -1, 3),
    NORTH_EAST(1, -1, 0, 1),
    NORTH_WEST(0, -1, 1, 11),
    WEST(-1, 0, 1, 9),
    SOUTH_WEST(-1, 1, 0, 7),
    SOUTH_EAST(0, 1, -1, 5);

    public static final int COUNT = 6;

    private static final HexDirection[] VALUES = values();

    private final Hex vector;
    private final int hour;

    HexDirection(int q, int r, int s, int hour) {
        this.vector = new Hex(q, r, s);
        this.hour = hour;
    }

    /**
     * Answer the direction with the given ordinal index
     *
     * @param index - 0 through 5
     * @throws InvalidDirectionException if the index is out of range
     */
    public static HexDirection of(int index) {
        if (index < 0 || index >= COUNT) {
            throw new InvalidDirectionException("Direction index must be 0-5, got: " + index);
        }
        return VALUES[index];
    }

    /**
     * Answer the direction at the given clock hour
     *
     * @param hour - one of 1, 3, 5, 7, 9, 11
     * @throws InvalidDirectionException if no direction sits at that hour
     */
    public static HexDirection atHour(int hour) {
        for (var direction : VALUES) {
            if (direction.hour == hour) {
                return direction;
            }
        }
        throw new InvalidDirectionException("Directions occupy the odd hours 1-11, got: " + hour);
    }

    /**
     * @return the six direction vectors in index order
     */
    public static List<Hex> vectors() {
        return List.of(EAST.vector, NORTH_EAST.vector, NORTH_WEST.vector, WEST.vector, SOUTH_WEST.vector,
                       SOUTH_EAST.vector);
    }

    public int hour() {
        return hour;
    }

    public int index() {
        return ordinal();
    }

    /**
     * @return the next direction counterclockwise
     */
    public HexDirection next() {
        return VALUES[(ordinal() + 1) % COUNT];
    }

    public HexDirection opposite() {
        return VALUES[(ordinal() + 3) % COUNT];
    }

    /**
     * @return the next direction clockwise
     */
    public HexDirection previous() {
        return VALUES[(ordinal() + COUNT - 1) % COUNT];
    }

    public Hex vector() {
        return vector;
    }
}
