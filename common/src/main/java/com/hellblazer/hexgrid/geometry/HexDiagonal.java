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
 * The six second ring vectors reaching the cells that touch a hex only at a corner. Diagonal {@code i} is the sum of
 * directions {@code i} and {@code i + 1}, and sits on the even clock hours.
 *
 * @author hal.hildebrand
 */
public enum HexDiagonal {
    EAST_NORTH_EAST(2, -1, -1, 2),
    NORTH(1, -2, 1, 12),
    WEST_NORTH_WEST(-1, -1, 2, 10),
    WEST_SOUTH_WEST(-2, 1, 1, 8),
    SOUTH(-1, 2, -1, 6),
    EAST_SOUTH_EAST(1, 1, -2, 4);

    public static final int COUNT = 6;

    private static final HexDiagonal[] VALUES = values();

    private final Hex vector;
    private final int hour;

    HexDiagonal(int q, int r, int s, int hour) {
        this.vector = new Hex(q, r, s);
        this.hour = hour;
    }

    /**
     * @throws InvalidDirectionException if the index is not 0-5
     */
    public static HexDiagonal of(int index) {
        if (index < 0 || index >= COUNT) {
            throw new InvalidDirectionException("Diagonal index must be 0-5, got: " + index);
        }
        return VALUES[index];
    }

    /**
     * @throws InvalidDirectionException if the hour is not one of 2, 4, 6, 8, 10, 12
     */
    public static HexDiagonal atHour(int hour) {
        for (var diagonal : VALUES) {
            if (diagonal.hour == hour) {
                return diagonal;
            }
        }
        throw new InvalidDirectionException("Diagonals occupy the even hours 2-12, got: " + hour);
    }

    public static List<Hex> vectors() {
        return List.of(EAST_NORTH_EAST.vector, NORTH.vector, WEST_NORTH_WEST.vector, WEST_SOUTH_WEST.vector,
                       SOUTH.vector, EAST_SOUTH_EAST.vector);
    }

    public int hour() {
        return hour;
    }

    public int index() {
        return ordinal();
    }

    public HexDiagonal next() {
        return VALUES[(ordinal() + 1) % COUNT];
    }

    public HexDiagonal opposite() {
        return VALUES[(ordinal() + 3) % COUNT];
    }

    public HexDiagonal previous() {
        return VALUES[(ordinal() + COUNT - 1) % COUNT];
    }

    public Hex vector() {
        return vector;
    }
}
