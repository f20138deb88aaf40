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

/**
 * The three cube coordinate axes.
 *
 * @author hal.hildebrand
 */
public enum HexAxis {
    Q, R, S;

    /**
     * @return the integer coordinate of the hex along this axis
     */
    public int of(Hex hex) {
        return switch (this) {
            case Q -> hex.q();
            case R -> hex.r();
            case S -> hex.s();
        };
    }

    /**
     * @return the fractional coordinate of the hex along this axis
     */
    public double of(FractionalHex hex) {
        return switch (this) {
            case Q -> hex.q();
            case R -> hex.r();
            case S -> hex.s();
        };
    }

    /**
     * Answer the axis that is neither this nor the other axis
     *
     * @throws IllegalArgumentException if other is this axis
     */
    public HexAxis remaining(HexAxis other) {
        if (other == this) {
            throw new IllegalArgumentException("Axes must be distinct, got " + this + " twice");
        }
        return values()[3 - ordinal() - other.ordinal()];
    }
}
