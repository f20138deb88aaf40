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
import com.hellblazer.hexgrid.geometry.HexGridException;

/**
 * Thrown when a hex is looked up in a {@link HexMap} that does not hold it.
 *
 * @author hal.hildebrand
 */
public final class HexNotFoundException extends HexGridException {
    private final Hex hex;

    public HexNotFoundException(Hex hex) {
        super("No value stored at " + hex);
        this.hex = hex;
    }

    public Hex getHex() {
        return hex;
    }
}
