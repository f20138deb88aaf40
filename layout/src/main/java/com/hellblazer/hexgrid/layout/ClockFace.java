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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Where the clock vectors of {@link HexClock} appear on screen. On a pointy-top layout hour h is drawn at the h
 * o'clock position. A flat-top layout draws the same vector one hour further clockwise. Custom orientations are
 * labeled like pointy ones.
 *
 * @author hal.hildebrand
 */
public final class ClockFace {
    private static final Logger log = LoggerFactory.getLogger(ClockFace.class);

    private ClockFace() {
    }

    /**
     * @param hour        clock hour of the vector, 1-12
     * @param orientation layout orientation
     * @return the on-screen clock position of that vector, 1-12
     */
    public static int faceHour(int hour, Orientation orientation) {
        requireHour(hour);
        return HexClock.normalize(hour + shift(orientation));
    }

    /**
     * @param face on-screen clock position, 1-12
     * @return the clock hour of the vector drawn there
     */
    public static int hourAtFace(int face, Orientation orientation) {
        requireHour(face);
        return HexClock.normalize(face - shift(orientation));
    }

    /**
     * @return the vector drawn at the on-screen clock position
     */
    public static Hex atFace(int face, Orientation orientation) {
        return HexClock.hour(hourAtFace(face, orientation));
    }

    /**
     * @return the neighbor of the hex drawn at the on-screen clock position
     */
    public static Hex neighborAtFace(Hex hex, int face, Orientation orientation) {
        return hex.add(atFace(face, orientation));
    }

    private static int shift(Orientation orientation) {
        return switch (orientation.kind()) {
            case POINTY -> 0;
            case FLAT -> 1;
            case CUSTOM -> {
                log.debug("Labeling custom orientation {} with the pointy clock face", orientation);
                yield 0;
            }
        };
    }

    private static void requireHour(int hour) {
        if (hour < 1 || hour > HexClock.HOURS) {
            throw new InvalidDirectionException("Clock hour must be 1-12, got: " + hour);
        }
    }
}
