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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compass labels for the six neighbor directions as they appear on screen. Pointy-top hexes have neighbors at NE, E,
 * SE, SW, W and NW; flat-top hexes at N, NE, SE, S, SW and NW.
 *
 * @author hal.hildebrand
 */
public final class HexCompass {
    private static final Logger log = LoggerFactory.getLogger(HexCompass.class);

    public static final HexCompass POINTY = new HexCompass(Orientation.Kind.POINTY,
                                                           new CompassPoint[] { CompassPoint.E, CompassPoint.NE,
                                                                                CompassPoint.NW, CompassPoint.W,
                                                                                CompassPoint.SW, CompassPoint.SE });

    public static final HexCompass FLAT = new HexCompass(Orientation.Kind.FLAT,
                                                         new CompassPoint[] { CompassPoint.SE, CompassPoint.NE,
                                                                              CompassPoint.N, CompassPoint.NW,
                                                                              CompassPoint.SW, CompassPoint.S });

    private final Orientation.Kind                kind;
    private final Map<CompassPoint, HexDirection> directions = new EnumMap<>(CompassPoint.class);
    private final Map<HexDirection, CompassPoint> labels     = new EnumMap<>(HexDirection.class);
    private final List<CompassPoint>              points;

    /**
     * @param byDirection the label of each direction, in direction index order
     */
    private HexCompass(Orientation.Kind kind, CompassPoint[] byDirection) {
        this.kind = kind;
        for (var direction : HexDirection.values()) {
            directions.put(byDirection[direction.index()], direction);
            labels.put(direction, byDirection[direction.index()]);
        }
        var sorted = new ArrayList<>(directions.keySet());
        Collections.sort(sorted);
        this.points = Collections.unmodifiableList(sorted);
    }

    /**
     * @return the compass for the orientation; custom orientations use the pointy compass
     */
    public static HexCompass of(Orientation orientation) {
        return switch (orientation.kind()) {
            case FLAT -> FLAT;
            case POINTY -> POINTY;
            case CUSTOM -> {
                log.debug("Using the pointy compass for custom orientation {}", orientation);
                yield POINTY;
            }
        };
    }

    /**
     * @throws InvalidDirectionException if this orientation has no neighbor at that point
     */
    public HexDirection at(CompassPoint point) {
        var direction = directions.get(point);
        if (direction == null) {
            throw new InvalidDirectionException(kind + " hexes have no neighbor at " + point + ", only " + points);
        }
        return direction;
    }

    public CompassPoint pointOf(HexDirection direction) {
        return labels.get(direction);
    }

    /**
     * @return the six points of this compass, in clockwise order from north
     */
    public List<CompassPoint> points() {
        return points;
    }

    public boolean has(CompassPoint point) {
        return directions.containsKey(point);
    }

    public Hex neighbor(Hex hex, CompassPoint point) {
        return hex.neighbor(at(point));
    }

    @Override
    public String toString() {
        return "HexCompass{" + kind + " " + points + "}";
    }
}
