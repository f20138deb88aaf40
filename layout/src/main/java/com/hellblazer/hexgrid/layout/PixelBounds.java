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

import javax.vecmath.Point2d;

/**
 * Axis aligned pixel rectangle enclosing a set of hex polygons.
 *
 * @author hal.hildebrand
 */
public record PixelBounds(double minX, double minY, double maxX, double maxY) {

    public PixelBounds {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(
            String.format("Minimum (%s, %s) exceeds maximum (%s, %s)", minX, minY, maxX, maxY));
        }
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    public Point2d center() {
        return new Point2d((minX + maxX) / 2.0, (minY + maxY) / 2.0);
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * @return the smallest bounds enclosing this and the other
     */
    public PixelBounds union(PixelBounds other) {
        return new PixelBounds(Math.min(minX, other.minX), Math.min(minY, other.minY), Math.max(maxX, other.maxX),
                               Math.max(maxY, other.maxY));
    }
}
