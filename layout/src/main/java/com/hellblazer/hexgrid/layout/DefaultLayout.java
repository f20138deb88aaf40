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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process wide holder of a layout for callers that do not want to pass one around. It starts empty and must be set
 * explicitly; nothing in this library consults it implicitly.
 *
 * @author hal.hildebrand
 */
public final class DefaultLayout {
    private static final Logger                  log     = LoggerFactory.getLogger(DefaultLayout.class);
    private static final AtomicReference<Layout> current = new AtomicReference<>();

    private DefaultLayout() {
    }

    /**
     * Install the default layout, replacing any previous one.
     *
     * @return the previous default, if any
     */
    public static Optional<Layout> set(Layout layout) {
        Objects.requireNonNull(layout, "layout");
        var previous = current.getAndSet(layout);
        if (previous == null) {
            log.info("Default layout set: {}", layout);
        } else {
            log.info("Default layout replaced: {} -> {}", previous, layout);
        }
        return Optional.ofNullable(previous);
    }

    /**
     * @throws IllegalStateException if no default layout has been set
     */
    public static Layout get() {
        var layout = current.get();
        if (layout == null) {
            throw new IllegalStateException("No default layout has been set");
        }
        return layout;
    }

    public static Optional<Layout> current() {
        return Optional.ofNullable(current.get());
    }

    public static void clear() {
        var previous = current.getAndSet(null);
        if (previous != null) {
            log.info("Default layout cleared: {}", previous);
        }
    }

    public static Point2d toPoint(Hex hex) {
        return get().toPoint(hex);
    }

    public static Hex toHex(double x, double y) {
        return get().toHex(x, y);
    }

    public static List<Point2d> polygonCorners(Hex hex) {
        return get().polygonCorners(hex);
    }
}
