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

import com.hellblazer.hexgrid.geometry.FractionalHex;
import com.hellblazer.hexgrid.geometry.Hex;

import javax.vecmath.Point2d;
import javax.vecmath.Point2i;
import javax.vecmath.Tuple2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable mapping between hex coordinates and pixel space: an {@link Orientation}, the pixel size of a hex along x
 * and y, and the pixel position of the origin hex's center.
 *
 * @author hal.hildebrand
 */
public final class Layout {

    private static final double SQRT3 = Math.sqrt(3.0);

    private final Orientation orientation;
    private final double      sizeX;
    private final double      sizeY;
    private final double      originX;
    private final double      originY;

    public static class Builder {
        private Orientation orientation = Orientation.POINTY;
        private double      sizeX       = 1.0;
        private double      sizeY       = 1.0;
        private double      originX     = 0.0;
        private double      originY     = 0.0;

        public Builder withOrientation(Orientation orientation) {
            this.orientation = Objects.requireNonNull(orientation, "orientation");
            return this;
        }

        public Builder withSize(double size) {
            return withSize(size, size);
        }

        public Builder withSize(double x, double y) {
            if (!(x > 0.0) || !(y > 0.0) || !Double.isFinite(x) || !Double.isFinite(y)) {
                throw new IllegalArgumentException(
                String.format("Size must be positive and finite, got (%s, %s)", x, y));
            }
            this.sizeX = x;
            this.sizeY = y;
            return this;
        }

        public Builder withOrigin(double x, double y) {
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new IllegalArgumentException(String.format("Origin must be finite, got (%s, %s)", x, y));
            }
            this.originX = x;
            this.originY = y;
            return this;
        }

        public Layout build() {
            return new Layout(orientation, sizeX, sizeY, originX, originY);
        }
    }

    private Layout(Orientation orientation, double sizeX, double sizeY, double originX, double originY) {
        this.orientation = orientation;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.originX = originX;
        this.originY = originY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Layout pointy(double size, double originX, double originY) {
        return builder().withOrientation(Orientation.POINTY).withSize(size).withOrigin(originX, originY).build();
    }

    public static Layout flat(double size, double originX, double originY) {
        return builder().withOrientation(Orientation.FLAT).withSize(size).withOrigin(originX, originY).build();
    }

    /**
     * @return a builder initialized with this layout's settings
     */
    public Builder toBuilder() {
        return builder().withOrientation(orientation).withSize(sizeX, sizeY).withOrigin(originX, originY);
    }

    /**
     * Pixel position of the center of a hex.
     */
    public Point2d toPoint(Hex hex) {
        return toPoint(hex.q(), hex.r());
    }

    public Point2d toPoint(FractionalHex hex) {
        return toPoint(hex.q(), hex.r());
    }

    private Point2d toPoint(double q, double r) {
        double x = (orientation.f0() * q + orientation.f1() * r) * sizeX;
        double y = (orientation.f2() * q + orientation.f3() * r) * sizeY;
        return new Point2d(x + originX, y + originY);
    }

    /**
     * Pixel position of the center of a hex, rounded to whole pixels.
     */
    public Point2i toPixel(Hex hex) {
        var point = toPoint(hex);
        return new Point2i((int) Math.round(point.x), (int) Math.round(point.y));
    }

    /**
     * Convert a pixel position to fractional hex coordinates. The caller decides whether and how to round.
     */
    public FractionalHex toFractionalHex(double x, double y) {
        double px = (x - originX) / sizeX;
        double py = (y - originY) / sizeY;
        double q = orientation.b0() * px + orientation.b1() * py;
        double r = orientation.b2() * px + orientation.b3() * py;
        return FractionalHex.of(q, r);
    }

    public FractionalHex toFractionalHex(Tuple2d point) {
        return toFractionalHex(point.x, point.y);
    }

    /**
     * @return the hex containing the pixel
     */
    public Hex toHex(double x, double y) {
        return toFractionalHex(x, y).round();
    }

    public Hex toHex(Tuple2d point) {
        return toHex(point.x, point.y);
    }

    /**
     * Offset of a polygon corner from the hex center.
     *
     * @param corner corner index, 0-5
     * @throws IllegalArgumentException if the index is out of range
     */
    public Point2d cornerOffset(int corner) {
        if (corner < 0 || corner > 5) {
            throw new IllegalArgumentException("Corner index must be 0-5, got: " + corner);
        }
        double angle = 2.0 * Math.PI * (orientation.startAngle() - corner) / 6.0;
        return new Point2d(sizeX * Math.cos(angle), sizeY * Math.sin(angle));
    }

    public List<Point2d> polygonCorners(Hex hex) {
        return polygonCorners(hex, 1.0);
    }

    /**
     * The six polygon corners of a hex, shrunk toward the center by the factor.
     *
     * @param factor scale of the polygon, in (0, 1]
     */
    public List<Point2d> polygonCorners(Hex hex, double factor) {
        if (!(factor > 0.0 && factor <= 1.0)) {
            throw new IllegalArgumentException("Shrink factor must be within (0, 1], got: " + factor);
        }
        var center = toPoint(hex);
        var corners = new ArrayList<Point2d>(6);
        for (int i = 0; i < 6; i++) {
            var offset = cornerOffset(i);
            corners.add(new Point2d(center.x + offset.x * factor, center.y + offset.y * factor));
        }
        return corners;
    }

    /**
     * The pixel rectangle enclosing the polygons of all the hexes.
     *
     * @throws IllegalArgumentException if there are no hexes
     */
    public PixelBounds pixelBounds(Iterable<Hex> hexes) {
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        boolean any = false;
        for (var hex : hexes) {
            any = true;
            for (var corner : polygonCorners(hex)) {
                minX = Math.min(minX, corner.x);
                minY = Math.min(minY, corner.y);
                maxX = Math.max(maxX, corner.x);
                maxY = Math.max(maxY, corner.y);
            }
        }
        if (!any) {
            throw new IllegalArgumentException("Cannot bound an empty set of hexes");
        }
        return new PixelBounds(minX, minY, maxX, maxY);
    }

    /**
     * Pixel width of a single hex, corner to corner for flat, edge to edge for pointy.
     */
    public double width() {
        return switch (requireRegular("width")) {
            case POINTY -> SQRT3 * sizeX;
            default -> 2.0 * sizeX;
        };
    }

    public double height() {
        return switch (requireRegular("height")) {
            case POINTY -> 2.0 * sizeY;
            default -> SQRT3 * sizeY;
        };
    }

    /**
     * Horizontal distance between the centers of neighboring columns.
     */
    public double horizontalSpacing() {
        return switch (requireRegular("horizontal spacing")) {
            case POINTY -> width();
            default -> 1.5 * sizeX;
        };
    }

    /**
     * Vertical distance between the centers of neighboring rows.
     */
    public double verticalSpacing() {
        return switch (requireRegular("vertical spacing")) {
            case POINTY -> 1.5 * sizeY;
            default -> height();
        };
    }

    private Orientation.Kind requireRegular(String metric) {
        if (orientation.kind() == Orientation.Kind.CUSTOM) {
            throw new IllegalStateException("No " + metric + " is defined for a custom orientation");
        }
        return orientation.kind();
    }

    public Orientation orientation() {
        return orientation;
    }

    public double sizeX() {
        return sizeX;
    }

    public double sizeY() {
        return sizeY;
    }

    public double originX() {
        return originX;
    }

    public double originY() {
        return originY;
    }

    public Point2d origin() {
        return new Point2d(originX, originY);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Layout other)) return false;
        return orientation.equals(other.orientation) && sizeX == other.sizeX && sizeY == other.sizeY
        && originX == other.originX && originY == other.originY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(orientation, sizeX, sizeY, originX, originY);
    }

    @Override
    public String toString() {
        return String.format("Layout{%s, size=(%.3f, %.3f), origin=(%.3f, %.3f)}", orientation, sizeX, sizeY,
                             originX, originY);
    }
}
