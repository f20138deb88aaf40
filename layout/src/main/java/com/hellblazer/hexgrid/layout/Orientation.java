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

import java.util.Objects;

/**
 * The linear map between axial hex coordinates and unit pixel space, together with the angle of the first corner.
 * The forward matrix takes (q, r) to pixels; the backward matrix is its inverse.
 *
 * @author hal.hildebrand
 */
public final class Orientation {

    public enum Kind {
        POINTY, FLAT, CUSTOM
    }

    private static final double SQRT3 = Math.sqrt(3.0);

    /** Hexes with a vertex at the top; rows are horizontal */
    public static final Orientation POINTY = new Orientation(Kind.POINTY, SQRT3, SQRT3 / 2.0, 0.0, 3.0 / 2.0, 0.5);

    /** Hexes with an edge at the top; columns are vertical */
    public static final Orientation FLAT = new Orientation(Kind.FLAT, 3.0 / 2.0, 0.0, SQRT3 / 2.0, SQRT3, 0.0);

    private final Kind   kind;
    private final double f0, f1, f2, f3;
    private final double b0, b1, b2, b3;
    private final double startAngle;

    private Orientation(Kind kind, double f0, double f1, double f2, double f3, double startAngle) {
        for (double v : new double[] { f0, f1, f2, f3, startAngle }) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Orientation parameters must be finite, got: " + v);
            }
        }
        double determinant = f0 * f3 - f1 * f2;
        if (Math.abs(determinant) < 1e-12) {
            throw new IllegalArgumentException(
            String.format("Forward matrix [[%s, %s], [%s, %s]] is singular", f0, f1, f2, f3));
        }
        this.kind = kind;
        this.f0 = f0;
        this.f1 = f1;
        this.f2 = f2;
        this.f3 = f3;
        this.b0 = f3 / determinant;
        this.b1 = -f1 / determinant;
        this.b2 = -f2 / determinant;
        this.b3 = f0 / determinant;
        this.startAngle = startAngle;
    }

    /**
     * Create an orientation from an arbitrary forward matrix. The backward matrix is computed.
     *
     * @param f0         row 0, column 0
     * @param f1         row 0, column 1
     * @param f2         row 1, column 0
     * @param f3         row 1, column 1
     * @param startAngle angle of corner 0, in sixths of a turn
     * @throws IllegalArgumentException if the matrix is singular or any parameter is not finite
     */
    public static Orientation custom(double f0, double f1, double f2, double f3, double startAngle) {
        return new Orientation(Kind.CUSTOM, f0, f1, f2, f3, startAngle);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isPointy() {
        return kind == Kind.POINTY;
    }

    public boolean isFlat() {
        return kind == Kind.FLAT;
    }

    public double f0() {
        return f0;
    }

    public double f1() {
        return f1;
    }

    public double f2() {
        return f2;
    }

    public double f3() {
        return f3;
    }

    public double b0() {
        return b0;
    }

    public double b1() {
        return b1;
    }

    public double b2() {
        return b2;
    }

    public double b3() {
        return b3;
    }

    public double startAngle() {
        return startAngle;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Orientation other)) return false;
        return kind == other.kind && f0 == other.f0 && f1 == other.f1 && f2 == other.f2 && f3 == other.f3
        && startAngle == other.startAngle;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, f0, f1, f2, f3, startAngle);
    }

    @Override
    public String toString() {
        return kind == Kind.CUSTOM ? String.format("Orientation{CUSTOM [[%.4f, %.4f], [%.4f, %.4f]], start=%.4f}", f0,
                                                   f1, f2, f3, startAngle) : "Orientation{" + kind + "}";
    }
}
