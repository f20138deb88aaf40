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
 * Floating point cube coordinate, the result of interpolation, scaling, division and pixel to hex conversion. The
 * components must be finite and sum to zero within {@link #EPSILON} relative to their magnitude (never less than
 * {@link #EPSILON} absolute).
 * <p>
 * Record equality is exact; use {@link #approximately(FractionalHex)} to compare within tolerance.
 *
 * @author hal.hildebrand
 */
public record FractionalHex(double q, double r, double s) {

    /** Tolerance for integral checks; the zero sum check scales it by the magnitude of the coordinates */
    public static final double EPSILON = 1e-6;

    /** Offset applied to line endpoints so samples never land exactly on a cell edge */
    public static final FractionalHex NUDGE = new FractionalHex(1e-6, 1e-6, -2e-6);

    public FractionalHex {
        if (!Double.isFinite(q) || !Double.isFinite(r) || !Double.isFinite(s)) {
            throw new InvalidCoordinateException(
            String.format("Cube coordinates must be finite: (%s, %s, %s)", q, r, s));
        }
        if (Math.abs(q + r + s) > EPSILON * Math.max(1.0, Math.abs(q) + Math.abs(r) + Math.abs(s))) {
            throw new InvalidCoordinateException(
            String.format("Cube coordinates must sum to zero: %s + %s + %s = %s", q, r, s, q + r + s));
        }
    }

    public static FractionalHex of(double q, double r) {
        return new FractionalHex(q, r, -q - r);
    }

    /**
     * Componentwise linear interpolation, a * (1 - t) + b * t.
     *
     * @throws IllegalArgumentException if t is not within [0, 1]
     */
    public static FractionalHex lerp(FractionalHex a, FractionalHex b, double t) {
        if (a == null || b == null) {
            throw new UnsupportedOperandException("Cannot interpolate a null hex");
        }
        if (!(t >= 0.0 && t <= 1.0)) {
            throw new IllegalArgumentException("Interpolation parameter must be within [0, 1], got: " + t);
        }
        double u = 1.0 - t;
        return new FractionalHex(a.q * u + b.q * t, a.r * u + b.r * t, a.s * u + b.s * t);
    }

    private static FractionalHex requireOperand(FractionalHex operand, String operation) {
        if (operand == null) {
            throw new UnsupportedOperandException("Cannot " + operation + " a null hex");
        }
        return operand;
    }

    public FractionalHex add(FractionalHex other) {
        requireOperand(other, "add");
        return new FractionalHex(q + other.q, r + other.r, s + other.s);
    }

    public FractionalHex subtract(FractionalHex other) {
        requireOperand(other, "subtract");
        return new FractionalHex(q - other.q, r - other.r, s - other.s);
    }

    public FractionalHex scale(double scalar) {
        Hex.requireScalar(scalar, "scale");
        return new FractionalHex(q * scalar, r * scalar, s * scalar);
    }

    /**
     * @throws DivisionByZeroException     if the divisor is zero
     * @throws UnsupportedOperandException if the divisor is NaN or infinite
     */
    public FractionalHex divide(double divisor) {
        Hex.requireScalar(divisor, "divide");
        if (divisor == 0.0) {
            throw new DivisionByZeroException("Cannot divide " + this + " by zero");
        }
        return new FractionalHex(q / divisor, r / divisor, s / divisor);
    }

    public Hex floorDivide(double divisor) {
        return divide(divisor).round();
    }

    public FractionalHex negate() {
        return new FractionalHex(-q, -r, -s);
    }

    public double length() {
        return (Math.abs(q) + Math.abs(r) + Math.abs(s)) / 2.0;
    }

    public double distanceTo(FractionalHex other) {
        return subtract(other).length();
    }

    public FractionalHex lerp(FractionalHex other, double t) {
        return lerp(this, other, t);
    }

    public FractionalHex nudged() {
        return add(NUDGE);
    }

    /**
     * Snap to the nearest lattice hex. Each axis is rounded half to even; the axis that moved the most is then
     * recomputed from the other two so the result sums to zero. Ties in the error favor recomputing s, then r.
     *
     * @return the nearest hex
     */
    public Hex round() {
        double rq = Math.rint(q);
        double rr = Math.rint(r);
        double rs = Math.rint(s);
        double dq = Math.abs(rq - q);
        double dr = Math.abs(rr - r);
        double ds = Math.abs(rs - s);
        if (dq > dr && dq > ds) {
            rq = -rr - rs;
        } else if (dr > ds) {
            rr = -rq - rs;
        } else {
            rs = -rq - rr;
        }
        return new Hex(toInt(rq), toInt(rr), toInt(rs));
    }

    public Hex toHex() {
        return round();
    }

    /**
     * Convert to a hex without rounding.
     *
     * @throws InvalidCoordinateException if any component is not integral
     */
    public Hex toExactHex() {
        if (!isIntegral()) {
            throw new InvalidCoordinateException("Not an integral hex: " + this);
        }
        return round();
    }

    public boolean isIntegral() {
        return Math.abs(q - Math.rint(q)) <= EPSILON && Math.abs(r - Math.rint(r)) <= EPSILON
        && Math.abs(s - Math.rint(s)) <= EPSILON;
    }

    public boolean approximately(FractionalHex other) {
        return approximately(other, EPSILON);
    }

    public boolean approximately(FractionalHex other, double tolerance) {
        requireOperand(other, "compare");
        return Math.abs(q - other.q) <= tolerance && Math.abs(r - other.r) <= tolerance
        && Math.abs(s - other.s) <= tolerance;
    }

    public double coordinate(HexAxis axis) {
        return axis.of(this);
    }

    private static int toInt(double value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new InvalidCoordinateException("Coordinate out of integer range: " + value);
        }
        return (int) value;
    }

    @Override
    public String toString() {
        return String.format("FractionalHex(%.6f, %.6f, %.6f)", q, r, s);
    }
}
