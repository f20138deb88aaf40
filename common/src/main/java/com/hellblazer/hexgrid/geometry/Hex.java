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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable hexagonal grid cell in cube coordinates. The three coordinates always satisfy {@code q + r + s == 0},
 * which the canonical constructor enforces.
 * <p>
 * All operations return new instances. Operations whose result is not generally on the lattice (scaling by a real,
 * division, interpolation) produce a {@link FractionalHex}.
 *
 * @author hal.hildebrand
 */
public record Hex(int q, int r, int s) {

    /** The origin hex (0, 0, 0) */
    public static final Hex ORIGIN = new Hex(0, 0, 0);

    /** Orders hexes by their distance from the origin */
    public static final Comparator<Hex> BY_LENGTH = Comparator.comparingInt(Hex::length);

    public Hex {
        if ((long) q + r + s != 0) {
            throw new InvalidCoordinateException(
            String.format("Cube coordinates must sum to zero: %d + %d + %d = %d", q, r, s, (long) q + r + s));
        }
    }

    /**
     * Create a hex from axial coordinates, deriving s.
     *
     * @param q Q coordinate
     * @param r R coordinate
     * @return Hex at (q, r, -q - r)
     */
    public static Hex of(int q, int r) {
        return new Hex(q, r, -q - r);
    }

    /**
     * Create a hex from the values of two named axes, deriving the third.
     *
     * @param first       first axis
     * @param firstValue  coordinate along the first axis
     * @param second      second axis, distinct from the first
     * @param secondValue coordinate along the second axis
     * @return the hex with those coordinates
     * @throws IllegalArgumentException if the axes are the same
     */
    public static Hex withAxes(HexAxis first, int firstValue, HexAxis second, int secondValue) {
        var third = first.remaining(second);
        var coordinates = new int[3];
        coordinates[first.ordinal()] = firstValue;
        coordinates[second.ordinal()] = secondValue;
        coordinates[third.ordinal()] = -firstValue - secondValue;
        return new Hex(coordinates[0], coordinates[1], coordinates[2]);
    }

    static Hex requireOperand(Hex operand, String operation) {
        if (operand == null) {
            throw new UnsupportedOperandException("Cannot " + operation + " a null hex");
        }
        return operand;
    }

    /**
     * @throws InvalidCoordinateException if the value does not fit in an int coordinate
     */
    static int exact(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new InvalidCoordinateException("Coordinate overflows the int range: " + value);
        }
        return (int) value;
    }

    static double requireScalar(double scalar, String operation) {
        if (!Double.isFinite(scalar)) {
            throw new UnsupportedOperandException("Cannot " + operation + " by non-finite scalar " + scalar);
        }
        return scalar;
    }

    /**
     * Add another hex to this hex.
     *
     * @param other Hex to add
     * @return New hex with summed coordinates
     */
    public Hex add(Hex other) {
        requireOperand(other, "add");
        return new Hex(exact((long) q + other.q), exact((long) r + other.r), exact((long) s + other.s));
    }

    /**
     * Subtract another hex from this hex.
     *
     * @param other Hex to subtract
     * @return New hex with subtracted coordinates
     */
    public Hex subtract(Hex other) {
        requireOperand(other, "subtract");
        return new Hex(exact((long) q - other.q), exact((long) r - other.r), exact((long) s - other.s));
    }

    /**
     * Multiply this hex by an integer scalar.
     *
     * @param scalar Scalar multiplier
     * @return New hex with scaled coordinates
     * @throws InvalidCoordinateException if a coordinate overflows
     */
    public Hex multiply(int scalar) {
        return new Hex(exact((long) q * scalar), exact((long) r * scalar), exact((long) s * scalar));
    }

    /**
     * Multiply this hex by a real scalar.
     *
     * @throws UnsupportedOperandException if the scalar is NaN or infinite
     */
    public FractionalHex scale(double scalar) {
        requireScalar(scalar, "scale");
        return new FractionalHex(q * scalar, r * scalar, s * scalar);
    }

    /**
     * Divide this hex by a real divisor.
     *
     * @throws DivisionByZeroException     if the divisor is zero
     * @throws UnsupportedOperandException if the divisor is NaN or infinite
     */
    public FractionalHex divide(double divisor) {
        return toFractional().divide(divisor);
    }

    /**
     * Divide then snap the quotient back onto the lattice.
     *
     * @return the nearest hex to this / divisor
     */
    public Hex floorDivide(double divisor) {
        return divide(divisor).round();
    }

    /**
     * @return the reflection of this hex through the origin
     */
    public Hex negate() {
        return new Hex(exact(-(long) q), exact(-(long) r), exact(-(long) s));
    }

    /**
     * @return the reflection of this hex through the center
     */
    public Hex negateAround(Hex center) {
        requireOperand(center, "negate around");
        return center.subtract(subtract(center));
    }

    /**
     * @return the number of steps from the origin to this hex
     */
    public int length() {
        return exact((Math.abs((long) q) + Math.abs((long) r) + Math.abs((long) s)) / 2);
    }

    /**
     * Calculate the grid distance to another hex.
     *
     * @param other Other hex
     * @return Minimum number of single steps between the two hexes
     */
    public int distanceTo(Hex other) {
        return subtract(other).length();
    }

    public boolean isCloserThan(Hex other) {
        return length() < requireOperand(other, "compare").length();
    }

    public boolean isNeighbor(Hex other) {
        return distanceTo(other) == 1;
    }

    /**
     * @return the coordinate along the given axis
     */
    public int coordinate(HexAxis axis) {
        return axis.of(this);
    }

    /**
     * Rotate 60 degrees counterclockwise about the origin: (q, r, s) becomes (-s, -q, -r).
     */
    public Hex rotateLeft() {
        return new Hex(exact(-(long) s), exact(-(long) q), exact(-(long) r));
    }

    /**
     * Rotate counterclockwise about the origin by the given number of 60 degree steps. Negative steps rotate
     * clockwise; steps are taken modulo 6.
     */
    public Hex rotateLeft(int steps) {
        int k = Math.floorMod(steps, 6);
        int shift = k % 3;
        int sign = (k & 1) == 0 ? 1 : -1;
        int[] c = { q, r, s };
        return new Hex(exact((long) sign * c[(3 - shift) % 3]), exact((long) sign * c[(4 - shift) % 3]),
                       exact((long) sign * c[(5 - shift) % 3]));
    }

    /**
     * Rotate 60 degrees clockwise about the origin: (q, r, s) becomes (-r, -s, -q).
     */
    public Hex rotateRight() {
        return new Hex(exact(-(long) r), exact(-(long) s), exact(-(long) q));
    }

    public Hex rotateRight(int steps) {
        return rotateLeft(6 - Math.floorMod(steps, 6));
    }

    public Hex rotateLeftAround(Hex center, int steps) {
        requireOperand(center, "rotate around");
        return center.add(subtract(center).rotateLeft(steps));
    }

    public Hex rotateRightAround(Hex center, int steps) {
        requireOperand(center, "rotate around");
        return center.add(subtract(center).rotateRight(steps));
    }

    /**
     * Mirror this hex across the line through the origin on which the given axis is constant. The axis coordinate is
     * kept and the other two are swapped.
     */
    public Hex reflect(HexAxis axis) {
        return switch (axis) {
            case Q -> new Hex(q, s, r);
            case R -> new Hex(s, r, q);
            case S -> new Hex(r, q, s);
        };
    }

    public Hex reflectAround(Hex center, HexAxis axis) {
        requireOperand(center, "reflect around");
        return center.add(subtract(center).reflect(axis));
    }

    /**
     * @param index direction index, 0-5
     * @return the adjacent hex in that direction
     * @throws InvalidDirectionException if the index is out of range
     */
    public Hex neighbor(int index) {
        return neighbor(HexDirection.of(index));
    }

    public Hex neighbor(HexDirection direction) {
        return add(direction.vector());
    }

    /**
     * @return the six adjacent hexes, in direction index order
     */
    public List<Hex> neighbors() {
        var result = new ArrayList<Hex>(HexDirection.COUNT);
        for (var direction : HexDirection.values()) {
            result.add(neighbor(direction));
        }
        return result;
    }

    public Hex diagonalNeighbor(int index) {
        return diagonalNeighbor(HexDiagonal.of(index));
    }

    public Hex diagonalNeighbor(HexDiagonal diagonal) {
        return add(diagonal.vector());
    }

    public List<Hex> diagonalNeighbors() {
        var result = new ArrayList<Hex>(HexDiagonal.COUNT);
        for (var diagonal : HexDiagonal.values()) {
            result.add(diagonalNeighbor(diagonal));
        }
        return result;
    }

    /**
     * @param hour clock hour 1-12; odd hours are adjacent cells, even hours diagonal cells
     * @return the hex at that clock position
     */
    public Hex clockNeighbor(int hour) {
        return add(HexClock.hour(hour));
    }

    /**
     * @return the twelve clock neighbors, hours 1 through 12
     */
    public List<Hex> allNeighbors() {
        var result = new ArrayList<Hex>(HexClock.HOURS);
        for (int hour = 1; hour <= HexClock.HOURS; hour++) {
            result.add(clockNeighbor(hour));
        }
        return result;
    }

    public FractionalHex toFractional() {
        return new FractionalHex(q, r, s);
    }

    /**
     * Linear interpolation toward another hex.
     *
     * @param t interpolation parameter in [0, 1]
     */
    public FractionalHex lerpTo(Hex other, double t) {
        requireOperand(other, "interpolate to");
        return FractionalHex.lerp(toFractional(), other.toFractional(), t);
    }

    /**
     * @return the hexes on the straight line from this hex to the other, both inclusive
     * @see HexTraversal#line(Hex, Hex)
     */
    public Iterable<Hex> lineTo(Hex other) {
        return HexTraversal.line(this, other);
    }

    public List<Hex> ring(int radius) {
        return HexTraversal.ring(this, radius);
    }

    public List<Hex> range(int radius) {
        return HexTraversal.range(this, radius);
    }

    public List<Hex> spiral(int radius) {
        return HexTraversal.spiral(this, radius);
    }

    /**
     * Convert to array [q, r, s].
     *
     * @return Array representation
     */
    public int[] toArray() {
        return new int[] { q, r, s };
    }

    @Override
    public String toString() {
        return String.format("Hex(%d, %d, %d)", q, r, s);
    }
}
