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

import com.hellblazer.hexgrid.geometry.FractionalHex;
import com.hellblazer.hexgrid.geometry.Hex;
import com.hellblazer.hexgrid.geometry.HexAxis;
import com.hellblazer.hexgrid.geometry.UnsupportedOperandException;
import com.hellblazer.hexgrid.layout.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Sparse container of values keyed by hex. Iteration follows insertion order; re-inserting a hex overwrites its
 * value in place. A map carries a default value used by {@link #put(Hex)}, {@link #setAll(Object)} and the shape
 * factories.
 * <p>
 * Not synchronized.
 *
 * @param <V> the type of stored values
 * @author hal.hildebrand
 */
public class HexMap<V> implements Iterable<Map.Entry<Hex, V>> {
    private static final Logger log = LoggerFactory.getLogger(HexMap.class);

    private final Map<Hex, V> cells;
    private final V           defaultValue;

    /**
     * Create an empty map with no default value.
     */
    public HexMap() {
        this(null);
    }

    /**
     * Create an empty map.
     *
     * @param defaultValue value stored by {@link #put(Hex)} and the shape factories
     */
    public HexMap(V defaultValue) {
        this.cells = new LinkedHashMap<>();
        this.defaultValue = defaultValue;
    }

    public static <V> HexMap<V> empty() {
        return new HexMap<>();
    }

    public static <V> HexMap<V> withDefault(V defaultValue) {
        return new HexMap<>(defaultValue);
    }

    /**
     * @return a map holding the value at each of the hexes
     */
    public static <V> HexMap<V> of(Iterable<Hex> hexes, V value) {
        var map = new HexMap<V>(value);
        map.putAll(hexes, value);
        return map;
    }

    /**
     * @return a map holding the value computed for each of the hexes
     */
    public static <V> HexMap<V> computed(Iterable<Hex> hexes, Function<? super Hex, ? extends V> values) {
        var map = new HexMap<V>();
        map.putAll(hexes, values);
        return map;
    }

    public static <V> HexMap<V> copyOf(Map<Hex, ? extends V> source) {
        var map = new HexMap<V>();
        source.forEach(map::put);
        return map;
    }

    public static <V> HexMap<V> hexagon(int radius, V value) {
        return hexagon(Hex.ORIGIN, radius, false, value);
    }

    /**
     * @param hollow only the outermost ring
     */
    public static <V> HexMap<V> hexagon(Hex center, int radius, boolean hollow, V value) {
        return fillShape("hexagon", HexShapes.hexagon(requireKey(center), radius, hollow), value);
    }

    public static <V> HexMap<V> computedHexagon(int radius, Function<? super Hex, ? extends V> values) {
        return computeShape("hexagon", HexShapes.hexagon(Hex.ORIGIN, radius), values);
    }

    public static <V> HexMap<V> rectangle(int width, int height, V value) {
        return rectangle(Hex.ORIGIN, width, height, Orientation.POINTY, false, value);
    }

    /**
     * A rectangle whose first cell is the origin hex.
     *
     * @param hollow only the four sides
     */
    public static <V> HexMap<V> rectangle(Hex origin, int width, int height, Orientation orientation,
                                          boolean hollow, V value) {
        return fillShape("rectangle", translated(HexShapes.rectangle(width, height, orientation, hollow), origin),
                         value);
    }

    public static <V> HexMap<V> computedRectangle(int width, int height, Function<? super Hex, ? extends V> values) {
        return computeShape("rectangle", HexShapes.rectangle(width, height), values);
    }

    public static <V> HexMap<V> parallelogram(HexAxis first, HexAxis second, int size, V value) {
        return parallelogram(Hex.ORIGIN, first, second, size, false, value);
    }

    /**
     * The parallelogram spanning -size through size on both axes around the center.
     *
     * @param hollow only the four sides
     */
    public static <V> HexMap<V> parallelogram(Hex center, HexAxis first, HexAxis second, int size, boolean hollow,
                                              V value) {
        HexShapes.requireSize(size);
        return fillShape("parallelogram",
                         translated(HexShapes.parallelogram(first, -size, size, second, -size, size, hollow), center),
                         value);
    }

    public static <V> HexMap<V> computedParallelogram(HexAxis first, HexAxis second, int size,
                                              Function<? super Hex, ? extends V> values) {
        return computeShape("parallelogram", HexShapes.parallelogram(first, second, size), values);
    }

    public static <V> HexMap<V> triangle(int size, V value) {
        return triangle(Hex.ORIGIN, size, value);
    }

    /**
     * A triangle with its corner at the origin hex.
     */
    public static <V> HexMap<V> triangle(Hex origin, int size, V value) {
        return fillShape("triangle", translated(HexShapes.triangle(size), origin), value);
    }

    public static <V> HexMap<V> computedTriangle(int size, Function<? super Hex, ? extends V> values) {
        return computeShape("triangle", HexShapes.triangle(size), values);
    }

    private static <V> HexMap<V> fillShape(String shape, List<Hex> hexes, V value) {
        var map = new HexMap<V>(value);
        map.putAll(hexes, value);
        log.debug("Created {} map of {} hexes", shape, map.size());
        return map;
    }

    private static <V> HexMap<V> computeShape(String shape, List<Hex> hexes, Function<? super Hex, ? extends V> values) {
        var map = new HexMap<V>();
        map.putAll(hexes, values);
        log.debug("Created {} map of {} computed hexes", shape, map.size());
        return map;
    }

    private static List<Hex> translated(List<Hex> hexes, Hex offset) {
        requireKey(offset);
        if (offset.equals(Hex.ORIGIN)) {
            return hexes;
        }
        var result = new ArrayList<Hex>(hexes.size());
        for (var hex : hexes) {
            result.add(hex.add(offset));
        }
        return result;
    }

    private static Hex requireKey(Hex hex) {
        if (hex == null) {
            throw new UnsupportedOperandException("A hex map key must not be null");
        }
        return hex;
    }

    /**
     * Store a value, replacing any value already held at the hex.
     *
     * @return the previous value, or null if there was none
     */
    public V put(Hex hex, V value) {
        return cells.put(requireKey(hex), value);
    }

    /**
     * Store a value at a fractional position that must lie exactly on a hex.
     *
     * @throws com.hellblazer.hexgrid.geometry.InvalidCoordinateException if the position is not integral
     */
    public V put(FractionalHex hex, V value) {
        if (hex == null) {
            throw new UnsupportedOperandException("A hex map key must not be null");
        }
        return put(hex.toExactHex(), value);
    }

    /**
     * Store the default value at the hex.
     */
    public V put(Hex hex) {
        return put(hex, defaultValue);
    }

    /**
     * @return the value that was stored at the hex, or null if there was none
     */
    public V remove(Hex hex) {
        return cells.remove(requireKey(hex));
    }

    /**
     * @throws HexNotFoundException if nothing is stored at the hex
     */
    public V get(Hex hex) {
        var value = cells.get(requireKey(hex));
        if (value == null && !cells.containsKey(hex)) {
            throw new HexNotFoundException(hex);
        }
        return value;
    }

    /**
     * @return the value at the hex; empty if there is none or the stored value is null
     */
    public Optional<V> find(Hex hex) {
        return Optional.ofNullable(cells.get(requireKey(hex)));
    }

    public V getOrDefault(Hex hex, V fallback) {
        return cells.getOrDefault(requireKey(hex), fallback);
    }

    public boolean contains(Hex hex) {
        return hex != null && cells.containsKey(hex);
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public void clear() {
        cells.clear();
    }

    public V defaultValue() {
        return defaultValue;
    }

    /**
     * Store the value at each of the hexes. Nothing is stored if any hex is null.
     */
    public void putAll(Iterable<Hex> hexes, V value) {
        var staged = new ArrayList<Hex>();
        for (var hex : hexes) {
            staged.add(requireKey(hex));
        }
        for (var hex : staged) {
            cells.put(hex, value);
        }
    }

    /**
     * Store the value computed for each of the hexes. Nothing is stored if any hex is null or the function throws.
     */
    public void putAll(Iterable<Hex> hexes, Function<? super Hex, ? extends V> values) {
        var staged = new LinkedHashMap<Hex, V>();
        for (var hex : hexes) {
            staged.put(requireKey(hex), values.apply(hex));
        }
        cells.putAll(staged);
    }

    public void putAll(HexMap<? extends V> other) {
        other.cells.forEach(this::put);
    }

    /**
     * Replace every stored value with the given one.
     */
    public void setAll(V value) {
        cells.replaceAll((hex, old) -> value);
    }

    /**
     * @return the stored hexes, in insertion order
     */
    public Set<Hex> hexes() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    public Collection<V> values() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public Set<Map.Entry<Hex, V>> entries() {
        return Collections.unmodifiableMap(cells).entrySet();
    }

    @Override
    public Iterator<Map.Entry<Hex, V>> iterator() {
        return entries().iterator();
    }

    public Stream<Map.Entry<Hex, V>> stream() {
        return entries().stream();
    }

    public List<Hex> hexesWithValue(V value) {
        return hexesMatching(v -> Objects.equals(v, value));
    }

    public List<Hex> hexesMatching(Predicate<? super V> predicate) {
        var result = new ArrayList<Hex>();
        cells.forEach((hex, value) -> {
            if (predicate.test(value)) {
                result.add(hex);
            }
        });
        return result;
    }

    /**
     * @return the stored neighbors of the hex, in direction order
     */
    public List<Hex> neighborsOf(Hex hex) {
        var result = new ArrayList<Hex>(6);
        for (var neighbor : requireKey(hex).neighbors()) {
            if (cells.containsKey(neighbor)) {
                result.add(neighbor);
            }
        }
        return result;
    }

    /**
     * @return the bounds of the stored hexes, or empty for an empty map
     */
    public Optional<HexBounds> bounds() {
        return HexBounds.of(cells.keySet());
    }

    /**
     * @return a new map holding the entries whose hex lies within the bounds
     */
    public HexMap<V> within(HexBounds bounds) {
        var result = new HexMap<V>(defaultValue);
        cells.forEach((hex, value) -> {
            if (bounds.contains(hex)) {
                result.cells.put(hex, value);
            }
        });
        return result;
    }

    public HexMap<V> copy() {
        var result = new HexMap<V>(defaultValue);
        result.cells.putAll(cells);
        return result;
    }

    /**
     * @return a new map with every hex translated by the offset
     */
    public HexMap<V> shifted(Hex offset) {
        requireKey(offset);
        var result = new HexMap<V>(defaultValue);
        cells.forEach((hex, value) -> result.cells.put(hex.add(offset), value));
        return result;
    }

    /**
     * The entries of both maps; where both hold a hex, this map's value wins.
     */
    public HexMap<V> union(HexMap<? extends V> other) {
        return union(other, (mine, theirs) -> mine);
    }

    /**
     * The entries of both maps; where both hold a hex, the values are merged.
     */
    public HexMap<V> union(HexMap<? extends V> other, BinaryOperator<V> merge) {
        var result = copy();
        other.cells.forEach((hex, value) -> {
            if (result.cells.containsKey(hex)) {
                result.cells.put(hex, merge.apply(result.cells.get(hex), value));
            } else {
                result.cells.put(hex, value);
            }
        });
        log.debug("Union of {} and {} hexes holds {}", size(), other.size(), result.size());
        return result;
    }

    /**
     * The entries of this map whose hexes the other map also holds.
     */
    public HexMap<V> intersection(HexMap<? extends V> other) {
        return intersection(other, (mine, theirs) -> mine);
    }

    public HexMap<V> intersection(HexMap<? extends V> other, BinaryOperator<V> merge) {
        var result = new HexMap<V>(defaultValue);
        cells.forEach((hex, value) -> {
            if (other.cells.containsKey(hex)) {
                result.cells.put(hex, merge.apply(value, other.cells.get(hex)));
            }
        });
        log.debug("Intersection of {} and {} hexes holds {}", size(), other.size(), result.size());
        return result;
    }

    /**
     * The entries of this map whose hexes the other map does not hold.
     */
    public HexMap<V> difference(HexMap<?> other) {
        var result = new HexMap<V>(defaultValue);
        cells.forEach((hex, value) -> {
            if (!other.cells.containsKey(hex)) {
                result.cells.put(hex, value);
            }
        });
        log.debug("Difference of {} and {} hexes holds {}", size(), other.size(), result.size());
        return result;
    }

    /**
     * The entries held by exactly one of the two maps.
     */
    public HexMap<V> symmetricDifference(HexMap<? extends V> other) {
        var result = difference(other);
        other.cells.forEach((hex, value) -> {
            if (!cells.containsKey(hex)) {
                result.cells.put(hex, value);
            }
        });
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HexMap<?> other)) return false;
        return cells.equals(other.cells) && Objects.equals(defaultValue, other.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells, defaultValue);
    }

    @Override
    public String toString() {
        return "HexMap{size=" + cells.size() + ", default=" + defaultValue + ", cells=" + cells + "}";
    }
}
