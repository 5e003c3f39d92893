/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.omap;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * Implements a mutable map that keeps its keys in an explicit order, and
 * that supports list-like access by position.
 * <p>
 * Features:
 * <ul>
 *     <li>iterates in the order in which keys were inserted, unless the
 *     order is changed with {@link #putAt}, {@link #sortBy}, {@link #sortByKey},
 *     {@link #sortByEntry} or {@link #reverse}</li>
 *     <li>gets, inserts and removes entries by position; negative positions
 *     count from the end, {@code -1} is the last entry</li>
 *     <li>allows null keys and null values, if the {@link MapStore} does</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>get, containsKey: O(1)</li>
 *     <li>put of a new or existing key: O(1) in an amortized sense</li>
 *     <li>getAt: O(1)</li>
 *     <li>putAt, remove, removeAt, indexOf: O(N)</li>
 *     <li>sortBy, sortByKey, sortByEntry: O(N log N)</li>
 *     <li>copy: O(N)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * This map consists of two parts: a {@link KeyOrder}, a list of the keys
 * without duplicates, and a {@link MapStore}, which maps keys to values.
 * Every mutating operation updates both parts, so that after each public
 * operation the order and the store contain the same keys. Keys are
 * compared with the equivalence of the store, see {@link MapStore#sameKey}.
 * <p>
 * Mutations write to the store first and change the order only after the
 * store has accepted the change. A store that rejects a key or a value
 * leaves the map as it was.
 * <p>
 * The order is never exposed as a mutable view. Callers permute it through
 * the sort and reverse methods of this class.
 * <p>
 * If a map is shared between threads, the callers must lock the whole map:
 * almost every mutation touches both the order and the store.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class OrderedMap<K, V> implements Iterable<Tuple2<K, V>> {
    private final KeyOrder<K> order;
    private final MapStore<K, V> store;

    /**
     * Creates an empty map backed by a {@link java.util.HashMap}.
     */
    public OrderedMap() {
        this(new KeyOrder<>(), MapStore.hashMap());
    }

    /**
     * Creates an empty map backed by a {@link java.util.HashMap}, sized for
     * the given number of entries.
     *
     * @param initialCapacity the expected number of entries
     */
    public OrderedMap(int initialCapacity) {
        this(new KeyOrder<>(initialCapacity), MapStore.hashMap(initialCapacity));
    }

    /**
     * Creates an empty map backed by the given store. The map takes ownership
     * of the store: the caller must not modify it afterwards.
     *
     * @param emptyStore an empty store
     * @throws NullPointerException     if {@code emptyStore} is null
     * @throws IllegalArgumentException if {@code emptyStore} is not empty
     */
    public OrderedMap(MapStore<K, V> emptyStore) {
        Objects.requireNonNull(emptyStore, "emptyStore is null");
        if (!emptyStore.isEmpty()) {
            throw new IllegalArgumentException("store is not empty, size=" + emptyStore.size());
        }
        this.order = new KeyOrder<>();
        this.store = emptyStore;
    }

    OrderedMap(KeyOrder<K> order, MapStore<K, V> store) {
        this.order = order;
        this.store = store;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedMap}.
     * The map has the encounter order of the stream. Later tuples with an
     * equal key overwrite the value, but not the position, of earlier ones.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedMap} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedMap<K, V>> collector() {
        return Collector.of(ArrayList::new, ArrayList::add, (left, right) -> {
            left.addAll(right);
            return left;
        }, list -> OrderedMap.<K, V>ofEntries(list));
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedMap}.
     *
     * @param keyMapper   The key mapper
     * @param valueMapper The value mapper
     * @param <K>         The key type
     * @param <V>         The value type
     * @param <T>         Initial {@link java.util.stream.Stream} elements type
     * @return An {@link OrderedMap} Collector.
     */
    public static <K, V, T> Collector<T, ArrayList<T>, OrderedMap<K, V>> collector(
            Function<? super T, ? extends K> keyMapper, Function<? super T, ? extends V> valueMapper) {
        Objects.requireNonNull(keyMapper, "keyMapper is null");
        Objects.requireNonNull(valueMapper, "valueMapper is null");
        return Collector.of(ArrayList::new, ArrayList::add, (left, right) -> {
            left.addAll(right);
            return left;
        }, list -> {
            OrderedMap<K, V> result = new OrderedMap<>(list.size());
            for (T t : list) {
                result.put(keyMapper.apply(t), valueMapper.apply(t));
            }
            return result;
        });
    }

    public static <K, V> OrderedMap<K, V> empty() {
        return new OrderedMap<>();
    }

    public static <K, V> OrderedMap<K, V> of(K key, V value) {
        OrderedMap<K, V> result = new OrderedMap<>();
        result.put(key, value);
        return result;
    }

    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2) {
        OrderedMap<K, V> result = new OrderedMap<>();
        result.put(k1, v1);
        result.put(k2, v2);
        return result;
    }

    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        OrderedMap<K, V> result = new OrderedMap<>();
        result.put(k1, v1);
        result.put(k2, v2);
        result.put(k3, v3);
        return result;
    }

    /**
     * Creates an OrderedMap from a {@link java.util.Map}. The order of the
     * new map is the iteration order of the source map, which is unspecified
     * for a {@link java.util.HashMap}.
     *
     * @param map A java.util.Map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new OrderedMap containing the entries of {@code map}
     */
    public static <K, V> OrderedMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        OrderedMap<K, V> result = new OrderedMap<>(map.size());
        result.putAll(map);
        return result;
    }

    /**
     * Creates a copy of the given OrderedMap. The copy has the same order and
     * the same values, and shares no mutable state with {@code map}.
     *
     * @param map An OrderedMap
     * @param <K> The key type
     * @param <V> The value type
     * @return A new OrderedMap
     */
    public static <K, V> OrderedMap<K, V> ofAll(OrderedMap<K, V> map) {
        Objects.requireNonNull(map, "map is null");
        return map.copy();
    }

    /**
     * Creates an OrderedMap from a copy of the given store. The order of the
     * new map is the key order of the store.
     *
     * @param store A store; it is copied, not adopted
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new OrderedMap
     */
    public static <K, V> OrderedMap<K, V> ofStore(MapStore<K, V> store) {
        Objects.requireNonNull(store, "store is null");
        MapStore<K, V> copy = store.copy();
        KeyOrder<K> order = new KeyOrder<>(copy.size());
        for (K key : copy.keys()) {
            order.append(key);
        }
        return new OrderedMap<>(order, copy);
    }

    /**
     * Creates an OrderedMap of the given entries, in the given order.
     * <p>
     * If a key occurs more than once, the first occurrence determines the
     * position of the key, and the last occurrence determines its value.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new OrderedMap containing the given entries
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K, V> OrderedMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ofEntries(Arrays.asList(entries));
    }

    /**
     * Creates an OrderedMap of the given entries, in the given order.
     * Duplicate keys are treated as in {@link #ofEntries(Tuple2[])}.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new OrderedMap containing the given entries
     */
    public static <K, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        OrderedMap<K, V> result = new OrderedMap<>();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            result.put(entry._1, entry._2);
        }
        return result;
    }

    /**
     * Creates an OrderedMap of the given entries, in the given order.
     * Duplicate keys are treated as in {@link #ofEntries(Tuple2[])}.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new OrderedMap containing the given entries
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K, V> OrderedMap<K, V> ofEntries(Map.Entry<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        OrderedMap<K, V> result = new OrderedMap<>(entries.length);
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Returns a copy of this map. The copy has the same order and the same
     * values, and shares no mutable state with this map. The values
     * themselves are not copied.
     *
     * @return a new OrderedMap
     */
    public OrderedMap<K, V> copy() {
        return new OrderedMap<>(new KeyOrder<>(order), store.copy());
    }

    // -- lookup

    public boolean containsKey(K key) {
        return store.containsKey(key);
    }

    public int size() {
        return order.size();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    /**
     * Returns the value for the given key.
     *
     * @param key a key
     * @return the value
     * @throws NoSuchElementException if the key is absent
     */
    public V get(K key) {
        return store.get(key).getOrElseThrow(() -> new NoSuchElementException("key not found: " + key));
    }

    public Option<V> getOption(K key) {
        return store.get(key);
    }

    public V getOrElse(K key, V defaultValue) {
        return store.get(key).getOrElse(defaultValue);
    }

    /**
     * Returns the entry at the given position.
     * <p>
     * A negative index counts from the end: {@code -1} is the last entry,
     * {@code -size()} is the first entry.
     *
     * @param index a position
     * @return the key and value at that position
     * @throws IndexOutOfBoundsException if the position is outside of the map
     */
    public Tuple2<K, V> getAt(int index) {
        K key = order.get(checkIndex(index, "getAt"));
        return Tuple.of(key, valueOf(key));
    }

    /**
     * Returns the key at the given position. Positions are interpreted as
     * in {@link #getAt(int)}.
     *
     * @throws IndexOutOfBoundsException if the position is outside of the map
     */
    public K keyAt(int index) {
        return order.get(checkIndex(index, "keyAt"));
    }

    /**
     * Returns the value at the given position. Positions are interpreted as
     * in {@link #getAt(int)}.
     *
     * @throws IndexOutOfBoundsException if the position is outside of the map
     */
    public V valueAt(int index) {
        return valueOf(order.get(checkIndex(index, "valueAt")));
    }

    /**
     * Returns the position of the given key, or -1 if the key is absent.
     */
    public int indexOf(K key) {
        return store.containsKey(key) ? order.indexOf(key, store::sameKey) : -1;
    }

    public Tuple2<K, V> head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty OrderedMap");
        }
        K key = order.first();
        return Tuple.of(key, valueOf(key));
    }

    public Tuple2<K, V> last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty OrderedMap");
        }
        K key = order.last();
        return Tuple.of(key, valueOf(key));
    }

    // -- iteration

    /**
     * Returns a snapshot of the keys in order.
     */
    public Vector<K> keys() {
        return order.toVector();
    }

    /**
     * Returns a lazy iterator over the values in order. Each value is looked
     * up when the iterator reaches it. Each call returns a new iterator that
     * starts at the current first entry.
     * <p>
     * The iterator throws {@link java.util.ConcurrentModificationException}
     * if the order of this map changes while the iterator is in use.
     */
    public Iterator<V> values() {
        return order.iterator().map(this::valueOf);
    }

    /**
     * Returns a lazy iterator over the entries in order, with the same
     * contract as {@link #values()}.
     */
    public Iterator<Tuple2<K, V>> pairs() {
        return order.iterator().map(key -> Tuple.of(key, valueOf(key)));
    }

    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return pairs();
    }

    /**
     * Returns a snapshot of the entries in order.
     * <p>
     * {@code OrderedMap.ofEntries(map.toPairs())} reproduces the order and
     * the values of {@code map}.
     */
    public Vector<Tuple2<K, V>> toPairs() {
        return Vector.ofAll(pairs());
    }

    /**
     * Returns a {@link java.util.LinkedHashMap} with the entries of this map
     * in order.
     */
    public java.util.LinkedHashMap<K, V> toJavaMap() {
        java.util.LinkedHashMap<K, V> result = new java.util.LinkedHashMap<>(Math.max(16, size() * 4 / 3 + 1));
        for (Tuple2<K, V> pair : this) {
            result.put(pair._1, pair._2);
        }
        return result;
    }

    // -- insertion

    /**
     * Associates the value with the key. A new key is appended to the end of
     * the order. An existing key keeps its position.
     *
     * @param key   a key
     * @param value a value
     * @return the previous value, or {@code None} if the key is new
     */
    public Option<V> put(K key, V value) {
        boolean isNew = !store.containsKey(key);
        Option<V> previous = store.put(key, value);
        if (isNew) {
            order.append(key);
        }
        return previous;
    }

    /**
     * Associates the value with the key, and moves the key to the given
     * position.
     * <p>
     * If the key is already present, it is first removed from its current
     * position, so that it occurs only once. A negative index is then
     * counted from the end of the remaining keys. An index before the
     * first position inserts at the front, an index at or after the end
     * appends.
     * <p>
     * For example, with the keys {@code [a, b, c]}, {@code putAt(0, "b", v)}
     * yields {@code [b, a, c]}, and {@code putAt(-1, "x", v)} yields
     * {@code [a, b, x, c]}.
     *
     * @param index a position
     * @param key   a key
     * @param value a value
     * @return the position at which the key was placed
     * @throws IllegalStateException if the store contains the key, but the
     *                               order does not
     */
    public int putAt(int index, K key, V value) {
        int current = -1;
        if (store.containsKey(key)) {
            current = order.indexOf(key, store::sameKey);
            if (current < 0) {
                throw new IllegalStateException("key is in the store, but has no position in the order: " + key);
            }
        }
        store.put(key, value);
        // a moved key keeps the instance the store holds
        K placed = current < 0 ? key : order.removeAt(current);
        return order.insert(order.normalize(index), placed);
    }

    /**
     * Puts all entries of the given map, in its order.
     *
     * @param map an OrderedMap
     */
    public void putAll(OrderedMap<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        for (Tuple2<? extends K, ? extends V> pair : map.toPairs()) {
            put(pair._1, pair._2);
        }
    }

    /**
     * Puts all entries of the given map, in its iteration order.
     *
     * @param map a java.util.Map
     */
    public void putAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    // -- removal

    /**
     * Removes the key.
     *
     * @param key a key
     * @return true if the key was removed, false if it was absent
     */
    public boolean remove(K key) {
        if (!store.containsKey(key)) {
            return false;
        }
        int index = order.indexOf(key, store::sameKey);
        if (index < 0) {
            throw new IllegalStateException("key is in the store, but has no position in the order: " + key);
        }
        store.remove(key);
        order.removeAt(index);
        return true;
    }

    /**
     * Removes the entry at the given position. Positions are interpreted as
     * in {@link #getAt(int)}.
     *
     * @param index a position
     * @return true if an entry was removed, false if the position is outside
     * of the map
     */
    public boolean removeAt(int index) {
        int normalized = order.normalize(index);
        if (!order.isDefinedAt(normalized)) {
            return false;
        }
        store.remove(order.get(normalized));
        order.removeAt(normalized);
        return true;
    }

    public void clear() {
        store.clear();
        order.clear();
    }

    // -- reordering

    /**
     * Sorts the entries by the natural order of their keys. The sort is
     * stable.
     *
     * @throws ClassCastException if the keys are not mutually comparable; the
     *                            order is left unchanged
     */
    @SuppressWarnings("unchecked")
    public void sortByKey() {
        order.sort((a, b) -> ((Comparable<Object>) a).compareTo(b));
    }

    /**
     * Sorts the entries by their keys. The sort is stable.
     *
     * @param comparator compares keys
     */
    public void sortBy(Comparator<? super K> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        order.sort(comparator);
    }

    /**
     * Sorts the entries. The sort is stable.
     *
     * @param comparator compares entries
     */
    public void sortByEntry(Comparator<? super Tuple2<K, V>> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        order.sort((a, b) -> comparator.compare(Tuple.of(a, valueOf(a)), Tuple.of(b, valueOf(b))));
    }

    public void reverse() {
        order.reverse();
    }

    // -- equality

    /**
     * Returns true if the given map has the same keys and values as this map.
     * The order is not compared.
     *
     * @param map a java.util.Map
     */
    public boolean contentEquals(Map<?, ?> map) {
        Objects.requireNonNull(map, "map is null");
        if (map.size() != size()) {
            return false;
        }
        for (Tuple2<K, V> pair : this) {
            if (!map.containsKey(pair._1) || !Objects.equals(map.get(pair._1), pair._2)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if the given map has the same entries as this map, in the
     * same order.
     *
     * @param that an OrderedMap
     */
    public boolean sequenceEquals(OrderedMap<?, ?> that) {
        Objects.requireNonNull(that, "that is null");
        if (that == this) {
            return true;
        }
        if (that.size() != size()) {
            return false;
        }
        java.util.Iterator<? extends Tuple2<?, ?>> it = that.pairs();
        for (Tuple2<K, V> pair : this) {
            if (!pair.equals(it.next())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares the keys and values of two OrderedMaps. The order is not
     * compared; use {@link #sequenceEquals(OrderedMap)} for that.
     * <p>
     * Keys of this map are looked up in the other map, so the comparison
     * uses the key equivalence of the other map's store.
     */
    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedMap<?, ?>)) {
            return false;
        }
        OrderedMap<K, Object> that = (OrderedMap<K, Object>) o;
        if (that.size() != size()) {
            return false;
        }
        try {
            for (Tuple2<K, V> pair : this) {
                Option<Object> other = that.store.get(pair._1);
                if (other.isEmpty() || !Objects.equals(other.get(), pair._2)) {
                    return false;
                }
            }
        } catch (ClassCastException | NullPointerException unused) {
            // the other store cannot hold keys like ours
            return false;
        }
        return true;
    }

    /**
     * Returns the sum of the entry hash codes, as defined by
     * {@link java.util.Map#hashCode()}. The order does not contribute.
     */
    @Override
    public int hashCode() {
        int h = 0;
        for (Tuple2<K, V> pair : this) {
            h += Objects.hashCode(pair._1) ^ Objects.hashCode(pair._2);
        }
        return h;
    }

    @Override
    public String toString() {
        return pairs().mkString("OrderedMap(", ", ", ")");
    }

    // -- internals

    private int checkIndex(int index, String operation) {
        int normalized = order.normalize(index);
        if (!order.isDefinedAt(normalized)) {
            throw new IndexOutOfBoundsException(operation + "(" + index + ") with size " + order.size());
        }
        return normalized;
    }

    private V valueOf(K key) {
        return store.get(key).getOrElseThrow(
                () -> new IllegalStateException("key has a position in the order, but no value in the store: " + key));
    }
}
