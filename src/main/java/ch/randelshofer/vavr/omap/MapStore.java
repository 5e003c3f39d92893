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

import io.vavr.collection.Iterator;
import io.vavr.control.Option;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * The key-value storage an {@link OrderedMap} delegates to.
 * <p>
 * A store knows nothing about the order of its keys. {@link OrderedMap}
 * keeps the order separately and is the only party that mutates the store
 * it owns.
 * <p>
 * A store decides which keys are the same through {@link #sameKey}. A store
 * backed by a {@link java.util.SortedMap} uses its comparator, one backed by
 * an {@link java.util.IdentityHashMap} uses reference equality.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface MapStore<K, V> {

    /**
     * Creates an empty store backed by a {@link java.util.HashMap}.
     *
     * @param <K> the key type
     * @param <V> the value type
     * @return a new empty store
     */
    static <K, V> MapStore<K, V> hashMap() {
        return new JavaMapStore<K, V>(java.util.HashMap::new);
    }

    /**
     * Creates an empty store backed by a {@link java.util.HashMap} with the
     * given initial capacity.
     *
     * @param initialCapacity the initial capacity
     * @param <K>             the key type
     * @param <V>             the value type
     * @return a new empty store
     */
    static <K, V> MapStore<K, V> hashMap(int initialCapacity) {
        return new JavaMapStore<K, V>(java.util.HashMap::new, new java.util.HashMap<>(initialCapacity));
    }

    /**
     * Creates an empty store backed by maps obtained from the given factory.
     * The factory is called again whenever the store is {@linkplain #copy() copied}.
     *
     * @param factory supplies new, empty {@link java.util.Map} instances
     * @param <K>     the key type
     * @param <V>     the value type
     * @return a new empty store
     * @throws NullPointerException     if {@code factory} is null
     * @throws IllegalArgumentException if the factory supplies a non-empty map
     */
    static <K, V> MapStore<K, V> of(Supplier<? extends java.util.Map<K, V>> factory) {
        Objects.requireNonNull(factory, "factory is null");
        return new JavaMapStore<K, V>(factory);
    }

    boolean containsKey(K key);

    /**
     * Returns true if this store treats the two keys as the same key.
     * The default implementation uses {@link Objects#equals(Object, Object)}.
     *
     * @param a a key
     * @param b a key
     * @return true if {@code a} and {@code b} address the same entry
     */
    default boolean sameKey(K a, K b) {
        return Objects.equals(a, b);
    }

    /**
     * Returns the value stored for the key.
     *
     * @param key a key
     * @return {@code Some(value)} if the key is present, {@code None} otherwise.
     * A null value is returned as {@code Some(null)}.
     */
    Option<V> get(K key);

    /**
     * Stores the value for the key.
     *
     * @return the previous value, or {@code None} if the key was absent
     */
    Option<V> put(K key, V value);

    /**
     * Removes the key.
     *
     * @return the removed value, or {@code None} if the key was absent
     */
    Option<V> remove(K key);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    void clear();

    /**
     * Returns the keys of this store, each exactly once, in an order defined
     * by the store.
     */
    Iterator<K> keys();

    /**
     * Returns a store of the same kind and content that does not share any
     * mutable state with this one.
     */
    MapStore<K, V> copy();
}
