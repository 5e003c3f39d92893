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

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.function.Supplier;

/**
 * A {@link MapStore} that adapts a mutable {@link java.util.Map}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
final class JavaMapStore<K, V> implements MapStore<K, V> {
    private final Supplier<? extends Map<K, V>> factory;
    private final Map<K, V> map;

    JavaMapStore(Supplier<? extends Map<K, V>> factory) {
        this(factory, factory.get());
    }

    JavaMapStore(Supplier<? extends Map<K, V>> factory, Map<K, V> map) {
        if (map == null) {
            throw new NullPointerException("factory supplied null");
        }
        if (!map.isEmpty()) {
            throw new IllegalArgumentException("factory supplied a non-empty map");
        }
        this.factory = factory;
        this.map = map;
    }

    @Override
    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean sameKey(K a, K b) {
        if (a == b) {
            return true;
        }
        if (map instanceof IdentityHashMap<?, ?>) {
            return false;
        }
        if (map instanceof SortedMap<?, ?>) {
            Comparator<? super K> comparator = ((SortedMap<K, V>) map).comparator();
            return comparator == null
                    ? ((Comparable<Object>) a).compareTo(b) == 0
                    : comparator.compare(a, b) == 0;
        }
        return Objects.equals(a, b);
    }

    @Override
    public Option<V> get(K key) {
        V value = map.get(key);
        return value != null || map.containsKey(key) ? Option.some(value) : Option.none();
    }

    @Override
    public Option<V> put(K key, V value) {
        boolean present = map.containsKey(key);
        V old = map.put(key, value);
        return present ? Option.some(old) : Option.none();
    }

    @Override
    public Option<V> remove(K key) {
        return map.containsKey(key) ? Option.some(map.remove(key)) : Option.none();
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public void clear() {
        map.clear();
    }

    @Override
    public Iterator<K> keys() {
        return Iterator.ofAll(map.keySet());
    }

    @Override
    public JavaMapStore<K, V> copy() {
        JavaMapStore<K, V> copy = new JavaMapStore<>(factory);
        copy.map.putAll(map);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof JavaMapStore<?, ?> && map.equals(((JavaMapStore<?, ?>) o).map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
