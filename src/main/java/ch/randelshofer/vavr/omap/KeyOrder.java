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
import io.vavr.collection.Vector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * The ordered, duplicate-free sequence of keys of an {@link OrderedMap}.
 * <p>
 * This class does not check for duplicates itself. {@link OrderedMap} consults
 * its store before it appends or inserts a key, and looks keys up with the
 * key equivalence of that store, which need not be {@link Object#equals}.
 * <p>
 * Every structural change and every permutation increments {@link #modCount},
 * so that iterators handed out by {@link #iterator()} fail fast.
 *
 * @param <K> the key type
 */
final class KeyOrder<K> {
    private final ArrayList<K> keys;
    private int modCount;

    KeyOrder() {
        keys = new ArrayList<>();
    }

    KeyOrder(int initialCapacity) {
        keys = new ArrayList<>(initialCapacity);
    }

    /**
     * Copy constructor. The new instance does not share its backing list with
     * {@code that}.
     *
     * @param that the key order to copy
     */
    KeyOrder(KeyOrder<K> that) {
        keys = new ArrayList<>(that.keys);
    }

    int size() {
        return keys.size();
    }

    boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Translates a negative index into an index counted from the end.
     * Non-negative indices are returned unchanged. The result may still be
     * out of range.
     */
    int normalize(int index) {
        return index < 0 ? keys.size() + index : index;
    }

    boolean isDefinedAt(int index) {
        return 0 <= index && index < keys.size();
    }

    K get(int index) {
        return keys.get(index);
    }

    K first() {
        if (keys.isEmpty()) {
            throw new NoSuchElementException("first of empty KeyOrder");
        }
        return keys.get(0);
    }

    K last() {
        if (keys.isEmpty()) {
            throw new NoSuchElementException("last of empty KeyOrder");
        }
        return keys.get(keys.size() - 1);
    }

    /**
     * Finds the key by a linear scan.
     *
     * @param key     a key
     * @param sameKey the key equivalence of the store
     * @return the index of the key, or -1 if it is absent
     */
    int indexOf(K key, BiPredicate<? super K, ? super K> sameKey) {
        for (int i = 0, n = keys.size(); i < n; i++) {
            if (sameKey.test(keys.get(i), key)) {
                return i;
            }
        }
        return -1;
    }

    void append(K key) {
        keys.add(key);
        modCount++;
    }

    /**
     * Inserts the key at the given index, clamping the index into
     * {@code [0, size()]}: negative indices insert at the front, indices at or
     * beyond the end append.
     *
     * @param index a normalized index
     * @param key   a key that is not yet in this order
     * @return the index at which the key was inserted
     */
    int insert(int index, K key) {
        int at = Math.max(0, Math.min(index, keys.size()));
        keys.add(at, key);
        modCount++;
        return at;
    }

    K removeAt(int index) {
        K removed = keys.remove(index);
        modCount++;
        return removed;
    }

    void clear() {
        keys.clear();
        modCount++;
    }

    /**
     * Stable sort of the keys. If the comparator throws, the order is left
     * as it was.
     */
    void sort(Comparator<? super K> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        ArrayList<K> sorted = new ArrayList<>(keys);
        sorted.sort(comparator);
        Collections.copy(keys, sorted);
        modCount++;
    }

    void reverse() {
        Collections.reverse(keys);
        modCount++;
    }

    /**
     * Returns a lazy iterator over the keys. The iterator throws
     * {@link ConcurrentModificationException} if this order changes while it
     * is in use.
     */
    Iterator<K> iterator() {
        return Iterator.ofAll(new java.util.Iterator<K>() {
            private final int expectedModCount = modCount;
            private int index;

            @Override
            public boolean hasNext() {
                return index < keys.size();
            }

            @Override
            public K next() {
                if (modCount != expectedModCount) {
                    throw new ConcurrentModificationException();
                }
                if (index >= keys.size()) {
                    throw new NoSuchElementException("next() on empty iterator");
                }
                return keys.get(index++);
            }
        });
    }

    Vector<K> toVector() {
        return Vector.ofAll(keys);
    }

    @Override
    public String toString() {
        return keys.toString();
    }
}
