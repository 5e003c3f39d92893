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

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class KeyOrderTest {

    private static KeyOrder<String> of(String... keys) {
        KeyOrder<String> order = new KeyOrder<>();
        for (String key : keys) {
            order.append(key);
        }
        return order;
    }

    @Test
    public void shouldNormalizeNegativeIndices() {
        KeyOrder<String> order = of("a", "b", "c");
        assertThat(order.normalize(0)).isEqualTo(0);
        assertThat(order.normalize(5)).isEqualTo(5);
        assertThat(order.normalize(-1)).isEqualTo(2);
        assertThat(order.normalize(-3)).isEqualTo(0);
        assertThat(order.normalize(-4)).isEqualTo(-1);
        assertThat(order.isDefinedAt(order.normalize(-4))).isFalse();
        assertThat(order.isDefinedAt(3)).isFalse();
        assertThat(order.isDefinedAt(2)).isTrue();
    }

    @Test
    public void shouldClampInsertionIndex() {
        KeyOrder<String> order = of("a", "b");
        assertThat(order.insert(-7, "x")).isEqualTo(0);
        assertThat(order.insert(99, "y")).isEqualTo(3);
        assertThat(order.insert(2, "z")).isEqualTo(2);
        assertThat(order.toVector()).containsExactly("x", "a", "z", "b", "y");
    }

    @Test
    public void shouldFindKeysWithGivenEquivalence() {
        KeyOrder<String> order = of("a", "b", "c");
        assertThat(order.indexOf("b", Objects::equals)).isEqualTo(1);
        assertThat(order.indexOf("B", Objects::equals)).isEqualTo(-1);
        assertThat(order.indexOf("B", String::equalsIgnoreCase)).isEqualTo(1);
        assertThat(order.indexOf(new String("c"), (x, y) -> x == y)).isEqualTo(-1);
    }

    @Test
    public void shouldRemoveByIndex() {
        KeyOrder<String> order = of("a", "b", "c");
        assertThat(order.removeAt(1)).isEqualTo("b");
        assertThat(order.removeAt(1)).isEqualTo("c");
        assertThat(order.toVector()).containsExactly("a");
    }

    @Test
    public void shouldReturnFirstAndLast() {
        KeyOrder<String> order = of("a", "b", "c");
        assertThat(order.first()).isEqualTo("a");
        assertThat(order.last()).isEqualTo("c");
        order.clear();
        assertThatThrownBy(order::first).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(order::last).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    public void shouldNotShareStateWithCopy() {
        KeyOrder<String> order = of("a", "b");
        KeyOrder<String> copy = new KeyOrder<>(order);
        copy.append("c");
        order.reverse();
        assertThat(order.toVector()).containsExactly("b", "a");
        assertThat(copy.toVector()).containsExactly("a", "b", "c");
    }

    @Test
    public void shouldSortStably() {
        KeyOrder<String> order = of("bb", "a", "cc", "d");
        order.sort(Comparator.comparing(String::length));
        assertThat(order.toVector()).containsExactly("a", "d", "bb", "cc");
    }

    @Test
    public void shouldKeepOrderWhenComparatorFails() {
        KeyOrder<String> order = of("c", "b", "a");
        assertThatThrownBy(() -> order.sort((x, y) -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(order.toVector()).containsExactly("c", "b", "a");
    }

    @Test
    public void shouldFailFastAfterPermutation() {
        KeyOrder<String> order = of("a", "b");
        io.vavr.collection.Iterator<String> it = order.iterator();
        assertThat(it.next()).isEqualTo("a");
        order.reverse();
        assertThatThrownBy(it::next).isInstanceOf(ConcurrentModificationException.class);
    }

    @Test
    public void shouldIterateAllKeys() {
        KeyOrder<String> order = of("a", "b", "c");
        assertThat(order.iterator().toJavaList()).containsExactly("a", "b", "c");
        assertThat(new KeyOrder<String>().iterator().hasNext()).isFalse();
    }
}
