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
package ch.randelshofer.vavr.equa;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class EqualityTest {

    @Test
    public void shouldShareOneNaturalPolicy() {
        assertThat((Object) Equality.natural()).isSameAs(HashingEquality.natural());
        assertThat((Object) HashingEquality.<String>natural()).isSameAs(OrderingEquality.<String>natural());
        assertThat((Object) Equivalence.natural()).isSameAs(Equality.natural());
    }

    @Test
    public void shouldCompareNaturally() {
        HashingEquality<String> eq = HashingEquality.natural();
        assertThat(eq.areEqual("a", "a")).isTrue();
        assertThat(eq.areEqual("a", "A")).isFalse();
        assertThat(eq.areEqual(null, null)).isTrue();
        assertThat(eq.hashCodeFor("a")).isEqualTo("a".hashCode());
        assertThat(eq.hashCodeFor(null)).isZero();
    }

    @Test
    public void shouldOrderNaturally() {
        OrderingEquality<Integer> eq = OrderingEquality.natural();
        assertThat(eq.compare(1, 2)).isNegative();
        assertThat(eq.compare(2, 2)).isZero();
        assertThat(eq.areEqual(2, 2)).isTrue();
    }

    @Test
    public void shouldAllowCrossTypeEquality() {
        Equality<Integer> eq = (a, b) -> b instanceof Number && ((Number) b).intValue() == a;
        assertThat(eq.areEqual(1, 1L)).isTrue();
        assertThat(eq.areEqual(1, "1")).isFalse();
        assertThat(eq.areEquivalent(1, 1)).isTrue();
    }
}
