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

public class UniformityTest {

    private final Uniformity<String> lowerCased = StringNormalizations.lowerCased();
    private final Uniformity<String> trimmed = StringNormalizations.trimmed();

    @Test
    public void shouldBeIdempotent() {
        for (String s : new String[]{" A ", "b", "  "}) {
            assertThat(lowerCased.normalized(lowerCased.normalized(s))).isEqualTo(lowerCased.normalized(s));
            assertThat(trimmed.normalized(trimmed.normalized(s))).isEqualTo(trimmed.normalized(s));
        }
    }

    @Test
    public void shouldLeaveUnhandledObjectsUntouched() {
        assertThat(lowerCased.normalizedCanHandle("A")).isTrue();
        assertThat(lowerCased.normalizedCanHandle(1)).isFalse();
        assertThat(lowerCased.normalizedOrSame(1)).isEqualTo(1);
        assertThat(lowerCased.normalizedOrSame("A")).isEqualTo("a");
    }

    @Test
    public void shouldDeriveEqualitiesWithoutBase() {
        assertThat(lowerCased.toEquality().areEqual("A", "a")).isTrue();
        assertThat(lowerCased.toEquality().areEqual("A", 1)).isFalse();
        assertThat(lowerCased.toHashingEquality().hashCodeFor("A")).isEqualTo("a".hashCode());
        assertThat(lowerCased.toEquivalence().areEquivalent("A", "a")).isTrue();
        assertThat(lowerCased.toEquivalence().areEquivalent("A", "b")).isFalse();
    }

    @Test
    public void shouldStayUniformityWhenComposedWithUniformity() {
        Uniformity<String> both = trimmed.and(lowerCased);
        assertThat(both.normalized(" AbC ")).isEqualTo("abc");
        assertThat(both.normalizedOrSame(42)).isEqualTo(42);
        assertThat(both.toEquality().areEqual(" A", "a ")).isTrue();
    }

    @Test
    public void shouldBecomePlainNormalizationWhenComposedWithNormalization() {
        Normalization<String> underscores = s -> s.replace('_', ' ');
        Normalization<String> composed = lowerCased.and(underscores);
        assertThat(composed).isNotInstanceOf(Uniformity.class);
        assertThat(composed.normalized("A_B")).isEqualTo("a b");
    }

    @Test
    public void shouldCreateUniformityForType() {
        Uniformity<Integer> abs = Uniformity.of(Integer.class, i -> Math.abs(i));
        assertThat(abs.toEquality().areEqual(-3, 3)).isTrue();
        assertThat(abs.normalizedCanHandle("3")).isFalse();
        assertThat(abs.toEquality().areEqual(3, "3")).isFalse();
    }

    @Test
    public void shouldHandleOnlyWhatBothComposedUniformitiesHandle() {
        Uniformity<String> nonBlank = new Uniformity<String>() {
            @Override
            public String normalized(String a) {
                return a.substring(1);
            }

            @Override
            public boolean normalizedCanHandle(Object b) {
                return b instanceof String && !((String) b).isEmpty();
            }
        };
        Uniformity<String> both = lowerCased.and(nonBlank);
        assertThat(both.normalizedCanHandle("Ab")).isTrue();
        assertThat(both.normalizedCanHandle("")).isFalse();
        assertThat(both.normalizedOrSame("")).isEqualTo("");
        assertThat(both.normalizedOrSame("Ab")).isEqualTo("b");
    }
}
