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

import io.vavr.PartialFunction;
import io.vavr.collection.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class EquaBridgeTest {

    private final Collections<String> caseInsensitive = Collections.of(StringNormalizations.lowerCased().toHashingEquality());
    private final Collections<Integer> numbers = Collections.natural();

    @Test
    public void shouldMapIntoTargetFactory() {
        EquaSet<Integer> lengths = caseInsensitive.equaSet("a", "bb", "CC").into(numbers).map(String::length);
        assertThat(lengths).isEqualTo(numbers.equaSet(1, 2));
        assertThat(lengths.path()).isSameAs(numbers);
    }

    @Test
    public void shouldDeduplicateUnderTargetPolicy() {
        EquaSet<String> trimmed = Collections.<String>natural().equaSet(" a", "a ", "A")
                .into(caseInsensitive).map(String::trim);
        assertThat(trimmed.size()).isEqualTo(1);
        assertThat(trimmed.contains("a")).isTrue();
    }

    @Test
    public void shouldFlatMapCollectAndScan() {
        EquaSet<Integer> source = numbers.fastEquaSet(1, 2, 3);
        assertThat(source.into(numbers).flatMap(i -> List.of(i, i * 10))).isEqualTo(numbers.equaSet(1, 10, 2, 20, 3, 30));
        PartialFunction<Integer, Integer> odd = new PartialFunction<Integer, Integer>() {
            private static final long serialVersionUID = 1L;

            @Override
            public Integer apply(Integer i) {
                return -i;
            }

            @Override
            public boolean isDefinedAt(Integer i) {
                return i % 2 != 0;
            }
        };
        assertThat(source.into(numbers).collect(odd)).isEqualTo(numbers.equaSet(-1, -3));
        assertThat(source.into(numbers).scanLeft(0, Integer::sum)).isEqualTo(numbers.equaSet(0, 1, 3, 6));
    }

    @Test
    public void shouldFilterBeforeBuilding() {
        EquaSet<Integer> evens = numbers.equaSet(1, 2, 3, 4).into(numbers).filter(i -> i % 2 == 0).map(i -> i / 2);
        assertThat(evens).isEqualTo(numbers.equaSet(1, 2));
    }

    @Test
    public void shouldBuildSortedSetForSortedTarget() {
        SortedEquaSet<Integer> sorted = caseInsensitive.equaSet("ccc", "a", "bb")
                .into(SortedCollections.<Integer>naturalOrder()).map(String::length);
        assertThat(sorted.toList()).containsExactly(1, 2, 3);
    }
}
