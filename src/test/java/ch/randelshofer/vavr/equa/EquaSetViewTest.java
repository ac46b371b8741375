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
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.List;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class EquaSetViewTest {

    private final Collections<String> trimmed = Collections.of(StringNormalizations.trimmed().toHashingEquality());
    private final Collections<Integer> numbers = Collections.natural();

    @Test
    public void shouldNotApplyFunctionsBeforeTraversal() {
        AtomicBoolean called = new AtomicBoolean();
        EquaSetView<Integer> view = trimmed.equaSet("1", "2").view()
                .map(s -> {
                    called.set(true);
                    return Integer.parseInt(s);
                })
                .filter(i -> i > 0)
                .flatMap(i -> List.of(i, i));
        assertThat(called.get()).isFalse();
        assertThat(view.size()).isEqualTo(4);
        assertThat(called.get()).isTrue();
    }

    @Test
    public void shouldRerunPipelineOnEveryTraversal() {
        AtomicInteger calls = new AtomicInteger();
        EquaSetView<Integer> view = trimmed.equaSet("1", "2", "3").view().map(s -> {
            calls.incrementAndGet();
            return Integer.parseInt(s);
        });
        view.toList();
        view.toList();
        assertThat(calls.get()).isEqualTo(6);
    }

    @Test
    public void shouldCompareProducedElements() {
        EquaSetView<Integer> left = trimmed.equaSet("1", "2", "01", "3").view().map(Integer::parseInt).map(i -> i + 1);
        EquaSetView<Integer> right = trimmed.equaSet("2", "3", "02", "4").view().map(Integer::parseInt);
        assertThat(left).isEqualTo(right);
        assertThat(left.hashCode()).isEqualTo(right.hashCode());
    }

    @Test
    public void shouldHaveBagSemantics() {
        assertThat(EquaSetView.of(1, 2, 2)).isEqualTo(EquaSetView.of(2, 1, 2));
        assertThat(EquaSetView.of(1, 2, 2)).isNotEqualTo(EquaSetView.of(1, 2));
        assertThat(EquaSetView.of(1, 1, 2)).isNotEqualTo(EquaSetView.of(1, 2, 2));
        assertThat(EquaSetView.of(1, 2).size()).isEqualTo(2);
    }

    @Test
    public void shouldDeduplicateWhenForced() {
        EquaSetView<Integer> view = trimmed.equaSet("1", "2", "01", "3").view().map(Integer::parseInt);
        assertThat(view.size()).isEqualTo(4);
        EquaSet<Integer> forced = view.toEquaSet(numbers);
        assertThat(forced).isEqualTo(numbers.equaSet(1, 2, 3));
        assertThat(view.force(numbers)).isEqualTo(forced);
        assertThat(view.toStrict(numbers)).isEqualTo(forced);
        assertThat(view.toFastEquaSet(numbers)).isEqualTo(forced);
        assertThat(view.toSortedEquaSet(SortedCollections.naturalOrder()).toList()).containsExactly(1, 2, 3);
    }

    @Test
    public void shouldRenderProducedElements() {
        assertThat(EquaSetView.of("a", "a").toString()).isEqualTo("EquaSetView(a, a)");
        assertThat(EquaSetView.of().toString()).isEqualTo("EquaSetView()");
        assertThat(EquaSetView.of().isEmpty()).isTrue();
    }

    @Test
    public void shouldCollectAndScan() {
        PartialFunction<Integer, String> evens = new PartialFunction<Integer, String>() {
            private static final long serialVersionUID = 1L;

            @Override
            public String apply(Integer i) {
                return "e" + i;
            }

            @Override
            public boolean isDefinedAt(Integer i) {
                return i % 2 == 0;
            }
        };
        assertThat(EquaSetView.of(1, 2, 3, 4).collect(evens).toList()).containsExactly("e2", "e4");
        assertThat(EquaSetView.of(1, 2, 3).scanLeft(0, Integer::sum).toList()).containsExactly(0, 1, 3, 6);
        assertThat(EquaSetView.of(1, 2, 3).scan(0, Integer::sum).toList()).containsExactly(0, 1, 3, 6);
        assertThat(EquaSetView.of(1, 2, 3).scanRight(0, Integer::sum).toList()).containsExactly(6, 5, 3, 0);
        assertThat(EquaSetView.of(1, 2, 3).withFilter(i -> i != 2).toList()).containsExactly(1, 3);
    }

    @Test
    public void shouldZip() {
        assertThat(EquaSetView.of("a", "b").zip(List.of(1, 2, 3)).toList())
                .containsExactly(Tuple.of("a", 1), Tuple.of("b", 2));
        assertThat(EquaSetView.of("a").zipAll(List.of(1, 2), "z", 0).toList())
                .containsExactly(Tuple.of("a", 1), Tuple.of("z", 2));
        assertThat(EquaSetView.of("a", "b").zipWithIndex().toList())
                .containsExactly(Tuple.of("a", 0), Tuple.of("b", 1));
        assertThat(EquaSetView.of("a", "b").zip(EquaSetView.of(1, 2)).size()).isEqualTo(2);
    }

    @Test
    public void shouldUnzip() {
        EquaSetView<Tuple2<String, Integer>> pairs = EquaSetView.of(Tuple.of("a", 1), Tuple.of("b", 2));
        Tuple2<? extends EquaSetView<String>, ? extends EquaSetView<Integer>> unzipped = pairs.<String, Integer>unzip(t -> t);
        assertThat(unzipped._1.toList()).containsExactly("a", "b");
        assertThat(unzipped._2.toList()).containsExactly(1, 2);
        assertThat(pairs.<String, Integer, Integer>unzip3(t -> Tuple.of(t._1, t._2, t._2 * 2))._3.toList()).containsExactly(2, 4);
    }

    @Test
    public void shouldNotEqualSortedView() {
        EquaSetView<Integer> unordered = EquaSetView.of(1, 2);
        SortedEquaSetView<Integer> sorted = SortedCollections.<Integer>naturalOrder().treeEquaSet(1, 2).view();
        assertThat(unordered).isNotEqualTo(sorted);
        assertThat(sorted).isNotEqualTo(unordered);
    }
}
