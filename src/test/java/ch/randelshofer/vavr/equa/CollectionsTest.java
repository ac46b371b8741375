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

import io.vavr.Tuple;
import io.vavr.collection.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CollectionsTest {

    private final OrderingEquality<String> caseInsensitive =
            StringNormalizations.lowerCased().toOrderingEquality(OrderingEquality.<String>natural());

    @Test
    public void shouldBeCompatibleWithFactoriesOfSamePolicyObject() {
        Collections<String> a = Collections.of(caseInsensitive);
        Collections<String> b = Collections.of(caseInsensitive);
        SortedCollections<String> c = SortedCollections.of(caseInsensitive);
        assertThat(a.isCompatibleWith(b)).isTrue();
        assertThat(a.isCompatibleWith(c)).isTrue();
        assertThat(c.isCompatibleWith(a)).isTrue();
        assertThat(a.isCompatibleWith(null)).isFalse();
        assertThat(a.equaSet("x").union(b.equaSet("X", "y"))).isEqualTo(c.treeEquaSet("Y", "x"));
    }

    @Test
    public void shouldNotBeCompatibleWithStructurallyEqualPolicies() {
        Collections<String> a = Collections.of(StringNormalizations.lowerCased().toHashingEquality());
        Collections<String> b = Collections.of(StringNormalizations.lowerCased().toHashingEquality());
        assertThat(a.isCompatibleWith(b)).isFalse();
        assertThat(a.equaSet("x")).isNotEqualTo(b.equaSet("x"));
        assertThatThrownBy(() -> a.equaSet("x").union(b.equaSet("y")))
                .isInstanceOf(IncompatibleCollectionsException.class)
                .hasMessageContaining("EquaSet");
    }

    @Test
    public void shouldHaveSymmetricCanEqualAcrossAllVariants() {
        Collections<String> hashed = Collections.of(caseInsensitive);
        SortedCollections<String> sorted = SortedCollections.of(caseInsensitive);
        List<EquaSet<String>> sets = List.of(
                hashed.equaSet("a"), hashed.fastEquaSet("a"), sorted.sortedEquaSet("a"), sorted.treeEquaSet("a"),
                sorted.equaSet("A"), sorted.fastEquaSet("A"));
        for (EquaSet<String> x : sets) {
            for (EquaSet<String> y : sets) {
                assertThat(x.canEqual(y)).isTrue();
                assertThat(x).isEqualTo(y);
                assertThat(x.hashCode()).isEqualTo(y.hashCode());
            }
        }
    }

    @Test
    public void shouldHaveSymmetricCanEqualForIncompatiblePolicies() {
        EquaSet<String> a = Collections.of(caseInsensitive).equaSet("a");
        EquaSet<String> b = SortedCollections.of(StringNormalizations.lowerCased()
                .toOrderingEquality(OrderingEquality.<String>natural())).treeEquaSet("a");
        assertThat(a.canEqual(b)).isFalse();
        assertThat(b.canEqual(a)).isFalse();
        assertThat(a.canEqual("a")).isFalse();
    }

    @Test
    public void shouldInteroperateNaturalFactories() {
        EquaSet<String> hashed = Collections.<String>natural().equaSet("a", "b");
        EquaSet<String> sorted = SortedCollections.<String>naturalOrder().treeEquaSet("b", "a");
        assertThat(hashed).isEqualTo(sorted);
        assertThat(hashed.union(sorted)).isEqualTo(hashed);
        assertThat(Collections.<String>natural()).isSameAs(Collections.<String>natural());
        assertThat(Collections.natural().equality()).isSameAs(HashingEquality.natural());
    }

    @Test
    public void shouldUseNativeEqualityInNaturalFactory() {
        EquaSet<String> set = Collections.<String>natural().equaSet("a", "A", "a");
        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    public void shouldCreateMaps() {
        Collections<String> path = Collections.of(caseInsensitive);
        FastEquaMap<String, Integer> map = path.equaMap(Tuple.of("a", 1), Tuple.of("A", 2));
        assertThat(map.size()).isEqualTo(1);
        assertThat(map.get("a").get()).isEqualTo(2);
        assertThat(path.<Integer>emptyEquaMap().isEmpty()).isTrue();
    }

    @Test
    public void shouldRenderPolicy() {
        assertThat(Collections.natural().toString()).isEqualTo("Collections(natural)");
        assertThat(SortedCollections.<String>naturalOrder().toString()).isEqualTo("SortedCollections(natural)");
    }
}
