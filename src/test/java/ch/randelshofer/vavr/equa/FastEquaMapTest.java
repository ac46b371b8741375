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
import io.vavr.Tuple2;
import io.vavr.collection.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FastEquaMapTest {

    private final Collections<String> caseInsensitive = Collections.of(StringNormalizations.lowerCased().toHashingEquality());

    @Test
    public void shouldLookUpKeysByPolicy() {
        FastEquaMap<String, Integer> map = caseInsensitive.equaMap(Tuple.of("a", 1), Tuple.of("b", 2));
        assertThat(map.get("A").get()).isEqualTo(1);
        assertThat(map.containsKey("B")).isTrue();
        assertThat(map.containsKey("c")).isFalse();
        assertThat(map.getOrElse("c", 0)).isEqualTo(0);
        assertThat(map.get("c").isEmpty()).isTrue();
    }

    @Test
    public void shouldReplaceEntryAndKeepPosition() {
        FastEquaMap<String, Integer> map = caseInsensitive.<Integer>emptyEquaMap()
                .put("a", 1).put("b", 2).put("A", 3);
        assertThat(map.size()).isEqualTo(2);
        assertThat(List.ofAll(map)).containsExactly(Tuple.of("A", 3), Tuple.of("b", 2));
        assertThat(map.keysIterator().toList()).containsExactly("A", "b");
        assertThat(map.values()).containsExactly(3, 2);
    }

    @Test
    public void shouldRemoveKeys() {
        FastEquaMap<String, Integer> map = caseInsensitive.equaMap(Tuple.of("a", 1), Tuple.of("b", 2), Tuple.of("c", 3));
        assertThat(map.remove("B").keysIterator().toList()).containsExactly("a", "c");
        assertThat(map.removeAll(List.of("A", "C")).keysIterator().toList()).containsExactly("b");
        assertThat(map.removeAll(caseInsensitive.equaSet("A", "B")).keysIterator().toList()).containsExactly("c");
    }

    @Test
    public void shouldRejectIncompatibleMaps() {
        FastEquaMap<String, Integer> map = caseInsensitive.equaMap(Tuple.of("a", 1));
        Collections<String> other = Collections.of(StringNormalizations.lowerCased().toHashingEquality());
        assertThatThrownBy(() -> map.putAll(other.equaMap(Tuple.of("b", 2))))
                .isInstanceOf(IncompatibleCollectionsException.class);
        assertThatThrownBy(() -> map.removeAll(other.equaSet("a")))
                .isInstanceOf(IncompatibleCollectionsException.class);
        assertThat(map.putAll(caseInsensitive.equaMap(Tuple.of("A", 5))).get("a").get()).isEqualTo(5);
    }

    @Test
    public void shouldReturnKeySetOfSameFactory() {
        FastEquaMap<String, Integer> map = caseInsensitive.equaMap(Tuple.of("b", 1), Tuple.of("a", 2));
        FastEquaSet<String> keys = map.keySet();
        assertThat(keys.path()).isSameAs(caseInsensitive);
        assertThat(keys.toList()).containsExactly("b", "a");
        assertThat(keys).isEqualTo(caseInsensitive.equaSet("A", "B"));
    }

    @Test
    public void shouldCompareByPolicyAndValues() {
        FastEquaMap<String, Integer> left = caseInsensitive.equaMap(Tuple.of("a", 1), Tuple.of("b", 2));
        FastEquaMap<String, Integer> right = caseInsensitive.equaMap(Tuple.of("B", 2), Tuple.of("A", 1));
        assertThat(left).isEqualTo(right);
        assertThat(left.hashCode()).isEqualTo(right.hashCode());
        assertThat(left).isNotEqualTo(caseInsensitive.equaMap(Tuple.of("a", 1), Tuple.of("b", 3)));
        assertThat(left).isNotEqualTo(Collections.<String>natural().equaMap(Tuple.of("a", 1), Tuple.of("b", 2)));
    }

    @Test
    public void shouldConvertAndRender() {
        FastEquaMap<String, Integer> map = caseInsensitive.equaMap(Tuple.of("a", 1));
        assertThat(map.toString()).isEqualTo("EquaMap(a -> 1)");
        assertThat(caseInsensitive.emptyEquaMap().toString()).isEqualTo("EquaMap()");
        assertThat(map.toJavaMap()).containsEntry("a", 1);
        assertThat(map.toMap().get("a").get()).isEqualTo(1);
        assertThat(map.toEquaBoxMap().containsKey(caseInsensitive.box("A"))).isTrue();
        Integer sum = map.put("b", 2).foldLeft(0, (acc, e) -> acc + e._2);
        assertThat(sum).isEqualTo(3);
        Tuple2<String, Integer> first = map.iterator().next();
        assertThat(first).isEqualTo(Tuple.of("a", 1));
    }
}
