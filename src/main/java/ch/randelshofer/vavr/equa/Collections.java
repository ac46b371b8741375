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

import io.vavr.Tuple2;
import io.vavr.collection.HashSet;
import io.vavr.collection.Iterator;
import io.vavr.collection.LinkedHashMap;
import io.vavr.collection.LinkedHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collector;

/**
 * A factory for collections whose elements are compared with a
 * {@link HashingEquality} instead of their native {@code equals}.
 * <p>
 * The factory is the unit of interoperability: binary operations such as
 * {@link EquaSet#union(EquaSet)} accept only collections whose factories carry
 * the same policy object. Two factories created from the same policy object are
 * compatible; two factories created from distinct policy objects are not, even
 * if the policies behave identically.
 * <pre><code>
 * Collections&lt;String&gt; ci = Collections.of(StringNormalizations.lowerCased().toHashingEquality());
 * EquaSet&lt;String&gt; set = ci.equaSet("one", "two", "Two");   // EquaSet(one, two)
 * </code></pre>
 *
 * @param <E> the element type
 */
public class Collections<E> {

    private static final Collections<?> NATURAL = new Collections<>(Equalities.NaturalEquality.INSTANCE);

    private final HashingEquality<E> equality;

    Collections(HashingEquality<E> equality) {
        this.equality = Objects.requireNonNull(equality, "equality is null");
    }

    /**
     * Creates a factory for the given policy.
     *
     * @param equality the equality policy
     * @param <E>      the element type
     * @return a new factory
     */
    public static <E> Collections<E> of(HashingEquality<E> equality) {
        return new Collections<>(equality);
    }

    /**
     * Returns the factory of the natural policy, whose collections compare
     * their elements with {@code equals} and {@code hashCode}.
     *
     * @param <E> the element type
     * @return the natural factory
     */
    @SuppressWarnings("unchecked")
    public static <E> Collections<E> natural() {
        return (Collections<E>) NATURAL;
    }

    /**
     * Returns the policy that governs the collections of this factory.
     *
     * @return the equality policy
     */
    public HashingEquality<E> equality() {
        return equality;
    }

    /**
     * Wraps a value into a box that is governed by the policy of this factory.
     *
     * @param value a value
     * @return a new box
     */
    public EquaBox<E> box(E value) {
        return new EquaBox<>(value, this);
    }

    /**
     * Tests whether the collections of this factory can be combined with the
     * collections of another factory.
     *
     * @param that another factory
     * @return true if both factories carry the same policy object
     */
    public boolean isCompatibleWith(Collections<?> that) {
        return that != null && that.equality() == equality();
    }

    // ---- EquaSet

    public HashEquaSet<E> emptyEquaSet() {
        return new HashEquaSet<>(this, HashSet.empty());
    }

    /**
     * Creates an {@link EquaSet} of the given elements. Of several elements
     * that are equal under the policy, the first one is kept.
     *
     * @param elements zero or more elements
     * @return a new set
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public final HashEquaSet<E> equaSet(E... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return equaSetOf(Arrays.asList(elements));
    }

    public HashEquaSet<E> equaSetOf(Iterable<? extends E> elements) {
        return emptyEquaSet().addAll(elements);
    }

    // ---- FastEquaSet

    public FastEquaSet<E> emptyFastEquaSet() {
        return new FastEquaSet<>(this, LinkedHashSet.empty());
    }

    /**
     * Creates a {@link FastEquaSet} of the given elements. The set iterates in
     * insertion order. Of several elements that are equal under the policy, the
     * first one is kept.
     *
     * @param elements zero or more elements
     * @return a new set
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public final FastEquaSet<E> fastEquaSet(E... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return fastEquaSetOf(Arrays.asList(elements));
    }

    public FastEquaSet<E> fastEquaSetOf(Iterable<? extends E> elements) {
        return emptyFastEquaSet().addAll(elements);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an
     * {@link EquaSet} of this factory.
     *
     * @return a collector
     */
    public Collector<E, ArrayList<E>, HashEquaSet<E>> collector() {
        return EquaModule.toListAndThen(this::equaSetOf);
    }

    // ---- EquaMap

    public <V> FastEquaMap<E, V> emptyEquaMap() {
        return new FastEquaMap<>(this, LinkedHashMap.empty());
    }

    /**
     * Creates an {@link EquaMap} of the given entries. The map iterates in
     * insertion order. Of several entries whose keys are equal under the
     * policy, the last one wins.
     *
     * @param entries zero or more entries
     * @param <V>     the value type
     * @return a new map
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public final <V> FastEquaMap<E, V> equaMap(Tuple2<? extends E, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return equaMapOf(Arrays.asList(entries));
    }

    public <V> FastEquaMap<E, V> equaMapOf(Iterable<? extends Tuple2<? extends E, ? extends V>> entries) {
        return this.<V>emptyEquaMap().putAll(entries);
    }

    /**
     * Boxes all values of an iterable.
     *
     * @param values some values
     * @return an iterator over the boxes
     */
    Iterator<EquaBox<E>> boxAll(Iterable<? extends E> values) {
        Objects.requireNonNull(values, "elements is null");
        return Iterator.<E>ofAll(values).map(this::box);
    }

    @Override
    public String toString() {
        return "Collections(" + equality + ")";
    }
}
