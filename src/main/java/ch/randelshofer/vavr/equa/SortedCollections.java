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
import io.vavr.collection.TreeMap;
import io.vavr.collection.TreeSet;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

/**
 * A factory for collections whose elements are compared and ordered with an
 * {@link OrderingEquality}.
 * <p>
 * In addition to the hash-backed collections of {@link Collections}, this
 * factory creates sorted collections, which iterate in ascending order of the
 * policy. Since an {@code OrderingEquality} is also a {@code HashingEquality},
 * the sorted sets of this factory can be combined with, and compared to, its
 * hash-backed sets.
 *
 * @param <E> the element type
 */
public class SortedCollections<E> extends Collections<E> {

    private static final SortedCollections<?> NATURAL = new SortedCollections<>(Equalities.NaturalEquality.INSTANCE);

    private final OrderingEquality<E> equality;
    private final Comparator<EquaBox<E>> boxOrdering;

    SortedCollections(OrderingEquality<E> equality) {
        super(equality);
        this.equality = equality;
        this.boxOrdering = (a, b) -> equality.compare(a.value(), b.value());
    }

    /**
     * Creates a factory for the given policy.
     *
     * @param equality the ordering equality policy
     * @param <E>      the element type
     * @return a new factory
     */
    public static <E> SortedCollections<E> of(OrderingEquality<E> equality) {
        return new SortedCollections<>(equality);
    }

    /**
     * Returns the factory of the natural ordering policy. Its collections are
     * compatible with the collections of {@link Collections#natural()}.
     *
     * @param <E> the element type
     * @return the natural sorted factory
     */
    @SuppressWarnings("unchecked")
    public static <E extends Comparable<? super E>> SortedCollections<E> naturalOrder() {
        return (SortedCollections<E>) NATURAL;
    }

    @Override
    public OrderingEquality<E> equality() {
        return equality;
    }

    /**
     * Returns the order of boxes that is induced by the policy.
     *
     * @return a comparator of boxes
     */
    public Comparator<EquaBox<E>> boxOrdering() {
        return boxOrdering;
    }

    // ---- SortedEquaSet

    public SortedEquaSet<E> emptySortedEquaSet() {
        return emptyTreeEquaSet();
    }

    @SafeVarargs
    @SuppressWarnings("varargs")
    public final SortedEquaSet<E> sortedEquaSet(E... elements) {
        return treeEquaSet(elements);
    }

    public SortedEquaSet<E> sortedEquaSetOf(Iterable<? extends E> elements) {
        return treeEquaSetOf(elements);
    }

    // ---- TreeEquaSet

    public TreeEquaSet<E> emptyTreeEquaSet() {
        return new TreeEquaSet<>(this, TreeSet.empty(boxOrdering));
    }

    /**
     * Creates a {@link TreeEquaSet} of the given elements, which iterates in
     * ascending order of the policy.
     *
     * @param elements zero or more elements
     * @return a new set
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public final TreeEquaSet<E> treeEquaSet(E... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return treeEquaSetOf(Arrays.asList(elements));
    }

    public TreeEquaSet<E> treeEquaSetOf(Iterable<? extends E> elements) {
        return emptyTreeEquaSet().addAll(elements);
    }

    // ---- TreeEquaMap

    public <V> TreeEquaMap<E, V> emptyTreeEquaMap() {
        return new TreeEquaMap<>(this, TreeMap.empty(boxOrdering));
    }

    @SafeVarargs
    @SuppressWarnings("varargs")
    public final <V> TreeEquaMap<E, V> treeEquaMap(Tuple2<? extends E, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return treeEquaMapOf(Arrays.asList(entries));
    }

    public <V> TreeEquaMap<E, V> treeEquaMapOf(Iterable<? extends Tuple2<? extends E, ? extends V>> entries) {
        return this.<V>emptyTreeEquaMap().putAll(entries);
    }

    @Override
    public String toString() {
        return "SortedCollections(" + equality + ")";
    }
}
