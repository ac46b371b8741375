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
import io.vavr.Tuple3;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.collection.Vector;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A lazy pipeline of transformations over the elements of a set, or of any
 * other iterable.
 * <p>
 * The transformations are recorded but not applied until the view is
 * traversed, which happens on {@link #iterator()}, {@link #size()},
 * {@link #toList()}, {@link #toString()}, {@link #equals(Object)},
 * {@link #hashCode()} and when the view is forced into a set. Every traversal
 * applies the whole pipeline again, so the functions passed to a view must be
 * free of side effects.
 * <p>
 * A view is not deduplicated: it may produce equal elements several times.
 * Deduplication happens when the view is forced into a set, under the policy
 * of the target factory:
 * <pre><code>
 * EquaSet&lt;Integer&gt; lengths = words.view().map(String::length).toEquaSet(Collections.natural());
 * </code></pre>
 * Two views are equal if they produce the same elements the same number of
 * times, in any order.
 *
 * @param <T> the element type
 */
public class EquaSetView<T> implements Iterable<T> {
    final ViewNode<T> node;

    EquaSetView(ViewNode<T> node) {
        this.node = node;
    }

    /**
     * Creates a view over the given elements.
     *
     * @param elements zero or more elements
     * @param <T>      the element type
     * @return a new view
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <T> EquaSetView<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return ofAll(Arrays.asList(elements));
    }

    public static <T> EquaSetView<T> ofAll(Iterable<? extends T> elements) {
        return new EquaSetView<>(new ViewNode.Source<>(elements));
    }

    @Override
    public Iterator<T> iterator() {
        return node.iterator();
    }

    public <U> EquaSetView<U> map(Function<? super T, ? extends U> mapper) {
        return new EquaSetView<>(new ViewNode.Mapped<>(node, mapper));
    }

    public <U> EquaSetView<U> flatMap(Function<? super T, ? extends Iterable<? extends U>> mapper) {
        return new EquaSetView<>(new ViewNode.FlatMapped<>(node, mapper));
    }

    public EquaSetView<T> filter(Predicate<? super T> predicate) {
        return new EquaSetView<>(new ViewNode.Filtered<>(node, predicate));
    }

    /**
     * Same as {@link #filter(Predicate)}.
     *
     * @param predicate a predicate
     * @return a new view
     */
    public EquaSetView<T> withFilter(Predicate<? super T> predicate) {
        return filter(predicate);
    }

    public <U> EquaSetView<U> collect(PartialFunction<? super T, ? extends U> partialFunction) {
        return new EquaSetView<>(new ViewNode.Collected<>(node, partialFunction));
    }

    public EquaSetView<T> scan(T zero, BiFunction<? super T, ? super T, ? extends T> operation) {
        return scanLeft(zero, operation);
    }

    public <U> EquaSetView<U> scanLeft(U zero, BiFunction<? super U, ? super T, ? extends U> operation) {
        return new EquaSetView<>(new ViewNode.ScannedLeft<>(node, zero, operation));
    }

    public <U> EquaSetView<U> scanRight(U zero, BiFunction<? super T, ? super U, ? extends U> operation) {
        return new EquaSetView<>(new ViewNode.ScannedRight<>(node, zero, operation));
    }

    public <U> EquaSetView<Tuple2<T, U>> zip(Iterable<? extends U> that) {
        return new EquaSetView<>(new ViewNode.Zipped<>(node, that));
    }

    public <U> EquaSetView<Tuple2<T, U>> zipAll(Iterable<? extends U> that, T thisElem, U thatElem) {
        return new EquaSetView<>(new ViewNode.ZippedAll<>(node, that, thisElem, thatElem));
    }

    public EquaSetView<Tuple2<T, Integer>> zipWithIndex() {
        return new EquaSetView<>(new ViewNode.ZippedWithIndex<>(node));
    }

    /**
     * Splits each element into two parts. Each of the returned views applies
     * {@code unzipper} on its own.
     *
     * @param unzipper a function that splits an element
     * @param <T1>     the type of the first parts
     * @param <T2>     the type of the second parts
     * @return a pair of views
     */
    public <T1, T2> Tuple2<? extends EquaSetView<T1>, ? extends EquaSetView<T2>> unzip(
            Function<? super T, Tuple2<? extends T1, ? extends T2>> unzipper) {
        Objects.requireNonNull(unzipper, "unzipper is null");
        return Tuple.of(this.<T1>map(t -> unzipper.apply(t)._1), this.<T2>map(t -> unzipper.apply(t)._2));
    }

    public <T1, T2, T3> Tuple3<? extends EquaSetView<T1>, ? extends EquaSetView<T2>, ? extends EquaSetView<T3>> unzip3(
            Function<? super T, Tuple3<? extends T1, ? extends T2, ? extends T3>> unzipper) {
        Objects.requireNonNull(unzipper, "unzipper is null");
        return Tuple.of(this.<T1>map(t -> unzipper.apply(t)._1), this.<T2>map(t -> unzipper.apply(t)._2),
                this.<T3>map(t -> unzipper.apply(t)._3));
    }

    /**
     * Traverses the pipeline and counts the produced elements.
     *
     * @return the number of produced elements, duplicates included
     */
    public int size() {
        return iterator().size();
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }

    public List<T> toList() {
        return List.ofAll(this);
    }

    public Vector<T> toVector() {
        return Vector.ofAll(this);
    }

    /**
     * Forces this view into an {@link EquaSet} of {@code target}, which
     * deduplicates the produced elements under its policy.
     *
     * @param target the factory of the result
     * @return a new set
     */
    public EquaSet<T> toEquaSet(Collections<T> target) {
        Objects.requireNonNull(target, "target is null");
        return target.equaSetOf(this);
    }

    public EquaSet<T> force(Collections<T> target) {
        return toEquaSet(target);
    }

    public EquaSet<T> toStrict(Collections<T> target) {
        return toEquaSet(target);
    }

    public FastEquaSet<T> toFastEquaSet(Collections<T> target) {
        Objects.requireNonNull(target, "target is null");
        return target.fastEquaSetOf(this);
    }

    public SortedEquaSet<T> toSortedEquaSet(SortedCollections<T> target) {
        Objects.requireNonNull(target, "target is null");
        return target.sortedEquaSetOf(this);
    }

    /**
     * Tests whether {@code o} is a view that can be compared with this one.
     *
     * @param o an object
     * @return true if {@code o} is an unordered view
     */
    public boolean canEqual(Object o) {
        return o instanceof EquaSetView;
    }

    /**
     * Compares the produced elements of two mutually comparable views.
     */
    boolean sameProducedElements(EquaSetView<?> that) {
        return EquaModule.bagOf(this).equals(EquaModule.bagOf(that));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EquaSetView)) {
            return false;
        }
        EquaSetView<?> that = (EquaSetView<?>) o;
        return that.canEqual(this) && canEqual(that) && sameProducedElements(that);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (T value : this) {
            h += Objects.hashCode(value);
        }
        return h;
    }

    public String stringPrefix() {
        return "EquaSetView";
    }

    @Override
    public String toString() {
        return iterator().mkString(stringPrefix() + "(", ", ", ")");
    }
}
