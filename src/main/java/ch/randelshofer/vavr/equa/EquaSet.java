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
import io.vavr.Tuple3;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.collection.Map;
import io.vavr.collection.Seq;
import io.vavr.collection.Set;
import io.vavr.collection.Stream;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.Comparator;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * An immutable set whose membership is decided by the equality policy of the
 * factory that created it.
 * <p>
 * All operations return new sets that are bound to the same factory as the
 * receiver. Binary operations accept only sets whose factory carries the same
 * policy object, and throw an {@link IncompatibleCollectionsException}
 * otherwise.
 * <p>
 * Two sets are equal if they are governed by the same policy object and
 * contain the same equivalence classes under that policy. The concrete variant
 * ({@link HashEquaSet}, {@link FastEquaSet}, {@link TreeEquaSet}) does not take
 * part in equality.
 * <p>
 * Sets cannot be mapped directly, because a mapping function may produce
 * values that the policy of the receiver considers equal. Use
 * {@link #into(Collections)} to map into another factory, or {@link #view()}
 * for a lazy pipeline.
 *
 * @param <T> the element type
 */
public interface EquaSet<T> extends Iterable<T> {

    /**
     * Returns the factory that created this set.
     *
     * @return the factory
     */
    Collections<T> path();

    // ---- algebra

    /**
     * Adds an element, unless an element that is equal under the policy is
     * already present.
     *
     * @param element an element
     * @return a set containing the element
     */
    EquaSet<T> add(T element);

    EquaSet<T> add(T element1, T element2, T... elements);

    EquaSet<T> addAll(Iterable<? extends T> elements);

    /**
     * Removes the element that is equal to {@code element} under the policy.
     *
     * @param element an element
     * @return a set that does not contain the element
     */
    EquaSet<T> remove(T element);

    EquaSet<T> remove(T element1, T element2, T... elements);

    EquaSet<T> removeAll(Iterable<? extends T> elements);

    /**
     * Computes the union of this set and {@code that}.
     *
     * @param that a compatible set
     * @return the union
     * @throws IncompatibleCollectionsException if {@code that} is governed by
     *                                          another policy
     */
    EquaSet<T> union(EquaSet<T> that);

    /**
     * Computes the intersection of this set and {@code that}. The elements
     * are taken from this set.
     *
     * @param that a compatible set
     * @return the intersection
     * @throws IncompatibleCollectionsException if {@code that} is governed by
     *                                          another policy
     */
    EquaSet<T> intersect(EquaSet<T> that);

    /**
     * Computes the elements of this set that are not in {@code that}.
     *
     * @param that a compatible set
     * @return the difference
     * @throws IncompatibleCollectionsException if {@code that} is governed by
     *                                          another policy
     */
    EquaSet<T> diff(EquaSet<T> that);

    boolean subsetOf(EquaSet<T> that);

    boolean contains(T element);

    /**
     * Tests whether this set can be meaningfully compared with {@code o}.
     * This is the case if {@code o} is an {@code EquaSet} governed by the same
     * policy object, whatever its variant.
     *
     * @param o an object
     * @return true if the two are comparable
     */
    boolean canEqual(Object o);

    // ---- traversal

    int size();

    boolean isEmpty();

    default boolean nonEmpty() {
        return !isEmpty();
    }

    T head();

    Option<T> headOption();

    T last();

    Option<T> lastOption();

    EquaSet<T> tail();

    EquaSet<T> init();

    Iterator<? extends EquaSet<T>> tails();

    Iterator<? extends EquaSet<T>> inits();

    EquaSet<T> filter(Predicate<? super T> predicate);

    EquaSet<T> filterNot(Predicate<? super T> predicate);

    Tuple2<? extends EquaSet<T>, ? extends EquaSet<T>> partition(Predicate<? super T> predicate);

    Tuple2<? extends EquaSet<T>, ? extends EquaSet<T>> span(Predicate<? super T> predicate);

    Tuple2<? extends EquaSet<T>, ? extends EquaSet<T>> splitAt(int n);

    EquaSet<T> drop(int n);

    EquaSet<T> dropRight(int n);

    EquaSet<T> dropWhile(Predicate<? super T> predicate);

    EquaSet<T> take(int n);

    EquaSet<T> takeRight(int n);

    EquaSet<T> takeWhile(Predicate<? super T> predicate);

    EquaSet<T> slice(int beginIndex, int endIndex);

    /**
     * Partitions this set into groups of {@code size} elements. The last
     * group may be smaller.
     *
     * @param size the group size
     * @return an iterator over the groups
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    Iterator<? extends EquaSet<T>> grouped(int size);

    Iterator<? extends EquaSet<T>> sliding(int size);

    /**
     * Slides a window of {@code size} elements over this set, advancing by
     * {@code step} elements each time.
     *
     * @param size the window size
     * @param step the distance between the first elements of two windows
     * @return an iterator over the windows
     * @throws IllegalArgumentException if {@code size} or {@code step} is not
     *                                  positive
     */
    Iterator<? extends EquaSet<T>> sliding(int size, int step);

    /**
     * Returns all subsets of this set, from the empty set up to the full set.
     * <p>
     * The subsets are computed lazily. Each call returns a new, independent
     * iterator. There are 2<sup>size</sup> subsets.
     *
     * @return an iterator over the subsets
     */
    Iterator<? extends EquaSet<T>> subsets();

    /**
     * Returns all subsets of this set with exactly {@code n} elements.
     *
     * @param n the size of the subsets
     * @return an iterator over the subsets
     * @throws IllegalArgumentException if {@code n} is negative
     */
    Iterator<? extends EquaSet<T>> subsets(int n);

    int count(Predicate<? super T> predicate);

    boolean exists(Predicate<? super T> predicate);

    boolean forall(Predicate<? super T> predicate);

    Option<T> find(Predicate<? super T> predicate);

    T fold(T zero, BiFunction<? super T, ? super T, ? extends T> combine);

    <U> U foldLeft(U zero, BiFunction<? super U, ? super T, ? extends U> combine);

    <U> U foldRight(U zero, BiFunction<? super T, ? super U, ? extends U> combine);

    /**
     * Folds the elements of this set into a result. The elements are folded
     * in iteration order with {@code seqop}; {@code combop} merges partial
     * results and is not needed by a sequential fold.
     *
     * @param zero   the initial value
     * @param seqop  adds an element to a partial result
     * @param combop merges two partial results
     * @param <U>    the result type
     * @return the aggregated value
     */
    <U> U aggregate(U zero, BiFunction<? super U, ? super T, ? extends U> seqop,
                    BiFunction<? super U, ? super U, ? extends U> combop);

    /**
     * Sums the elements of this set, which must be numbers.
     *
     * @return the sum, {@code 0} for an empty set
     * @throws UnsupportedOperationException if the elements are not numbers
     */
    Number sum();

    /**
     * Multiplies the elements of this set, which must be numbers.
     *
     * @return the product, {@code 1} for an empty set
     * @throws UnsupportedOperationException if the elements are not numbers
     */
    Number product();

    /**
     * Reduces the elements of this set in iteration order.
     *
     * @param op a binary operator
     * @return the reduced value
     * @throws java.util.NoSuchElementException if this set is empty
     */
    T reduce(BiFunction<? super T, ? super T, ? extends T> op);

    Option<T> reduceOption(BiFunction<? super T, ? super T, ? extends T> op);

    T reduceLeft(BiFunction<? super T, ? super T, ? extends T> op);

    Option<T> reduceLeftOption(BiFunction<? super T, ? super T, ? extends T> op);

    T reduceRight(BiFunction<? super T, ? super T, ? extends T> op);

    Option<T> reduceRightOption(BiFunction<? super T, ? super T, ? extends T> op);

    Option<T> max(Comparator<? super T> comparator);

    Option<T> min(Comparator<? super T> comparator);

    <U extends Comparable<? super U>> Option<T> maxBy(Function<? super T, ? extends U> f);

    <U extends Comparable<? super U>> Option<T> minBy(Function<? super T, ? extends U> f);

    <K> Map<K, ? extends EquaSet<T>> groupBy(Function<? super T, ? extends K> classifier);

    /**
     * Tests whether {@code that} yields elements that are equal under the
     * policy to the elements of this set, in iteration order.
     *
     * @param that some elements
     * @return true if both yield the same elements in the same order
     */
    boolean sameElements(Iterable<? extends T> that);

    String mkString();

    String mkString(CharSequence delimiter);

    String mkString(CharSequence prefix, CharSequence delimiter, CharSequence suffix);

    String stringPrefix();

    @Override
    Iterator<T> iterator();

    // ---- mapping and views

    /**
     * Returns a bridge for building a set of {@code target} from the elements
     * of this set.
     * <pre><code>
     * EquaSet&lt;Integer&gt; lengths = words.into(Collections.&lt;Integer&gt;natural()).map(String::length);
     * </code></pre>
     *
     * @param target the factory of the result
     * @param <U>    the element type of the result
     * @return a bridge
     */
    <U> EquaBridge<T, U, ? extends EquaSet<U>> into(Collections<U> target);

    <U> EquaBridge<T, U, ? extends SortedEquaSet<U>> into(SortedCollections<U> target);

    /**
     * Returns a lazy view over the elements of this set.
     *
     * @return a view
     */
    EquaSetView<T> view();

    /**
     * Rebuilds this set under another factory of the same element type.
     * Elements that the other policy considers equal are merged.
     *
     * @param target the factory of the result
     * @return a new set
     */
    EquaSet<T> copyInto(Collections<T> target);

    <T1, T2> Tuple2<? extends EquaSet<T1>, ? extends EquaSet<T2>> unzip(
            Function<? super T, Tuple2<? extends T1, ? extends T2>> unzipper,
            Collections<T1> target1, Collections<T2> target2);

    <T1, T2, T3> Tuple3<? extends EquaSet<T1>, ? extends EquaSet<T2>, ? extends EquaSet<T3>> unzip3(
            Function<? super T, Tuple3<? extends T1, ? extends T2, ? extends T3>> unzipper,
            Collections<T1> target1, Collections<T2> target2, Collections<T3> target3);

    /**
     * Pairs the elements of this set, in iteration order, with the elements
     * of {@code that}. The pairs are compared with their native equality.
     *
     * @param that an iterable
     * @param <U>  the element type of {@code that}
     * @return a set of pairs, in iteration order
     */
    <U> Set<Tuple2<T, U>> zip(Iterable<? extends U> that);

    <U> Set<Tuple2<T, U>> zipAll(Iterable<? extends U> that, T thisElem, U thatElem);

    Set<Tuple2<T, Integer>> zipWithIndex();

    // ---- conversions

    Object[] toArray();

    T[] toArray(IntFunction<T[]> arrayFactory);

    List<T> toList();

    Vector<T> toVector();

    Seq<T> toSeq();

    Stream<T> toStream();

    java.util.stream.Stream<T> toJavaStream();

    java.util.List<T> toJavaList();

    /**
     * Copies the elements into a new mutable list.
     *
     * @return a new list
     */
    java.util.ArrayList<T> toBuffer();

    /**
     * Converts this set into a set that uses the native equality of the
     * elements.
     *
     * @return a new set
     */
    Set<T> toSet();

    java.util.Set<T> toJavaSet();

    Iterator<T> toIterator();

    <K, V> Map<K, V> toMap(Function<? super T, ? extends Tuple2<? extends K, ? extends V>> f);

    <K, V> java.util.Map<K, V> toJavaMap(Function<? super T, ? extends Tuple2<? extends K, ? extends V>> f);

    List<EquaBox<T>> toEquaBoxList();

    Vector<EquaBox<T>> toEquaBoxVector();

    Seq<EquaBox<T>> toEquaBoxSeq();

    EquaBox<T>[] toEquaBoxArray();

    /**
     * Returns the boxes of this set. Boxes compare equal under the policy,
     * so this set has the same size as this {@code EquaSet}.
     *
     * @return the boxes
     */
    Set<EquaBox<T>> toEquaBoxSet();

    Iterator<EquaBox<T>> toEquaBoxIterator();

    java.util.ArrayList<EquaBox<T>> toEquaBoxBuffer();
}
