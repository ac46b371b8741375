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
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Map;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An {@link EquaSet} that iterates in ascending order of its
 * {@link OrderingEquality}.
 * <p>
 * Every operation that returns a set of the same element type returns a
 * {@code SortedEquaSet}.
 *
 * @param <T> the element type
 */
public interface SortedEquaSet<T> extends EquaSet<T> {

    @Override
    SortedCollections<T> path();

    /**
     * Returns the policy that orders this set.
     *
     * @return the ordering equality
     */
    default OrderingEquality<T> ordering() {
        return path().equality();
    }

    @Override
    SortedEquaSet<T> add(T element);

    @Override
    SortedEquaSet<T> add(T element1, T element2, T... elements);

    @Override
    SortedEquaSet<T> addAll(Iterable<? extends T> elements);

    @Override
    SortedEquaSet<T> remove(T element);

    @Override
    SortedEquaSet<T> remove(T element1, T element2, T... elements);

    @Override
    SortedEquaSet<T> removeAll(Iterable<? extends T> elements);

    @Override
    SortedEquaSet<T> union(EquaSet<T> that);

    @Override
    SortedEquaSet<T> intersect(EquaSet<T> that);

    @Override
    SortedEquaSet<T> diff(EquaSet<T> that);

    @Override
    SortedEquaSet<T> tail();

    @Override
    SortedEquaSet<T> init();

    @Override
    Iterator<? extends SortedEquaSet<T>> tails();

    @Override
    Iterator<? extends SortedEquaSet<T>> inits();

    @Override
    SortedEquaSet<T> filter(Predicate<? super T> predicate);

    @Override
    SortedEquaSet<T> filterNot(Predicate<? super T> predicate);

    @Override
    Tuple2<? extends SortedEquaSet<T>, ? extends SortedEquaSet<T>> partition(Predicate<? super T> predicate);

    @Override
    Tuple2<? extends SortedEquaSet<T>, ? extends SortedEquaSet<T>> span(Predicate<? super T> predicate);

    @Override
    Tuple2<? extends SortedEquaSet<T>, ? extends SortedEquaSet<T>> splitAt(int n);

    @Override
    SortedEquaSet<T> drop(int n);

    @Override
    SortedEquaSet<T> dropRight(int n);

    @Override
    SortedEquaSet<T> dropWhile(Predicate<? super T> predicate);

    @Override
    SortedEquaSet<T> take(int n);

    @Override
    SortedEquaSet<T> takeRight(int n);

    @Override
    SortedEquaSet<T> takeWhile(Predicate<? super T> predicate);

    @Override
    SortedEquaSet<T> slice(int beginIndex, int endIndex);

    @Override
    Iterator<? extends SortedEquaSet<T>> grouped(int size);

    @Override
    Iterator<? extends SortedEquaSet<T>> sliding(int size);

    @Override
    Iterator<? extends SortedEquaSet<T>> sliding(int size, int step);

    @Override
    Iterator<? extends SortedEquaSet<T>> subsets();

    @Override
    Iterator<? extends SortedEquaSet<T>> subsets(int n);

    @Override
    <K> Map<K, ? extends SortedEquaSet<T>> groupBy(Function<? super T, ? extends K> classifier);

    /**
     * Applies {@code partialFunction} to each element it is defined at, and
     * collects the results into a set of the same factory.
     *
     * @param partialFunction a partial function
     * @return a new set
     */
    SortedEquaSet<T> collect(PartialFunction<? super T, ? extends T> partialFunction);

    /**
     * Computes running results from left to right, starting with
     * {@code zero}, and collects them into a set of the same factory.
     *
     * @param zero      the initial value
     * @param operation the accumulating function
     * @return a new set
     */
    SortedEquaSet<T> scanLeft(T zero, BiFunction<? super T, ? super T, ? extends T> operation);

    SortedEquaSet<T> scanRight(T zero, BiFunction<? super T, ? super T, ? extends T> operation);

    /**
     * Returns a lazy view over the elements of this set, which keeps their
     * order.
     *
     * @return a view
     */
    @Override
    SortedEquaSetView<T> view();
}
