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
import io.vavr.collection.List;
import io.vavr.collection.Vector;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A lazy pipeline over the elements of a {@link SortedEquaSet}, which keeps the
 * order of the elements.
 * <p>
 * Two sorted views are equal if they produce equal elements in the same
 * order. A sorted view is never equal to an unordered {@link EquaSetView}.
 *
 * @param <T> the element type
 */
public class SortedEquaSetView<T> extends EquaSetView<T> {

    SortedEquaSetView(ViewNode<T> node) {
        super(node);
    }

    @Override
    public <U> SortedEquaSetView<U> map(Function<? super T, ? extends U> mapper) {
        return new SortedEquaSetView<>(new ViewNode.Mapped<>(node, mapper));
    }

    @Override
    public <U> SortedEquaSetView<U> flatMap(Function<? super T, ? extends Iterable<? extends U>> mapper) {
        return new SortedEquaSetView<>(new ViewNode.FlatMapped<>(node, mapper));
    }

    @Override
    public SortedEquaSetView<T> filter(Predicate<? super T> predicate) {
        return new SortedEquaSetView<>(new ViewNode.Filtered<>(node, predicate));
    }

    @Override
    public SortedEquaSetView<T> withFilter(Predicate<? super T> predicate) {
        return filter(predicate);
    }

    @Override
    public <U> SortedEquaSetView<U> collect(PartialFunction<? super T, ? extends U> partialFunction) {
        return new SortedEquaSetView<>(new ViewNode.Collected<>(node, partialFunction));
    }

    @Override
    public SortedEquaSetView<T> scan(T zero, BiFunction<? super T, ? super T, ? extends T> operation) {
        return scanLeft(zero, operation);
    }

    @Override
    public <U> SortedEquaSetView<U> scanLeft(U zero, BiFunction<? super U, ? super T, ? extends U> operation) {
        return new SortedEquaSetView<>(new ViewNode.ScannedLeft<>(node, zero, operation));
    }

    @Override
    public <U> SortedEquaSetView<U> scanRight(U zero, BiFunction<? super T, ? super U, ? extends U> operation) {
        return new SortedEquaSetView<>(new ViewNode.ScannedRight<>(node, zero, operation));
    }

    @Override
    public <U> SortedEquaSetView<Tuple2<T, U>> zip(Iterable<? extends U> that) {
        return new SortedEquaSetView<>(new ViewNode.Zipped<>(node, that));
    }

    @Override
    public <U> SortedEquaSetView<Tuple2<T, U>> zipAll(Iterable<? extends U> that, T thisElem, U thatElem) {
        return new SortedEquaSetView<>(new ViewNode.ZippedAll<>(node, that, thisElem, thatElem));
    }

    @Override
    public SortedEquaSetView<Tuple2<T, Integer>> zipWithIndex() {
        return new SortedEquaSetView<>(new ViewNode.ZippedWithIndex<>(node));
    }

    @Override
    public <T1, T2> Tuple2<SortedEquaSetView<T1>, SortedEquaSetView<T2>> unzip(
            Function<? super T, Tuple2<? extends T1, ? extends T2>> unzipper) {
        Objects.requireNonNull(unzipper, "unzipper is null");
        return Tuple.of(this.<T1>map(t -> unzipper.apply(t)._1), this.<T2>map(t -> unzipper.apply(t)._2));
    }

    @Override
    public <T1, T2, T3> Tuple3<SortedEquaSetView<T1>, SortedEquaSetView<T2>, SortedEquaSetView<T3>> unzip3(
            Function<? super T, Tuple3<? extends T1, ? extends T2, ? extends T3>> unzipper) {
        Objects.requireNonNull(unzipper, "unzipper is null");
        return Tuple.of(this.<T1>map(t -> unzipper.apply(t)._1), this.<T2>map(t -> unzipper.apply(t)._2),
                this.<T3>map(t -> unzipper.apply(t)._3));
    }

    /**
     * Evaluates the pipeline into a sequence. The result is not deduplicated,
     * because no policy has been named yet.
     *
     * @return the produced elements, in order
     */
    public Vector<T> force() {
        return toVector();
    }

    @Override
    public boolean canEqual(Object o) {
        return o instanceof SortedEquaSetView;
    }

    @Override
    boolean sameProducedElements(EquaSetView<?> that) {
        return toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return List.ofAll(this).hashCode();
    }

    @Override
    public String stringPrefix() {
        return "SortedEquaSetView";
    }
}
