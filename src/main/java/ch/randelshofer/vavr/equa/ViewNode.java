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

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A node in the pipeline of a view.
 * <p>
 * Every node, except {@link Source}, holds its upstream node and one
 * transformation. {@link #iterator()} evaluates the pipeline from the source,
 * every time it is called. Nothing is evaluated before that.
 *
 * @param <T> the type of the elements that this node produces
 */
abstract class ViewNode<T> {

    /**
     * Returns a new iterator over the elements that this node produces.
     */
    abstract Iterator<T> iterator();

    static final class Source<T> extends ViewNode<T> {
        private final Iterable<? extends T> elements;

        Source(Iterable<? extends T> elements) {
            this.elements = Objects.requireNonNull(elements, "elements is null");
        }

        @Override
        Iterator<T> iterator() {
            return Iterator.ofAll(elements);
        }
    }

    /**
     * Base class of the nodes that transform an upstream node.
     */
    abstract static class Transform<S, T> extends ViewNode<T> {
        final ViewNode<S> upstream;

        Transform(ViewNode<S> upstream) {
            this.upstream = upstream;
        }
    }

    static final class Mapped<S, T> extends Transform<S, T> {
        private final Function<? super S, ? extends T> mapper;

        Mapped(ViewNode<S> upstream, Function<? super S, ? extends T> mapper) {
            super(upstream);
            this.mapper = Objects.requireNonNull(mapper, "mapper is null");
        }

        @Override
        Iterator<T> iterator() {
            return upstream.iterator().map(mapper);
        }
    }

    static final class FlatMapped<S, T> extends Transform<S, T> {
        private final Function<? super S, ? extends Iterable<? extends T>> mapper;

        FlatMapped(ViewNode<S> upstream, Function<? super S, ? extends Iterable<? extends T>> mapper) {
            super(upstream);
            this.mapper = Objects.requireNonNull(mapper, "mapper is null");
        }

        @Override
        Iterator<T> iterator() {
            return upstream.iterator().flatMap(mapper);
        }
    }

    static final class Filtered<T> extends Transform<T, T> {
        private final Predicate<? super T> predicate;

        Filtered(ViewNode<T> upstream, Predicate<? super T> predicate) {
            super(upstream);
            this.predicate = Objects.requireNonNull(predicate, "predicate is null");
        }

        @Override
        Iterator<T> iterator() {
            return upstream.iterator().filter(predicate);
        }
    }

    static final class Collected<S, T> extends Transform<S, T> {
        private final PartialFunction<? super S, ? extends T> partialFunction;

        Collected(ViewNode<S> upstream, PartialFunction<? super S, ? extends T> partialFunction) {
            super(upstream);
            this.partialFunction = Objects.requireNonNull(partialFunction, "partialFunction is null");
        }

        @Override
        Iterator<T> iterator() {
            return upstream.iterator().collect(partialFunction);
        }
    }

    static final class ScannedLeft<S, T> extends Transform<S, T> {
        private final T zero;
        private final BiFunction<? super T, ? super S, ? extends T> operation;

        ScannedLeft(ViewNode<S> upstream, T zero, BiFunction<? super T, ? super S, ? extends T> operation) {
            super(upstream);
            this.zero = zero;
            this.operation = Objects.requireNonNull(operation, "operation is null");
        }

        @Override
        Iterator<T> iterator() {
            return upstream.iterator().scanLeft(zero, operation);
        }
    }

    /**
     * Computes running results from the right. The upstream elements are
     * buffered when iteration starts.
     */
    static final class ScannedRight<S, T> extends Transform<S, T> {
        private final T zero;
        private final BiFunction<? super S, ? super T, ? extends T> operation;

        ScannedRight(ViewNode<S> upstream, T zero, BiFunction<? super S, ? super T, ? extends T> operation) {
            super(upstream);
            this.zero = zero;
            this.operation = Objects.requireNonNull(operation, "operation is null");
        }

        @Override
        Iterator<T> iterator() {
            return upstream.iterator().scanRight(zero, operation);
        }
    }

    static final class Zipped<S, U> extends Transform<S, Tuple2<S, U>> {
        private final Iterable<? extends U> that;

        Zipped(ViewNode<S> upstream, Iterable<? extends U> that) {
            super(upstream);
            this.that = Objects.requireNonNull(that, "that is null");
        }

        @Override
        Iterator<Tuple2<S, U>> iterator() {
            return upstream.iterator().zip(that);
        }
    }

    static final class ZippedAll<S, U> extends Transform<S, Tuple2<S, U>> {
        private final Iterable<? extends U> that;
        private final S thisElem;
        private final U thatElem;

        ZippedAll(ViewNode<S> upstream, Iterable<? extends U> that, S thisElem, U thatElem) {
            super(upstream);
            this.that = Objects.requireNonNull(that, "that is null");
            this.thisElem = thisElem;
            this.thatElem = thatElem;
        }

        @Override
        Iterator<Tuple2<S, U>> iterator() {
            return upstream.iterator().zipAll(that, thisElem, thatElem);
        }
    }

    static final class ZippedWithIndex<S> extends Transform<S, Tuple2<S, Integer>> {

        ZippedWithIndex(ViewNode<S> upstream) {
            super(upstream);
        }

        @Override
        Iterator<Tuple2<S, Integer>> iterator() {
            return upstream.iterator().zipWithIndex();
        }
    }
}
