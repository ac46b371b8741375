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
import io.vavr.collection.Iterator;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds a set of another factory from the elements of a source set.
 * <p>
 * A bridge is obtained with {@link EquaSet#into(Collections)}. Its
 * operations transform the source elements and collect the results into a new
 * set of the target factory, which deduplicates them under its own policy.
 *
 * @param <T> the element type of the source
 * @param <U> the element type of the target
 * @param <R> the type of the resulting set
 */
public final class EquaBridge<T, U, R extends EquaSet<U>> {
    private final Iterable<T> source;
    private final Function<Iterable<? extends U>, ? extends R> builder;

    EquaBridge(Iterable<T> source, Function<Iterable<? extends U>, ? extends R> builder) {
        this.source = source;
        this.builder = builder;
    }

    private Iterator<T> sourceIterator() {
        return Iterator.ofAll(source);
    }

    /**
     * Applies {@code mapper} to each element.
     *
     * @param mapper a function
     * @return a new set of the target factory
     */
    public R map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return builder.apply(sourceIterator().map(mapper));
    }

    public R flatMap(Function<? super T, ? extends Iterable<? extends U>> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return builder.apply(sourceIterator().flatMap(mapper));
    }

    /**
     * Applies {@code partialFunction} to each element it is defined at, and
     * drops all other elements.
     *
     * @param partialFunction a partial function
     * @return a new set of the target factory
     */
    public R collect(PartialFunction<? super T, ? extends U> partialFunction) {
        Objects.requireNonNull(partialFunction, "partialFunction is null");
        return builder.apply(sourceIterator().collect(partialFunction));
    }

    /**
     * Computes running results, starting with {@code zero}.
     *
     * @param zero      the initial value
     * @param operation the accumulating function
     * @return a new set of the target factory
     */
    public R scanLeft(U zero, BiFunction<? super U, ? super T, ? extends U> operation) {
        Objects.requireNonNull(operation, "operation is null");
        return builder.apply(sourceIterator().scanLeft(zero, operation));
    }

    /**
     * Drops the source elements that do not satisfy {@code predicate}.
     *
     * @param predicate a predicate
     * @return a bridge over the remaining elements
     */
    public EquaBridge<T, U, R> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return new EquaBridge<>(() -> sourceIterator().filter(predicate), builder);
    }
}
