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

import io.vavr.collection.LinkedHashSet;
import io.vavr.collection.Set;

/**
 * An {@link EquaSet} that is backed by a linked hash set of boxes, and thus
 * iterates in insertion order.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements, if the policy does</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>iterates in the order in which the elements were first added</li>
 * </ul>
 * <p>
 * Adding an element that is already present, under the policy, neither
 * replaces the element nor changes its position.
 *
 * @param <T> the element type
 */
public final class FastEquaSet<T> extends AbstractEquaSet<T, FastEquaSet<T>> {

    FastEquaSet(Collections<T> path, Set<EquaBox<T>> underlying) {
        super(path, underlying);
    }

    @Override
    FastEquaSet<T> wrap(Set<EquaBox<T>> boxes) {
        return new FastEquaSet<>(path, boxes);
    }

    @Override
    Set<EquaBox<T>> emptyUnderlying() {
        return LinkedHashSet.empty();
    }

    @Override
    <U> EquaSet<U> newSet(Collections<U> target, Iterable<? extends U> elements) {
        return target.fastEquaSetOf(elements);
    }

    @Override
    public String stringPrefix() {
        return "FastEquaSet";
    }
}
