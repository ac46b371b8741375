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

import io.vavr.collection.HashSet;
import io.vavr.collection.Set;

/**
 * An {@link EquaSet} that is backed by a hash set of boxes.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements, if the policy does</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>does not guarantee a specific iteration order</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add: O(1)</li>
 *     <li>remove: O(1)</li>
 *     <li>contains: O(1)</li>
 * </ul>
 * Each operation computes the hash code of the element with the policy.
 *
 * @param <T> the element type
 */
public final class HashEquaSet<T> extends AbstractEquaSet<T, HashEquaSet<T>> {

    HashEquaSet(Collections<T> path, Set<EquaBox<T>> underlying) {
        super(path, underlying);
    }

    @Override
    HashEquaSet<T> wrap(Set<EquaBox<T>> boxes) {
        return new HashEquaSet<>(path, boxes);
    }

    @Override
    Set<EquaBox<T>> emptyUnderlying() {
        return HashSet.empty();
    }

    @Override
    <U> EquaSet<U> newSet(Collections<U> target, Iterable<? extends U> elements) {
        return target.equaSetOf(elements);
    }

    @Override
    public String stringPrefix() {
        return "EquaSet";
    }
}
