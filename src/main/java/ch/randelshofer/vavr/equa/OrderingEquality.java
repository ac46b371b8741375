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

import java.util.Comparator;

/**
 * A {@link HashingEquality} that also defines a total order, so that it can
 * govern sorted storage.
 * <p>
 * Implementations must keep the order consistent with equality:
 * <pre>compare(a, b) == 0 if and only if areEqual(a, b)</pre>
 * and with hashing, as required by {@link HashingEquality}. None of this is
 * checked at run time.
 *
 * @param <T> the type whose equality and order are defined
 */
public interface OrderingEquality<T> extends HashingEquality<T>, Comparator<T> {

    /**
     * Returns the ordering equality of a {@link Comparable} type: its natural
     * order, {@code equals} and {@code hashCode}.
     * <p>
     * The returned instance is the same object as {@link HashingEquality#natural()},
     * so sorted and hashed natural factories are compatible. It is only
     * consistent for types whose natural order is consistent with {@code equals}.
     *
     * @param <T> the value type
     * @return the natural ordering equality
     */
    @SuppressWarnings("unchecked")
    static <T extends Comparable<? super T>> OrderingEquality<T> natural() {
        return (OrderingEquality<T>) (OrderingEquality<?>) Equalities.NaturalEquality.INSTANCE;
    }

    @Override
    int compare(T a, T b);
}
