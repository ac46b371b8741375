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
import java.util.Objects;

/**
 * A pure, deterministic transformation applied to values before they are
 * compared, for example trimming or lower-casing a string.
 * <p>
 * A normalization can be promoted into an equality policy by combining it with
 * a base policy that compares the normalized values:
 * <pre><code>
 * HashingEquality&lt;String&gt; eq = StringNormalizations.trimmed().and(s -&gt; s.replace('_', ' ')).toHashingEquality();
 * </code></pre>
 * Equalities derived from a plain normalization assume that the right-hand
 * side of {@link Equality#areEqual(Object, Object)} is also a {@code T}. Use a
 * {@link Uniformity} if values of other types must be handled gracefully.
 *
 * @param <T> the type of the normalized values
 */
@FunctionalInterface
public interface Normalization<T> {

    /**
     * Returns the normalized form of {@code a}.
     *
     * @param a a value
     * @return the normalized value
     */
    T normalized(T a);

    /**
     * Normalizes an arbitrary object, assuming that it is a {@code T}.
     *
     * @param b a value
     * @return the normalized value
     * @throws ClassCastException if {@code b} is not a {@code T} and the
     *                            normalization touches it
     */
    @SuppressWarnings("unchecked")
    default Object normalizedOrSame(Object b) {
        return normalized((T) b);
    }

    /**
     * Composes this normalization with another one. The resulting
     * normalization applies this normalization first and {@code other}
     * second.
     * <p>
     * Composition is associative.
     *
     * @param other the normalization applied second
     * @return a new normalization
     */
    default Normalization<T> and(Normalization<T> other) {
        Objects.requireNonNull(other, "other is null");
        return a -> other.normalized(normalized(a));
    }

    /**
     * Combines this normalization with {@code base}, which compares the
     * normalized values.
     *
     * @param base the equality applied after normalization
     * @return a new equality
     */
    default Equality<T> toEquality(Equality<T> base) {
        return new Equalities.NormalizingEquality<>(this, base);
    }

    /**
     * Combines this normalization with the natural hashing equality.
     *
     * @return a new hashing equality
     */
    default HashingEquality<T> toHashingEquality() {
        return toHashingEquality(HashingEquality.natural());
    }

    /**
     * Combines this normalization with {@code base}, which compares and hashes
     * the normalized values.
     *
     * @param base the hashing equality applied after normalization
     * @return a new hashing equality
     */
    default HashingEquality<T> toHashingEquality(HashingEquality<T> base) {
        return new Equalities.NormalizingHashingEquality<>(this, base);
    }

    /**
     * Combines this normalization with a comparator of normalized values.
     * Equality and hashing of the normalized values are the natural ones, so
     * {@code base} must be consistent with {@code equals}.
     *
     * @param base the order applied after normalization
     * @return a new ordering equality
     */
    default OrderingEquality<T> toOrderingEquality(Comparator<? super T> base) {
        return toOrderingEquality(new Equalities.ComparatorOrderingEquality<>(base));
    }

    /**
     * Combines this normalization with {@code base}, which orders, compares
     * and hashes the normalized values.
     *
     * @param base the ordering equality applied after normalization
     * @return a new ordering equality
     */
    default OrderingEquality<T> toOrderingEquality(OrderingEquality<T> base) {
        return new Equalities.NormalizingOrderingEquality<>(this, base);
    }
}
