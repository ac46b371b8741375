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

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A {@link Normalization} that is sufficient on its own to decide equality.
 * <p>
 * A uniformity must be idempotent:
 * <pre>normalized(normalized(x)).equals(normalized(x))</pre>
 * and any two values with equal normalized forms may be treated as equal.
 * Because of that, a uniformity can be turned into an equality without a base
 * policy: see {@link #toEquality()}, {@link #toHashingEquality()} and
 * {@link #toEquivalence()}.
 * <p>
 * A uniformity also knows which objects it can handle, so equalities derived
 * from it compare values of other types with their native equality instead of
 * failing.
 *
 * @param <T> the type of the normalized values
 */
public interface Uniformity<T> extends Normalization<T> {

    /**
     * Creates a uniformity that handles exactly the instances of {@code type}.
     * <p>
     * The caller is responsible for {@code f} being idempotent.
     *
     * @param type the handled type
     * @param f    the normalizing function
     * @param <T>  the handled type
     * @return a new uniformity
     */
    static <T> Uniformity<T> of(Class<T> type, UnaryOperator<T> f) {
        Objects.requireNonNull(type, "type is null");
        Objects.requireNonNull(f, "f is null");
        return new Uniformity<T>() {
            @Override
            public T normalized(T a) {
                return f.apply(a);
            }

            @Override
            public boolean normalizedCanHandle(Object b) {
                return type.isInstance(b);
            }
        };
    }

    /**
     * Tests whether {@link #normalized(Object)} can be applied to {@code b}.
     *
     * @param b an arbitrary object
     * @return true if {@code b} can be normalized by this uniformity
     */
    boolean normalizedCanHandle(Object b);

    /**
     * Normalizes {@code b} if this uniformity can handle it, and returns it
     * unchanged otherwise.
     *
     * @param b an arbitrary object
     * @return the normalized value or {@code b} itself
     */
    @SuppressWarnings("unchecked")
    @Override
    default Object normalizedOrSame(Object b) {
        return normalizedCanHandle(b) ? normalized((T) b) : b;
    }

    /**
     * Composes this uniformity with another uniformity. The result is again a
     * uniformity, that applies this uniformity first. It handles only the
     * objects that both uniformities can handle.
     * <p>
     * Composing with a plain {@link Normalization} yields a plain
     * normalization, see {@link Normalization#and(Normalization)}.
     *
     * @param other the uniformity applied second
     * @return a new uniformity
     */
    default Uniformity<T> and(Uniformity<T> other) {
        Objects.requireNonNull(other, "other is null");
        final Uniformity<T> first = this;
        return new Uniformity<T>() {
            @Override
            public T normalized(T a) {
                return other.normalized(first.normalized(a));
            }

            @Override
            public boolean normalizedCanHandle(Object b) {
                return first.normalizedCanHandle(b) && other.normalizedCanHandle(b);
            }
        };
    }

    /**
     * Returns an equality that compares normalized values with their natural
     * equality.
     *
     * @return a new equality
     */
    default Equality<T> toEquality() {
        return toHashingEquality();
    }

    /**
     * Returns a hashing equality that compares and hashes normalized values
     * with their natural equality and hash code.
     *
     * @return a new hashing equality
     */
    @Override
    default HashingEquality<T> toHashingEquality() {
        return toHashingEquality(HashingEquality.natural());
    }

    /**
     * Returns an equivalence that compares normalized values with their
     * natural equality.
     *
     * @return a new equivalence
     */
    default Equivalence<T> toEquivalence() {
        return (a, b) -> Objects.equals(normalized(a), normalized(b));
    }
}
