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
 * Implementations of the equality policies that are created through the
 * static and default methods of the policy interfaces.
 */
final class Equalities {

    private Equalities() {
    }

    /**
     * Native {@code equals}, {@code hashCode} and, for {@link Comparable}
     * values, {@code compareTo}.
     * <p>
     * A single instance serves as the natural equality, hashing equality and
     * ordering equality, so that all natural factories share one policy.
     */
    static final class NaturalEquality implements OrderingEquality<Object> {
        static final NaturalEquality INSTANCE = new NaturalEquality();

        private NaturalEquality() {
        }

        @Override
        public boolean areEqual(Object a, Object b) {
            return Objects.equals(a, b);
        }

        @Override
        public int hashCodeFor(Object a) {
            return Objects.hashCode(a);
        }

        @SuppressWarnings("unchecked")
        @Override
        public int compare(Object a, Object b) {
            return ((Comparable<Object>) a).compareTo(b);
        }

        @Override
        public String toString() {
            return "natural";
        }
    }

    /**
     * Orders values with a comparator, and compares and hashes them with their
     * native {@code equals} and {@code hashCode}.
     */
    static final class ComparatorOrderingEquality<T> implements OrderingEquality<T> {
        private final Comparator<? super T> comparator;

        ComparatorOrderingEquality(Comparator<? super T> comparator) {
            this.comparator = Objects.requireNonNull(comparator, "comparator is null");
        }

        @Override
        public boolean areEqual(T a, Object b) {
            return Objects.equals(a, b);
        }

        @Override
        public int hashCodeFor(T a) {
            return Objects.hashCode(a);
        }

        @Override
        public int compare(T a, T b) {
            return comparator.compare(a, b);
        }
    }

    static class NormalizingEquality<T> implements Equality<T> {
        final Normalization<T> normalization;
        private final Equality<T> base;

        NormalizingEquality(Normalization<T> normalization, Equality<T> base) {
            this.normalization = Objects.requireNonNull(normalization, "normalization is null");
            this.base = Objects.requireNonNull(base, "base is null");
        }

        @Override
        public boolean areEqual(T a, Object b) {
            return base.areEqual(normalization.normalized(a), normalization.normalizedOrSame(b));
        }
    }

    static class NormalizingHashingEquality<T> extends NormalizingEquality<T> implements HashingEquality<T> {
        private final HashingEquality<T> base;

        NormalizingHashingEquality(Normalization<T> normalization, HashingEquality<T> base) {
            super(normalization, base);
            this.base = base;
        }

        @Override
        public int hashCodeFor(T a) {
            return base.hashCodeFor(normalization.normalized(a));
        }
    }

    static final class NormalizingOrderingEquality<T> extends NormalizingHashingEquality<T> implements OrderingEquality<T> {
        private final OrderingEquality<T> base;

        NormalizingOrderingEquality(Normalization<T> normalization, OrderingEquality<T> base) {
            super(normalization, base);
            this.base = base;
        }

        @Override
        public int compare(T a, T b) {
            return base.compare(normalization.normalized(a), normalization.normalized(b));
        }
    }
}
