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

/**
 * Defines a custom way to determine equality for a type, independently of the
 * type's own {@link Object#equals(Object)}.
 * <p>
 * The right-hand side of {@link #areEqual(Object, Object)} is an arbitrary
 * object, so an equality may decide that values of other types are equal to a
 * {@code T}. Such an equality need not be symmetric with respect to the native
 * equality of the values involved, but it must always be reflexive for values
 * of type {@code T}.
 *
 * @param <T> the type whose equality is defined
 */
@FunctionalInterface
public interface Equality<T> extends Equivalence<T> {

    /**
     * Returns the equality that delegates to {@link java.util.Objects#equals(Object, Object)}.
     * <p>
     * The returned instance is a singleton.
     *
     * @param <T> the value type
     * @return the natural equality
     */
    static <T> Equality<T> natural() {
        return HashingEquality.natural();
    }

    /**
     * Tests whether {@code a} is equal to {@code b} under this equality.
     *
     * @param a the left-hand value
     * @param b the right-hand value, of any type
     * @return true if the values are equal
     */
    boolean areEqual(T a, Object b);

    @Override
    default boolean areEquivalent(T a, T b) {
        return areEqual(a, b);
    }
}
