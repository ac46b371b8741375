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
 * An {@link Equality} that can also compute hash codes, so that it can govern
 * hash-based storage.
 * <p>
 * Implementations must keep the two methods consistent:
 * <pre>areEqual(a, b) implies hashCodeFor(a) == hashCodeFor(b)</pre>
 * This is not checked. Collections built over an inconsistent policy behave in
 * an undefined way: lookups may miss elements and sets may hold duplicates.
 *
 * @param <T> the type whose equality is defined
 */
public interface HashingEquality<T> extends Equality<T> {

    /**
     * Returns the hashing equality that delegates to
     * {@link java.util.Objects#equals(Object, Object)} and
     * {@link java.util.Objects#hashCode(Object)}.
     * <p>
     * The returned instance is a singleton, so all natural factories share
     * the same policy and are mutually compatible.
     *
     * @param <T> the value type
     * @return the natural hashing equality
     */
    @SuppressWarnings("unchecked")
    static <T> HashingEquality<T> natural() {
        return (HashingEquality<T>) (HashingEquality<?>) Equalities.NaturalEquality.INSTANCE;
    }

    /**
     * Computes a hash code for {@code a} that is consistent with
     * {@link #areEqual(Object, Object)}.
     *
     * @param a a value
     * @return the hash code
     */
    int hashCodeFor(T a);
}
