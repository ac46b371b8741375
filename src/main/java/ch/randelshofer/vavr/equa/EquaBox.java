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
 * Pairs a value with the factory whose equality policy governs it.
 * <p>
 * Two boxes are equal if their factories carry the same policy object and the
 * policy considers the values equal. The hash code of a box is the hash code
 * that the policy computes for the value. The native {@code equals} and
 * {@code hashCode} of the value are never consulted.
 * <p>
 * Boxes are created by {@link Collections#box(Object)}.
 *
 * @param <T> the value type
 */
public final class EquaBox<T> {
    private final T value;
    private final Collections<T> path;

    EquaBox(T value, Collections<T> path) {
        this.value = value;
        this.path = path;
    }

    public T value() {
        return value;
    }

    /**
     * Returns the factory that created this box.
     *
     * @return the factory
     */
    public Collections<T> path() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EquaBox)) {
            return false;
        }
        EquaBox<?> that = (EquaBox<?>) o;
        return path.equality() == that.path.equality()
                && path.equality().areEqual(value, that.value);
    }

    @Override
    public int hashCode() {
        return path.equality().hashCodeFor(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
