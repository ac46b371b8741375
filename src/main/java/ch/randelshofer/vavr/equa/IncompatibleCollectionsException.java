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
 * Thrown when a binary operation combines two collections that are governed by
 * different equality policies.
 * <p>
 * Two collections are compatible only if their factories carry the same policy
 * object. Structurally equal but distinct policy objects are not compatible.
 */
public class IncompatibleCollectionsException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for an operation between two collections.
     *
     * @param thisPrefix the string prefix of the receiver
     * @param thatPrefix the string prefix of the argument
     */
    public IncompatibleCollectionsException(String thisPrefix, String thatPrefix) {
        super("cannot combine " + thisPrefix + " with " + thatPrefix
                + ": the collections are governed by different equality policies");
    }
}
