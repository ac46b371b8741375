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

import java.util.Locale;

/**
 * Frequently used {@link Uniformity uniformities} for strings.
 * <p>
 * Each uniformity handles only {@link String} values; objects of any other
 * type are left untouched by {@link Uniformity#normalizedOrSame(Object)}.
 */
public final class StringNormalizations {

    private static final Uniformity<String> LOWER_CASED = Uniformity.of(String.class, s -> s.toLowerCase(Locale.ROOT));
    private static final Uniformity<String> UPPER_CASED = Uniformity.of(String.class, s -> s.toUpperCase(Locale.ROOT));
    private static final Uniformity<String> TRIMMED = Uniformity.of(String.class, String::trim);

    private StringNormalizations() {
    }

    /**
     * Lower-cases strings in the root locale.
     *
     * @return a uniformity
     */
    public static Uniformity<String> lowerCased() {
        return LOWER_CASED;
    }

    /**
     * Upper-cases strings in the root locale.
     *
     * @return a uniformity
     */
    public static Uniformity<String> upperCased() {
        return UPPER_CASED;
    }

    /**
     * Removes leading and trailing whitespace.
     *
     * @return a uniformity
     */
    public static Uniformity<String> trimmed() {
        return TRIMMED;
    }
}
