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

import io.vavr.collection.LinkedHashSet;
import io.vavr.collection.Map;

/**
 * An {@link EquaMap} that iterates in insertion order.
 * <p>
 * Replacing the entry of a key that is already present keeps the position of
 * the entry.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class FastEquaMap<K, V> extends AbstractEquaMap<K, V, FastEquaMap<K, V>> {

    FastEquaMap(Collections<K> path, Map<EquaBox<K>, V> underlying) {
        super(path, underlying);
    }

    @Override
    FastEquaMap<K, V> wrap(Map<EquaBox<K>, V> entries) {
        return new FastEquaMap<>(path, entries);
    }

    @Override
    public FastEquaSet<K> keySet() {
        return new FastEquaSet<>(path, LinkedHashSet.ofAll(underlying.keysIterator()));
    }

    @Override
    public String stringPrefix() {
        return "EquaMap";
    }
}
