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

import io.vavr.collection.Map;
import io.vavr.collection.TreeSet;

/**
 * An {@link EquaMap} whose entries are sorted by their keys, in ascending order
 * of the {@link OrderingEquality} of its factory.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TreeEquaMap<K, V> extends AbstractEquaMap<K, V, TreeEquaMap<K, V>> {

    private final SortedCollections<K> sortedPath;

    TreeEquaMap(SortedCollections<K> path, Map<EquaBox<K>, V> underlying) {
        super(path, underlying);
        this.sortedPath = path;
    }

    @Override
    public SortedCollections<K> path() {
        return sortedPath;
    }

    @Override
    TreeEquaMap<K, V> wrap(Map<EquaBox<K>, V> entries) {
        return new TreeEquaMap<>(sortedPath, entries);
    }

    @Override
    public TreeEquaSet<K> keySet() {
        return new TreeEquaSet<>(sortedPath, TreeSet.ofAll(sortedPath.boxOrdering(), underlying.keysIterator()));
    }

    @Override
    public String stringPrefix() {
        return "TreeEquaMap";
    }
}
