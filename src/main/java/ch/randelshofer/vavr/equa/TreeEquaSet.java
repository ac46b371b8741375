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

import io.vavr.PartialFunction;
import io.vavr.collection.Set;
import io.vavr.collection.TreeSet;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * A {@link SortedEquaSet} that is backed by a red-black tree of boxes, ordered
 * by the {@link OrderingEquality} of its factory.
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add: O(log N)</li>
 *     <li>remove: O(log N)</li>
 *     <li>contains: O(log N)</li>
 *     <li>head, last: O(log N)</li>
 * </ul>
 *
 * @param <T> the element type
 */
public final class TreeEquaSet<T> extends AbstractEquaSet<T, TreeEquaSet<T>> implements SortedEquaSet<T> {

    private final SortedCollections<T> sortedPath;

    TreeEquaSet(SortedCollections<T> path, Set<EquaBox<T>> underlying) {
        super(path, underlying);
        this.sortedPath = path;
    }

    @Override
    public SortedCollections<T> path() {
        return sortedPath;
    }

    @Override
    TreeEquaSet<T> wrap(Set<EquaBox<T>> boxes) {
        return new TreeEquaSet<>(sortedPath, boxes);
    }

    @Override
    Set<EquaBox<T>> emptyUnderlying() {
        return TreeSet.empty(sortedPath.boxOrdering());
    }

    @Override
    <U> EquaSet<U> newSet(Collections<U> target, Iterable<? extends U> elements) {
        if (target instanceof SortedCollections) {
            return ((SortedCollections<U>) target).treeEquaSetOf(elements);
        }
        return target.equaSetOf(elements);
    }

    @Override
    public <U> EquaBridge<T, U, SortedEquaSet<U>> into(SortedCollections<U> target) {
        Objects.requireNonNull(target, "target is null");
        return new EquaBridge<T, U, SortedEquaSet<U>>(this, elements -> target.treeEquaSetOf(elements));
    }

    @Override
    public TreeEquaSet<T> collect(PartialFunction<? super T, ? extends T> partialFunction) {
        Objects.requireNonNull(partialFunction, "partialFunction is null");
        return fromBoxes(sortedPath.boxAll(iterator().collect(partialFunction)));
    }

    @Override
    public TreeEquaSet<T> scanLeft(T zero, BiFunction<? super T, ? super T, ? extends T> operation) {
        Objects.requireNonNull(operation, "operation is null");
        return fromBoxes(sortedPath.boxAll(iterator().scanLeft(zero, operation)));
    }

    @Override
    public TreeEquaSet<T> scanRight(T zero, BiFunction<? super T, ? super T, ? extends T> operation) {
        Objects.requireNonNull(operation, "operation is null");
        return fromBoxes(sortedPath.boxAll(iterator().scanRight(zero, operation)));
    }

    @Override
    public SortedEquaSetView<T> view() {
        return new SortedEquaSetView<>(new ViewNode.Source<>(this));
    }

    @Override
    public String stringPrefix() {
        return "TreeEquaSet";
    }
}
