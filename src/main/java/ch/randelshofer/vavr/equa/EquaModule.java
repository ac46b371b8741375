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

import io.vavr.collection.HashMap;
import io.vavr.collection.Iterator;
import io.vavr.collection.Map;
import io.vavr.collection.Set;
import io.vavr.collection.Vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * Internal helpers shared by the collections and views of this package.
 */
final class EquaModule {

    private EquaModule() {
    }

    static <T, R> Collector<T, ArrayList<T>, R> toListAndThen(Function<ArrayList<T>, R> finisher) {
        return Collector.of(ArrayList::new, ArrayList::add, (left, right) -> {
            left.addAll(right);
            return left;
        }, finisher);
    }

    static void requireCompatible(Collections<?> thisPath, String thisPrefix, Collections<?> thatPath, String thatPrefix) {
        if (!thisPath.isCompatibleWith(thatPath)) {
            throw new IncompatibleCollectionsException(thisPrefix, thatPrefix);
        }
    }

    static void requireCompatible(EquaSet<?> thisSet, EquaSet<?> thatSet) {
        Objects.requireNonNull(thatSet, "that is null");
        requireCompatible(thisSet.path(), thisSet.stringPrefix(), thatSet.path(), thatSet.stringPrefix());
    }

    /**
     * Adds the boxes one by one, so that a box already present, or added
     * earlier from {@code boxes}, is kept and later equal boxes are dropped.
     */
    static <T> Set<EquaBox<T>> addFirstWins(Set<EquaBox<T>> set, Iterable<? extends EquaBox<T>> boxes) {
        Objects.requireNonNull(boxes, "boxes is null");
        Set<EquaBox<T>> result = set;
        for (EquaBox<T> box : boxes) {
            result = result.add(box);
        }
        return result;
    }

    static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " is not positive: " + value);
        }
    }

    static <T, R extends Collection<T>> R toJavaCollection(Iterable<T> values, int size, Function<Integer, R> containerSupplier) {
        R container = containerSupplier.apply(size);
        Objects.requireNonNull(container);
        values.forEach(container::add);
        return container;
    }

    /**
     * Counts the occurrences of each value, using the native equality of the
     * values.
     */
    static Map<Object, Integer> bagOf(Iterable<?> values) {
        Map<Object, Integer> bag = HashMap.empty();
        for (Object value : values) {
            bag = bag.put(value, bag.get(value).getOrElse(0) + 1);
        }
        return bag;
    }

    /**
     * Returns an iterator over all subsequences of {@code elements} of length
     * {@code k}, in lexicographic order of their indices.
     * <p>
     * The combinations are computed one at a time.
     */
    static <E> Iterator<Vector<E>> combinations(Vector<E> elements, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("size is negative: " + k);
        }
        if (k > elements.size()) {
            return Iterator.empty();
        }
        return new CombinationIterator<>(elements, k);
    }

    private static final class CombinationIterator<E> implements Iterator<Vector<E>> {
        private final Vector<E> elements;
        private final int[] indices;
        private boolean hasNext = true;

        CombinationIterator(Vector<E> elements, int k) {
            this.elements = elements;
            this.indices = new int[k];
            for (int i = 0; i < k; i++) {
                indices[i] = i;
            }
        }

        @Override
        public boolean hasNext() {
            return hasNext;
        }

        @Override
        public Vector<E> next() {
            if (!hasNext) {
                throw new NoSuchElementException();
            }
            Vector<E> result = Vector.empty();
            for (int index : indices) {
                result = result.append(elements.get(index));
            }
            advance();
            return result;
        }

        private void advance() {
            int n = elements.size();
            int k = indices.length;
            int i = k - 1;
            while (i >= 0 && indices[i] == n - k + i) {
                i--;
            }
            if (i < 0) {
                hasNext = false;
                return;
            }
            indices[i]++;
            for (int j = i + 1; j < k; j++) {
                indices[j] = indices[j - 1] + 1;
            }
        }
    }
}
