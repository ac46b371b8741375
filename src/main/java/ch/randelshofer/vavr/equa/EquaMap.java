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

import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Map;
import io.vavr.collection.Seq;
import io.vavr.control.Option;

import java.util.function.BiFunction;

/**
 * An immutable map whose keys are compared with the equality policy of the
 * factory that created it. Values are compared with their native equality.
 * <p>
 * Putting a key that is already present, under the policy, replaces the entry:
 * both the key and the value of the later entry are kept.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface EquaMap<K, V> extends Iterable<Tuple2<K, V>> {

    /**
     * Returns the factory that created this map, and whose policy governs its
     * keys.
     *
     * @return the factory
     */
    Collections<K> path();

    EquaMap<K, V> put(K key, V value);

    EquaMap<K, V> put(Tuple2<? extends K, ? extends V> entry);

    EquaMap<K, V> putAll(Iterable<? extends Tuple2<? extends K, ? extends V>> entries);

    /**
     * Puts all entries of a compatible map.
     *
     * @param that a map governed by the same policy
     * @return a new map
     * @throws IncompatibleCollectionsException if {@code that} is governed by
     *                                          another policy
     */
    EquaMap<K, V> putAll(EquaMap<K, ? extends V> that);

    EquaMap<K, V> remove(K key);

    EquaMap<K, V> removeAll(Iterable<? extends K> keys);

    /**
     * Removes the keys of a compatible set.
     *
     * @param keys a set governed by the same policy
     * @return a new map
     * @throws IncompatibleCollectionsException if {@code keys} is governed by
     *                                          another policy
     */
    EquaMap<K, V> removeAll(EquaSet<K> keys);

    Option<V> get(K key);

    V getOrElse(K key, V defaultValue);

    boolean containsKey(K key);

    /**
     * Returns the keys of this map as a set of the same factory.
     *
     * @return the keys
     */
    EquaSet<K> keySet();

    Iterator<K> keysIterator();

    Seq<V> values();

    Iterator<V> valuesIterator();

    int size();

    boolean isEmpty();

    <U> U foldLeft(U zero, BiFunction<? super U, ? super Tuple2<K, V>, ? extends U> combine);

    /**
     * Converts this map into a map that uses the native equality of the keys.
     * Keys that are equal under the policy but not natively remain distinct.
     *
     * @return a new map
     */
    Map<K, V> toMap();

    java.util.Map<K, V> toJavaMap();

    Map<EquaBox<K>, V> toEquaBoxMap();

    boolean canEqual(Object o);

    String stringPrefix();

    @Override
    Iterator<Tuple2<K, V>> iterator();
}
