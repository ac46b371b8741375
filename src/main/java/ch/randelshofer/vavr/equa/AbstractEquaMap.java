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

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.LinkedHashMap;
import io.vavr.collection.Map;
import io.vavr.collection.Seq;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Implements the operations of an {@link EquaMap} on top of an immutable vavr
 * {@link Map} whose keys are {@link EquaBox}es.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @param <M> the type of the subclass
 */
abstract class AbstractEquaMap<K, V, M extends AbstractEquaMap<K, V, M>> implements EquaMap<K, V> {

    final Collections<K> path;
    final Map<EquaBox<K>, V> underlying;

    AbstractEquaMap(Collections<K> path, Map<EquaBox<K>, V> underlying) {
        this.path = path;
        this.underlying = underlying;
    }

    abstract M wrap(Map<EquaBox<K>, V> entries);

    @Override
    public Collections<K> path() {
        return path;
    }

    @Override
    public M put(K key, V value) {
        return wrap(underlying.put(path.box(key), value));
    }

    @Override
    public M put(Tuple2<? extends K, ? extends V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        return put(entry._1, entry._2);
    }

    @Override
    public M putAll(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        Map<EquaBox<K>, V> result = underlying;
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            result = result.put(path.box(entry._1), entry._2);
        }
        return wrap(result);
    }

    @Override
    public M putAll(EquaMap<K, ? extends V> that) {
        Objects.requireNonNull(that, "that is null");
        EquaModule.requireCompatible(path, stringPrefix(), that.path(), that.stringPrefix());
        Map<EquaBox<K>, V> result = underlying;
        for (Tuple2<EquaBox<K>, ? extends V> entry : that.toEquaBoxMap()) {
            result = result.put(entry._1, entry._2);
        }
        return wrap(result);
    }

    @Override
    public M remove(K key) {
        return wrap(underlying.remove(path.box(key)));
    }

    @Override
    public M removeAll(Iterable<? extends K> keys) {
        return wrap(underlying.removeAll(path.boxAll(keys)));
    }

    @Override
    public M removeAll(EquaSet<K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        EquaModule.requireCompatible(path, stringPrefix(), keys.path(), keys.stringPrefix());
        return wrap(underlying.removeAll(keys.toEquaBoxSet()));
    }

    @Override
    public Option<V> get(K key) {
        return underlying.get(path.box(key));
    }

    @Override
    public V getOrElse(K key, V defaultValue) {
        return get(key).getOrElse(defaultValue);
    }

    @Override
    public boolean containsKey(K key) {
        return underlying.containsKey(path.box(key));
    }

    @Override
    public Iterator<K> keysIterator() {
        return underlying.keysIterator().map(EquaBox::value);
    }

    @Override
    public Seq<V> values() {
        return Vector.ofAll(underlying.valuesIterator());
    }

    @Override
    public Iterator<V> valuesIterator() {
        return underlying.valuesIterator();
    }

    @Override
    public int size() {
        return underlying.size();
    }

    @Override
    public boolean isEmpty() {
        return underlying.isEmpty();
    }

    @Override
    public <U> U foldLeft(U zero, BiFunction<? super U, ? super Tuple2<K, V>, ? extends U> combine) {
        Objects.requireNonNull(combine, "combine is null");
        return iterator().foldLeft(zero, combine);
    }

    @Override
    public Map<K, V> toMap() {
        return LinkedHashMap.ofEntries(iterator());
    }

    @Override
    public java.util.Map<K, V> toJavaMap() {
        java.util.Map<K, V> map = new java.util.LinkedHashMap<>();
        for (Tuple2<K, V> entry : this) {
            map.put(entry._1, entry._2);
        }
        return map;
    }

    @Override
    public Map<EquaBox<K>, V> toEquaBoxMap() {
        return underlying;
    }

    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return underlying.iterator().map(e -> Tuple.of(e._1.value(), e._2));
    }

    @Override
    public boolean canEqual(Object o) {
        return o instanceof EquaMap && path.isCompatibleWith(((EquaMap<?, ?>) o).path());
    }

    @SuppressWarnings("unchecked")
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!canEqual(o)) {
            return false;
        }
        EquaMap<K, V> that = (EquaMap<K, V>) o;
        if (size() != that.size()) {
            return false;
        }
        Map<EquaBox<K>, V> thatEntries = that.toEquaBoxMap();
        return underlying.forAll(e -> thatEntries.get(e._1).map(v -> Objects.equals(v, e._2)).getOrElse(false));
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Tuple2<EquaBox<K>, V> entry : underlying) {
            h += entry._1.hashCode() ^ Objects.hashCode(entry._2);
        }
        return h;
    }

    @Override
    public String toString() {
        return iterator().map(e -> e._1 + " -> " + e._2).mkString(stringPrefix() + "(", ", ", ")");
    }
}
