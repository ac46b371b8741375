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
import io.vavr.Tuple3;
import io.vavr.collection.Iterator;
import io.vavr.collection.LinkedHashMap;
import io.vavr.collection.LinkedHashSet;
import io.vavr.collection.List;
import io.vavr.collection.Map;
import io.vavr.collection.Seq;
import io.vavr.collection.Set;
import io.vavr.collection.Stream;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.StreamSupport;

/**
 * Implements the operations of an {@link EquaSet} on top of an immutable vavr
 * {@link Set} of {@link EquaBox}es.
 * <p>
 * Subclasses choose the backing set, and thereby the iteration order, and
 * define how a new instance is created from a backing set.
 *
 * @param <T> the element type
 * @param <S> the type of the subclass
 */
abstract class AbstractEquaSet<T, S extends AbstractEquaSet<T, S>> implements EquaSet<T> {

    final Collections<T> path;
    final Set<EquaBox<T>> underlying;

    AbstractEquaSet(Collections<T> path, Set<EquaBox<T>> underlying) {
        this.path = path;
        this.underlying = underlying;
    }

    /**
     * Creates a set of the same variant and factory as this set.
     */
    abstract S wrap(Set<EquaBox<T>> boxes);

    /**
     * Returns an empty backing set of the kind that this variant uses.
     */
    abstract Set<EquaBox<T>> emptyUnderlying();

    /**
     * Creates a set of {@code target} in the variant that corresponds to
     * this set.
     */
    abstract <U> EquaSet<U> newSet(Collections<U> target, Iterable<? extends U> elements);

    S fromBoxes(Iterable<? extends EquaBox<T>> boxes) {
        return wrap(EquaModule.addFirstWins(emptyUnderlying(), boxes));
    }

    @SuppressWarnings("unchecked")
    S self() {
        return (S) this;
    }

    private S wrapIfChanged(Set<EquaBox<T>> boxes) {
        return boxes == underlying ? self() : wrap(boxes);
    }

    private Set<EquaBox<T>> boxesOf(EquaSet<T> that) {
        EquaModule.requireCompatible(this, that);
        return that.toEquaBoxSet();
    }

    @Override
    public Collections<T> path() {
        return path;
    }

    @Override
    public S add(T element) {
        return wrapIfChanged(underlying.add(path.box(element)));
    }

    @SafeVarargs
    @Override
    public final S add(T element1, T element2, T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return add(element1).add(element2).addAll(Arrays.asList(elements));
    }

    @Override
    public S addAll(Iterable<? extends T> elements) {
        return wrapIfChanged(EquaModule.addFirstWins(underlying, path.boxAll(elements)));
    }

    @Override
    public S remove(T element) {
        return wrapIfChanged(underlying.remove(path.box(element)));
    }

    @SafeVarargs
    @Override
    public final S remove(T element1, T element2, T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return remove(element1).remove(element2).removeAll(Arrays.asList(elements));
    }

    @Override
    public S removeAll(Iterable<? extends T> elements) {
        return wrapIfChanged(underlying.removeAll(path.boxAll(elements)));
    }

    @Override
    public S union(EquaSet<T> that) {
        Set<EquaBox<T>> thatBoxes = boxesOf(that);
        return wrapIfChanged(EquaModule.addFirstWins(underlying, thatBoxes.iterator().map(b -> path.box(b.value()))));
    }

    @Override
    public S intersect(EquaSet<T> that) {
        Set<EquaBox<T>> thatBoxes = boxesOf(that);
        return wrap(underlying.filter(thatBoxes::contains));
    }

    @Override
    public S diff(EquaSet<T> that) {
        Set<EquaBox<T>> thatBoxes = boxesOf(that);
        if (isEmpty() || thatBoxes.isEmpty()) {
            return self();
        }
        return wrap(underlying.filter(b -> !thatBoxes.contains(b)));
    }

    @Override
    public boolean subsetOf(EquaSet<T> that) {
        Set<EquaBox<T>> thatBoxes = boxesOf(that);
        return underlying.forAll(thatBoxes::contains);
    }

    @Override
    public boolean contains(T element) {
        return underlying.contains(path.box(element));
    }

    @Override
    public boolean canEqual(Object o) {
        return o instanceof EquaSet && path.isCompatibleWith(((EquaSet<?>) o).path());
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
    public T head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty " + stringPrefix());
        }
        return underlying.head().value();
    }

    @Override
    public Option<T> headOption() {
        return isEmpty() ? Option.none() : Option.some(head());
    }

    @Override
    public T last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty " + stringPrefix());
        }
        return underlying.last().value();
    }

    @Override
    public Option<T> lastOption() {
        return isEmpty() ? Option.none() : Option.some(last());
    }

    @Override
    public S tail() {
        if (isEmpty()) {
            throw new UnsupportedOperationException("tail of empty " + stringPrefix());
        }
        return wrap(underlying.remove(underlying.head()));
    }

    @Override
    public S init() {
        if (isEmpty()) {
            throw new UnsupportedOperationException("init of empty " + stringPrefix());
        }
        return wrap(underlying.remove(underlying.last()));
    }

    @Override
    public Iterator<S> tails() {
        Vector<EquaBox<T>> boxes = underlying.toVector();
        return Iterator.rangeClosed(0, boxes.size()).map(n -> fromBoxes(boxes.drop(n)));
    }

    @Override
    public Iterator<S> inits() {
        Vector<EquaBox<T>> boxes = underlying.toVector();
        return Iterator.rangeClosed(0, boxes.size()).map(n -> fromBoxes(boxes.dropRight(n)));
    }

    @Override
    public S filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        Set<EquaBox<T>> filtered = underlying.filter(b -> predicate.test(b.value()));
        return filtered.size() == size() ? self() : wrap(filtered);
    }

    @Override
    public S filterNot(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return filter(predicate.negate());
    }

    @Override
    public Tuple2<S, S> partition(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return Tuple.of(filter(predicate), filterNot(predicate));
    }

    @Override
    public Tuple2<S, S> span(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        Tuple2<Iterator<EquaBox<T>>, Iterator<EquaBox<T>>> t = underlying.iterator().span(b -> predicate.test(b.value()));
        return Tuple.of(fromBoxes(t._1), fromBoxes(t._2));
    }

    @Override
    public Tuple2<S, S> splitAt(int n) {
        return Tuple.of(take(n), drop(n));
    }

    @Override
    public S drop(int n) {
        if (n <= 0) {
            return self();
        }
        return fromBoxes(underlying.iterator().drop(n));
    }

    @Override
    public S dropRight(int n) {
        if (n <= 0) {
            return self();
        }
        return fromBoxes(underlying.toVector().dropRight(n));
    }

    @Override
    public S dropWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return fromBoxes(underlying.iterator().dropWhile(b -> predicate.test(b.value())));
    }

    @Override
    public S take(int n) {
        if (n >= size()) {
            return self();
        }
        return fromBoxes(underlying.iterator().take(n));
    }

    @Override
    public S takeRight(int n) {
        if (n >= size()) {
            return self();
        }
        return fromBoxes(underlying.toVector().takeRight(n));
    }

    @Override
    public S takeWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return fromBoxes(underlying.iterator().takeWhile(b -> predicate.test(b.value())));
    }

    @Override
    public S slice(int beginIndex, int endIndex) {
        return fromBoxes(underlying.toVector().slice(beginIndex, endIndex));
    }

    @Override
    public Iterator<S> grouped(int size) {
        return sliding(size, size);
    }

    @Override
    public Iterator<S> sliding(int size) {
        return sliding(size, 1);
    }

    @Override
    public Iterator<S> sliding(int size, int step) {
        EquaModule.requirePositive(size, "size");
        EquaModule.requirePositive(step, "step");
        return underlying.iterator().sliding(size, step).map(this::fromBoxes);
    }

    @Override
    public Iterator<S> subsets() {
        Vector<EquaBox<T>> boxes = underlying.toVector();
        return Iterator.rangeClosed(0, boxes.size())
                .flatMap(k -> EquaModule.combinations(boxes, k))
                .map(this::fromBoxes);
    }

    @Override
    public Iterator<S> subsets(int n) {
        return EquaModule.combinations(underlying.toVector(), n).map(this::fromBoxes);
    }

    @Override
    public int count(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return underlying.count(b -> predicate.test(b.value()));
    }

    @Override
    public boolean exists(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return underlying.exists(b -> predicate.test(b.value()));
    }

    @Override
    public boolean forall(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return underlying.forAll(b -> predicate.test(b.value()));
    }

    @Override
    public Option<T> find(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return underlying.find(b -> predicate.test(b.value())).map(EquaBox::value);
    }

    @Override
    public T fold(T zero, BiFunction<? super T, ? super T, ? extends T> combine) {
        return foldLeft(zero, combine);
    }

    @Override
    public <U> U foldLeft(U zero, BiFunction<? super U, ? super T, ? extends U> combine) {
        Objects.requireNonNull(combine, "combine is null");
        return iterator().foldLeft(zero, combine);
    }

    @Override
    public <U> U foldRight(U zero, BiFunction<? super T, ? super U, ? extends U> combine) {
        Objects.requireNonNull(combine, "combine is null");
        return toList().foldRight(zero, combine);
    }

    @Override
    public <U> U aggregate(U zero, BiFunction<? super U, ? super T, ? extends U> seqop,
                           BiFunction<? super U, ? super U, ? extends U> combop) {
        Objects.requireNonNull(combop, "combop is null");
        return foldLeft(zero, seqop);
    }

    @Override
    public Number sum() {
        return toVector().sum();
    }

    @Override
    public Number product() {
        return toVector().product();
    }

    @Override
    public T reduce(BiFunction<? super T, ? super T, ? extends T> op) {
        return reduceLeft(op);
    }

    @Override
    public Option<T> reduceOption(BiFunction<? super T, ? super T, ? extends T> op) {
        return reduceLeftOption(op);
    }

    @Override
    public T reduceLeft(BiFunction<? super T, ? super T, ? extends T> op) {
        Objects.requireNonNull(op, "op is null");
        if (isEmpty()) {
            throw new NoSuchElementException("reduceLeft of empty " + stringPrefix());
        }
        return iterator().reduceLeft(op);
    }

    @Override
    public Option<T> reduceLeftOption(BiFunction<? super T, ? super T, ? extends T> op) {
        return isEmpty() ? Option.none() : Option.some(reduceLeft(op));
    }

    @Override
    public T reduceRight(BiFunction<? super T, ? super T, ? extends T> op) {
        Objects.requireNonNull(op, "op is null");
        if (isEmpty()) {
            throw new NoSuchElementException("reduceRight of empty " + stringPrefix());
        }
        return toList().reduceRight(op);
    }

    @Override
    public Option<T> reduceRightOption(BiFunction<? super T, ? super T, ? extends T> op) {
        return isEmpty() ? Option.none() : Option.some(reduceRight(op));
    }

    @Override
    public Option<T> max(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        return iterator().maxBy(comparator);
    }

    @Override
    public Option<T> min(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        return iterator().minBy(comparator);
    }

    @Override
    public <U extends Comparable<? super U>> Option<T> maxBy(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        return iterator().maxBy(f);
    }

    @Override
    public <U extends Comparable<? super U>> Option<T> minBy(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        return iterator().minBy(f);
    }

    @Override
    public <K> Map<K, S> groupBy(Function<? super T, ? extends K> classifier) {
        Objects.requireNonNull(classifier, "classifier is null");
        Map<K, Set<EquaBox<T>>> groups = LinkedHashMap.empty();
        for (EquaBox<T> box : underlying) {
            K key = classifier.apply(box.value());
            groups = groups.put(key, groups.get(key).getOrElse(emptyUnderlying()).add(box));
        }
        return groups.mapValues(this::wrap);
    }

    @Override
    public boolean sameElements(Iterable<? extends T> that) {
        Objects.requireNonNull(that, "that is null");
        java.util.Iterator<? extends T> it = that.iterator();
        for (T value : this) {
            if (!it.hasNext() || !path.equality().areEqual(value, it.next())) {
                return false;
            }
        }
        return !it.hasNext();
    }

    @Override
    public String mkString() {
        return iterator().mkString();
    }

    @Override
    public String mkString(CharSequence delimiter) {
        return iterator().mkString(delimiter);
    }

    @Override
    public String mkString(CharSequence prefix, CharSequence delimiter, CharSequence suffix) {
        return iterator().mkString(prefix, delimiter, suffix);
    }

    @Override
    public Iterator<T> iterator() {
        return underlying.iterator().map(EquaBox::value);
    }

    @Override
    public <U> EquaBridge<T, U, EquaSet<U>> into(Collections<U> target) {
        Objects.requireNonNull(target, "target is null");
        return new EquaBridge<>(this, elements -> newSet(target, elements));
    }

    @Override
    public <U> EquaBridge<T, U, SortedEquaSet<U>> into(SortedCollections<U> target) {
        Objects.requireNonNull(target, "target is null");
        return new EquaBridge<T, U, SortedEquaSet<U>>(this, elements -> target.sortedEquaSetOf(elements));
    }

    @Override
    public EquaSetView<T> view() {
        return new EquaSetView<>(new ViewNode.Source<>(this));
    }

    @Override
    public EquaSet<T> copyInto(Collections<T> target) {
        Objects.requireNonNull(target, "target is null");
        return newSet(target, this);
    }

    @Override
    public <T1, T2> Tuple2<EquaSet<T1>, EquaSet<T2>> unzip(
            Function<? super T, Tuple2<? extends T1, ? extends T2>> unzipper,
            Collections<T1> target1, Collections<T2> target2) {
        Objects.requireNonNull(unzipper, "unzipper is null");
        return Tuple.of(newSet(target1, iterator().map(t -> unzipper.apply(t)._1)),
                newSet(target2, iterator().map(t -> unzipper.apply(t)._2)));
    }

    @Override
    public <T1, T2, T3> Tuple3<EquaSet<T1>, EquaSet<T2>, EquaSet<T3>> unzip3(
            Function<? super T, Tuple3<? extends T1, ? extends T2, ? extends T3>> unzipper,
            Collections<T1> target1, Collections<T2> target2, Collections<T3> target3) {
        Objects.requireNonNull(unzipper, "unzipper is null");
        return Tuple.of(newSet(target1, iterator().map(t -> unzipper.apply(t)._1)),
                newSet(target2, iterator().map(t -> unzipper.apply(t)._2)),
                newSet(target3, iterator().map(t -> unzipper.apply(t)._3)));
    }

    @Override
    public <U> Set<Tuple2<T, U>> zip(Iterable<? extends U> that) {
        Objects.requireNonNull(that, "that is null");
        return LinkedHashSet.ofAll(iterator().zip(that));
    }

    @Override
    public <U> Set<Tuple2<T, U>> zipAll(Iterable<? extends U> that, T thisElem, U thatElem) {
        Objects.requireNonNull(that, "that is null");
        return LinkedHashSet.ofAll(iterator().zipAll(that, thisElem, thatElem));
    }

    @Override
    public Set<Tuple2<T, Integer>> zipWithIndex() {
        return LinkedHashSet.ofAll(iterator().zipWithIndex());
    }

    @Override
    public Object[] toArray() {
        return toJavaList().toArray();
    }

    @Override
    public T[] toArray(IntFunction<T[]> arrayFactory) {
        Objects.requireNonNull(arrayFactory, "arrayFactory is null");
        return toJavaList().toArray(arrayFactory.apply(size()));
    }

    @Override
    public List<T> toList() {
        return List.ofAll(this);
    }

    @Override
    public Vector<T> toVector() {
        return Vector.ofAll(this);
    }

    @Override
    public Seq<T> toSeq() {
        return toVector();
    }

    @Override
    public Stream<T> toStream() {
        return Stream.ofAll(this);
    }

    @Override
    public java.util.stream.Stream<T> toJavaStream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public java.util.List<T> toJavaList() {
        return toBuffer();
    }

    @Override
    public ArrayList<T> toBuffer() {
        return EquaModule.toJavaCollection(this, size(), ArrayList::new);
    }

    @Override
    public Set<T> toSet() {
        return LinkedHashSet.ofAll(this);
    }

    @Override
    public java.util.Set<T> toJavaSet() {
        return EquaModule.toJavaCollection(this, size(), java.util.LinkedHashSet::new);
    }

    @Override
    public Iterator<T> toIterator() {
        return iterator();
    }

    @Override
    public <K, V> Map<K, V> toMap(Function<? super T, ? extends Tuple2<? extends K, ? extends V>> f) {
        Objects.requireNonNull(f, "f is null");
        return LinkedHashMap.ofEntries(iterator().map(f));
    }

    @Override
    public <K, V> java.util.Map<K, V> toJavaMap(Function<? super T, ? extends Tuple2<? extends K, ? extends V>> f) {
        Objects.requireNonNull(f, "f is null");
        java.util.Map<K, V> map = new java.util.LinkedHashMap<>();
        for (T value : this) {
            Tuple2<? extends K, ? extends V> entry = f.apply(value);
            map.put(entry._1, entry._2);
        }
        return map;
    }

    @Override
    public List<EquaBox<T>> toEquaBoxList() {
        return underlying.toList();
    }

    @Override
    public Vector<EquaBox<T>> toEquaBoxVector() {
        return underlying.toVector();
    }

    @Override
    public Seq<EquaBox<T>> toEquaBoxSeq() {
        return toEquaBoxVector();
    }

    @SuppressWarnings("unchecked")
    @Override
    public EquaBox<T>[] toEquaBoxArray() {
        return toEquaBoxBuffer().toArray(new EquaBox[0]);
    }

    @Override
    public Set<EquaBox<T>> toEquaBoxSet() {
        return underlying;
    }

    @Override
    public Iterator<EquaBox<T>> toEquaBoxIterator() {
        return underlying.iterator();
    }

    @Override
    public ArrayList<EquaBox<T>> toEquaBoxBuffer() {
        return EquaModule.toJavaCollection(underlying, size(), ArrayList::new);
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
        EquaSet<T> that = (EquaSet<T>) o;
        if (size() != that.size()) {
            return false;
        }
        Set<EquaBox<T>> thatBoxes = that.toEquaBoxSet();
        return underlying.forAll(thatBoxes::contains);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (EquaBox<T> box : underlying) {
            h += box.hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return mkString(stringPrefix() + "(", ", ", ")");
    }
}
