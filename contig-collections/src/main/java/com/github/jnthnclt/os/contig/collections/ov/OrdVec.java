package com.github.jnthnclt.os.contig.collections.ov;

import com.fasterxml.jackson.annotation.JsonValue;
import com.github.jnthnclt.os.contig.collections.api.exceptions.DuplicateKeyException;
import com.github.jnthnclt.os.contig.collections.api.exceptions.KeyChangedException;
import com.github.jnthnclt.os.contig.log.ContigLogger;
import com.github.jnthnclt.os.contig.log.ContigLoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Array backed sequence kept sorted by a key extracted from each element, intended for fast lookup by key.
 * <p>
 * The key lives inside {@code T} and is extracted by the {@link OrdVecKey} {@code X}. Vectors over the same
 * element type but ordered by different key classes are different types, e.g.
 * {@code OrdVec<User, Long, UidKey>} and {@code OrdVec<User, String, ZipKey>}. Use {@link KeyValue} with
 * {@link FirstKey} when the key is not stored alongside the data.
 * <p>
 * Restrictions:
 * <ul>
 * <li>Two elements with the same key are not allowed. Any operation that would create them fails with
 * {@link DuplicateKeyException}.</li>
 * <li>A resident element must not be modified in a way that changes its key. Use
 * {@link #retainMap(Function)} to change keys.</li>
 * <li>Null elements are not allowed, so {@code null} results always mean "not found".</li>
 * </ul>
 * Not thread safe.
 *
 * @param <T> element type
 * @param <K> key type
 * @param <X> key extraction type
 */
public class OrdVec<T, K, X extends OrdVecKey<T, K>> implements Iterable<T> {

    private static final ContigLogger LOG = ContigLoggerFactory.getLogger();

    private static final Object[] EMPTY = new Object[0];
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final X key;
    private final OrdVecConfig config;
    private Object[] items;
    private int count;
    private int modCount;

    private OrdVec(X key, OrdVecConfig config, Object[] items, int count) {
        this.key = Preconditions.checkNotNull(key, "key");
        this.config = Preconditions.checkNotNull(config, "config");
        this.items = items;
        this.count = count;
    }

    public static <T, K, X extends OrdVecKey<T, K>> OrdVec<T, K, X> empty(X key) {
        return new OrdVec<>(key, OrdVecConfig.DEFAULT, EMPTY, 0);
    }

    public static <T, K, X extends OrdVecKey<T, K>> OrdVec<T, K, X> empty(X key, OrdVecConfig config) {
        return new OrdVec<>(key, config, config.initialCapacity == 0 ? EMPTY : new Object[config.initialCapacity], 0);
    }

    /**
     * Copies the given items and sorts them by key.
     *
     * @throws DuplicateKeyException if two items share a key
     */
    public static <T, K, X extends OrdVecKey<T, K>> OrdVec<T, K, X> fromUnsorted(X key, Collection<? extends T> unsorted) {
        Preconditions.checkNotNull(unsorted, "unsorted");
        Object[] items = Arrays.copyOf(unsorted.toArray(), unsorted.size(), Object[].class);
        for (Object item : items) {
            Preconditions.checkNotNull(item, "null items are not allowed");
        }
        OrdVec<T, K, X> ov = new OrdVec<>(key, OrdVecConfig.DEFAULT, items, items.length);
        int duplicate = ov.sortAndFindDuplicate();
        if (duplicate != -1) {
            throw new DuplicateKeyException("Duplicate keys are not allowed", ov.keyAt(duplicate));
        }
        return ov;
    }

    public static <T, K, X extends OrdVecKey<T, K>> OrdVec<T, K, X> fromIterator(X key, Iterator<? extends T> iterator) {
        List<T> unsorted = new ArrayList<>();
        iterator.forEachRemaining(unsorted::add);
        return OrdVec.<T, K, X>fromUnsorted(key, unsorted);
    }

    @SafeVarargs
    public static <T, K, X extends OrdVecKey<T, K>> OrdVec<T, K, X> of(X key, T... unsorted) {
        return OrdVec.<T, K, X>fromUnsorted(key, Arrays.asList(unsorted));
    }

    public static <T, K, X extends OrdVecKey<T, K>> Collector<T, ?, OrdVec<T, K, X>> toOrdVec(X key) {
        return Collector.of(ArrayList<T>::new,
            List::add,
            (a, b) -> {
                a.addAll(b);
                return a;
            },
            unsorted -> OrdVec.<T, K, X>fromUnsorted(key, unsorted));
    }

    public X key() {
        return key;
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * @return the position of the element with the given key in the ordered storage, or -1
     */
    public int indexOfKey(K k) {
        int i = binarySearch(k);
        return i < 0 ? -1 : i;
    }

    public boolean containsKey(K k) {
        return binarySearch(k) >= 0;
    }

    /**
     * @return the element with the given key, or null
     */
    public T getByKey(K k) {
        int i = binarySearch(k);
        return i < 0 ? null : itemAt(i);
    }

    /**
     * Same lookup as {@link #getByKey(Object)}, for callers that intend to mutate the resident element.
     * The mutation must not change the element's key, the order of the vector is undefined afterwards if it does.
     */
    public T getMutableByKey(K k) {
        return getByKey(k);
    }

    /**
     * Swaps the element with the given key for {@code replacer}'s result, which must present the same key.
     *
     * @return the replacement, or null when no element has the key
     * @throws KeyChangedException if the replacement has a different key, the vector is left untouched
     */
    public T replaceByKey(K k, UnaryOperator<T> replacer) {
        int i = binarySearch(k);
        if (i < 0) {
            return null;
        }
        T replacement = Preconditions.checkNotNull(replacer.apply(itemAt(i)), "null replacement");
        K replacementKey = key.key(replacement);
        if (key.compare(keyAt(i), replacementKey) != 0) {
            throw new KeyChangedException(keyAt(i), replacementKey);
        }
        items[i] = replacement;
        return replacement;
    }

    public T get(int index) {
        Preconditions.checkElementIndex(index, count);
        return itemAt(index);
    }

    public T first() {
        return count == 0 ? null : itemAt(0);
    }

    public T last() {
        return count == 0 ? null : itemAt(count - 1);
    }

    /**
     * @throws DuplicateKeyException if an element with the same key is present, the vector is left untouched
     */
    public void insert(T item) {
        Preconditions.checkNotNull(item, "null items are not allowed");
        K k = key.key(item);
        int insertIndex;
        if (count == 0 || key.compare(k, keyAt(count - 1)) > 0) {
            insertIndex = count;
        } else {
            int i = binarySearch(k);
            if (i >= 0) {
                throw new DuplicateKeyException("Cannot insert an item with a duplicate key", k);
            }
            insertIndex = -(i + 1);
        }
        ensureCapacity(count + 1);
        System.arraycopy(items, insertIndex, items, insertIndex + 1, count - insertIndex);
        items[insertIndex] = item;
        count++;
        modCount++;
    }

    /**
     * @return the removed element, or null when no element has the key
     */
    public T removeByKey(K k) {
        int i = binarySearch(k);
        if (i < 0) {
            return null;
        }
        T removed = itemAt(i);
        System.arraycopy(items, i + 1, items, i, count - i - 1);
        count--;
        items[count] = null;
        modCount++;
        return removed;
    }

    public void clear() {
        Arrays.fill(items, 0, count, null);
        count = 0;
        modCount++;
    }

    /**
     * Applies {@code f} to every element and keeps its result in place of the element, or drops the element when
     * the result is null. A result may carry a different key, in which case it moves to its new position.
     * <p>
     * Each element is visited exactly once but NOT in key order. Elements are taken out by swapping the last live
     * element into their slot, so e.g. for keys 0..7 where the odd keys are dropped the visit order is
     * 0, 1, 7, 6, 2, 3, 5, 4. Callers with side effects in {@code f} must not depend on any order.
     * <p>
     * Survivors are sorted once at the end. The call is all or nothing: if {@code f} throws anything, or two
     * survivors share a key ({@link DuplicateKeyException}), the vector is put back exactly as it was before the
     * call and the failure is rethrown. This costs one O(n) copy of the element references on every call.
     */
    public void retainMap(Function<? super T, ? extends T> f) {
        Preconditions.checkNotNull(f, "f");
        modCount++;
        Object[] previous = Arrays.copyOf(items, count);
        boolean applied = false;
        int visited = 0;
        try {
            int i = 0;
            while (i < count) {
                T item = itemAt(i);
                count--;
                items[i] = items[count];
                items[count] = null;

                T mapped = f.apply(item);
                visited++;

                if (mapped != null) {
                    if (i < count) {
                        items[count] = items[i];
                        items[i] = mapped;
                    } else {
                        items[count] = mapped;
                    }
                    count++;
                    i++;
                }
            }
            int duplicate = sortAndFindDuplicate();
            if (duplicate != -1) {
                K duplicateKey = keyAt(duplicate);
                LOG.error("retainMap produced duplicate key:{}, restoring {} items", duplicateKey, previous.length);
                throw new DuplicateKeyException("Duplicate keys are not allowed", duplicateKey);
            }
            applied = true;
        } finally {
            if (!applied) {
                Arrays.fill(items, 0, count, null);
                System.arraycopy(previous, 0, items, 0, previous.length);
                count = previous.length;
                LOG.warn("retainMap aborted after visiting {} of {} items, previous state restored", visited, previous.length);
            }
        }
        LOG.debug("retainMap visited:{} retained:{}", visited, count);
    }

    @JsonValue
    public List<T> toList() {
        ImmutableList.Builder<T> builder = ImmutableList.builderWithExpectedSize(count);
        for (int i = 0; i < count; i++) {
            builder.add(itemAt(i));
        }
        return builder.build();
    }

    public OrdVec<T, K, X> copy() {
        return new OrdVec<>(key, config, count == 0 ? EMPTY : Arrays.copyOf(items, count), count);
    }

    public boolean stream(OrdVecStream<T> stream) throws Exception {
        for (int i = 0; i < count; i++) {
            if (!stream.item(i, itemAt(i))) {
                return false;
            }
        }
        return true;
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), count, Spliterator.ORDERED | Spliterator.NONNULL);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private final int expectedModCount = modCount;
            private int i = 0;

            @Override
            public boolean hasNext() {
                checkForComodification();
                return i < count;
            }

            @Override
            public T next() {
                checkForComodification();
                if (i >= count) {
                    throw new NoSuchElementException();
                }
                return itemAt(i++);
            }

            private void checkForComodification() {
                if (modCount != expectedModCount) {
                    throw new ConcurrentModificationException();
                }
            }
        };
    }

    /**
     * Equal when both hold equal elements in the same order under equal key instances. Key classes that do not
     * override {@code equals} compare by identity, so vectors meant to compare equal should share one key instance
     * (as {@link FirstKey#singleton()} does). Each {@link OrdVecKeys} call creates a distinct key.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        OrdVec<?, ?, ?> other = (OrdVec<?, ?, ?>) obj;
        if (!key.equals(other.key) || count != other.count) {
            return false;
        }
        for (int i = 0; i < count; i++) {
            if (!items[i].equals(other.items[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hashCode = 1;
        for (int i = 0; i < count; i++) {
            hashCode = 31 * hashCode + items[i].hashCode();
        }
        return hashCode;
    }

    @Override
    public String toString() {
        return Arrays.toString(Arrays.copyOf(items, count));
    }

    @SuppressWarnings("unchecked")
    private T itemAt(int i) {
        return (T) items[i];
    }

    private K keyAt(int i) {
        return key.key(itemAt(i));
    }

    private int binarySearch(K k) {
        int low = 0;
        int high = count - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int c = key.compare(keyAt(mid), k);
            if (c < 0) {
                low = mid + 1;
            } else if (c > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }

    @SuppressWarnings("unchecked")
    private int sortAndFindDuplicate() {
        Arrays.sort(items, 0, count, (a, b) -> key.compareItems((T) a, (T) b));
        for (int i = 1; i < count; i++) {
            if (key.compare(keyAt(i - 1), keyAt(i)) == 0) {
                return i;
            }
        }
        return -1;
    }

    private void ensureCapacity(int minCapacity) {
        if (minCapacity <= items.length) {
            return;
        }
        if (minCapacity > MAX_CAPACITY) {
            throw new OutOfMemoryError("Required capacity " + minCapacity + " exceeds " + MAX_CAPACITY);
        }
        long grown = items == EMPTY ? Math.max(config.initialCapacity, 1) : (long) items.length * 2;
        int capacity = (int) Math.min(MAX_CAPACITY, Math.max(grown, minCapacity));
        LOG.debug("Growing from {} to {}", items.length, capacity);
        items = Arrays.copyOf(items, capacity);
    }
}
