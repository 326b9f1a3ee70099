package com.github.jnthnclt.os.contig.collections.ov;

/**
 * Extracts the ordering key of an {@link OrdVec} element.
 * <p>
 * Implementations must be stateless and deterministic: the same element always yields the same key, and
 * {@link #compare(Object, Object)} is a total order. Nothing checks this. An inconsistent key leaves the
 * owning {@link OrdVec} in an undefined order.
 * <p>
 * Several keys may exist for the same element type. Declaring each as its own class makes vectors ordered by
 * different keys distinct types, see {@link OrdVec}.
 *
 * @param <T> element type
 * @param <K> key type
 */
public interface OrdVecKey<T, K> {

    K key(T item);

    int compare(K a, K b);

    default int compareItems(T a, T b) {
        return compare(key(a), key(b));
    }
}
