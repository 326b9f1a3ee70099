package com.github.jnthnclt.os.contig.collections.ov;

import com.google.common.base.Preconditions;
import java.util.Comparator;
import java.util.function.Function;

/**
 * Ad-hoc {@link OrdVecKey} instances for when a named key class is more ceremony than it is worth.
 */
public class OrdVecKeys {

    private OrdVecKeys() {
    }

    public static <T, K extends Comparable<? super K>> OrdVecKey<T, K> natural(Function<? super T, ? extends K> extractor) {
        return comparing(extractor, Comparator.<K>naturalOrder());
    }

    public static <T, K> OrdVecKey<T, K> comparing(Function<? super T, ? extends K> extractor, Comparator<? super K> comparator) {
        Preconditions.checkNotNull(extractor, "extractor");
        Preconditions.checkNotNull(comparator, "comparator");
        return new OrdVecKey<T, K>() {
            @Override
            public K key(T item) {
                return extractor.apply(item);
            }

            @Override
            public int compare(K a, K b) {
                return comparator.compare(a, b);
            }
        };
    }
}
