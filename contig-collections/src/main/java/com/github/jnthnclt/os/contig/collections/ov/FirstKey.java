package com.github.jnthnclt.os.contig.collections.ov;

/**
 * Orders {@link KeyValue} pairs by their key component.
 */
public class FirstKey<K extends Comparable<? super K>, V> implements OrdVecKey<KeyValue<K, V>, K> {

    @SuppressWarnings("rawtypes")
    private static final FirstKey SINGLETON = new FirstKey();

    @SuppressWarnings("unchecked")
    public static <K extends Comparable<? super K>, V> FirstKey<K, V> singleton() {
        return (FirstKey<K, V>) SINGLETON;
    }

    @Override
    public K key(KeyValue<K, V> item) {
        return item.getKey();
    }

    @Override
    public int compare(K a, K b) {
        return a.compareTo(b);
    }
}
