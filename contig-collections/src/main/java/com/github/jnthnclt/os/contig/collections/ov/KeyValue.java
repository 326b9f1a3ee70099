package com.github.jnthnclt.os.contig.collections.ov;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Immutable key value pair, for elements that do not carry their own key. Ordered by {@link FirstKey}.
 */
public class KeyValue<K, V> {

    private final K key;
    private final V value;

    @JsonCreator
    public KeyValue(@JsonProperty("key") K key,
        @JsonProperty("value") V value) {
        this.key = key;
        this.value = value;
    }

    public static <K, V> KeyValue<K, V> of(K key, V value) {
        return new KeyValue<>(key, value);
    }

    @JsonProperty("key")
    public K getKey() {
        return key;
    }

    @JsonProperty("value")
    public V getValue() {
        return value;
    }

    public KeyValue<K, V> withKey(K newKey) {
        return new KeyValue<>(newKey, value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        KeyValue<?, ?> other = (KeyValue<?, ?>) obj;
        return Objects.equals(key, other.key) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int hashCode = 3;
        hashCode = 59 * hashCode + Objects.hashCode(key);
        hashCode = 59 * hashCode + Objects.hashCode(value);
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + key + ", " + value + ")";
    }
}
