package com.github.jnthnclt.os.contig.collections.api.exceptions;

/**
 * Two elements of a key ordered collection would share a key. This is a caller logic error.
 */
public class DuplicateKeyException extends IllegalArgumentException {

    private final transient Object key;

    public DuplicateKeyException(String message, Object key) {
        super(message + ":" + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
