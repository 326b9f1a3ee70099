package com.github.jnthnclt.os.contig.collections.api.exceptions;

/**
 * A replacement for a resident element presented a different key.
 */
public class KeyChangedException extends IllegalStateException {

    public KeyChangedException(Object was, Object now) {
        super("Replacement changed key from:" + was + " to:" + now);
    }
}
