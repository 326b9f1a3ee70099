package com.github.jnthnclt.os.contig.collections.api.exceptions;

public class InconsistentRowLengthException extends IllegalArgumentException {

    public InconsistentRowLengthException(int row, int expectedLength, int length) {
        super("Rows must have identical lengths, row:" + row + " has " + length + " elements, expected " + expectedLength);
    }
}
