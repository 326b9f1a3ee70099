package com.github.jnthnclt.os.contig.collections.ov;

public interface OrdVecStream<T> {

    boolean item(int index, T item) throws Exception;
}
