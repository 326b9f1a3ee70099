package com.github.jnthnclt.os.contig.collections.ov;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

public class OrdVecConfig {

    public static final OrdVecConfig DEFAULT = new OrdVecConfig(10);

    public final int initialCapacity;

    @JsonCreator
    public OrdVecConfig(@JsonProperty("initialCapacity") int initialCapacity) {
        Preconditions.checkArgument(initialCapacity >= 0, "initialCapacity must be >= 0, was %s", initialCapacity);
        this.initialCapacity = initialCapacity;
    }

    @Override
    public String toString() {
        return "OrdVecConfig{"
            + "initialCapacity=" + initialCapacity
            + '}';
    }
}
