package com.github.jnthnclt.os.contig.collections.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.github.jnthnclt.os.contig.collections.api.exceptions.DuplicateKeyException;
import com.github.jnthnclt.os.contig.collections.ov.OrdVec;
import com.github.jnthnclt.os.contig.collections.ov.OrdVecKey;
import java.io.IOException;
import java.util.List;

/**
 * Reads a JSON array into an {@link OrdVec}. The array is never trusted to be sorted or duplicate free, it goes
 * through {@link OrdVec#fromUnsorted}.
 */
public class OrdVecDeserializer<T, K, X extends OrdVecKey<T, K>> extends StdDeserializer<OrdVec<T, K, X>> {

    private final JavaType itemsType;
    private final X key;

    public OrdVecDeserializer(JavaType ordVecType, JavaType itemsType, X key) {
        super(ordVecType);
        this.itemsType = itemsType;
        this.key = key;
    }

    @Override
    @SuppressWarnings("unchecked")
    public OrdVec<T, K, X> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonDeserializer<Object> itemsDeserializer = ctxt.findRootValueDeserializer(itemsType);
        List<T> items = (List<T>) itemsDeserializer.deserialize(p, ctxt);
        try {
            return OrdVec.<T, K, X>fromUnsorted(key, items);
        } catch (DuplicateKeyException | NullPointerException x) {
            throw JsonMappingException.from(p, "Invalid " + handledType().getSimpleName() + ": " + x.getMessage(), x);
        }
    }
}
