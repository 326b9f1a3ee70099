package com.github.jnthnclt.os.contig.collections.json;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.github.jnthnclt.os.contig.collections.ov.OrdVec;
import com.github.jnthnclt.os.contig.collections.ov.OrdVecKey;
import com.github.jnthnclt.os.contig.log.ContigLogger;
import com.github.jnthnclt.os.contig.log.ContigLoggerFactory;
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lets Jackson read {@link OrdVec} values. Writing needs no module, an {@link OrdVec} serializes as the JSON array of
 * its elements.
 * <p>
 * Jackson cannot conjure a key instance from a type, so every key class a mapper will meet in a declared
 * {@code OrdVec<T, K, X>} must be registered with {@link #addKey(OrdVecKey)}. The registered instance is looked up by
 * the raw class of {@code X}.
 */
public class ContigModule extends SimpleModule {

    private static final ContigLogger LOG = ContigLoggerFactory.getLogger();

    private final Map<Class<?>, OrdVecKey<?, ?>> keys = new ConcurrentHashMap<>();

    public ContigModule() {
        super("ContigModule");
    }

    public ContigModule addKey(OrdVecKey<?, ?> key) {
        Preconditions.checkNotNull(key, "key");
        OrdVecKey<?, ?> had = keys.put(key.getClass(), key);
        if (had != null && had != key) {
            LOG.warn("Replaced registered key instance for {}", key.getClass().getName());
        }
        return this;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addDeserializers(new OrdVecDeserializers());
    }

    private class OrdVecDeserializers extends Deserializers.Base {

        @Override
        @SuppressWarnings({ "unchecked", "rawtypes" })
        public JsonDeserializer<?> findBeanDeserializer(JavaType type,
            DeserializationConfig config,
            BeanDescription beanDesc) throws JsonMappingException {
            if (!OrdVec.class.equals(type.getRawClass())) {
                return null;
            }
            JavaType itemType = type.containedTypeOrUnknown(0);
            JavaType keyType = type.containedTypeOrUnknown(2);
            OrdVecKey key = keys.get(keyType.getRawClass());
            if (key == null) {
                throw new IllegalArgumentException("No key registered for " + type + ", see ContigModule.addKey");
            }
            JavaType itemsType = config.getTypeFactory().constructCollectionType(List.class, itemType);
            return new OrdVecDeserializer(type, itemsType, key);
        }
    }
}
