package com.github.jnthnclt.os.contig.collections.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jnthnclt.os.contig.collections.a2.Array2;
import com.github.jnthnclt.os.contig.collections.api.exceptions.DuplicateKeyException;
import com.github.jnthnclt.os.contig.collections.ov.FirstKey;
import com.github.jnthnclt.os.contig.collections.ov.KeyValue;
import com.github.jnthnclt.os.contig.collections.ov.OrdVec;
import com.github.jnthnclt.os.contig.collections.ov.OrdVecConfig;
import com.github.jnthnclt.os.contig.collections.ov.OrdVecKey;
import java.util.Arrays;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class ContigModuleNGTest {

    private static final TypeReference<OrdVec<KeyValue<Integer, String>, Integer, FirstKey<Integer, String>>> KV_VEC =
        new TypeReference<OrdVec<KeyValue<Integer, String>, Integer, FirstKey<Integer, String>>>() {
        };

    private ObjectMapper mapper;

    @BeforeMethod
    public void setUp() throws Exception {
        mapper = new ObjectMapper();
        mapper.registerModule(new ContigModule()
            .addKey(FirstKey.<Integer, String>singleton())
            .addKey(new NameKey()));
    }

    @Test
    public void testWritesPlainArray() throws Exception {
        OrdVec<KeyValue<Integer, String>, Integer, FirstKey<Integer, String>> ov = OrdVec.of(FirstKey.<Integer, String>singleton(),
            KeyValue.of(1, "B"), KeyValue.of(0, "A"));

        Assert.assertEquals(mapper.writeValueAsString(ov), "[{\"key\":0,\"value\":\"A\"},{\"key\":1,\"value\":\"B\"}]");
        Assert.assertEquals(new ObjectMapper().writeValueAsString(ov), "[{\"key\":0,\"value\":\"A\"},{\"key\":1,\"value\":\"B\"}]");
    }

    @Test
    public void testReadSortsUntrustedInput() throws Exception {
        OrdVec<KeyValue<Integer, String>, Integer, FirstKey<Integer, String>> ov = mapper.readValue(
            "[{\"key\":2,\"value\":\"C\"},{\"key\":0,\"value\":\"A\"},{\"key\":1,\"value\":\"B\"}]", KV_VEC);

        Assert.assertEquals(ov.toList(), Arrays.asList(KeyValue.of(0, "A"), KeyValue.of(1, "B"), KeyValue.of(2, "C")));
        Assert.assertEquals(ov.getByKey(1), KeyValue.of(1, "B"));

        OrdVec<KeyValue<Integer, String>, Integer, FirstKey<Integer, String>> back = mapper.readValue(mapper.writeValueAsBytes(ov), KV_VEC);
        Assert.assertEquals(back, ov);
    }

    @Test
    public void testReadRejectsDuplicates() throws Exception {
        JsonMappingException x = Assert.expectThrows(JsonMappingException.class,
            () -> mapper.readValue("[{\"key\":1,\"value\":\"A\"},{\"key\":1,\"value\":\"B\"}]", KV_VEC));
        Assert.assertTrue(x.getCause() instanceof DuplicateKeyException, String.valueOf(x.getCause()));
    }

    @Test
    public void testReadRejectsNulls() throws Exception {
        Assert.expectThrows(JsonMappingException.class, () -> mapper.readValue("[{\"key\":1,\"value\":\"A\"},null]", KV_VEC));
    }

    @Test
    public void testUnregisteredKey() throws Exception {
        Assert.expectThrows(JsonMappingException.class,
            () -> mapper.readValue("[\"b\",\"a\"]", new TypeReference<OrdVec<String, String, UnregisteredKey>>() {
            }));
    }

    @Test
    public void testNestedInBean() throws Exception {
        String json = "{\"byName\":[\"pear\",\"apple\"],\"byKey\":[{\"key\":9,\"value\":\"x\"},{\"key\":3,\"value\":\"y\"}]}";
        Catalog catalog = mapper.readValue(json, Catalog.class);

        Assert.assertEquals(catalog.byName.toList(), Arrays.asList("apple", "pear"));
        Assert.assertEquals(catalog.byKey.toList(), Arrays.asList(KeyValue.of(3, "y"), KeyValue.of(9, "x")));
        Assert.assertEquals(mapper.writeValueAsString(catalog),
            "{\"byName\":[\"apple\",\"pear\"],\"byKey\":[{\"key\":3,\"value\":\"y\"},{\"key\":9,\"value\":\"x\"}]}");

        Assert.expectThrows(JsonMappingException.class, () -> mapper.readValue("{\"byName\":[\"pear\",\"pear\"]}", Catalog.class));
    }

    @Test
    public void testArray2() throws Exception {
        Array2<Integer> a2 = Array2.fromRows(Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(4, 5, 6)));
        String json = mapper.writeValueAsString(a2);
        Assert.assertEquals(json, "{\"numColumns\":3,\"data\":[1,2,3,4,5,6]}");

        Array2<Integer> back = mapper.readValue(json, new TypeReference<Array2<Integer>>() {
        });
        Assert.assertEquals(back, a2);
        Assert.assertEquals(back.row(1), Arrays.asList(4, 5, 6));

        Assert.expectThrows(JsonMappingException.class,
            () -> mapper.readValue("{\"numColumns\":4,\"data\":[1,2,3,4,5,6]}", new TypeReference<Array2<Integer>>() {
            }));
    }

    @Test
    public void testConfig() throws Exception {
        OrdVecConfig config = mapper.readValue("{\"initialCapacity\":4}", OrdVecConfig.class);
        Assert.assertEquals(config.initialCapacity, 4);
        Assert.expectThrows(JsonMappingException.class, () -> mapper.readValue("{\"initialCapacity\":-1}", OrdVecConfig.class));
    }

    public static class Catalog {

        @JsonProperty
        public OrdVec<String, String, NameKey> byName;
        @JsonProperty
        public OrdVec<KeyValue<Integer, String>, Integer, FirstKey<Integer, String>> byKey;
    }

    public static class NameKey implements OrdVecKey<String, String> {

        @Override
        public String key(String item) {
            return item;
        }

        @Override
        public int compare(String a, String b) {
            return a.compareTo(b);
        }
    }

    public static class UnregisteredKey extends NameKey {
    }
}
