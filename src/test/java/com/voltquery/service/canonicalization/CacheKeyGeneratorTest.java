package com.voltquery.service.canonicalization;

import com.voltquery.config.JacksonConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyGeneratorTest {

    private CacheKeyGenerator keyGenerator;

    @BeforeEach
    void setUp() {
        keyGenerator = new CacheKeyGenerator(JacksonConfiguration.createObjectMapper());
    }

    @Test
    void testKeyIsPrefixedSha256() {
        String key = keyGenerator.generateKey("utility_rates", 39.74, -104.99);

        assertTrue(key.startsWith("utility_rates:"));
        assertEquals("utility_rates:".length() + 64, key.length());
    }

    @Test
    void testNamedArgumentOrderDoesNotMatter() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("sector", "residential");
        first.put("limit", 5);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("limit", 5);
        second.put("sector", "residential");

        assertEquals(keyGenerator.generateKey("rates", List.of(1), first),
                keyGenerator.generateKey("rates", List.of(1), second));
    }

    @Test
    void testNestedMapsAreSorted() {
        Map<String, Object> inner1 = new LinkedHashMap<>();
        inner1.put("b", 2);
        inner1.put("a", 1);
        Map<String, Object> inner2 = new LinkedHashMap<>();
        inner2.put("a", 1);
        inner2.put("b", 2);

        assertEquals(keyGenerator.generateKey("p", List.of(inner1), Map.of()),
                keyGenerator.generateKey("p", List.of(inner2), Map.of()));
    }

    @Test
    void testDifferentArgumentsProduceDifferentKeys() {
        assertNotEquals(keyGenerator.generateKey("geocode_zip", "80202"),
                keyGenerator.generateKey("geocode_zip", "80203"));
        assertNotEquals(keyGenerator.generateKey("a", "x"), keyGenerator.generateKey("b", "x"));
    }

    @Test
    void testNullArgumentsAllowed() {
        String key = keyGenerator.generateKey("p", "x", null);
        assertEquals(key, keyGenerator.generateKey("p", "x", null));
    }

    @Test
    void testCanonicalFormSortsKeys() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("z", 1);
        value.put("a", List.of(Map.of("y", 2)));

        assertEquals("{\"a\":[{\"y\":2}],\"z\":1}", keyGenerator.canonicalize(value));
    }
}
