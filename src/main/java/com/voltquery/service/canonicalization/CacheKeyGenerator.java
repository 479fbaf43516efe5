package com.voltquery.service.canonicalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives cache keys for external API calls.
 *
 * Key = {@code prefix + ":" + sha256(canonical JSON of {prefix, args, kwargs})}, where the
 * canonical form sorts object keys recursively. Identical logical calls therefore produce the
 * same key whatever order their named arguments were supplied in.
 */
@Slf4j
@Service
public class CacheKeyGenerator {

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Key for a call with positional arguments only.
     */
    public String generateKey(String prefix, Object... args) {
        return generateKey(prefix, Arrays.asList(args), Map.of());
    }

    /**
     * Key for a call with positional and named arguments.
     *
     * @param prefix key namespace, also used for prefix clears
     * @param args   positional arguments
     * @param kwargs named arguments, in any order
     * @return namespaced SHA-256 key
     */
    public String generateKey(String prefix, List<?> args, Map<String, ?> kwargs) {
        Map<String, Object> call = new LinkedHashMap<>();
        call.put("prefix", prefix);
        call.put("args", args);
        call.put("kwargs", kwargs);

        return prefix + ":" + DigestUtils.sha256Hex(canonicalize(call));
    }

    /**
     * Canonical JSON string for any value.
     */
    public String canonicalize(Object value) {
        JsonNode node = objectMapper.valueToTree(value);
        try {
            return objectMapper.writeValueAsString(canonicalizeNode(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical cache key input", e);
        }
    }

    private JsonNode canonicalizeNode(JsonNode node) {
        if (node.isObject()) {
            return canonicalizeObject((ObjectNode) node);
        } else if (node.isArray()) {
            return canonicalizeArray((ArrayNode) node);
        }
        return node;
    }

    private JsonNode canonicalizeObject(ObjectNode node) {
        ObjectNode canonical = objectMapper.createObjectNode();

        List<String> fieldNames = new ArrayList<>();
        node.fieldNames().forEachRemaining(fieldNames::add);
        Collections.sort(fieldNames);

        for (String fieldName : fieldNames) {
            canonical.set(fieldName, canonicalizeNode(node.get(fieldName)));
        }

        return canonical;
    }

    private JsonNode canonicalizeArray(ArrayNode node) {
        ArrayNode canonical = objectMapper.createArrayNode();
        for (JsonNode element : node) {
            canonical.add(canonicalizeNode(element));
        }
        return canonical;
    }
}
