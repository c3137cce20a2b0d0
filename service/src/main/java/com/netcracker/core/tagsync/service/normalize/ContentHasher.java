package com.netcracker.core.tagsync.service.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-256 digests used to pin externally sourced content.
 */
public final class ContentHasher {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private ContentHasher() {
    }

    /**
     * Hash of the normalized value in canonical form (object keys sorted, arrays in order).
     */
    public static String hash(JsonNode value) {
        return sha256Hex(canonicalString(EntityNormalizer.normalize(value)));
    }

    public static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String canonicalString(JsonNode value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(canonical(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value for hashing", e);
        }
    }

    private static JsonNode canonical(JsonNode value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(value.size());
            value.forEach(item -> out.add(canonical(item)));
            return out;
        }
        if (value.isObject()) {
            List<String> keys = new ArrayList<>();
            value.fieldNames().forEachRemaining(keys::add);
            keys.sort(null);
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            keys.forEach(key -> out.set(key, canonical(value.get(key))));
            return out;
        }
        return value;
    }
}
