package org.newslens.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic fingerprint of a question plus its parameters.
 *
 * <p>The query is lowercased and trimmed, merged with the parameters under the
 * {@code query} key, serialized as JSON with sorted keys and hashed with SHA-256.
 * The key is {@code prefix + ":" + } the first 16 hex characters.</p>
 */
public class CacheKeyGenerator {

    public static final String DEFAULT_PREFIX = "qa";

    private static final int HASH_LENGTH = 16;

    private final String prefix;
    private final ObjectMapper objectMapper;

    public CacheKeyGenerator() {
        this(DEFAULT_PREFIX);
    }

    public CacheKeyGenerator(String prefix) {
        this.prefix = prefix;
        this.objectMapper = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String getPrefix() {
        return prefix;
    }

    public String generate(String query, Map<String, ?> params) {
        Map<String, Object> data = new TreeMap<>();
        if (params != null) {
            data.putAll(params);
        }
        data.put("query", query == null ? "" : query.toLowerCase(Locale.ROOT).trim());

        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parameters are not serializable", e);
        }
        return prefix + ":" + sha256Hex(serialized).substring(0, HASH_LENGTH);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
