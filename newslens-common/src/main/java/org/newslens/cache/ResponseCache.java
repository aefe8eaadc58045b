package org.newslens.cache;

import org.newslens.model.QAResponse;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Fingerprint to answer store placed in front of the question answering pipeline.
 *
 * <p>Implementations never throw on backend failure: reads degrade to a miss and
 * writes are dropped, both with a log line.</p>
 */
public interface ResponseCache {

    /**
     * Builds the key for a question and its request parameters.
     */
    String generateKey(String query, Map<String, ?> params);

    Optional<QAResponse> get(String key);

    /**
     * Stores a response. {@code ttl} must be positive.
     */
    void set(String key, QAResponse value, Duration ttl);

    void delete(String key);

    boolean exists(String key);

    /**
     * Removes every entry under this cache's key prefix.
     */
    void clear();
}
