package org.newslens.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.newslens.model.QAResponse;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed response cache. Values are stored as JSON strings with a Redis TTL.
 */
@Slf4j
public class RedisResponseCache implements ResponseCache {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final CacheKeyGenerator keyGenerator;

    public RedisResponseCache(StringRedisTemplate redis, ObjectMapper objectMapper, CacheKeyGenerator keyGenerator) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyGenerator = keyGenerator;
    }

    @Override
    public String generateKey(String query, Map<String, ?> params) {
        return keyGenerator.generate(query, params);
    }

    @Override
    public Optional<QAResponse> get(String key) {
        try {
            String json = redis.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, QAResponse.class));
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, QAResponse value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void delete(String key) {
        try {
            redis.delete(key);
        } catch (DataAccessException e) {
            log.warn("Cache delete failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redis.hasKey(key));
        } catch (DataAccessException e) {
            log.warn("Cache lookup failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public void clear() {
        String pattern = keyGenerator.getPrefix() + ":*";
        try {
            Set<String> keys = redis.keys(pattern);
            if (keys != null && !keys.isEmpty()) {
                redis.delete(keys);
            }
            log.info("Redis response cache cleared ({} keys matching {})", keys != null ? keys.size() : 0, pattern);
        } catch (DataAccessException e) {
            log.warn("Cache clear failed for {}: {}", pattern, e.getMessage());
        }
    }
}
