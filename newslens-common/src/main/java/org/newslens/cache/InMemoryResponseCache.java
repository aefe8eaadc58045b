package org.newslens.cache;

import lombok.extern.slf4j.Slf4j;
import org.newslens.model.QAResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache with per-entry expiry. Expired entries are evicted lazily on access.
 */
@Slf4j
public class InMemoryResponseCache implements ResponseCache {

    private final CacheKeyGenerator keyGenerator;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryResponseCache(CacheKeyGenerator keyGenerator) {
        this(keyGenerator, Clock.systemUTC());
    }

    public InMemoryResponseCache(CacheKeyGenerator keyGenerator, Clock clock) {
        this.keyGenerator = keyGenerator;
        this.clock = clock;
    }

    @Override
    public String generateKey(String query, Map<String, ?> params) {
        return keyGenerator.generate(query, params);
    }

    @Override
    public Optional<QAResponse> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, QAResponse value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        int size = entries.size();
        entries.clear();
        log.info("In-memory response cache cleared ({} entries)", size);
    }

    private record Entry(QAResponse value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
