package org.newslens.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.newslens.model.AnswerConfidence;
import org.newslens.model.Intent;
import org.newslens.model.QAResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResponseCacheTest {

    private MutableClock clock;
    private InMemoryResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        cache = new InMemoryResponseCache(new CacheKeyGenerator(), clock);
    }

    @Test
    void setThenGetReturnsValue() {
        QAResponse response = response("salam");
        String key = cache.generateKey("salam", Map.of("top_k", 5));

        cache.set(key, response, Duration.ofHours(1));

        assertThat(cache.get(key)).contains(response);
        assertThat(cache.exists(key)).isTrue();
    }

    @Test
    void entryExpiresAfterTtl() {
        cache.set("qa:1", response("q"), Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertThat(cache.get("qa:1")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("qa:1")).isEmpty();
        assertThat(cache.exists("qa:1")).isFalse();
    }

    @Test
    void clearRemovesEverything() {
        cache.set("qa:1", response("a"), Duration.ofHours(1));
        cache.set("qa:2", response("b"), Duration.ofHours(1));

        cache.clear();

        assertThat(cache.get("qa:1")).isEmpty();
        assertThat(cache.get("qa:2")).isEmpty();
    }

    @Test
    void deleteRemovesSingleEntry() {
        cache.set("qa:1", response("a"), Duration.ofHours(1));
        cache.set("qa:2", response("b"), Duration.ofHours(1));

        cache.delete("qa:1");

        assertThat(cache.exists("qa:1")).isFalse();
        assertThat(cache.exists("qa:2")).isTrue();
    }

    @Test
    void nonPositiveTtlIsRejected() {
        assertThatThrownBy(() -> cache.set("qa:1", response("a"), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static QAResponse response(String query) {
        return QAResponse.builder()
                .query(query)
                .language("az")
                .intent(Intent.TALK)
                .answer("Salam!")
                .confidence(AnswerConfidence.HIGH)
                .handlerUsed("TalkHandler")
                .build();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
