package com.locplat.translation.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        store.set("k", bytes("v"), Duration.ofSeconds(60));
        assertThat(store.get("k")).isEqualTo(bytes("v"));

        clock.advance(Duration.ofSeconds(61));

        assertThat(store.get("k")).isNull();
    }

    @Test
    void deleteMatchingUsesGlobPatterns() {
        store.set("ai_response:v1:bedrock:m:fr:abc", bytes("1"), Duration.ofMinutes(1));
        store.set("ai_response:v1:bedrock:m:ar:def", bytes("2"), Duration.ofMinutes(1));
        store.set("ai_response:v1:other:m:fr:ghi", bytes("3"), Duration.ofMinutes(1));

        long removed = store.deleteMatching("ai_response:v1:bedrock:*:*:*");

        assertThat(removed).isEqualTo(2);
        assertThat(store.keys("ai_response:*")).containsExactly("ai_response:v1:other:m:fr:ghi");
    }

    @Test
    void globTreatsRegexCharactersLiterally() {
        store.set("field_config:v1:client.a:articles", bytes("x"), null);
        store.set("field_config:v1:clientXa:articles", bytes("y"), null);

        assertThat(store.keys("field_config:v1:client.a:*")).containsExactly("field_config:v1:client.a:articles");
    }

    @Test
    void incrementStartsAtOne() {
        assertThat(store.increment("cache_stats:p:m:hits")).isEqualTo(1);
        assertThat(store.increment("cache_stats:p:m:hits")).isEqualTo(2);
        assertThat(new String(store.get("cache_stats:p:m:hits"), StandardCharsets.US_ASCII)).isEqualTo("2");
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
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
