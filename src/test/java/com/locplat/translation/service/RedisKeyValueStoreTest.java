package com.locplat.translation.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.ValueOperations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueStoreTest {

    @Mock
    private RedisTemplate<String, byte[]> redisTemplate;

    @Mock
    private ValueOperations<String, byte[]> valueOperations;

    @Mock
    private Cursor<String> cursor;

    @InjectMocks
    private RedisKeyValueStore store;

    @Test
    void setAppliesTtlWhenPositive() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        byte[] value = "v".getBytes(StandardCharsets.UTF_8);

        store.set("k", value, Duration.ofSeconds(30));
        store.set("forever", value, Duration.ZERO);

        verify(valueOperations).set("k", value, Duration.ofSeconds(30));
        verify(valueOperations).set("forever", value);
    }

    @Test
    void deleteMatchingScansThenDeletesInOneCall() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn("ai_response:v1:a", "ai_response:v1:b");
        doCallRealMethod().when(cursor).forEachRemaining(any());
        when(redisTemplate.delete(anyCollection())).thenReturn(2L);

        long removed = store.deleteMatching("ai_response:v1:*");

        assertThat(removed).isEqualTo(2);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(redisTemplate).delete(captor.capture());
        assertThat(captor.getValue()).containsExactlyInAnyOrder("ai_response:v1:a", "ai_response:v1:b");
        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redisTemplate).scan(options.capture());
        assertThat(options.getValue().getPattern()).isEqualTo("ai_response:v1:*");
        verify(cursor).close();
    }

    @Test
    void deleteMatchingWithNoKeysSkipsDelete() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(false);
        doCallRealMethod().when(cursor).forEachRemaining(any());

        assertThat(store.deleteMatching("nothing:*")).isZero();
        verify(redisTemplate, never()).delete(anyCollection());
    }

    @Test
    void keysReturnsScannedSet() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, false);
        when(cursor.next()).thenReturn("cache_stats:p:m:hits");
        doCallRealMethod().when(cursor).forEachRemaining(any());

        Set<String> keys = store.keys("cache_stats:*");

        assertThat(keys).containsExactly("cache_stats:p:m:hits");
    }

    @Test
    void incrementTreatsNullAsZero() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("counter")).thenReturn(null, 5L);

        assertThat(store.increment("counter")).isZero();
        assertThat(store.increment("counter")).isEqualTo(5);
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        when(redisTemplate.delete("k")).thenReturn(Boolean.TRUE, Boolean.FALSE);

        assertThat(store.delete("k")).isTrue();
        assertThat(store.delete("k")).isFalse();
    }
}
