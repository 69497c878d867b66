package com.locplat.translation.service;

import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * {@link KeyValueStore} over Redis. Values are raw bytes; keys are scanned rather
 * than listed with KEYS so large keyspaces do not block the server.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_BATCH = 100;

    private final RedisTemplate<String, byte[]> redisTemplate;

    public RedisKeyValueStore(RedisTemplate<String, byte[]> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public byte[] get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redisTemplate.opsForValue().set(key, value);
        } else {
            redisTemplate.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public long deleteMatching(String pattern) {
        Set<String> keys = keys(pattern);
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0 : deleted;
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = new HashSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }

    @Override
    public long increment(String key) {
        Long value = redisTemplate.opsForValue().increment(key);
        return value == null ? 0 : value;
    }
}
