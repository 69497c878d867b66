package com.locplat.translation.service;

import java.time.Duration;
import java.util.Set;

/**
 * Minimal key-value contract the caches are written against. Patterns use Redis
 * glob syntax ({@code *} and {@code ?}).
 */
public interface KeyValueStore {

    /**
     * @return the stored bytes, or {@code null} when absent or expired
     */
    byte[] get(String key);

    void set(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    /**
     * @return number of keys removed
     */
    long deleteMatching(String pattern);

    Set<String> keys(String pattern);

    long increment(String key);
}
