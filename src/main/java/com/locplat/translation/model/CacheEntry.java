package com.locplat.translation.model;

/**
 * A value as written to the key-value store.
 *
 * @param payload    stored bytes, zlib-compressed when {@code compressed} is set
 * @param ttlSeconds expiry applied on write
 */
public record CacheEntry(String key, byte[] payload, long ttlSeconds, boolean compressed) {
}
