package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hit/miss counters for AI responses, optionally narrowed to a provider and model.
 */
public record CacheStats(
        String provider,
        String model,
        long hits,
        long misses,
        @JsonProperty("total_requests") long totalRequests,
        @JsonProperty("hit_rate") double hitRate
) {
    public static CacheStats of(String provider, String model, long hits, long misses) {
        long total = hits + misses;
        double rate = total == 0 ? 0.0 : Math.round((double) hits / total * 1000.0) / 1000.0;
        return new CacheStats(provider, model, hits, misses, total, rate);
    }
}
