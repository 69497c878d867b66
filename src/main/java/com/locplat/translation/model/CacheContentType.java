package com.locplat.translation.model;

import java.util.Locale;

public enum CacheContentType {
    CRITICAL(0.5),
    STANDARD(1.0),
    STATIC(7.0),
    TEMPORARY(0.25);

    private final double ttlFactor;

    CacheContentType(double ttlFactor) {
        this.ttlFactor = ttlFactor;
    }

    public double getTtlFactor() {
        return ttlFactor;
    }

    /**
     * Lenient lookup; anything unrecognised is cached as standard content.
     */
    public static CacheContentType fromValue(String raw) {
        if (raw == null) {
            return STANDARD;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STANDARD;
        }
    }
}
