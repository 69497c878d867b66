package com.locplat.translation.model;

/**
 * Coarse provider/model expense class. Pricier models keep cached responses longer.
 */
public enum CostTier {
    LOW(0.8),
    MEDIUM(1.0),
    HIGH(1.5),
    VERY_HIGH(2.0);

    private final double ttlFactor;

    CostTier(double ttlFactor) {
        this.ttlFactor = ttlFactor;
    }

    public double getTtlFactor() {
        return ttlFactor;
    }
}
