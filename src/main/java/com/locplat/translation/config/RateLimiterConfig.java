package com.locplat.translation.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.translationQps:5.0}") // 0 or less disables throttling
    private double translationQps;

    @Bean("translationRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter translationRateLimiter() {
        double effectiveQps = translationQps > 0 ? translationQps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
