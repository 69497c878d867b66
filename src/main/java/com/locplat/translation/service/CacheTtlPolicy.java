package com.locplat.translation.service;

import com.locplat.translation.model.CacheContentType;
import com.locplat.translation.model.CostTier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Computes how long an AI response stays cached. Responses from expensive models
 * and responses the provider was confident about are kept longer.
 */
@Component
public class CacheTtlPolicy {

    private static final Map<String, Map<String, CostTier>> PROVIDER_COST_TIERS = Map.of(
            "openai", Map.of(
                    "gpt-3.5-turbo", CostTier.LOW,
                    "gpt-4", CostTier.HIGH,
                    "gpt-4-turbo", CostTier.HIGH,
                    "gpt-4o", CostTier.HIGH,
                    "gpt-4o-mini", CostTier.MEDIUM),
            "anthropic", Map.of(
                    "claude-instant", CostTier.MEDIUM,
                    "claude-2", CostTier.HIGH,
                    "claude-3-opus", CostTier.VERY_HIGH,
                    "claude-3-sonnet", CostTier.HIGH,
                    "claude-3-haiku", CostTier.MEDIUM,
                    "claude-3-5-sonnet", CostTier.HIGH,
                    "claude-3-5-haiku", CostTier.MEDIUM),
            "mistral", Map.of(
                    "mistral-tiny", CostTier.LOW,
                    "mistral-small", CostTier.MEDIUM,
                    "mistral-medium", CostTier.MEDIUM,
                    "mistral-large", CostTier.HIGH,
                    "mistral-7b-instruct", CostTier.LOW,
                    "mixtral-8x7b-instruct", CostTier.MEDIUM),
            "deepseek", Map.of(
                    "deepseek-coder", CostTier.MEDIUM,
                    "deepseek-chat", CostTier.MEDIUM,
                    "deepseek-v2", CostTier.MEDIUM),
            "bedrock", Map.of(
                    "anthropic.claude-3-haiku-20240307-v1:0", CostTier.MEDIUM,
                    "anthropic.claude-3-sonnet-20240229-v1:0", CostTier.HIGH,
                    "anthropic.claude-3-5-sonnet-20240620-v1:0", CostTier.HIGH,
                    "anthropic.claude-3-opus-20240229-v1:0", CostTier.VERY_HIGH)
    );

    private final long baseTtlSeconds;

    public CacheTtlPolicy(@Value("${app.cache.default-ttl-seconds:86400}") long baseTtlSeconds) {
        this.baseTtlSeconds = baseTtlSeconds;
    }

    public CostTier costTier(String provider, String model) {
        Map<String, CostTier> models = provider == null ? null : PROVIDER_COST_TIERS.get(provider);
        if (models == null || model == null) {
            return CostTier.MEDIUM;
        }
        return models.getOrDefault(model, CostTier.MEDIUM);
    }

    /**
     * base TTL x content type factor x cost tier factor x confidence, with confidence clamped to [0.5, 1.5].
     */
    public Duration ttl(CacheContentType contentType, String provider, String model, double confidence) {
        double contentFactor = contentType == null ? 1.0 : contentType.getTtlFactor();
        double tierFactor = costTier(provider, model).getTtlFactor();
        double confidenceFactor = Math.max(0.5, Math.min(1.5, confidence));
        return Duration.ofSeconds((long) (baseTtlSeconds * contentFactor * tierFactor * confidenceFactor));
    }
}
