package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.locplat.translation.model.TranslationSettings;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Builds the versioned cache keys and invalidation patterns shared by all caches.
 */
@Component
public class CacheKeyFactory {

    static final String VERSION = "v1";
    static final String AI_RESPONSE_PREFIX = "ai_response:" + VERSION;
    static final String FIELD_CONFIG_PREFIX = "field_config:" + VERSION;
    static final String EXTRACTION_PREFIX = "field_extraction:" + VERSION;
    static final String STATS_PREFIX = "cache_stats";

    // Content whose canonical form is longer than this is never cached by extraction.
    static final int MAX_HASHED_CONTENT_LENGTH = 50_000;

    private final ContentHashingService hashingService;

    public CacheKeyFactory(ContentHashingService hashingService) {
        this.hashingService = hashingService;
    }

    /**
     * Source language and prompt context only feed the hashed segment, so pattern invalidation
     * over provider, model, target language and collection is unaffected by them.
     */
    public String aiResponseKey(TranslationSettings settings, String text, String context) {
        StringBuilder hashed = new StringBuilder(text).append(':').append(settings.sourceLang())
                .append(':').append(settings.targetLang());
        if (context != null && !context.isBlank()) {
            hashed.append(':').append(context);
        }
        String key = String.join(":", AI_RESPONSE_PREFIX, settings.provider(), settings.model(),
                settings.targetLang(), hashingService.fastHash(hashed.toString()));
        String collection = settings.collection();
        return collection == null || collection.isBlank() ? key : key + ":collection:" + collection;
    }

    /**
     * Pattern over AI response keys; any {@code null} argument matches every value.
     */
    public String aiResponsePattern(String provider, String model, String language, String collection) {
        String pattern = String.join(":", AI_RESPONSE_PREFIX, orAny(provider), orAny(model), orAny(language), "*");
        return collection == null || collection.isBlank() ? pattern : pattern + ":collection:" + collection;
    }

    public String fieldConfigKey(String clientId, String collection) {
        return String.join(":", FIELD_CONFIG_PREFIX, clientId, collection);
    }

    public String fieldConfigPattern(String clientId) {
        return String.join(":", FIELD_CONFIG_PREFIX, orAny(clientId), "*");
    }

    /**
     * Extraction key for the content, or empty when the content is too large to be cached.
     */
    public Optional<String> extractionKey(String configHash, JsonNode content, String language) {
        String canonical = hashingService.canonicalJson(content);
        if (canonical.length() > MAX_HASHED_CONTENT_LENGTH) {
            return Optional.empty();
        }
        String key = String.join(":", EXTRACTION_PREFIX, configHash, hashingService.fastHash(canonical));
        return Optional.of(language == null || language.isBlank() ? key : key + ":" + language);
    }

    public String statsKey(String provider, String model, String counter) {
        return String.join(":", STATS_PREFIX, provider, model, counter);
    }

    public String statsPattern(String provider, String model, String counter) {
        return String.join(":", STATS_PREFIX, orAny(provider), orAny(model), counter);
    }

    private static String orAny(String value) {
        return value == null || value.isBlank() ? "*" : value;
    }
}
