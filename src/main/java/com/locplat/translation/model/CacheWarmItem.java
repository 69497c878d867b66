package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A known translation to preload into the AI response cache. A missing source language is
 * taken from the response.
 */
public record CacheWarmItem(
        String text,
        String provider,
        String model,
        @JsonProperty("source_language") String sourceLanguage,
        @JsonProperty("target_language") String targetLanguage,
        String collection,
        FieldTranslation response,
        @JsonProperty("content_type") CacheContentType contentType,
        Double confidence,
        String context
) {
}
