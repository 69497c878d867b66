package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A translated field: the source text paired with its translation and provider details.
 */
public record FieldTranslation(
        @JsonProperty("translated_text") String translatedText,
        @JsonProperty("provider_used") String provider,
        @JsonProperty("model_used") String model,
        @JsonProperty("source_lang") String sourceLang,
        @JsonProperty("target_lang") String targetLang,
        @JsonProperty("quality_score") double qualityScore,
        Map<String, Object> metadata
) {
    public Map<String, Object> metadata() {
        return metadata == null ? Map.of() : metadata;
    }
}
