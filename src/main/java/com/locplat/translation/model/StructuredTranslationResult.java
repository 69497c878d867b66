package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outcome of translating one document. Always a best-effort result: failed fields
 * keep their source text and are listed in the metadata.
 */
public record StructuredTranslationResult(
        @JsonProperty("translated_content") JsonNode translatedContent,
        @JsonProperty("field_translations") Map<String, FieldTranslation> fieldTranslations,
        Map<String, Object> metadata
) {
}
