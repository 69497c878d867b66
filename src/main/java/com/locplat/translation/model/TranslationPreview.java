package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationPreview(
        @JsonProperty("extractable_fields") Map<String, PreviewField> extractableFields,
        @JsonProperty("field_config") Map<String, Object> fieldConfig,
        String warning
) {
}
