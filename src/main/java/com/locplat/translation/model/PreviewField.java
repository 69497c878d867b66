package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A field that would be sent for translation.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PreviewField(
        JsonNode content,
        FieldType type,
        Map<String, Object> metadata,
        @JsonProperty("batch_processing") boolean batchProcessing
) {
}
