package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A single value pulled out of a document by its field path.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedField(
        String path,
        JsonNode value,
        FieldType type,
        Map<String, Object> metadata,
        @JsonProperty("batch_index") Integer batchIndex
) {
    public Map<String, Object> metadata() {
        return metadata == null ? Map.of() : metadata;
    }

    public String textValue() {
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
