package com.locplat.translation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.locplat.translation.model.FieldMappingConfig;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ExtractRequest {

    @NotNull
    private JsonNode content;

    @NotNull
    @JsonProperty("field_config")
    private FieldMappingConfig fieldConfig;

    private String language;
}
