package com.locplat.translation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.locplat.translation.model.FieldMappingConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Either names a stored config by client and collection, or carries one inline.
 */
@Data
public class PreviewRequest {

    @NotNull
    private JsonNode content;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("collection_name")
    private String collectionName;

    @NotBlank
    @JsonProperty("target_lang")
    private String targetLang;

    @JsonProperty("field_config")
    private FieldMappingConfig fieldConfig;
}
