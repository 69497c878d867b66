package com.locplat.translation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.locplat.translation.model.TranslationSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StructuredTranslationRequest {

    @NotNull
    private JsonNode content;

    @NotBlank
    @JsonProperty("client_id")
    private String clientId;

    @NotBlank
    @JsonProperty("collection_name")
    private String collectionName;

    @JsonProperty("source_lang")
    private String sourceLang = "en";

    @NotBlank
    @JsonProperty("target_lang")
    private String targetLang;

    private String provider = "bedrock";

    private String model;

    private String context;

    public TranslationSettings toSettings() {
        return new TranslationSettings(provider, model, sourceLang, targetLang, collectionName);
    }
}
