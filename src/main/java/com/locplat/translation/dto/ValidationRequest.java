package com.locplat.translation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ValidationRequest {

    @NotBlank
    @JsonProperty("client_id")
    private String clientId;

    @NotBlank
    @JsonProperty("collection_name")
    private String collectionName;

    @NotBlank
    private String provider;

    @NotBlank
    @JsonProperty("source_lang")
    private String sourceLang;

    @NotBlank
    @JsonProperty("target_lang")
    private String targetLang;
}
