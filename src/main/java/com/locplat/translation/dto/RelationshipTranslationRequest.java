package com.locplat.translation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class RelationshipTranslationRequest extends StructuredTranslationRequest {

    @Min(0)
    @Max(10)
    @JsonProperty("max_depth")
    private int maxDepth = 3;

    @JsonProperty("translate_related")
    private boolean translateRelated = true;
}
