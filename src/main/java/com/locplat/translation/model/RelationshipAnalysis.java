package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Advisory summary of how expensive relationship-aware translation of a collection is likely to be.
 */
public record RelationshipAnalysis(
        String collection,
        @JsonProperty("direct_relationships") int directRelationships,
        @JsonProperty("relationship_types") Map<String, Integer> relationshipTypes,
        @JsonProperty("circular_references") List<String> circularReferences,
        @JsonProperty("max_depth_found") int maxDepthFound,
        @JsonProperty("complexity_score") int complexityScore,
        List<String> recommendations
) {
}
