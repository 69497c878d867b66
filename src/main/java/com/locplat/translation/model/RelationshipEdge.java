package com.locplat.translation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static schema metadata describing how a collection links to another.
 * Bound from {@code app.relationships.<collection>[n]} properties.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipEdge {

    private String sourceCollection;
    private String sourceField;
    private String targetCollection;
    private String targetField;
    private RelationshipType relationshipType;

    /** Only set for many-to-many edges. */
    private String junctionCollection;

    @Builder.Default
    private boolean translateRelated = true;
}
