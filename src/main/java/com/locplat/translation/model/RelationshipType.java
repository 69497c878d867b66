package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelationshipType {
    MANY_TO_ONE("many_to_one", 5),
    ONE_TO_MANY("one_to_many", 15),
    MANY_TO_MANY("many_to_many", 25),
    ONE_TO_ONE("one_to_one", 3);

    private final String value;
    private final int complexityWeight;

    RelationshipType(String value, int complexityWeight) {
        this.value = value;
        this.complexityWeight = complexityWeight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Weight of one edge of this type in the schema complexity score.
     */
    public int getComplexityWeight() {
        return complexityWeight;
    }
}
