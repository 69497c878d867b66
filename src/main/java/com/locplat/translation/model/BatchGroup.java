package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * Plain-text fields grouped for one batched provider call.
 *
 * @param texts   texts in field path order
 * @param mapping field path to its index in {@code texts}
 * @param types   detected type per field path
 */
public record BatchGroup(List<String> texts, Map<String, Integer> mapping, Map<String, FieldType> types) {

    @JsonIgnore
    public boolean isEmpty() {
        return texts == null || texts.isEmpty();
    }

    public int size() {
        return texts == null ? 0 : texts.size();
    }
}
