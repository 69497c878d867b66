package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Output shapes for re-inserting translated fields into a CMS record.
 */
public enum TranslationPattern {
    MERGE_IN_PLACE("merge_in_place"),
    COLLECTION_TRANSLATIONS("collection_translations"),
    LANGUAGE_COLLECTIONS("language_collections");

    private final String value;

    TranslationPattern(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * "custom" was the legacy name for in-place merging and is still accepted.
     */
    @JsonCreator
    public static TranslationPattern fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return COLLECTION_TRANSLATIONS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("custom".equals(normalized)) {
            return MERGE_IN_PLACE;
        }
        for (TranslationPattern pattern : values()) {
            if (pattern.value.equals(normalized)) {
                return pattern;
            }
        }
        throw new IllegalArgumentException("Unknown translation pattern: " + raw);
    }
}
