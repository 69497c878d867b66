package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Content types a mapped field can carry. Values mirror the CMS interface names.
 */
public enum FieldType {
    TEXT("text"),
    STRING("string"),
    TEXTAREA("textarea"),
    WYSIWYG("wysiwyg"),
    HTML("html"),
    MARKDOWN("markdown"),
    JSON("json"),
    RELATION("relation");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Plain-text-like fields are grouped into a single batched provider call.
     */
    public boolean isBatchable() {
        return this == TEXT || this == STRING || this == TEXTAREA;
    }

    public boolean isRichText() {
        return this == WYSIWYG || this == HTML;
    }

    /**
     * Resolves a configured type name. Unknown names and CMS relation aliases
     * (o2m, m2o, m2m, m2a) are mapped the same way the CMS does.
     */
    @JsonCreator
    public static FieldType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return STRING;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "o2m":
            case "m2o":
            case "m2m":
            case "m2a":
                return RELATION;
            default:
                for (FieldType type : values()) {
                    if (type.value.equals(normalized)) {
                        return type;
                    }
                }
                return STRING;
        }
    }
}
