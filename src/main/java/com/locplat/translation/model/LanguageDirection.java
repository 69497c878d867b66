package com.locplat.translation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

public enum LanguageDirection {
    LTR("ltr"),
    RTL("rtl");

    // Languages whose field mapping may be overridden for right-to-left rendering.
    private static final Set<String> RTL_LANGUAGES = Set.of("ar", "he", "fa", "ur");

    private final String value;

    LanguageDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static LanguageDirection of(String languageCode) {
        return isRightToLeft(languageCode) ? RTL : LTR;
    }

    public static boolean isRightToLeft(String languageCode) {
        return languageCode != null && RTL_LANGUAGES.contains(languageCode.trim().toLowerCase(Locale.ROOT));
    }
}
