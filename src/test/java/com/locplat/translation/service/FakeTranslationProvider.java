package com.locplat.translation.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Upper-cases its input. Texts registered with {@link #failOn} raise a {@link TranslationException}.
 */
class FakeTranslationProvider implements TranslationProvider {

    static final String NAME = "fake";

    private final Set<String> failing = new HashSet<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> unsupportedTargets = new HashSet<>();

    FakeTranslationProvider failOn(String text) {
        failing.add(text);
        return this;
    }

    FakeTranslationProvider rejectTarget(String language) {
        unsupportedTargets.add(language);
        return this;
    }

    List<String> calls() {
        return calls;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultModel() {
        return "fake-model";
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang, String model, String context) {
        calls.add(text);
        if (failing.contains(text)) {
            throw new TranslationException(NAME, "refused '" + text + "'");
        }
        return text.toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean supportsLanguagePair(String sourceLang, String targetLang) {
        return !unsupportedTargets.contains(targetLang);
    }
}
