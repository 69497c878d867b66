package com.locplat.translation.service;

/**
 * An AI back end able to translate a single piece of text.
 */
public interface TranslationProvider {

    String getName();

    String getDefaultModel();

    /**
     * @param model   model override, {@code null} for {@link #getDefaultModel()}
     * @param context optional instructions appended to the prompt
     * @return the translated text
     * @throws TranslationException when no translation could be produced
     */
    String translate(String text, String sourceLang, String targetLang, String model, String context);

    boolean supportsLanguagePair(String sourceLang, String targetLang);
}
