package com.locplat.translation.model;

/**
 * Provider, model and language pair shared by every unit of one translation call.
 *
 * @param model      {@code null} selects the provider's default model
 * @param collection CMS collection the content belongs to, used to scope cache entries
 */
public record TranslationSettings(String provider, String model, String sourceLang, String targetLang,
                                  String collection) {

    public TranslationSettings withCollection(String otherCollection) {
        return new TranslationSettings(provider, model, sourceLang, targetLang, otherCollection);
    }
}
