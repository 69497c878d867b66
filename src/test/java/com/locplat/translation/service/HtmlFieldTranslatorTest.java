package com.locplat.translation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locplat.translation.model.FieldTranslation;
import com.locplat.translation.model.TranslationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlFieldTranslatorTest {

    private FakeTranslationProvider provider;
    private HtmlFieldTranslator translator;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        provider = new FakeTranslationProvider();
        ContentHashingService hashing = new ContentHashingService(objectMapper);
        AiResponseCache cache = new AiResponseCache(new InMemoryKeyValueStore(), new CacheKeyFactory(hashing),
                new CacheTtlPolicy(86_400), new CachePayloadCodec(), objectMapper);
        CachedTranslationService translationService = new CachedTranslationService(
                new TranslationProviderRegistry(List.of(provider)), cache, new TranslationQualityEstimator(),
                Runnable::run, false);
        translator = new HtmlFieldTranslator(new HtmlTextNodeCodec(), translationService);
    }

    @Test
    void translatesTextRunsAndKeepsMarkup() {
        FieldTranslation result = translator.translate(
                "<p class=\"lead\">hello <a href=\"/x\">link</a></p>", settings("fr"), null);

        assertThat(result.translatedText()).isEqualTo("<p class=\"lead\">HELLO <a href=\"/x\">LINK</a></p>");
        assertThat(result.qualityScore()).isEqualTo(1.0);
        assertThat(result.model()).isEqualTo("fake-model");
        assertThat(result.metadata())
                .containsEntry("html_preserved", true)
                .containsEntry("text_nodes", 2)
                .containsEntry("rtl_optimized", false)
                .doesNotContainKey("failed_text_nodes");
    }

    @Test
    void repeatedRunsAreTranslatedOnce() {
        translator.translate("<li>same</li><li>same</li><li>other</li>", settings("fr"), null);

        assertThat(provider.calls()).containsExactly("same", "other");
    }

    @Test
    void rightToLeftTargetsScoreLower() {
        FieldTranslation result = translator.translate("<b>hello</b>", settings("ar"), null);

        assertThat(result.qualityScore()).isEqualTo(0.9);
        assertThat(result.metadata()).containsEntry("rtl_optimized", true);
    }

    @Test
    void markupWithoutTextIsReturnedAsIs() {
        FieldTranslation result = translator.translate("<br/>", settings("fr"), null);

        assertThat(result.translatedText()).isEqualTo("<br/>");
        assertThat(result.metadata()).containsEntry("text_nodes", 0);
        assertThat(provider.calls()).isEmpty();
    }

    private static TranslationSettings settings(String target) {
        return new TranslationSettings(FakeTranslationProvider.NAME, null, "en", target, null);
    }
}
