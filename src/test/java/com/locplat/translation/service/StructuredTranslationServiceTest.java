package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.model.StructuredTranslationResult;
import com.locplat.translation.model.TranslationPattern;
import com.locplat.translation.model.TranslationPreview;
import com.locplat.translation.model.TranslationSettings;
import com.locplat.translation.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StructuredTranslationServiceTest {

    private static final TranslationSettings SETTINGS =
            new TranslationSettings(FakeTranslationProvider.NAME, null, "en", "fr", null);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private FieldConfigStore configStore;

    @Mock
    private ProcessingLogRecorder logRecorder;

    private FakeTranslationProvider provider;
    private StructuredTranslationService service;

    @BeforeEach
    void setUp() {
        provider = new FakeTranslationProvider();
        HtmlTextNodeCodec codec = new HtmlTextNodeCodec();
        FieldPathResolver resolver = new FieldPathResolver();
        ContentHashingService hashing = new ContentHashingService(objectMapper);
        CacheKeyFactory keyFactory = new CacheKeyFactory(hashing);
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        FieldMappingCache mappingCache = new FieldMappingCache(store, keyFactory, new CachePayloadCodec(), hashing,
                objectMapper, 1800, 600);
        AiResponseCache responseCache = new AiResponseCache(store, keyFactory, new CacheTtlPolicy(86_400),
                new CachePayloadCodec(), objectMapper);
        TranslationProviderRegistry registry = new TranslationProviderRegistry(List.of(provider));
        CachedTranslationService translationService = new CachedTranslationService(registry, responseCache,
                new TranslationQualityEstimator(), Runnable::run, true);
        FieldExtractionService extractionService = new FieldExtractionService(resolver, codec,
                new HtmlContentSanitizer(codec), mappingCache, logRecorder, 50_000);
        service = new StructuredTranslationService(configStore, extractionService, translationService,
                new HtmlFieldTranslator(codec, translationService),
                new ContentReconstructionService(resolver, objectMapper), registry, logRecorder);
    }

    @Test
    void translatesBatchedAndRichTextFieldsInPlace() throws Exception {
        when(configStore.getConfig("acme", "articles")).thenReturn(mergeConfig(true));
        JsonNode content = objectMapper.readTree("{\"t1\":\"a\",\"t2\":\"b\",\"t3\":\"c\",\"rich\":\"<i>d</i>\"}");

        StructuredTranslationResult result = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);

        JsonNode translated = result.translatedContent();
        assertThat(translated.get("t1").asText()).isEqualTo("A");
        assertThat(translated.get("t2").asText()).isEqualTo("B");
        assertThat(translated.get("t3").asText()).isEqualTo("C");
        assertThat(translated.get("rich").asText()).isEqualTo("<i>D</i>");
        assertThat(translated.has(ContentReconstructionService.METADATA_FIELD)).isTrue();
        assertThat(result.fieldTranslations()).containsOnlyKeys("t1", "t2", "t3", "rich");
        assertThat(result.fieldTranslations().get("rich").metadata()).containsEntry("html_preserved", true);
        assertThat(result.metadata())
                .containsEntry("fields_translated", 4)
                .containsEntry("fields_failed", 0)
                .containsEntry("partial", false)
                .containsEntry("batch_fallback", false)
                .containsEntry("provider_used", "fake")
                .containsEntry("model_used", "fake-model")
                .containsEntry("language_direction", "ltr");
        assertThat(content.get("t1").asText()).isEqualTo("a");
        verify(logRecorder).recordSuccess(eq("acme"), eq("articles"), eq("translate"), eq(4), anyLong());
    }

    @Test
    void fallsBackToSequentialTranslationWhenBatchFails() throws Exception {
        provider.failOn("b");
        when(configStore.getConfig("acme", "articles")).thenReturn(mergeConfig(true));
        JsonNode content = objectMapper.readTree("{\"t1\":\"a\",\"t2\":\"b\",\"t3\":\"c\"}");

        StructuredTranslationResult result = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);

        assertThat(result.translatedContent().get("t1").asText()).isEqualTo("A");
        assertThat(result.translatedContent().get("t2").asText()).isEqualTo("b");
        assertThat(result.translatedContent().get("t3").asText()).isEqualTo("C");
        assertThat(result.metadata())
                .containsEntry("batch_fallback", true)
                .containsEntry("partial", true)
                .containsEntry("failed_fields", List.of("t2"));
    }

    @Test
    void failedRichTextRunKeepsSourceText() throws Exception {
        provider.failOn("world");
        when(configStore.getConfig("acme", "articles")).thenReturn(mergeConfig(false));
        JsonNode content = objectMapper.readTree("{\"t1\":\"a\",\"rich\":\"<p>hello <b>world</b></p>\"}");

        StructuredTranslationResult result = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);

        assertThat(result.translatedContent().get("rich").asText()).isEqualTo("<p>HELLO <b>world</b></p>");
        assertThat(result.fieldTranslations().get("rich").metadata()).containsEntry("failed_text_nodes", 1);
        assertThat(result.metadata()).containsEntry("partial", false);
    }

    @Test
    void singleFieldFailureMarksResultPartial() throws Exception {
        provider.failOn("b");
        when(configStore.getConfig("acme", "articles")).thenReturn(mergeConfig(false));
        JsonNode content = objectMapper.readTree("{\"t1\":\"a\",\"t2\":\"b\"}");

        StructuredTranslationResult result = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);

        assertThat(result.fieldTranslations()).containsOnlyKeys("t1");
        assertThat(result.metadata())
                .containsEntry("fields_translated", 1)
                .containsEntry("fields_failed", 1)
                .containsEntry("failed_fields", List.of("t2"))
                .containsEntry("partial", true);
    }

    @Test
    void returnsContentUnchangedWithoutFieldConfig() throws Exception {
        when(configStore.getConfig("acme", "articles"))
                .thenReturn(FieldMappingConfig.defaultFor("acme", "articles"));
        JsonNode content = objectMapper.readTree("{\"title\":\"Hello\"}");

        StructuredTranslationResult result = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);

        assertThat(result.translatedContent()).isEqualTo(content);
        assertThat(result.fieldTranslations()).isEmpty();
        assertThat(result.metadata()).containsKey("warning");
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    void rejectsNonObjectContent() throws Exception {
        JsonNode array = objectMapper.readTree("[1,2]");

        assertThatThrownBy(() -> service.translateStructuredContent(array, "acme", "articles", SETTINGS, null))
                .isInstanceOf(InvalidTranslationRequestException.class);
    }

    @Test
    void rejectsUnknownProviderAndUnsupportedPair() throws Exception {
        JsonNode content = objectMapper.readTree("{\"title\":\"Hello\"}");
        provider.rejectTarget("xx");

        assertThatThrownBy(() -> service.translateStructuredContent(content, "acme", "articles",
                new TranslationSettings("nope", null, "en", "fr", null), null))
                .isInstanceOf(InvalidTranslationRequestException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> service.translateStructuredContent(content, "acme", "articles",
                new TranslationSettings(FakeTranslationProvider.NAME, null, "en", "xx", null), null))
                .isInstanceOf(InvalidTranslationRequestException.class);
    }

    @Test
    void repeatedTranslationIsServedFromCache() throws Exception {
        FieldMappingConfig config = mergeConfig(true).toBuilder()
                .translationPattern(TranslationPattern.COLLECTION_TRANSLATIONS)
                .build();
        when(configStore.getConfig("acme", "articles")).thenReturn(config);
        JsonNode content = objectMapper.readTree("{\"id\":5,\"t1\":\"a\",\"t2\":\"b\"}");

        StructuredTranslationResult first = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);
        StructuredTranslationResult second = service.translateStructuredContent(content, "acme", "articles",
                SETTINGS, null);

        assertThat(second.translatedContent()).isEqualTo(first.translatedContent());
        assertThat(second.translatedContent().get("articles_id").asInt()).isEqualTo(5);
        assertThat(provider.calls()).containsExactly("a", "b");
        assertThat(second.fieldTranslations().get("t1").metadata()).containsEntry("cached", true);
    }

    @Test
    void translatingTranslatedOutputAgainKeepsItsShape() throws Exception {
        when(configStore.getConfig("acme", "articles")).thenReturn(mergeConfig(true));
        JsonNode content = objectMapper.readTree(
                "{\"t1\":\"a\",\"t2\":\"b\",\"t3\":\"c\",\"rich\":\"<i>d</i>\",\"views\":3}");

        ObjectNode once = (ObjectNode) service.translateStructuredContent(content, "acme", "articles", SETTINGS, null)
                .translatedContent();
        ObjectNode twice = (ObjectNode) service.translateStructuredContent(once, "acme", "articles", SETTINGS, null)
                .translatedContent();

        once.remove(ContentReconstructionService.METADATA_FIELD);
        twice.remove(ContentReconstructionService.METADATA_FIELD);
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void previewListsBatchedAndIndividualFields() throws Exception {
        JsonNode content = objectMapper.readTree("{\"t1\":\"a\",\"rich\":\"<i>d</i>\"}");

        TranslationPreview preview = service.preview(content, mergeConfig(true), "fr");

        assertThat(preview.extractableFields()).containsOnlyKeys("t1", "rich");
        assertThat(preview.extractableFields().get("t1").batchProcessing()).isTrue();
        assertThat(preview.extractableFields().get("rich").batchProcessing()).isFalse();
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    void validationReportsErrorsAndWarnings() {
        when(configStore.getConfig("acme", "articles"))
                .thenReturn(FieldMappingConfig.defaultFor("acme", "articles"));

        ValidationResult unknown = service.validate("acme", "articles", "nope", "en", "fr");
        ValidationResult same = service.validate("acme", "articles", FakeTranslationProvider.NAME, "en", "en");

        assertThat(unknown.valid()).isFalse();
        assertThat(unknown.errors()).hasSize(1);
        assertThat(same.valid()).isTrue();
        assertThat(same.warnings()).hasSize(2);
    }

    private static FieldMappingConfig mergeConfig(boolean batch) {
        return FieldMappingConfig.builder()
                .clientId("acme")
                .collectionName("articles")
                .fieldPaths(List.of("t1", "t2", "t3", "rich"))
                .batchProcessing(batch)
                .translationPattern(TranslationPattern.MERGE_IN_PLACE)
                .build();
    }
}
