package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.locplat.translation.model.BatchGroup;
import com.locplat.translation.model.ExtractedField;
import com.locplat.translation.model.ExtractionResult;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.model.FieldTranslation;
import com.locplat.translation.model.LanguageDirection;
import com.locplat.translation.model.PreviewField;
import com.locplat.translation.model.StructuredTranslationResult;
import com.locplat.translation.model.TranslationPreview;
import com.locplat.translation.model.TranslationSettings;
import com.locplat.translation.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the configured fields of one CMS document: extract, translate each unit,
 * reassemble. Individual field failures degrade the result instead of failing it.
 */
@Service
public class StructuredTranslationService {

    private static final Logger logger = LoggerFactory.getLogger(StructuredTranslationService.class);

    static final String OPERATION = "translate";

    private final FieldConfigStore configStore;
    private final FieldExtractionService extractionService;
    private final CachedTranslationService translationService;
    private final HtmlFieldTranslator htmlTranslator;
    private final ContentReconstructionService reconstructionService;
    private final TranslationProviderRegistry providerRegistry;
    private final ProcessingLogRecorder logRecorder;

    public StructuredTranslationService(FieldConfigStore configStore,
                                        FieldExtractionService extractionService,
                                        CachedTranslationService translationService,
                                        HtmlFieldTranslator htmlTranslator,
                                        ContentReconstructionService reconstructionService,
                                        TranslationProviderRegistry providerRegistry,
                                        ProcessingLogRecorder logRecorder) {
        this.configStore = configStore;
        this.extractionService = extractionService;
        this.translationService = translationService;
        this.htmlTranslator = htmlTranslator;
        this.reconstructionService = reconstructionService;
        this.providerRegistry = providerRegistry;
        this.logRecorder = logRecorder;
    }

    /**
     * @throws InvalidTranslationRequestException when the content is not a JSON object,
     *                                            the provider is unknown or the language pair unsupported
     */
    public StructuredTranslationResult translateStructuredContent(JsonNode content, String clientId,
                                                                  String collection, TranslationSettings settings,
                                                                  String context) {
        long start = System.currentTimeMillis();
        if (content == null || !content.isObject()) {
            throw new InvalidTranslationRequestException("Content must be a JSON object");
        }
        TranslationProvider provider = providerRegistry.require(settings.provider());
        if (!provider.supportsLanguagePair(settings.sourceLang(), settings.targetLang())) {
            throw new InvalidTranslationRequestException("Provider " + provider.getName()
                    + " does not support " + settings.sourceLang() + " -> " + settings.targetLang());
        }
        logger.info("Starting structured content translation: {}/{}, {} -> {}, provider: {}",
                clientId, collection, settings.sourceLang(), settings.targetLang(), provider.getName());

        FieldMappingConfig config = configStore.getConfig(clientId, collection);
        if (!config.hasFieldPaths()) {
            logger.warn("No field configuration found for {}/{}", clientId, collection);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("warning", "No field mapping configuration - content returned unchanged");
            metadata.put("processing_time_ms", System.currentTimeMillis() - start);
            return new StructuredTranslationResult(content.deepCopy(), Map.of(), metadata);
        }

        TranslationSettings scoped = settings.withCollection(collection);
        try {
            ExtractionResult extraction = extractionService.extract(content, config, settings.targetLang());

            Map<String, FieldTranslation> translated = new LinkedHashMap<>();
            List<String> failed = new ArrayList<>();
            boolean batchFallback = false;

            if (extraction.hasBatch()) {
                batchFallback = !translateBatch(extraction.getBatch(), scoped, context, translated, failed);
            }
            for (ExtractedField field : extraction.getFields().values()) {
                translateField(field, config, scoped, context, translated, failed);
            }

            Map<String, FieldTranslation> ordered = inPathOrder(translated, config.effectiveFieldPaths(settings.targetLang()));
            JsonNode output = reconstructionService.assemble(content, ordered, config, settings.targetLang());

            long elapsed = System.currentTimeMillis() - start;
            logRecorder.recordSuccess(clientId, collection, OPERATION, ordered.size(), elapsed);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("client_id", clientId);
            metadata.put("collection_name", collection);
            metadata.put("source_lang", settings.sourceLang());
            metadata.put("target_lang", settings.targetLang());
            metadata.put("provider_used", provider.getName());
            metadata.put("model_used", settings.model() == null ? provider.getDefaultModel() : settings.model());
            metadata.put("fields_translated", ordered.size());
            metadata.put("fields_failed", failed.size());
            metadata.put("failed_fields", failed);
            metadata.put("partial", !failed.isEmpty());
            metadata.put("batch_processing", config.isBatchProcessing());
            metadata.put("batch_fallback", batchFallback);
            metadata.put("processing_time_ms", elapsed);
            metadata.put("language_direction", LanguageDirection.of(settings.targetLang()).getValue());
            logger.info("Translated {} fields for {}/{} ({} failed) in {} ms", ordered.size(), clientId,
                    collection, failed.size(), elapsed);
            return new StructuredTranslationResult(output, ordered, metadata);
        } catch (RuntimeException e) {
            logRecorder.recordFailure(clientId, collection, OPERATION, e.getMessage(),
                    System.currentTimeMillis() - start);
            logger.error("Translation failed for {}/{}: {}", clientId, collection, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Shows what would be translated for a stored config, without calling any provider.
     */
    public TranslationPreview preview(JsonNode content, String clientId, String collection, String targetLang) {
        return preview(content, configStore.getConfig(clientId, collection), targetLang);
    }

    public TranslationPreview preview(JsonNode content, FieldMappingConfig config, String targetLang) {
        if (content == null || !content.isObject()) {
            throw new InvalidTranslationRequestException("Content must be a JSON object");
        }
        if (!config.hasFieldPaths()) {
            return new TranslationPreview(Map.of(), null, "No field mapping configuration found");
        }
        ExtractionResult extraction = extractionService.extract(content, config, targetLang);
        Map<String, PreviewField> fields = new LinkedHashMap<>();
        BatchGroup batch = extraction.getBatch();
        if (batch != null) {
            batch.mapping().forEach((path, index) -> fields.put(path, new PreviewField(
                    TextNode.valueOf(batch.texts().get(index)),
                    batch.types().get(path), Map.of(), true)));
        }
        for (ExtractedField field : extraction.getFields().values()) {
            fields.put(field.path(), new PreviewField(field.value(), field.type(), field.metadata(), false));
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_fields", config.getFieldPaths().size());
        summary.put("batch_processing", config.isBatchProcessing());
        summary.put("translation_pattern", config.getTranslationPattern());
        summary.put("rtl_support", config.getRtlFieldMapping() != null
                && config.getRtlFieldMapping().containsKey(targetLang));
        return new TranslationPreview(inPathOrder(fields, config.effectiveFieldPaths(targetLang)), summary, null);
    }

    /**
     * Checks a request before it is made. Never throws for bad input; problems are
     * reported as errors (blocking) or warnings.
     */
    public ValidationResult validate(String clientId, String collection, String providerName,
                                     String sourceLang, String targetLang) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!configStore.getConfig(clientId, collection).hasFieldPaths()) {
            warnings.add("No field mapping configuration found for " + clientId + "/" + collection);
        }
        Optional<TranslationProvider> provider = providerRegistry.find(providerName);
        if (provider.isEmpty()) {
            errors.add("Unsupported provider: " + providerName + ". Available: " + providerRegistry.names());
        } else if (!provider.get().supportsLanguagePair(sourceLang, targetLang)) {
            errors.add("Unsupported language pair: " + sourceLang + " -> " + targetLang);
        }
        if (sourceLang != null && sourceLang.equalsIgnoreCase(targetLang)) {
            warnings.add("Source and target language are the same");
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /**
     * @return whether the batch went through; {@code false} means it fell back to per-field calls
     */
    private boolean translateBatch(BatchGroup batch, TranslationSettings settings, String context,
                                   Map<String, FieldTranslation> translated, List<String> failed) {
        try {
            List<FieldTranslation> results = translationService.batchTranslate(batch.texts(), settings, context);
            batch.mapping().forEach((path, index) -> {
                if (index < results.size()) {
                    translated.put(path, results.get(index));
                }
            });
            return true;
        } catch (BatchTranslationException e) {
            logger.warn("Batch translation failed ({}); falling back to sequential translation", e.getMessage());
            batch.mapping().forEach((path, index) -> {
                try {
                    translated.put(path, translationService.translate(batch.texts().get(index), settings, context));
                } catch (TranslationException te) {
                    logger.warn("Translation failed for field {}: {}", path, te.getMessage());
                    failed.add(path);
                }
            });
            return false;
        }
    }

    private void translateField(ExtractedField field, FieldMappingConfig config, TranslationSettings settings,
                                String context, Map<String, FieldTranslation> translated, List<String> failed) {
        String text = field.textValue();
        if (text == null) {
            logger.debug("Skipping non-text field {} of type {}", field.path(), field.type());
            return;
        }
        try {
            FieldTranslation result = field.type().isRichText() && config.isPreserveHtml()
                    ? htmlTranslator.translate(text, settings, context)
                    : translationService.translate(text, settings, context);
            translated.put(field.path(), result);
        } catch (TranslationException e) {
            logger.warn("Translation failed for field {}: {}", field.path(), e.getMessage());
            failed.add(field.path());
        }
    }

    private static <T> Map<String, T> inPathOrder(Map<String, T> values, List<String> paths) {
        Map<String, T> ordered = new LinkedHashMap<>();
        for (String path : paths) {
            T value = values.get(path);
            if (value != null) {
                ordered.put(path, value);
            }
        }
        values.forEach(ordered::putIfAbsent);
        return ordered;
    }
}
