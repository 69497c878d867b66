package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.locplat.translation.model.BatchGroup;
import com.locplat.translation.model.ExtractedField;
import com.locplat.translation.model.ExtractionResult;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.model.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls the configured fields out of a document, classifies them and groups plain
 * text for batched translation.
 */
@Service
public class FieldExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(FieldExtractionService.class);

    static final String OPERATION = "extract";

    private final FieldPathResolver pathResolver;
    private final HtmlTextNodeCodec htmlCodec;
    private final ContentSanitizer contentSanitizer;
    private final FieldMappingCache mappingCache;
    private final ProcessingLogRecorder logRecorder;
    private final int maxFieldLength;

    public FieldExtractionService(FieldPathResolver pathResolver,
                                  HtmlTextNodeCodec htmlCodec,
                                  ContentSanitizer contentSanitizer,
                                  FieldMappingCache mappingCache,
                                  ProcessingLogRecorder logRecorder,
                                  @Value("${app.translation.max-field-length:50000}") int maxFieldLength) {
        this.pathResolver = pathResolver;
        this.htmlCodec = htmlCodec;
        this.contentSanitizer = contentSanitizer;
        this.mappingCache = mappingCache;
        this.logRecorder = logRecorder;
        this.maxFieldLength = maxFieldLength;
    }

    /**
     * Extracts the fields {@code config} maps for {@code language}. Missing and null
     * values are skipped. With batch processing on, plain-text fields end up in the
     * result's batch group instead of its field map.
     */
    public ExtractionResult extract(JsonNode content, FieldMappingConfig config, String language) {
        long start = System.currentTimeMillis();
        Optional<ExtractionResult> cached = mappingCache.getExtraction(config, content, language);
        if (cached.isPresent()) {
            logger.debug("Using cached extraction for {}/{}", config.getClientId(), config.getCollectionName());
            return cached.get();
        }

        try {
            ExtractionResult result = doExtract(content, config, language);
            long elapsed = System.currentTimeMillis() - start;
            logRecorder.recordSuccess(config.getClientId(), config.getCollectionName(), OPERATION,
                    result.totalFieldCount(), elapsed);
            mappingCache.putExtraction(config, content, language, result);
            return result;
        } catch (RuntimeException e) {
            logRecorder.recordFailure(config.getClientId(), config.getCollectionName(), OPERATION, e.getMessage(),
                    System.currentTimeMillis() - start);
            throw e;
        }
    }

    /**
     * Classifies a value that has no explicit type in the config.
     */
    public FieldType detectType(JsonNode value) {
        if (value.isTextual()) {
            String text = value.asText();
            if (htmlCodec.isHtml(text)) {
                return FieldType.WYSIWYG;
            }
            if (text.indexOf('\n') >= 0) {
                return FieldType.TEXTAREA;
            }
            return FieldType.TEXT;
        }
        if (value.isObject()) {
            return FieldType.JSON;
        }
        return FieldType.STRING;
    }

    private ExtractionResult doExtract(JsonNode content, FieldMappingConfig config, String language) {
        ExtractionResult result = new ExtractionResult();
        List<String> batchTexts = new ArrayList<>();
        Map<String, Integer> batchMapping = new LinkedHashMap<>();
        Map<String, FieldType> batchTypes = new LinkedHashMap<>();

        for (String path : config.effectiveFieldPaths(language)) {
            JsonNode value = pathResolver.get(content, path);
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            FieldType type = config.explicitTypeFor(path);
            if (type == null) {
                type = detectType(value);
            }
            if (value.isTextual() && config.isContentSanitization()) {
                value = TextNode.valueOf(contentSanitizer.sanitize(value.asText(), maxFieldLength));
            }

            if (config.isBatchProcessing() && type.isBatchable() && value.isTextual()) {
                batchMapping.put(path, batchTexts.size());
                batchTypes.put(path, type);
                batchTexts.add(value.asText());
            } else {
                result.addField(new ExtractedField(path, value, type, metadataFor(value, type), null));
            }
        }

        if (!batchTexts.isEmpty()) {
            result.setBatch(new BatchGroup(batchTexts, batchMapping, batchTypes));
        }
        logger.debug("Extracted {} fields ({} batched) for {}/{}", result.totalFieldCount(), batchTexts.size(),
                config.getClientId(), config.getCollectionName());
        return result;
    }

    private Map<String, Object> metadataFor(JsonNode value, FieldType type) {
        if (!value.isTextual()) {
            return Map.of();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (type.isRichText()) {
            metadata.putAll(htmlCodec.structure(value.asText()));
        }
        metadata.put("length", value.asText().length());
        return metadata;
    }
}
