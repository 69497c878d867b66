package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.model.FieldTranslation;
import com.locplat.translation.model.TranslationPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes translated fields back into one of the supported CMS record shapes.
 * The original document is never modified.
 */
@Service
public class ContentReconstructionService {

    private static final Logger logger = LoggerFactory.getLogger(ContentReconstructionService.class);

    public static final String METADATA_FIELD = "_translation_metadata";

    private final FieldPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ContentReconstructionService(FieldPathResolver pathResolver, ObjectMapper objectMapper) {
        this(pathResolver, objectMapper, Clock.systemUTC());
    }

    ContentReconstructionService(FieldPathResolver pathResolver, ObjectMapper objectMapper, Clock clock) {
        this.pathResolver = pathResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param translations translated fields keyed by field path, in field path order
     */
    public ObjectNode assemble(JsonNode original, Map<String, FieldTranslation> translations,
                               FieldMappingConfig config, String targetLang) {
        TranslationPattern pattern = config.getTranslationPattern() == null
                ? TranslationPattern.COLLECTION_TRANSLATIONS : config.getTranslationPattern();
        switch (pattern) {
            case MERGE_IN_PLACE:
                return mergeInPlace(original, translations, targetLang);
            case LANGUAGE_COLLECTIONS:
                return languageCollectionsRecord(original, translations);
            case COLLECTION_TRANSLATIONS:
            default:
                return collectionTranslationsRecord(original, translations, config, targetLang);
        }
    }

    private ObjectNode mergeInPlace(JsonNode original, Map<String, FieldTranslation> translations,
                                    String targetLang) {
        ObjectNode result = original != null && original.isObject()
                ? ((ObjectNode) original).deepCopy() : objectMapper.createObjectNode();
        for (Map.Entry<String, FieldTranslation> entry : translations.entrySet()) {
            if (!pathResolver.set(result, entry.getKey(), TextNode.valueOf(entry.getValue().translatedText()))) {
                logger.warn("Could not write translation back to path {}", entry.getKey());
            }
        }

        ObjectNode metadata = result.putObject(METADATA_FIELD);
        metadata.put("translated_at", Instant.now(clock).toString());
        metadata.put("target_language", targetLang);
        translations.keySet().forEach(metadata.putArray("fields_translated")::add);
        metadata.set("provider_stats", providerStats(translations));
        return result;
    }

    private ObjectNode collectionTranslationsRecord(JsonNode original, Map<String, FieldTranslation> translations,
                                                    FieldMappingConfig config, String targetLang) {
        String parent = config.getPrimaryCollection() != null && !config.getPrimaryCollection().isBlank()
                ? config.getPrimaryCollection() : config.getCollectionName();
        ObjectNode result = objectMapper.createObjectNode();
        result.set("id", NullNode.getInstance());
        result.set(parent + "_id", idOf(original));
        result.put("languages_code", targetLang);
        putLeaves(result, translations);
        return result;
    }

    private ObjectNode languageCollectionsRecord(JsonNode original, Map<String, FieldTranslation> translations) {
        ObjectNode result = objectMapper.createObjectNode();
        result.set("id", idOf(original));
        putLeaves(result, translations);
        return result;
    }

    /**
     * Flattens paths to their leaf names. Two paths sharing a leaf name collide and
     * the later one wins.
     */
    private void putLeaves(ObjectNode result, Map<String, FieldTranslation> translations) {
        Map<String, String> leafSources = new LinkedHashMap<>();
        for (Map.Entry<String, FieldTranslation> entry : translations.entrySet()) {
            String leaf = pathResolver.leafName(entry.getKey());
            String previous = leafSources.put(leaf, entry.getKey());
            if (previous != null) {
                logger.warn("Field paths {} and {} both map to '{}'; keeping the translation of {}",
                        previous, entry.getKey(), leaf, entry.getKey());
            }
            result.put(leaf, entry.getValue().translatedText());
        }
    }

    private JsonNode idOf(JsonNode original) {
        JsonNode id = original == null ? null : original.get("id");
        return id == null ? NullNode.getInstance() : id.deepCopy();
    }

    private ObjectNode providerStats(Map<String, FieldTranslation> translations) {
        Map<String, double[]> perProvider = new LinkedHashMap<>();
        double total = 0;
        for (FieldTranslation translation : translations.values()) {
            String provider = translation.provider() == null ? "unknown" : translation.provider();
            double[] acc = perProvider.computeIfAbsent(provider, p -> new double[2]);
            acc[0]++;
            acc[1] += translation.qualityScore();
            total += translation.qualityScore();
        }
        ObjectNode stats = objectMapper.createObjectNode();
        ObjectNode providers = stats.putObject("providers");
        perProvider.forEach((provider, acc) -> {
            ObjectNode node = providers.putObject(provider);
            node.put("count", (int) acc[0]);
            node.put("avg_quality", acc[1] / acc[0]);
        });
        stats.put("overall_avg_quality", translations.isEmpty() ? 0.0 : total / translations.size());
        return stats;
    }
}
