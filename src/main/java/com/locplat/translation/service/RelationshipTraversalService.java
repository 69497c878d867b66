package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.locplat.translation.model.RelationshipAnalysis;
import com.locplat.translation.model.RelationshipEdge;
import com.locplat.translation.model.RelationshipType;
import com.locplat.translation.model.StructuredTranslationResult;
import com.locplat.translation.model.TranslationSettings;
import com.locplat.translation.model.TraversalContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a document together with the related items embedded in it.
 * <p>
 * Each item is identified by {@code (collection, id)}. An item that is already being
 * translated further up the current branch yields a circular reference marker, and
 * items beyond the maximum depth yield a depth marker; neither is an error.
 */
@Service
public class RelationshipTraversalService {

    private static final Logger logger = LoggerFactory.getLogger(RelationshipTraversalService.class);

    static final String CIRCULAR_REFERENCE = "_circular_reference";
    static final String MAX_DEPTH_REACHED = "_max_depth_reached";
    static final String TRANSLATION_ERROR = "_translation_error";
    static final String UNKNOWN_ID = "unknown";

    private final StructuredTranslationService structuredTranslationService;
    private final RelationshipCatalog relationshipCatalog;
    private final TranslationProviderRegistry providerRegistry;
    private final ObjectMapper objectMapper;

    public RelationshipTraversalService(StructuredTranslationService structuredTranslationService,
                                        RelationshipCatalog relationshipCatalog,
                                        TranslationProviderRegistry providerRegistry,
                                        ObjectMapper objectMapper) {
        this.structuredTranslationService = structuredTranslationService;
        this.relationshipCatalog = relationshipCatalog;
        this.providerRegistry = providerRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts a traversal at {@code content}.
     *
     * @param translateRelated {@code false} translates only the item itself
     * @throws InvalidTranslationRequestException for non-object content, an unknown provider or a
     *         language pair the provider does not support
     */
    public JsonNode translateWithRelationships(JsonNode content, String clientId, String collection,
                                               TranslationSettings settings, int maxDepth,
                                               boolean translateRelated) {
        if (content == null || !content.isObject()) {
            throw new InvalidTranslationRequestException("Content must be a JSON object");
        }
        TranslationProvider provider = providerRegistry.require(settings.provider());
        if (!provider.supportsLanguagePair(settings.sourceLang(), settings.targetLang())) {
            throw new InvalidTranslationRequestException("Provider " + provider.getName()
                    + " does not support " + settings.sourceLang() + " -> " + settings.targetLang());
        }
        TraversalContext context = TraversalContext.root(maxDepth, clientId,
                settings.sourceLang(), settings.targetLang(), settings.provider(), settings.model());
        logger.info("Starting relationship-aware translation of {} for client {} (max depth {})",
                collection, clientId, context.getMaxDepth());
        return translateWithRelationships(content, collection, context, translateRelated);
    }

    public JsonNode translateWithRelationships(JsonNode content, String collection, TraversalContext context) {
        return translateWithRelationships(content, collection, context, true);
    }

    private JsonNode translateWithRelationships(JsonNode content, String collection, TraversalContext context,
                                                boolean followRelationships) {
        JsonNode itemId = itemId(content);
        if (context.isVisited(collection, itemId)) {
            logger.debug("Circular reference to {}/{} at depth {}", collection, itemId, context.getCurrentDepth());
            return marker(CIRCULAR_REFERENCE, collection, itemId);
        }
        if (context.isDepthExceeded()) {
            logger.debug("Max depth {} reached at {}/{}", context.getMaxDepth(), collection, itemId);
            return marker(MAX_DEPTH_REACHED, collection, itemId);
        }

        context.enter(collection, itemId);
        try {
            ObjectNode translated = translateItem(content, collection, context);
            if (!followRelationships) {
                return translated;
            }
            for (RelationshipEdge edge : relationshipCatalog.getRelationships(collection)) {
                if (!edge.isTranslateRelated() || edge.getRelationshipType() == null) {
                    continue;
                }
                TraversalContext childContext = context.child();
                switch (edge.getRelationshipType()) {
                    case MANY_TO_ONE:
                    case ONE_TO_ONE:
                        handleSingleReference(content, translated, edge, childContext);
                        break;
                    case ONE_TO_MANY:
                        handleOneToMany(content, translated, edge, childContext);
                        break;
                    case MANY_TO_MANY:
                        handleManyToMany(content, translated, edge, childContext);
                        break;
                    default:
                        break;
                }
            }
            return translated;
        } finally {
            context.leave(collection, itemId);
        }
    }

    /**
     * Schema-level complexity estimate for traversing from {@code collection}. Walks
     * the relationship catalog only; no content is read.
     */
    public RelationshipAnalysis analyze(String collection, int maxDepth) {
        List<RelationshipEdge> direct = relationshipCatalog.getRelationships(collection);
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (RelationshipEdge edge : direct) {
            if (edge.getRelationshipType() != null) {
                typeCounts.merge(edge.getRelationshipType().getValue(), 1, Integer::sum);
            }
        }

        List<String> circular = new ArrayList<>();
        int[] maxDepthFound = {0};
        walkSchema(collection, 0, maxDepth, new HashSet<>(), circular, maxDepthFound);

        int score = direct.size() * 10;
        for (RelationshipType type : RelationshipType.values()) {
            score += type.getComplexityWeight() * typeCounts.getOrDefault(type.getValue(), 0);
        }
        score += maxDepthFound[0] * 20;
        score += circular.size() * 50;

        return new RelationshipAnalysis(collection, direct.size(), typeCounts, circular, maxDepthFound[0], score,
                recommendations(score, circular, typeCounts, maxDepthFound[0]));
    }

    private ObjectNode translateItem(JsonNode content, String collection, TraversalContext context) {
        TranslationSettings settings = new TranslationSettings(context.getProvider(), context.getModel(),
                context.getSourceLang(), context.getTargetLang(), collection);
        try {
            StructuredTranslationResult result = structuredTranslationService.translateStructuredContent(
                    content, context.getClientId(), collection, settings, null);
            JsonNode translated = result.translatedContent();
            if (translated instanceof ObjectNode objectNode) {
                return objectNode;
            }
            return content.deepCopy();
        } catch (RuntimeException e) {
            logger.warn("Translation of {}/{} failed, keeping original: {}", collection, itemId(content), e.getMessage());
            ObjectNode original = content.deepCopy();
            original.put(TRANSLATION_ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            return original;
        }
    }

    private void handleSingleReference(JsonNode content, ObjectNode translated, RelationshipEdge edge,
                                       TraversalContext context) {
        JsonNode related = content.get(edge.getSourceField());
        if (related == null || related.isNull() || (related.isBoolean() && !related.asBoolean())) {
            return;
        }
        String targetField = edge.getSourceField() + "_translated";
        if (related.isObject()) {
            translated.set(targetField, translateWithRelationships(related, edge.getTargetCollection(), context));
        } else if (related.isValueNode()) {
            ObjectNode placeholder = objectMapper.createObjectNode();
            placeholder.set("id", related.deepCopy());
            placeholder.put("collection", edge.getTargetCollection());
            placeholder.put("_relation_type", edge.getRelationshipType().getValue());
            placeholder.put("_not_expanded", true);
            translated.set(targetField, placeholder);
        }
    }

    private void handleOneToMany(JsonNode content, ObjectNode translated, RelationshipEdge edge,
                                 TraversalContext context) {
        String itemsField = edge.getTargetCollection() + "_items";
        JsonNode related = content.get(itemsField);
        if (related == null) {
            ObjectNode placeholder = objectMapper.createObjectNode();
            placeholder.put("_relation_type", RelationshipType.ONE_TO_MANY.getValue());
            placeholder.put("_target_collection", edge.getTargetCollection());
            placeholder.put("_not_expanded", true);
            placeholder.put("count", 0);
            translated.set(itemsField + "_translated", placeholder);
            return;
        }
        if (!related.isArray()) {
            return;
        }
        ArrayNode items = objectMapper.createArrayNode();
        for (JsonNode item : related) {
            items.add(item.isObject()
                    ? translateWithRelationships(item, edge.getTargetCollection(), context)
                    : item.deepCopy());
        }
        translated.set(itemsField + "_translated", items);
    }

    private void handleManyToMany(JsonNode content, ObjectNode translated, RelationshipEdge edge,
                                  TraversalContext context) {
        JsonNode related = content.get(edge.getSourceField());
        if (related == null || !related.isArray()) {
            return;
        }
        ArrayNode items = objectMapper.createArrayNode();
        for (JsonNode item : related) {
            if (!item.isObject()) {
                items.add(item.deepCopy());
            } else if (edge.getJunctionCollection() != null && item.get("item") != null && item.get("item").isObject()) {
                ObjectNode envelope = ((ObjectNode) item).deepCopy();
                envelope.set("item_translated",
                        translateWithRelationships(item.get("item"), edge.getTargetCollection(), context));
                items.add(envelope);
            } else {
                items.add(translateWithRelationships(item, edge.getTargetCollection(), context));
            }
        }
        translated.set(edge.getSourceField() + "_translated", items);
    }

    private void walkSchema(String collection, int depth, int maxDepth, Set<String> path, List<String> circular,
                            int[] maxDepthFound) {
        if (path.contains(collection)) {
            circular.add(collection);
            return;
        }
        if (depth >= maxDepth) {
            return;
        }
        maxDepthFound[0] = Math.max(maxDepthFound[0], depth);
        Set<String> branch = new HashSet<>(path);
        branch.add(collection);
        for (RelationshipEdge edge : relationshipCatalog.getRelationships(collection)) {
            walkSchema(edge.getTargetCollection(), depth + 1, maxDepth, branch, circular, maxDepthFound);
        }
    }

    private List<String> recommendations(int score, List<String> circular, Map<String, Integer> typeCounts,
                                         int maxDepthFound) {
        List<String> recommendations = new ArrayList<>();
        if (score < 50) {
            recommendations.add("Low complexity - standard translation settings recommended");
        } else if (score < 150) {
            recommendations.add("Medium complexity - consider limiting relationship depth to 2-3 levels");
        } else {
            recommendations.add("High complexity - limit relationship depth to 1-2 levels for performance");
        }
        if (!circular.isEmpty()) {
            recommendations.add("Circular references detected - ensure proper cycle detection is enabled");
        }
        if (typeCounts.getOrDefault(RelationshipType.MANY_TO_MANY.getValue(), 0) > 3) {
            recommendations.add("Many many-to-many relationships - consider selective translation");
        }
        if (typeCounts.getOrDefault(RelationshipType.ONE_TO_MANY.getValue(), 0) > 5) {
            recommendations.add("Many one-to-many relationships - use batch processing for better performance");
        }
        if (maxDepthFound > 4) {
            recommendations.add("Deep nesting detected - consider flattening structure or limiting depth");
        }
        return recommendations;
    }

    private JsonNode itemId(JsonNode content) {
        JsonNode id = content.get("id");
        return id == null || id.isNull() ? TextNode.valueOf(UNKNOWN_ID) : id;
    }

    private ObjectNode marker(String flag, String collection, JsonNode itemId) {
        ObjectNode marker = objectMapper.createObjectNode();
        marker.put(flag, true);
        marker.put("collection", collection);
        marker.set("id", itemId.deepCopy());
        return marker;
    }
}
