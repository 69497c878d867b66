package com.locplat.translation.service;

import com.locplat.translation.config.RelationshipProperties;
import com.locplat.translation.model.RelationshipEdge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Relationship edges per collection. Edges without an explicit source collection
 * inherit the collection they are listed under.
 */
@Component
public class RelationshipCatalog {

    private final RelationshipProperties properties;
    private final Map<String, List<RelationshipEdge>> memo = new ConcurrentHashMap<>();

    public RelationshipCatalog(RelationshipProperties properties) {
        this.properties = properties;
    }

    public List<RelationshipEdge> getRelationships(String collection) {
        if (collection == null) {
            return List.of();
        }
        return memo.computeIfAbsent(collection, this::load);
    }

    private List<RelationshipEdge> load(String collection) {
        List<RelationshipEdge> configured = properties.getRelationships().get(collection);
        if (configured == null) {
            return List.of();
        }
        List<RelationshipEdge> edges = new ArrayList<>(configured.size());
        for (RelationshipEdge edge : configured) {
            RelationshipEdge copy = RelationshipEdge.builder()
                    .sourceCollection(edge.getSourceCollection() == null ? collection : edge.getSourceCollection())
                    .sourceField(edge.getSourceField())
                    .targetCollection(edge.getTargetCollection())
                    .targetField(edge.getTargetField() == null ? "id" : edge.getTargetField())
                    .relationshipType(edge.getRelationshipType())
                    .junctionCollection(edge.getJunctionCollection())
                    .translateRelated(edge.isTranslateRelated())
                    .build();
            edges.add(copy);
        }
        return List.copyOf(edges);
    }
}
