package com.locplat.translation.controller;

import com.locplat.translation.model.RelationshipAnalysis;
import com.locplat.translation.model.RelationshipEdge;
import com.locplat.translation.service.RelationshipCatalog;
import com.locplat.translation.service.RelationshipTraversalService;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/relationships")
public class RelationshipController {

    private final RelationshipTraversalService traversalService;
    private final RelationshipCatalog relationshipCatalog;

    public RelationshipController(RelationshipTraversalService traversalService,
                                  RelationshipCatalog relationshipCatalog) {
        this.traversalService = traversalService;
        this.relationshipCatalog = relationshipCatalog;
    }

    @Operation(summary = "Relationship edges configured for a collection")
    @GetMapping("/{collection}")
    public ResponseEntity<List<RelationshipEdge>> relationships(@PathVariable String collection) {
        return ResponseEntity.ok(relationshipCatalog.getRelationships(collection));
    }

    @Operation(summary = "Estimate relationship translation complexity",
            description = "Walks the relationship schema from a collection and scores how costly a deep translation would be.")
    @GetMapping("/{collection}/analysis")
    public ResponseEntity<RelationshipAnalysis> analyze(@PathVariable String collection,
                                                        @RequestParam(name = "max_depth", defaultValue = "5") int maxDepth) {
        return ResponseEntity.ok(traversalService.analyze(collection, maxDepth));
    }
}
