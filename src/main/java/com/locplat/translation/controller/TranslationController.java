package com.locplat.translation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.locplat.translation.dto.PreviewRequest;
import com.locplat.translation.dto.RelationshipTranslationRequest;
import com.locplat.translation.dto.StructuredTranslationRequest;
import com.locplat.translation.dto.ValidationRequest;
import com.locplat.translation.model.StructuredTranslationResult;
import com.locplat.translation.model.TranslationPreview;
import com.locplat.translation.model.ValidationResult;
import com.locplat.translation.service.InvalidTranslationRequestException;
import com.locplat.translation.service.RelationshipTraversalService;
import com.locplat.translation.service.StructuredTranslationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/translate")
public class TranslationController {

    private final StructuredTranslationService translationService;
    private final RelationshipTraversalService traversalService;

    public TranslationController(StructuredTranslationService translationService,
                                 RelationshipTraversalService traversalService) {
        this.translationService = translationService;
        this.traversalService = traversalService;
    }

    @Operation(
            summary = "Translate structured content",
            description = "Translates the configured fields of a CMS document and returns it in the configured output shape."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Content translated, possibly partially"),
            @ApiResponse(responseCode = "400", description = "Content is not a document, or provider/language pair unsupported"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/structured")
    public ResponseEntity<StructuredTranslationResult> translateStructured(
            @Valid @RequestBody StructuredTranslationRequest request) {
        StructuredTranslationResult result = translationService.translateStructuredContent(request.getContent(),
                request.getClientId(), request.getCollectionName(), request.toSettings(), request.getContext());
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Translate content with related items",
            description = "Translates a document and the related items embedded in it, guarding against cycles and excessive depth."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Content tree translated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/relationships")
    public ResponseEntity<JsonNode> translateWithRelationships(
            @Valid @RequestBody RelationshipTranslationRequest request) {
        JsonNode result = traversalService.translateWithRelationships(request.getContent(), request.getClientId(),
                request.getCollectionName(), request.toSettings(), request.getMaxDepth(), request.isTranslateRelated());
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Preview translatable fields",
            description = "Lists the fields that would be translated, using a stored or inline field config. No provider is called."
    )
    @PostMapping("/preview")
    public ResponseEntity<TranslationPreview> preview(@Valid @RequestBody PreviewRequest request) {
        if (request.getFieldConfig() != null) {
            return ResponseEntity.ok(translationService.preview(request.getContent(), request.getFieldConfig(),
                    request.getTargetLang()));
        }
        if (request.getClientId() == null || request.getCollectionName() == null) {
            throw new InvalidTranslationRequestException("Either field_config or client_id and collection_name are required");
        }
        return ResponseEntity.ok(translationService.preview(request.getContent(), request.getClientId(),
                request.getCollectionName(), request.getTargetLang()));
    }

    @Operation(summary = "Validate a translation request without translating anything")
    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidationRequest request) {
        return ResponseEntity.ok(translationService.validate(request.getClientId(), request.getCollectionName(),
                request.getProvider(), request.getSourceLang(), request.getTargetLang()));
    }
}
