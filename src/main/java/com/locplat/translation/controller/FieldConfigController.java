package com.locplat.translation.controller;

import com.locplat.translation.dto.ExtractRequest;
import com.locplat.translation.model.ExtractionResult;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.service.FieldConfigStore;
import com.locplat.translation.service.FieldExtractionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/field-config")
public class FieldConfigController {

    private static final Logger logger = LoggerFactory.getLogger(FieldConfigController.class);

    private final FieldConfigStore configStore;
    private final FieldExtractionService extractionService;

    public FieldConfigController(FieldConfigStore configStore, FieldExtractionService extractionService) {
        this.configStore = configStore;
        this.extractionService = extractionService;
    }

    @Operation(summary = "Get the field mapping config of a collection",
            description = "Returns the stored config, or an empty default config when none is stored.")
    @GetMapping("/{clientId}/{collection}")
    public ResponseEntity<FieldMappingConfig> getConfig(
            @Parameter(description = "Client identifier", required = true) @PathVariable String clientId,
            @Parameter(description = "CMS collection name", required = true) @PathVariable String collection) {
        return ResponseEntity.ok(configStore.getConfig(clientId, collection));
    }

    @Operation(summary = "List all field mapping configs of a client")
    @GetMapping("/{clientId}")
    public ResponseEntity<List<FieldMappingConfig>> listConfigs(@PathVariable String clientId) {
        return ResponseEntity.ok(configStore.listConfigs(clientId));
    }

    @Operation(summary = "Create or replace the field mapping config of a collection")
    @PutMapping("/{clientId}/{collection}")
    public ResponseEntity<FieldMappingConfig> saveConfig(@PathVariable String clientId,
                                                         @PathVariable String collection,
                                                         @RequestBody FieldMappingConfig config) {
        FieldMappingConfig toSave = config.toBuilder().clientId(clientId).collectionName(collection).build();
        logger.info("Saving field config for {}/{}", clientId, collection);
        return ResponseEntity.ok(configStore.saveConfig(toSave));
    }

    @Operation(summary = "Extract translatable fields with an inline config",
            description = "Runs field extraction only and returns the extracted fields, including the __batch__ group.")
    @PostMapping("/extract")
    public ResponseEntity<ExtractionResult> extract(@Valid @RequestBody ExtractRequest request) {
        return ResponseEntity.ok(extractionService.extract(request.getContent(), request.getFieldConfig(),
                request.getLanguage()));
    }
}
