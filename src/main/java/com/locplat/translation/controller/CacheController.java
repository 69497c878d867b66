package com.locplat.translation.controller;

import com.locplat.translation.model.CacheStats;
import com.locplat.translation.model.CacheWarmItem;
import com.locplat.translation.service.AiResponseCache;
import com.locplat.translation.service.FieldConfigStore;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final AiResponseCache responseCache;
    private final FieldConfigStore configStore;

    public CacheController(AiResponseCache responseCache, FieldConfigStore configStore) {
        this.responseCache = responseCache;
        this.configStore = configStore;
    }

    @Operation(summary = "AI response cache hit/miss statistics")
    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats(@RequestParam(required = false) String provider,
                                            @RequestParam(required = false) String model) {
        return ResponseEntity.ok(responseCache.stats(provider, model));
    }

    @Operation(summary = "Invalidate AI responses",
            description = "Deletes cached responses matching every given filter; omitted filters match everything.")
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> invalidate(@RequestParam(required = false) String provider,
                                                          @RequestParam(required = false) String model,
                                                          @RequestParam(required = false) String language,
                                                          @RequestParam(required = false) String collection) {
        long removed = responseCache.invalidate(provider, model, language, collection);
        return ResponseEntity.ok(Map.of("invalidated", removed));
    }

    @Operation(summary = "Invalidate one AI response by its full cache key")
    @DeleteMapping("/key/{key}")
    public ResponseEntity<Map<String, Object>> invalidateKey(@PathVariable String key) {
        boolean removed = responseCache.invalidateKey(key);
        return ResponseEntity.ok(Map.of("key", key, "invalidated", removed));
    }

    @Operation(summary = "Flush all AI responses and statistics")
    @DeleteMapping("/all")
    public ResponseEntity<Map<String, Object>> clearAll() {
        return ResponseEntity.ok(Map.of("invalidated", responseCache.clearAll()));
    }

    @Operation(summary = "Invalidate cached field configs of a client")
    @DeleteMapping("/field-config/{clientId}")
    public ResponseEntity<Map<String, Object>> invalidateFieldConfigs(@PathVariable String clientId) {
        return ResponseEntity.ok(Map.of("invalidated", configStore.invalidateClient(clientId)));
    }

    @Operation(summary = "Preload known translations into the AI response cache")
    @PostMapping("/warm")
    public ResponseEntity<Map<String, Object>> warm(@RequestBody List<CacheWarmItem> items) {
        return ResponseEntity.ok(Map.of("warmed", responseCache.warm(items), "requested", items.size()));
    }
}
