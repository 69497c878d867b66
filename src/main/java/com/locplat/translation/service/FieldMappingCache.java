package com.locplat.translation.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locplat.translation.model.CacheEntry;
import com.locplat.translation.model.ExtractionResult;
import com.locplat.translation.model.FieldMappingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caches field mapping configs and extraction results. Extraction entries carry the
 * config hash they were produced with and are ignored once the config changes.
 */
@Service
public class FieldMappingCache {

    private static final Logger logger = LoggerFactory.getLogger(FieldMappingCache.class);

    private final KeyValueStore store;
    private final CacheKeyFactory keyFactory;
    private final CachePayloadCodec payloadCodec;
    private final ContentHashingService hashingService;
    private final ObjectMapper objectMapper;
    private final Duration configTtl;
    private final Duration extractionTtl;

    public FieldMappingCache(KeyValueStore store,
                             CacheKeyFactory keyFactory,
                             CachePayloadCodec payloadCodec,
                             ContentHashingService hashingService,
                             ObjectMapper objectMapper,
                             @Value("${app.cache.config-ttl-seconds:1800}") long configTtlSeconds,
                             @Value("${app.cache.extraction-ttl-seconds:600}") long extractionTtlSeconds) {
        this.store = store;
        this.keyFactory = keyFactory;
        this.payloadCodec = payloadCodec;
        this.hashingService = hashingService;
        this.objectMapper = objectMapper;
        this.configTtl = Duration.ofSeconds(configTtlSeconds);
        this.extractionTtl = Duration.ofSeconds(extractionTtlSeconds);
    }

    public Optional<FieldMappingConfig> getConfig(String clientId, String collection) {
        String key = keyFactory.fieldConfigKey(clientId, collection);
        return read(key, FieldMappingConfig.class);
    }

    public void putConfig(FieldMappingConfig config) {
        write(keyFactory.fieldConfigKey(config.getClientId(), config.getCollectionName()), config, configTtl);
    }

    public void invalidateConfig(String clientId, String collection) {
        String key = keyFactory.fieldConfigKey(clientId, collection);
        try {
            store.delete(key);
            logger.debug("Invalidated field config cache entry {}", key);
        } catch (RuntimeException e) {
            logger.error("Field config cache invalidation failed for {}", key, e);
        }
    }

    /**
     * Drops every cached config of a client.
     *
     * @return number of entries removed
     */
    public long invalidateClient(String clientId) {
        String pattern = keyFactory.fieldConfigPattern(clientId);
        try {
            long removed = store.deleteMatching(pattern);
            logger.info("Invalidated {} field config cache entries for client {}", removed, clientId);
            return removed;
        } catch (RuntimeException e) {
            logger.error("Field config cache invalidation failed for client {}", clientId, e);
            return 0;
        }
    }

    public Optional<ExtractionResult> getExtraction(FieldMappingConfig config, JsonNode content, String language) {
        String configHash = hashingService.configHash(config);
        Optional<String> extractionKey = keyFactory.extractionKey(configHash, content, language);
        if (extractionKey.isEmpty()) {
            return Optional.empty();
        }
        String key = extractionKey.get();
        Optional<CachedExtraction> cached = read(key, CachedExtraction.class);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        if (!Objects.equals(configHash, cached.get().configHash())) {
            logger.debug("Ignoring stale extraction cache entry {}", key);
            return Optional.empty();
        }
        return Optional.ofNullable(cached.get().result());
    }

    public void putExtraction(FieldMappingConfig config, JsonNode content, String language, ExtractionResult result) {
        String configHash = hashingService.configHash(config);
        Optional<String> key = keyFactory.extractionKey(configHash, content, language);
        if (key.isEmpty()) {
            logger.debug("Content too large for the extraction cache, skipping write");
            return;
        }
        write(key.get(), new CachedExtraction(configHash, result), extractionTtl);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            byte[] stored = store.get(key);
            if (stored == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(payloadCodec.decode(stored), type));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("Cache read failed for key {}", key, e);
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        try {
            CacheEntry entry = payloadCodec.encode(key, objectMapper.writeValueAsString(value), ttl);
            store.set(entry.key(), entry.payload(), ttl);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize value for cache key {}: {}", key, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Cache write failed for key {}", key, e);
        }
    }

    record CachedExtraction(@JsonProperty("config_hash") String configHash, ExtractionResult result) {
    }
}
