package com.locplat.translation.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.locplat.translation.model.FieldConfigEntity;
import com.locplat.translation.model.FieldMappingConfig;
import com.locplat.translation.model.FieldType;
import com.locplat.translation.model.TranslationPattern;
import com.locplat.translation.repository.FieldConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field mapping configs backed by the database, fronted by a short-lived local memo
 * and the shared field config cache.
 */
@Service
public class FieldConfigStore {

    private static final Logger logger = LoggerFactory.getLogger(FieldConfigStore.class);

    private final FieldConfigRepository configRepository;
    private final FieldMappingCache mappingCache;
    private final Cache<String, FieldMappingConfig> localMemo;

    public FieldConfigStore(FieldConfigRepository configRepository,
                            FieldMappingCache mappingCache,
                            @Value("${app.field-config.memo-ttl-seconds:300}") long memoTtlSeconds) {
        this.configRepository = configRepository;
        this.mappingCache = mappingCache;
        this.localMemo = CacheBuilder.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(memoTtlSeconds))
                .maximumSize(1_000)
                .build();
    }

    /**
     * @return the stored config, or {@link FieldMappingConfig#defaultFor} when none exists
     */
    public FieldMappingConfig getConfig(String clientId, String collection) {
        String memoKey = memoKey(clientId, collection);
        FieldMappingConfig memoized = localMemo.getIfPresent(memoKey);
        if (memoized != null) {
            return memoized;
        }

        Optional<FieldMappingConfig> cached = mappingCache.getConfig(clientId, collection);
        if (cached.isPresent()) {
            localMemo.put(memoKey, cached.get());
            return cached.get();
        }

        Optional<FieldConfigEntity> stored = configRepository.findByClientIdAndCollectionName(clientId, collection);
        if (stored.isEmpty()) {
            logger.debug("No field config stored for {}/{}", clientId, collection);
            return FieldMappingConfig.defaultFor(clientId, collection);
        }
        FieldMappingConfig config = toConfig(stored.get());
        localMemo.put(memoKey, config);
        mappingCache.putConfig(config);
        return config;
    }

    @Transactional
    public FieldMappingConfig saveConfig(FieldMappingConfig config) {
        FieldConfigEntity entity = configRepository
                .findByClientIdAndCollectionName(config.getClientId(), config.getCollectionName())
                .orElseGet(FieldConfigEntity::new);
        apply(config, entity);
        FieldConfigEntity saved = configRepository.save(entity);
        FieldMappingConfig result = toConfig(saved);

        localMemo.invalidate(memoKey(config.getClientId(), config.getCollectionName()));
        mappingCache.invalidateConfig(config.getClientId(), config.getCollectionName());
        logger.info("Saved field config for {}/{} with {} field paths", config.getClientId(),
                config.getCollectionName(), result.getFieldPaths().size());
        return result;
    }

    public List<FieldMappingConfig> listConfigs(String clientId) {
        List<FieldMappingConfig> configs = new ArrayList<>();
        for (FieldConfigEntity entity : configRepository.findAllByClientId(clientId)) {
            configs.add(toConfig(entity));
        }
        return configs;
    }

    /**
     * Drops every cached config of a client, locally and in the shared cache.
     */
    public long invalidateClient(String clientId) {
        String prefix = clientId + "/";
        localMemo.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        return mappingCache.invalidateClient(clientId);
    }

    private static String memoKey(String clientId, String collection) {
        return clientId + "/" + collection;
    }

    private void apply(FieldMappingConfig config, FieldConfigEntity entity) {
        entity.setClientId(config.getClientId());
        entity.setCollectionName(config.getCollectionName());
        entity.setFieldPaths(config.getFieldPaths() == null ? new ArrayList<>() : new ArrayList<>(config.getFieldPaths()));
        Map<String, String> types = new LinkedHashMap<>();
        if (config.getFieldTypes() != null) {
            config.getFieldTypes().forEach((path, type) -> types.put(path, type.getValue()));
        }
        entity.setFieldTypes(types);
        entity.setRtlFieldMapping(config.getRtlFieldMapping() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(config.getRtlFieldMapping()));
        entity.setBatchProcessing(config.isBatchProcessing());
        entity.setPreserveHtml(config.isPreserveHtml());
        entity.setContentSanitization(config.isContentSanitization());
        entity.setTranslationPattern(config.getTranslationPattern() == null
                ? null : config.getTranslationPattern().getValue());
        entity.setPrimaryCollection(config.getPrimaryCollection());
    }

    FieldMappingConfig toConfig(FieldConfigEntity entity) {
        Map<String, FieldType> types = new LinkedHashMap<>();
        if (entity.getFieldTypes() != null) {
            entity.getFieldTypes().forEach((path, type) -> types.put(path, FieldType.fromValue(type)));
        }
        return FieldMappingConfig.builder()
                .clientId(entity.getClientId())
                .collectionName(entity.getCollectionName())
                .fieldPaths(entity.getFieldPaths() == null ? new ArrayList<>() : new ArrayList<>(entity.getFieldPaths()))
                .fieldTypes(types)
                .rtlFieldMapping(entity.getRtlFieldMapping() == null
                        ? new LinkedHashMap<>() : new LinkedHashMap<>(entity.getRtlFieldMapping()))
                .batchProcessing(entity.isBatchProcessing())
                .preserveHtml(entity.isPreserveHtml())
                .contentSanitization(entity.isContentSanitization())
                .translationPattern(TranslationPattern.fromValue(entity.getTranslationPattern()))
                .primaryCollection(entity.getPrimaryCollection())
                .build();
    }
}
