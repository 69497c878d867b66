package com.locplat.translation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locplat.translation.model.CacheContentType;
import com.locplat.translation.model.CacheEntry;
import com.locplat.translation.model.CacheStats;
import com.locplat.translation.model.CacheWarmItem;
import com.locplat.translation.model.FieldTranslation;
import com.locplat.translation.model.TranslationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Content-addressed cache of provider responses.
 * <p>
 * The cache only ever accelerates: every backend failure is logged and reported as
 * a miss (reads) or as "nothing written" (writes), never thrown.
 */
@Service
public class AiResponseCache {

    private static final Logger logger = LoggerFactory.getLogger(AiResponseCache.class);

    private final KeyValueStore store;
    private final CacheKeyFactory keyFactory;
    private final CacheTtlPolicy ttlPolicy;
    private final CachePayloadCodec payloadCodec;
    private final ObjectMapper objectMapper;

    public AiResponseCache(KeyValueStore store,
                           CacheKeyFactory keyFactory,
                           CacheTtlPolicy ttlPolicy,
                           CachePayloadCodec payloadCodec,
                           ObjectMapper objectMapper) {
        this.store = store;
        this.keyFactory = keyFactory;
        this.ttlPolicy = ttlPolicy;
        this.payloadCodec = payloadCodec;
        this.objectMapper = objectMapper;
    }

    /**
     * @param context  prompt context the response was produced with, may be {@code null}
     * @param settings settings with the model already resolved
     */
    public Optional<FieldTranslation> get(String text, String context, TranslationSettings settings) {
        String key = keyFactory.aiResponseKey(settings, text, context);
        String provider = settings.provider();
        String model = settings.model();
        try {
            byte[] stored = store.get(key);
            if (stored == null) {
                recordStat(provider, model, "misses");
                return Optional.empty();
            }
            FieldTranslation cached = objectMapper.readValue(payloadCodec.decode(stored), FieldTranslation.class);
            recordStat(provider, model, "hits");
            logger.debug("AI response cache hit for key {}", key);
            return Optional.of(cached);
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            safeDelete(key);
            recordStat(provider, model, "misses");
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("AI response cache read failed for key {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Stores a response with a TTL derived from content type, model cost and confidence.
     *
     * @return whether the entry was written
     */
    public boolean put(String text, String context, TranslationSettings settings,
                       FieldTranslation response, CacheContentType contentType, double confidence) {
        String key = keyFactory.aiResponseKey(settings, text, context);
        try {
            Duration ttl = ttlPolicy.ttl(contentType, settings.provider(), settings.model(), confidence);
            CacheEntry entry = payloadCodec.encode(key, objectMapper.writeValueAsString(response), ttl);
            store.set(entry.key(), entry.payload(), Duration.ofSeconds(entry.ttlSeconds()));
            logger.debug("Cached AI response {} (ttl={}s, compressed={})", key, entry.ttlSeconds(), entry.compressed());
            return true;
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize AI response for caching: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            logger.error("AI response cache write failed for key {}", key, e);
            return false;
        }
    }

    /**
     * Deletes AI responses matching every non-null filter.
     *
     * @return number of entries removed
     */
    public long invalidate(String provider, String model, String targetLanguage, String collection) {
        String pattern = keyFactory.aiResponsePattern(provider, model, targetLanguage, collection);
        try {
            long removed = store.deleteMatching(pattern);
            logger.info("Invalidated {} AI response cache entries matching {}", removed, pattern);
            return removed;
        } catch (RuntimeException e) {
            logger.error("AI response cache invalidation failed for pattern {}", pattern, e);
            return 0;
        }
    }

    /**
     * Deletes one AI response entry by its full key. Keys outside the AI response namespace are left alone.
     *
     * @return {@code true} when an entry was removed
     */
    public boolean invalidateKey(String key) {
        if (key == null || !key.startsWith(CacheKeyFactory.AI_RESPONSE_PREFIX + ":")) {
            logger.warn("Refusing to invalidate non AI response key {}", key);
            return false;
        }
        boolean removed = safeDelete(key);
        logger.info("Invalidated AI response cache entry {}: {}", key, removed);
        return removed;
    }

    /**
     * Removes all AI responses and their statistics.
     */
    public long clearAll() {
        try {
            long removed = store.deleteMatching(CacheKeyFactory.AI_RESPONSE_PREFIX + ":*");
            store.deleteMatching(CacheKeyFactory.STATS_PREFIX + ":*");
            logger.info("Cleared {} AI response cache entries", removed);
            return removed;
        } catch (RuntimeException e) {
            logger.error("Clearing AI response cache failed", e);
            return 0;
        }
    }

    public CacheStats stats(String provider, String model) {
        try {
            long hits = sumCounters(keyFactory.statsPattern(provider, model, "hits"));
            long misses = sumCounters(keyFactory.statsPattern(provider, model, "misses"));
            return CacheStats.of(provider, model, hits, misses);
        } catch (RuntimeException e) {
            logger.error("Reading cache statistics failed", e);
            return CacheStats.of(provider, model, 0, 0);
        }
    }

    /**
     * Preloads responses that are not cached yet.
     *
     * @return number of entries written
     */
    public int warm(List<CacheWarmItem> items) {
        int warmed = 0;
        for (CacheWarmItem item : items) {
            String sourceLanguage = item.sourceLanguage() != null || item.response() == null
                    ? item.sourceLanguage() : item.response().sourceLang();
            TranslationSettings settings = new TranslationSettings(item.provider(), item.model(), sourceLanguage,
                    item.targetLanguage(), item.collection());
            String key = keyFactory.aiResponseKey(settings, item.text(), item.context());
            try {
                if (store.get(key) != null) {
                    continue;
                }
            } catch (RuntimeException e) {
                logger.warn("Cache lookup failed while warming {}: {}", key, e.getMessage());
                continue;
            }
            double confidence = item.confidence() == null ? 1.0 : item.confidence();
            if (put(item.text(), item.context(), settings, item.response(), item.contentType(), confidence)) {
                warmed++;
            }
        }
        logger.info("Warmed AI response cache with {} of {} entries", warmed, items.size());
        return warmed;
    }

    private long sumCounters(String pattern) {
        long total = 0;
        for (String key : store.keys(pattern)) {
            byte[] value = store.get(key);
            if (value != null) {
                try {
                    total += Long.parseLong(new String(value, StandardCharsets.US_ASCII).trim());
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring non-numeric cache counter {}", key);
                }
            }
        }
        return total;
    }

    private void recordStat(String provider, String model, String counter) {
        try {
            store.increment(keyFactory.statsKey(provider, model, counter));
        } catch (RuntimeException e) {
            logger.debug("Could not update cache statistics: {}", e.getMessage());
        }
    }

    private boolean safeDelete(String key) {
        try {
            return store.delete(key);
        } catch (RuntimeException e) {
            logger.error("Cache delete failed for key {}", key, e);
            return false;
        }
    }
}
