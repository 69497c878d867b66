package com.locplat.translation.service;

import com.locplat.translation.model.CacheContentType;
import com.locplat.translation.model.FieldTranslation;
import com.locplat.translation.model.LanguageDirection;
import com.locplat.translation.model.TranslationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for provider calls: checks the AI response cache, calls the provider
 * on a miss, scores the result and caches it.
 */
@Service
public class CachedTranslationService {

    private static final Logger logger = LoggerFactory.getLogger(CachedTranslationService.class);

    private final TranslationProviderRegistry providerRegistry;
    private final AiResponseCache responseCache;
    private final TranslationQualityEstimator qualityEstimator;
    private final Executor translationExecutor;
    private final boolean cacheEnabled;

    public CachedTranslationService(TranslationProviderRegistry providerRegistry,
                                    AiResponseCache responseCache,
                                    TranslationQualityEstimator qualityEstimator,
                                    @Qualifier("translationExecutor") Executor translationExecutor,
                                    @Value("${app.cache.enabled:true}") boolean cacheEnabled) {
        this.providerRegistry = providerRegistry;
        this.responseCache = responseCache;
        this.qualityEstimator = qualityEstimator;
        this.translationExecutor = translationExecutor;
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * Translates one text.
     *
     * @throws InvalidTranslationRequestException for an unknown provider
     * @throws TranslationException               when the provider fails
     */
    public FieldTranslation translate(String text, TranslationSettings settings, String context) {
        TranslationProvider provider = providerRegistry.require(settings.provider());
        String model = settings.model() == null || settings.model().isBlank()
                ? provider.getDefaultModel() : settings.model();

        if (text == null || text.isBlank()) {
            return new FieldTranslation(text, provider.getName(), model, settings.sourceLang(),
                    settings.targetLang(), 1.0, Map.of("skipped", "empty"));
        }

        TranslationSettings resolved = new TranslationSettings(provider.getName(), model, settings.sourceLang(),
                settings.targetLang(), settings.collection());
        if (cacheEnabled) {
            Optional<FieldTranslation> cached = responseCache.get(text, context, resolved);
            if (cached.isPresent()) {
                return withMetadata(cached.get(), "cached", true);
            }
        }

        String translated = provider.translate(text, settings.sourceLang(), settings.targetLang(), model, context);
        double quality = qualityEstimator.estimate(text, translated);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("language_direction", LanguageDirection.of(settings.targetLang()).getValue());
        metadata.put("cached", false);
        FieldTranslation result = new FieldTranslation(translated, provider.getName(), model,
                settings.sourceLang(), settings.targetLang(), quality, metadata);

        if (cacheEnabled) {
            responseCache.put(text, context, resolved, result, CacheContentType.STANDARD, quality);
        }
        return result;
    }

    /**
     * Translates all texts concurrently on the translation executor. The result list
     * has the same order as {@code texts}.
     *
     * @throws BatchTranslationException when any single item fails
     */
    public List<FieldTranslation> batchTranslate(List<String> texts, TranslationSettings settings, String context) {
        if (texts.isEmpty()) {
            return List.of();
        }
        providerRegistry.require(settings.provider());
        logger.info("Batch translating {} texts {} -> {} with {}", texts.size(),
                settings.sourceLang(), settings.targetLang(), settings.provider());

        List<CompletableFuture<FieldTranslation>> futures = new ArrayList<>(texts.size());
        for (String text : texts) {
            futures.add(CompletableFuture.supplyAsync(() -> translate(text, settings, context), translationExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(ex -> null)
                .join();

        List<FieldTranslation> results = new ArrayList<>(texts.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warn("Batch item {} failed: {}", i, cause.getMessage());
                throw new BatchTranslationException(i, cause);
            }
        }
        return results;
    }

    private FieldTranslation withMetadata(FieldTranslation translation, String key, Object value) {
        Map<String, Object> metadata = new LinkedHashMap<>(translation.metadata());
        metadata.put(key, value);
        return new FieldTranslation(translation.translatedText(), translation.provider(), translation.model(),
                translation.sourceLang(), translation.targetLang(), translation.qualityScore(), metadata);
    }
}
