package com.locplat.translation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up translation providers by name.
 */
@Component
public class TranslationProviderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TranslationProviderRegistry.class);

    private final Map<String, TranslationProvider> providers = new LinkedHashMap<>();

    @Autowired
    public TranslationProviderRegistry(ObjectProvider<TranslationProvider> providers) {
        this(providers.orderedStream().toList());
    }

    public TranslationProviderRegistry(List<TranslationProvider> providers) {
        for (TranslationProvider provider : providers) {
            this.providers.put(provider.getName().toLowerCase(Locale.ROOT), provider);
        }
        logger.info("Registered translation providers: {}", this.providers.keySet());
    }

    public Optional<TranslationProvider> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(providers.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * @throws InvalidTranslationRequestException when no provider has that name
     */
    public TranslationProvider require(String name) {
        return find(name).orElseThrow(() -> new InvalidTranslationRequestException(
                "Unknown translation provider '" + name + "'. Available: " + providers.keySet()));
    }

    public Set<String> names() {
        return providers.keySet();
    }
}
