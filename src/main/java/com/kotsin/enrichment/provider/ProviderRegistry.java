package com.kotsin.enrichment.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lookup table of providers by kind, fixed at startup.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, EnrichmentProvider> providers;

    public ProviderRegistry(Collection<? extends EnrichmentProvider> providers) {
        Map<String, EnrichmentProvider> byKind = new TreeMap<>();
        for (EnrichmentProvider provider : providers) {
            EnrichmentProvider existing = byKind.putIfAbsent(provider.kind(), provider);
            if (existing != null) {
                throw new IllegalStateException("Duplicate provider for kind " + provider.kind());
            }
        }
        this.providers = Collections.unmodifiableMap(byKind);
        log.info("[PROVIDER] Registered providers: {}", this.providers.keySet());
    }

    public Optional<EnrichmentProvider> get(String kind) {
        return Optional.ofNullable(providers.get(kind));
    }

    public Set<String> kinds() {
        return providers.keySet();
    }
}
