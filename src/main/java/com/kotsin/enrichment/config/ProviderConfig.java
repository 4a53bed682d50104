package com.kotsin.enrichment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.enrichment.provider.EnrichmentProvider;
import com.kotsin.enrichment.provider.HttpEnrichmentProvider;
import com.kotsin.enrichment.provider.ProviderRegistry;
import com.kotsin.enrichment.settings.ConfigDefaults;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Provider wiring.
 *
 * The registry holds every {@link EnrichmentProvider} bean plus one HTTP provider
 * per non-blank {@code enrichment.providers.<kind>.url}. A kind already served by
 * a bean is not registered again over HTTP.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    private static final List<String> KNOWN_KINDS = List.of(
            ConfigDefaults.PRICE_PREDICTOR,
            ConfigDefaults.POLICY_ENGINE,
            ConfigDefaults.SENTIMENT,
            ConfigDefaults.CONSENSUS);

    @Bean
    public OkHttpClient providerHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public ProviderRegistry providerRegistry(ObjectProvider<EnrichmentProvider> providerBeans,
                                             OkHttpClient providerHttpClient,
                                             ObjectMapper objectMapper,
                                             Environment environment) {
        List<EnrichmentProvider> providers = new ArrayList<>();
        providerBeans.orderedStream().forEach(providers::add);
        Set<String> served = providers.stream().map(EnrichmentProvider::kind).collect(Collectors.toSet());

        for (String kind : KNOWN_KINDS) {
            String url = environment.getProperty("enrichment.providers." + kind + ".url", "");
            if (url.isBlank() || served.contains(kind)) {
                continue;
            }
            providers.add(new HttpEnrichmentProvider(kind, url.trim(), providerHttpClient, objectMapper));
            log.info("[PROVIDER] Registered HTTP provider {} -> {}", kind, url.trim());
        }

        if (providers.isEmpty()) {
            log.warn("[PROVIDER] No enrichment providers registered, signals will pass through unenriched");
        }
        return new ProviderRegistry(providers);
    }
}
