package com.kotsin.enrichment.settings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default configuration document. A file on disk is merged on top of it.
 */
public final class ConfigDefaults {

    public static final String PRICE_PREDICTOR = "price_predictor";
    public static final String POLICY_ENGINE = "policy_engine";
    public static final String SENTIMENT = "sentiment";
    public static final String CONSENSUS = "consensus";

    private ConfigDefaults() {
    }

    /**
     * @return a fresh, mutable copy of the defaults
     */
    public static Map<String, Object> document() {
        Map<String, Object> doc = new LinkedHashMap<>();

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("global_timeout_ms", 30_000);
        system.put("cache_ttl_seconds", 300);
        system.put("shed_below_health", 0.3);
        doc.put("system", system);

        Map<String, Object> providers = new LinkedHashMap<>();
        providers.put(PRICE_PREDICTOR, provider(10_000, 0.0, true));
        providers.put(POLICY_ENGINE, provider(10_000, 0.0, false));
        providers.put(SENTIMENT, provider(5_000, 0.0, false));
        providers.put(CONSENSUS, provider(15_000, 0.0, false));
        doc.put("providers", providers);

        // Cheap, tolerant dependencies get a higher threshold and a shorter recovery window
        Map<String, Object> breakers = new LinkedHashMap<>();
        breakers.put("failure_threshold", 3);
        breakers.put("recovery_timeout_ms", 120_000);
        breakers.put(PRICE_PREDICTOR, breaker(3, 120_000));
        breakers.put(POLICY_ENGINE, breaker(3, 120_000));
        breakers.put(SENTIMENT, breaker(5, 60_000));
        breakers.put(CONSENSUS, breaker(2, 300_000));
        doc.put("circuit_breakers", breakers);

        Map<String, Object> caching = new LinkedHashMap<>();
        caching.put("enabled", true);
        doc.put("caching", caching);

        return doc;
    }

    private static Map<String, Object> provider(int timeoutMs, double confidenceFloor, boolean essential) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("enabled", true);
        section.put("timeout_ms", timeoutMs);
        section.put("confidence_floor", confidenceFloor);
        section.put("essential", essential);
        return section;
    }

    private static Map<String, Object> breaker(int failureThreshold, int recoveryTimeoutMs) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("failure_threshold", failureThreshold);
        section.put("recovery_timeout_ms", recoveryTimeoutMs);
        return section;
    }
}
