package com.kotsin.enrichment.monitoring;

/**
 * Metric names recorded by the enrichment core.
 */
public final class MetricNames {

    public static final String ERROR_RATE = "error_rate";
    public static final String ENRICHMENT_TIME_MS = "enrichment_time_ms";
    public static final String PROVIDER_CALL_MS = "provider_call_ms";
    public static final String PROVIDERS_USED = "providers_used";
    public static final String CIRCUIT_BREAKERS_OPEN = "circuit_breakers_open";
    public static final String CACHE_MISS_RATE = "cache_miss_rate";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String SIGNAL_QUALITY_SCORE = "signal_quality_score";
    public static final String MARKET_QUALITY_SCORE = "market_quality_score";

    private MetricNames() {
    }
}
