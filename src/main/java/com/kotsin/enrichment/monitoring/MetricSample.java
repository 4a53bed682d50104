package com.kotsin.enrichment.monitoring;

import java.util.Map;

/**
 * One recorded metric value.
 */
public record MetricSample(double value, long timestampMs, Map<String, String> tags) {
}
