package com.kotsin.enrichment.monitoring;

public enum AlertType {
    ERROR_RATE_HIGH(AlertSeverity.CRITICAL),
    PERFORMANCE_DEGRADATION(AlertSeverity.WARNING),
    CIRCUIT_BREAKERS_OPEN(AlertSeverity.WARNING),
    MEMORY_USAGE_HIGH(AlertSeverity.WARNING),
    CACHE_MISS_RATE_HIGH(AlertSeverity.INFO);

    private final AlertSeverity severity;

    AlertType(AlertSeverity severity) {
        this.severity = severity;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }
}
