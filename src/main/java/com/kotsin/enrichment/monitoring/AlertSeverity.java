package com.kotsin.enrichment.monitoring;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
