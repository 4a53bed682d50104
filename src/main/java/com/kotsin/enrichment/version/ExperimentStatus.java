package com.kotsin.enrichment.version;

public enum ExperimentStatus {
    RUNNING,
    COMPLETED
}
