package com.kotsin.enrichment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-provider diagnostic attached to an enriched signal for operators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderDiagnostic {

    private String kind;
    private ProviderStatus status;
    private long latencyMs;
    private String versionId;
    private Double confidence;
    private String detail;
    private Double errorProbability;
    private List<String> alternatives;
}
