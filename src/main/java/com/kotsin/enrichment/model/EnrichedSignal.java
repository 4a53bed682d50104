package com.kotsin.enrichment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of an enrichment call.
 *
 * <p>{@code providerFields} is keyed by provider kind; each provider's fields live
 * only under its own namespace.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedSignal {

    // Base signal
    private String signalId;
    private String asset;
    private Direction direction;
    private Double price;
    private Instant createdAt;
    private Map<String, Object> attributes;
    private QualityTier baseQualityTier;
    private double baseConfidence;

    // Enrichment
    private Map<String, Map<String, Object>> providerFields;
    private List<String> providersUsed;
    private Map<String, String> providerVersions;
    private double confidence;
    private QualityTier qualityTier;
    private double qualityScore;

    // Diagnostics
    private Map<String, ProviderDiagnostic> diagnostics;
    private List<String> validationWarnings;
    private double dataQualityScore;
    private double marketDataQualityScore;
    private boolean cacheUsed;
    private long processingTimeMs;
    private Instant enrichedAt;
}
