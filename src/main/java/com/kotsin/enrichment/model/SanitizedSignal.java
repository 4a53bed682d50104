package com.kotsin.enrichment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Typed signal after validation. Asset and direction are always set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SanitizedSignal {

    private String signalId;
    private String asset;
    private Direction direction;
    private QualityTier qualityTier;
    private double confidence;
    private Double price;
    private Instant createdAt;
    private Map<String, Object> attributes;
}
