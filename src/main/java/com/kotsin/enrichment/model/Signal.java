package com.kotsin.enrichment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Base signal as supplied by the producer. Fields are raw strings and boxed
 * numbers; {@code SignalValidator} coerces them into a {@link SanitizedSignal}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Signal {

    private String signalId;
    private String asset;
    private String direction;
    private String qualityTier;
    private Double confidence;
    private Double price;
    private Instant createdAt;
    private Map<String, Object> attributes;
}
