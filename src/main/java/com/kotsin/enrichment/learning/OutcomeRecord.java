package com.kotsin.enrichment.learning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable pairing of an attempt's context with its result.
 *
 * <p>A call the predictor skipped is recorded with {@code avoided = true} and
 * {@code hadError = false}.
 */
@Value
@Builder
@Jacksonized
public class OutcomeRecord {

    OperationContext context;
    boolean hadError;
    String errorDetail;
    Map<String, Object> successMetrics;
    boolean avoided;
    Instant timestamp;
}
