package com.kotsin.enrichment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request-scoped context passed alongside a signal.
 *
 * <p>{@code requestId} drives experiment routing and is excluded from cache keys.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentContext {

    private String requestId;
    private MarketSnapshot market;
    private Double systemLoad;
}
