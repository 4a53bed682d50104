package com.kotsin.enrichment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market conditions at the time of the request. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSnapshot {

    private Double price;
    private Double volume;
    private Double change24h;
    private Double volatility;
}
