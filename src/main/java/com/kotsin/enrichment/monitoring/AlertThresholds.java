package com.kotsin.enrichment.monitoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertThresholds {

    @Builder.Default
    private double errorRate = 0.1;
    /** Latest enrichment time above baseline times this factor counts as degraded. */
    @Builder.Default
    private double latencyDegradationFactor = 2.0;
    @Builder.Default
    private int openBreakers = 2;
    @Builder.Default
    private double memoryUsage = 0.8;
    @Builder.Default
    private double cacheMissRate = 0.9;

    public static AlertThresholds defaults() {
        return AlertThresholds.builder().build();
    }
}
