package com.kotsin.enrichment.monitoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricStats {

    private String metric;
    private int count;
    private double mean;
    private double min;
    private double max;
    private double latest;
    private double stdDev;

    static MetricStats empty(String metric) {
        return MetricStats.builder().metric(metric).build();
    }
}
