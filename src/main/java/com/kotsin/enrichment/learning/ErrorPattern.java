package com.kotsin.enrichment.learning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Per-provider summary of recorded outcomes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPattern {

    private String providerKind;
    private int totalOperations;
    private int errors;
    private int avoided;
    private double errorRate;
    private List<Integer> recentErrorHours;
    private Map<String, Double> avgSuccessMetrics;
}
