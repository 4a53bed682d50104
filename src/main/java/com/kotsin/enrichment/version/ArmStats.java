package com.kotsin.enrichment.version;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArmStats {

    private String versionId;
    private long requests;
    private long errors;
    private double errorRate;
    private Map<String, Double> avgMetrics;
}
