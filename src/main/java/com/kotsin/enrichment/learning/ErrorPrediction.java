package com.kotsin.enrichment.learning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPrediction {

    private double errorProbability;
    private double confidence;
    private boolean shouldAttempt;
    @Builder.Default
    private List<String> alternatives = Collections.emptyList();
    private boolean modelBased;
}
