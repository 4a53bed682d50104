package com.kotsin.enrichment.version;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentResults {

    private String experimentId;
    private String providerKind;
    private ExperimentStatus status;
    private double trafficSplit;
    private Instant startedAt;
    private Instant endsAt;
    private ArmStats armA;
    private ArmStats armB;

    /** Version id with the lower error rate, null on a tie. */
    private String winner;
    private double confidence;
    private Recommendation recommendation;
    private boolean sampleSizeSufficient;
    private Instant finalizedAt;
}
