package com.kotsin.enrichment.version;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;

/**
 * Time-boxed traffic split between two versions of one provider kind.
 * Per-arm counters are updated under the experiment's own lock.
 */
public class Experiment {

    static final int METRIC_WINDOW = 50;

    private final String experimentId;
    private final String providerKind;
    private final String versionA;
    private final String versionB;
    private final double trafficSplit;
    private final Instant startedAt;
    private final Instant endsAt;

    private final Arm armA = new Arm();
    private final Arm armB = new Arm();
    private ExperimentStatus status = ExperimentStatus.RUNNING;
    private ExperimentResults finalResults;

    Experiment(String experimentId, String providerKind, String versionA, String versionB,
               double trafficSplit, Instant startedAt, Instant endsAt) {
        this.experimentId = experimentId;
        this.providerKind = providerKind;
        this.versionA = versionA;
        this.versionB = versionB;
        this.trafficSplit = trafficSplit;
        this.startedAt = startedAt;
        this.endsAt = endsAt;
    }

    private static final class Arm {
        long requests;
        long errors;
        final Map<String, Deque<Double>> metrics = new TreeMap<>();
    }

    synchronized boolean record(String versionId, boolean success, Map<String, Double> metrics) {
        Arm arm = versionA.equals(versionId) ? armA : versionB.equals(versionId) ? armB : null;
        if (arm == null) {
            return false;
        }
        arm.requests++;
        if (!success) {
            arm.errors++;
        }
        if (metrics != null) {
            metrics.forEach((name, value) -> {
                Deque<Double> window = arm.metrics.computeIfAbsent(name, k -> new ArrayDeque<>());
                window.addLast(value);
                while (window.size() > METRIC_WINDOW) {
                    window.removeFirst();
                }
            });
        }
        return true;
    }

    synchronized ArmStats statsA() {
        return stats(versionA, armA);
    }

    synchronized ArmStats statsB() {
        return stats(versionB, armB);
    }

    private static ArmStats stats(String versionId, Arm arm) {
        Map<String, Double> averages = new TreeMap<>();
        arm.metrics.forEach((name, window) -> averages.put(name,
                window.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)));
        return ArmStats.builder()
                .versionId(versionId)
                .requests(arm.requests)
                .errors(arm.errors)
                .errorRate(arm.requests > 0 ? (double) arm.errors / arm.requests : 0.0)
                .avgMetrics(averages)
                .build();
    }

    synchronized void complete(ExperimentResults results) {
        this.status = ExperimentStatus.COMPLETED;
        this.finalResults = results;
    }

    synchronized ExperimentStatus getStatus() {
        return status;
    }

    synchronized ExperimentResults getFinalResults() {
        return finalResults;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(endsAt);
    }

    public String getExperimentId() {
        return experimentId;
    }

    public String getProviderKind() {
        return providerKind;
    }

    public String getVersionA() {
        return versionA;
    }

    public String getVersionB() {
        return versionB;
    }

    public double getTrafficSplit() {
        return trafficSplit;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndsAt() {
        return endsAt;
    }
}
