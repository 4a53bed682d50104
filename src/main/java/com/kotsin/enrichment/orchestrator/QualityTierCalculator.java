package com.kotsin.enrichment.orchestrator;

import com.kotsin.enrichment.model.QualityTier;

import java.util.Collection;

/**
 * Quality score after enrichment: {@code min(5, base + 0.5 * contributors + 0.5 * confidence)},
 * tier = floor of the score.
 *
 * <p>Adding a contributor adds 0.5 while the mean confidence can move by at most 1,
 * so a new successful provider never lowers the score.
 */
public final class QualityTierCalculator {

    static final double CONTRIBUTOR_WEIGHT = 0.5;
    static final double CONFIDENCE_WEIGHT = 0.5;
    static final double MAX_SCORE = 5.0;
    static final double NO_CONTRIBUTOR_CONFIDENCE = 0.5;

    private QualityTierCalculator() {
    }

    /**
     * Mean of contributor confidences, clamped to [0, 1]; 0.5 when there are none.
     */
    public static double aggregateConfidence(Collection<Double> confidences) {
        if (confidences.isEmpty()) {
            return NO_CONTRIBUTOR_CONFIDENCE;
        }
        double sum = 0.0;
        for (double c : confidences) {
            sum += Math.max(0.0, Math.min(1.0, c));
        }
        return sum / confidences.size();
    }

    public static double score(QualityTier base, int contributors, double aggregateConfidence) {
        double raw = base.getScore() + CONTRIBUTOR_WEIGHT * contributors + CONFIDENCE_WEIGHT * aggregateConfidence;
        return Math.min(MAX_SCORE, raw);
    }

    public static QualityTier tier(QualityTier base, int contributors, double aggregateConfidence) {
        return QualityTier.fromScore(score(base, contributors, aggregateConfidence));
    }
}
