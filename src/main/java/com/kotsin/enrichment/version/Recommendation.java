package com.kotsin.enrichment.version;

/**
 * Outcome of comparing the two arms of an experiment.
 */
public enum Recommendation {
    /** Arm A's error rate is clearly lower. */
    ADOPT_A,
    /** Arm B's error rate is clearly lower. */
    ADOPT_B,
    /** Both arms reached the minimum sample size without a clear difference. */
    INSUFFICIENT_EVIDENCE,
    /** At least one arm is below the minimum sample size. */
    CONTINUE_TESTING
}
