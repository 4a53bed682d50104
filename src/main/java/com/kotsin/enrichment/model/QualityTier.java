package com.kotsin.enrichment.model;

import java.util.Locale;

/**
 * Ordinal rating of a signal's enrichment completeness and confidence.
 */
public enum QualityTier {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    ULTRA(4),
    ELITE(5);

    private final int score;

    QualityTier(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    /**
     * Tier for a numeric score. Scores are floored and clamped to 1..5.
     */
    public static QualityTier fromScore(double score) {
        int floored = (int) Math.floor(score);
        if (floored <= 1) {
            return LOW;
        }
        if (floored >= 5) {
            return ELITE;
        }
        return values()[floored - 1];
    }

    /**
     * @return the tier, or null when the value is not recognised
     */
    public static QualityTier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("QUANTUM_ELITE".equals(normalized)) {
            return ELITE;
        }
        for (QualityTier tier : values()) {
            if (tier.name().equals(normalized)) {
                return tier;
            }
        }
        return null;
    }
}
