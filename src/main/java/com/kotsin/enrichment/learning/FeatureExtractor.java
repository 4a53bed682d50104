package com.kotsin.enrichment.learning;

import com.kotsin.enrichment.settings.ConfigDefaults;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps an {@link OperationContext} to a fixed-scale feature vector.
 *
 * Scaling is fixed rather than fitted, so a vector means the same thing before
 * and after a retrain. Provider kind is one-hot encoded; unknown kinds share the
 * "other" slot.
 */
public final class FeatureExtractor {

    static final int MAX_STREAK = 5;

    private static final List<String> KNOWN_KINDS = List.of(
            ConfigDefaults.PRICE_PREDICTOR,
            ConfigDefaults.POLICY_ENGINE,
            ConfigDefaults.SENTIMENT,
            ConfigDefaults.CONSENSUS);

    public static final List<String> FEATURE_NAMES;

    static {
        List<String> names = new ArrayList<>(List.of(
                "time_of_day", "day_of_week", "volatility", "error_streak", "system_load", "quality_score"));
        for (String kind : KNOWN_KINDS) {
            names.add("kind_" + kind);
        }
        names.add("kind_other");
        FEATURE_NAMES = Collections.unmodifiableList(names);
    }

    private FeatureExtractor() {
    }

    public static int dimension() {
        return FEATURE_NAMES.size();
    }

    public static double[] extract(OperationContext context) {
        double[] features = new double[dimension()];
        features[0] = context.getHourOfDay() / 24.0;
        features[1] = context.getDayOfWeek() / 6.0;
        features[2] = clamp01(context.getVolatility());
        features[3] = Math.min(context.getErrorStreak(), MAX_STREAK) / (double) MAX_STREAK;
        features[4] = clamp01(context.getSystemLoad());
        features[5] = clamp01(context.getQualityScore() / 5.0);

        int kindIndex = KNOWN_KINDS.indexOf(context.getProviderKind());
        features[6 + (kindIndex >= 0 ? kindIndex : KNOWN_KINDS.size())] = 1.0;
        return features;
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
