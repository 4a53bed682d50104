package com.kotsin.enrichment.learning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Describes one provider invocation attempt, as seen by the failure predictor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationContext {

    private String providerKind;
    private String asset;
    private Instant timestamp;

    // Features
    private int hourOfDay;       // 0..23
    private int dayOfWeek;       // 0 = Monday .. 6 = Sunday
    private double volatility;
    private int errorStreak;     // errors in the provider's last 5 outcomes
    private double systemLoad;
    private int qualityScore;    // 1..5
}
