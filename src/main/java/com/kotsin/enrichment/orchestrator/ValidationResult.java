package com.kotsin.enrichment.orchestrator;

import com.kotsin.enrichment.model.SanitizedSignal;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Sanitised signal plus what was wrong with the input. Never a rejection.
 */
@Data
@Builder
public class ValidationResult {

    private SanitizedSignal signal;
    private List<String> warnings;
    /** 1.0 when every signal field was present, lower per missing field. */
    private double signalQualityScore;
    private double marketQualityScore;
    /** The input had no creation time and {@code signal.createdAt} was filled with the current time. */
    private boolean createdAtDefaulted;

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
