package com.kotsin.enrichment.monitoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private String message;
    private double value;
    private double threshold;
    private Instant raisedAt;
}
