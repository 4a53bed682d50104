package com.kotsin.enrichment.breaker;

import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of a breaker.
 */
@Data
@Builder
public class CircuitBreakerStatus {

    private String name;
    private CircuitBreaker.State state;
    private int failureCount;
    private long lastFailureTime;
    private int failureThreshold;
    private long recoveryTimeoutMs;
    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
}
