package com.kotsin.enrichment.breaker;

/**
 * Thrown when a breaker refuses a call without invoking it.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
