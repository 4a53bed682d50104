package com.kotsin.enrichment.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CircuitBreaker - Isolates failures of a single enrichment provider
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failure count reached the threshold, calls fail fast
 * - HALF_OPEN: Recovery timeout elapsed, exactly one trial call is admitted
 *
 * A success while CLOSED decrements the failure count (floored at 0), so a
 * provider that fails intermittently recovers credit gradually. The recovery
 * timeout is measured from the most recent failure.
 *
 * Callers either wrap a call with {@link #attempt(Callable)} or drive the
 * permission API ({@link #tryAcquirePermission()}, {@link #onSuccess()},
 * {@link #onFailure(Throwable)}) when the call completes asynchronously.
 */
@Slf4j
public class CircuitBreaker {

    public enum State {
        CLOSED,     // Normal - calls pass
        OPEN,       // Failed - calls blocked
        HALF_OPEN   // Testing recovery with a single call
    }

    private final String name;
    private final int failureThreshold;
    private final long recoveryTimeoutMs;
    private final Clock clock;

    // Guarded by this
    private State state = State.CLOSED;
    private int failureCount;
    private long lastFailureTime;
    private boolean trialInFlight;

    // Statistics
    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong rejectedCalls = new AtomicLong(0);
    private final AtomicLong successfulCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);

    /**
     * @param name provider kind, used for logging
     * @param failureThreshold failures before opening
     * @param recoveryTimeoutMs time after the last failure before a trial call is admitted
     * @param clock time source
     */
    public CircuitBreaker(String name, int failureThreshold, long recoveryTimeoutMs, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (recoveryTimeoutMs < 0) {
            throw new IllegalArgumentException("recoveryTimeoutMs must be >= 0");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeoutMs = recoveryTimeoutMs;
        this.clock = clock;

        log.info("[BREAKER] '{}' created: threshold={}, recoveryTimeout={}ms",
                name, failureThreshold, recoveryTimeoutMs);
    }

    // ======================== CALL WRAPPING ========================

    /**
     * Run a call through the breaker.
     *
     * @throws CircuitBreakerOpenException if the breaker refuses the call; the call is not invoked
     * @throws Exception whatever the call throws, after it has been counted as a failure
     */
    public <T> T attempt(Callable<T> call) throws Exception {
        if (!tryAcquirePermission()) {
            throw new CircuitBreakerOpenException(name);
        }
        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            onFailure(e);
            throw e;
        }
        onSuccess();
        return result;
    }

    // ======================== PERMISSION API ========================

    /**
     * Ask to make one call. A granted permission must be followed by exactly one
     * {@link #onSuccess()} or {@link #onFailure(Throwable)}.
     */
    public synchronized boolean tryAcquirePermission() {
        totalCalls.incrementAndGet();

        if (state == State.OPEN) {
            long elapsed = clock.millis() - lastFailureTime;
            if (elapsed < recoveryTimeoutMs) {
                reject();
                return false;
            }
            transitionTo(State.HALF_OPEN);
        }

        if (state == State.HALF_OPEN) {
            if (trialInFlight) {
                reject();
                return false;
            }
            trialInFlight = true;
        }
        return true;
    }

    public synchronized void onSuccess() {
        successfulCalls.incrementAndGet();

        if (state == State.HALF_OPEN) {
            trialInFlight = false;
            transitionTo(State.CLOSED);
        } else if (state == State.CLOSED && failureCount > 0) {
            failureCount--;
        }
    }

    public synchronized void onFailure(Throwable error) {
        failedCalls.incrementAndGet();
        failureCount++;
        lastFailureTime = clock.millis();

        log.warn("[BREAKER] '{}' failure #{}: {}", name, failureCount,
                error == null ? "unknown" : error.getMessage());

        if (state == State.HALF_OPEN) {
            trialInFlight = false;
            transitionTo(State.OPEN);
        } else if (state == State.CLOSED && failureCount >= failureThreshold) {
            transitionTo(State.OPEN);
        }
    }

    private void reject() {
        rejectedCalls.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("[BREAKER] '{}' {} - rejecting call", name, state);
        }
    }

    // ======================== STATE ========================

    public synchronized State getState() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state == State.OPEN;
    }

    /**
     * Force reset to closed state
     */
    public synchronized void reset() {
        state = State.CLOSED;
        failureCount = 0;
        trialInFlight = false;
        log.info("[BREAKER] '{}' manually reset to CLOSED", name);
    }

    private void transitionTo(State newState) {
        State oldState = this.state;
        this.state = newState;

        if (newState == State.OPEN) {
            log.warn("[BREAKER] '{}' OPENED after {} failures", name, failureCount);
        } else if (newState == State.HALF_OPEN) {
            log.info("[BREAKER] '{}' HALF_OPEN - admitting trial call", name);
        } else {
            failureCount = 0;
            log.info("[BREAKER] '{}' CLOSED - provider recovered", name);
        }

        log.debug("[BREAKER] '{}' state: {} -> {}", name, oldState, newState);
    }

    // ======================== STATS ========================

    public String getName() {
        return name;
    }

    public synchronized CircuitBreakerStatus status() {
        return CircuitBreakerStatus.builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .lastFailureTime(lastFailureTime)
                .failureThreshold(failureThreshold)
                .recoveryTimeoutMs(recoveryTimeoutMs)
                .totalCalls(totalCalls.get())
                .successfulCalls(successfulCalls.get())
                .failedCalls(failedCalls.get())
                .rejectedCalls(rejectedCalls.get())
                .build();
    }

    public String getStats() {
        return String.format(
            "CircuitBreaker '%s': state=%s, total=%d, success=%d, failed=%d, rejected=%d",
            name, getState(), totalCalls.get(), successfulCalls.get(), failedCalls.get(), rejectedCalls.get()
        );
    }

    public void logStats() {
        log.info("[BREAKER] {}", getStats());
    }
}
