package com.kotsin.enrichment.breaker;

import com.kotsin.enrichment.settings.ConfigChange;
import com.kotsin.enrichment.settings.ConfigChangeListener;
import com.kotsin.enrichment.settings.ConfigurationStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One breaker per provider kind, created on first use.
 *
 * Thresholds come from {@code circuit_breakers.<kind>.*} in the live configuration,
 * then {@code circuit_breakers.*}. They are read when the breaker is created. On a
 * threshold change, CLOSED breakers are recreated at once; OPEN and HALF_OPEN ones
 * keep their state until they close or {@link #reset(String)} drops them.
 */
@Slf4j
@Component
public class CircuitBreakerRegistry {

    static final int DEFAULT_FAILURE_THRESHOLD = 3;
    static final long DEFAULT_RECOVERY_TIMEOUT_MS = 120_000L;
    private static final String PREFIX = "circuit_breakers.";

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final ConfigurationStore config;
    private final Clock clock;
    private final ConfigChangeListener thresholdListener = this::onConfigChange;

    public CircuitBreakerRegistry(ConfigurationStore config, Clock clock) {
        this.config = config;
        this.clock = clock;
        config.onChange(thresholdListener);
    }

    @PreDestroy
    public void shutdown() {
        config.removeListener(thresholdListener);
    }

    private void onConfigChange(Map<String, ConfigChange> changes) {
        Set<String> kinds = new HashSet<>();
        for (String path : changes.keySet()) {
            if (!path.startsWith(PREFIX)) {
                continue;
            }
            String rest = path.substring(PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot < 0) {
                // Global threshold; every breaker without its own value may be affected
                kinds.addAll(breakers.keySet());
            } else {
                kinds.add(rest.substring(0, dot));
            }
        }
        for (String kind : kinds) {
            refreshIfClosed(kind);
        }
    }

    private void refreshIfClosed(String kind) {
        breakers.computeIfPresent(kind, (k, current) -> {
            if (current.getState() != CircuitBreaker.State.CLOSED) {
                log.info("[BREAKER] '{}' is {}, new thresholds apply once it closes or is reset",
                        k, current.getState());
                return current;
            }
            CircuitBreaker replacement = create(k);
            log.info("[BREAKER] '{}' recreated with threshold={} recovery={}ms",
                    k, replacement.status().getFailureThreshold(), replacement.status().getRecoveryTimeoutMs());
            return replacement;
        });
    }

    public CircuitBreaker get(String kind) {
        return breakers.computeIfAbsent(kind, this::create);
    }

    private CircuitBreaker create(String kind) {
        int globalThreshold = config.getInt("circuit_breakers.failure_threshold", DEFAULT_FAILURE_THRESHOLD);
        long globalRecovery = config.getLong("circuit_breakers.recovery_timeout_ms", DEFAULT_RECOVERY_TIMEOUT_MS);
        int threshold = config.getInt("circuit_breakers." + kind + ".failure_threshold", globalThreshold);
        long recovery = config.getLong("circuit_breakers." + kind + ".recovery_timeout_ms", globalRecovery);
        return new CircuitBreaker(kind, threshold, recovery, clock);
    }

    /**
     * Number of breakers currently OPEN.
     */
    public int openCount() {
        int open = 0;
        for (CircuitBreaker breaker : breakers.values()) {
            if (breaker.isOpen()) {
                open++;
            }
        }
        return open;
    }

    public Map<String, CircuitBreakerStatus> statuses() {
        Map<String, CircuitBreakerStatus> result = new TreeMap<>();
        breakers.forEach((kind, breaker) -> result.put(kind, breaker.status()));
        return result;
    }

    /**
     * Drop the breaker for a kind; the next call recreates it CLOSED with current thresholds.
     *
     * @return true if a breaker existed
     */
    public boolean reset(String kind) {
        CircuitBreaker removed = breakers.remove(kind);
        if (removed != null) {
            log.info("[BREAKER] '{}' reset via registry, last stats: {}", kind, removed.getStats());
            return true;
        }
        return false;
    }

    public void resetAll() {
        breakers.keySet().forEach(this::reset);
    }
}
