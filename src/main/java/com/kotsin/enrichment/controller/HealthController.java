package com.kotsin.enrichment.controller;

import com.kotsin.enrichment.breaker.CircuitBreakerRegistry;
import com.kotsin.enrichment.breaker.CircuitBreakerStatus;
import com.kotsin.enrichment.learning.FailurePredictor;
import com.kotsin.enrichment.monitoring.Alert;
import com.kotsin.enrichment.monitoring.AlertSeverity;
import com.kotsin.enrichment.monitoring.HealthMonitor;
import com.kotsin.enrichment.orchestrator.EnrichmentOrchestrator;
import com.kotsin.enrichment.settings.ConfigurationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health check and metrics endpoint
 *
 * KUBERNETES READY: Provides liveness and readiness probes
 */
@RestController
@RequestMapping("/api/v1/health")
@Slf4j
public class HealthController {

    private final HealthMonitor monitor;
    private final CircuitBreakerRegistry breakers;
    private final FailurePredictor predictor;
    private final EnrichmentOrchestrator orchestrator;
    private final ConfigurationStore config;
    private final Clock clock;

    public HealthController(HealthMonitor monitor,
                            CircuitBreakerRegistry breakers,
                            FailurePredictor predictor,
                            EnrichmentOrchestrator orchestrator,
                            ConfigurationStore config,
                            Clock clock) {
        this.monitor = monitor;
        this.breakers = breakers;
        this.predictor = predictor;
        this.orchestrator = orchestrator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Liveness probe - Is the application running?
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> liveness() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.millis());
        return ResponseEntity.ok(response);
    }

    /**
     * Readiness probe - DOWN while the health score is below the shedding threshold.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        double score = monitor.healthScore();
        double threshold = config.getDouble("system.shed_below_health", 0.3);
        boolean ready = score >= threshold;

        Map<String, Object> response = new HashMap<>();
        response.put("status", ready ? "UP" : "DOWN");
        response.put("timestamp", clock.millis());
        response.put("healthScore", score);

        if (!ready) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * Detailed health check
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("healthScore", monitor.healthScore());
        response.put("availableProviders", orchestrator.getAvailableProviders());
        response.put("circuitBreakersOpen", breakers.openCount());
        response.put("activeAlerts", monitor.activeAlerts(null).size());
        response.put("modelTrained", predictor.isModelTrained());
        response.put("timestamp", clock.millis());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<Alert>> alerts(@RequestParam(required = false) AlertSeverity severity) {
        return ResponseEntity.ok(monitor.activeAlerts(severity));
    }

    @GetMapping("/breakers")
    public ResponseEntity<Map<String, CircuitBreakerStatus>> circuitBreakers() {
        return ResponseEntity.ok(breakers.statuses());
    }

    @GetMapping("/report")
    public ResponseEntity<Map<String, Object>> report() {
        return ResponseEntity.ok(monitor.monitoringReport());
    }

    @GetMapping("/learning")
    public ResponseEntity<Map<String, Object>> learning() {
        return ResponseEntity.ok(predictor.insights());
    }
}
