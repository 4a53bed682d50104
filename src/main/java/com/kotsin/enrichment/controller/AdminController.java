package com.kotsin.enrichment.controller;

import com.kotsin.enrichment.breaker.CircuitBreakerRegistry;
import com.kotsin.enrichment.cache.ResultCache;
import com.kotsin.enrichment.learning.FailurePredictor;
import com.kotsin.enrichment.settings.ConfigurationStore;
import com.kotsin.enrichment.version.ExperimentResults;
import com.kotsin.enrichment.version.VersionManager;
import com.kotsin.enrichment.version.VersionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AdminController - Administrative endpoints for the enrichment core.
 *
 * Endpoints:
 * - GET  /admin/config                       - Current configuration snapshot
 * - PUT  /admin/config?path=...              - Set one value (validated, persisted)
 * - POST /admin/config/reset                 - Restore defaults
 * - GET  /admin/features                     - Feature flags
 * - POST /admin/features/{name}/enable|disable
 * - GET  /admin/versions/{kind}              - List versions for a provider
 * - POST /admin/versions/{kind}              - Create (and activate) a version
 * - POST /admin/versions/{kind}/{id}/activate
 * - POST /admin/experiments                  - Start an A/B experiment
 * - GET  /admin/experiments[/{id}]           - Experiment results
 * - POST /admin/cache/invalidate?pattern=... - Invalidate cached results
 * - POST /admin/breakers/{kind}/reset        - Reset a circuit breaker
 * - POST /admin/learning/retrain             - Retrain the failure model now
 *
 * Security Note: These endpoints should be protected in production.
 */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final ConfigurationStore config;
    private final VersionManager versions;
    private final ResultCache cache;
    private final CircuitBreakerRegistry breakers;
    private final FailurePredictor predictor;

    // ======================== CONFIG ========================

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("version", config.snapshot().getVersion());
        response.put("loadedAt", config.snapshot().getLoadedAt());
        response.put("config", config.snapshot().asMap());
        return ResponseEntity.ok(response);
    }

    @PutMapping("/config")
    public ResponseEntity<Map<String, Object>> setConfig(@RequestParam String path, @RequestBody Object value) {
        log.info("[ADMIN] Setting config {}={}", path, value);
        config.set(path, value);
        return ResponseEntity.ok(success("config_updated", Map.of("path", path, "value", value)));
    }

    @PostMapping("/config/reset")
    public ResponseEntity<Map<String, Object>> resetConfig() {
        log.warn("[ADMIN] Resetting configuration to defaults");
        config.resetToDefaults();
        return ResponseEntity.ok(success("config_reset", Map.of()));
    }

    @GetMapping("/features")
    public ResponseEntity<Map<String, Boolean>> features() {
        return ResponseEntity.ok(config.getFeatureFlags());
    }

    @PostMapping("/features/{name}/enable")
    public ResponseEntity<Map<String, Object>> enableFeature(@PathVariable String name) {
        config.enableFeature(name);
        return ResponseEntity.ok(success("feature_enabled", Map.of("feature", name)));
    }

    @PostMapping("/features/{name}/disable")
    public ResponseEntity<Map<String, Object>> disableFeature(@PathVariable String name) {
        config.disableFeature(name);
        return ResponseEntity.ok(success("feature_disabled", Map.of("feature", name)));
    }

    // ======================== VERSIONS ========================

    @GetMapping("/versions/{kind}")
    public ResponseEntity<List<VersionRecord>> listVersions(@PathVariable String kind) {
        return ResponseEntity.ok(versions.listVersions(kind));
    }

    @PostMapping("/versions/{kind}")
    public ResponseEntity<Map<String, Object>> createVersion(@PathVariable String kind,
                                                             @RequestBody Map<String, Object> versionConfig,
                                                             @RequestParam(required = false) String parent,
                                                             @RequestParam(required = false) String description) {
        String versionId = versions.createVersion(kind, versionConfig, parent, description);
        return ResponseEntity.ok(success("version_created", Map.of("versionId", versionId)));
    }

    @PostMapping("/versions/{kind}/{versionId}/activate")
    public ResponseEntity<Map<String, Object>> activateVersion(@PathVariable String kind,
                                                               @PathVariable String versionId) {
        versions.activateVersion(kind, versionId);
        return ResponseEntity.ok(success("version_activated", Map.of("versionId", versionId)));
    }

    // ======================== EXPERIMENTS ========================

    @PostMapping("/experiments")
    public ResponseEntity<Map<String, Object>> startExperiment(@RequestParam String kind,
                                                               @RequestParam String versionA,
                                                               @RequestParam String versionB,
                                                               @RequestParam(defaultValue = "0.5") double split,
                                                               @RequestParam(defaultValue = "24") long durationHours) {
        String experimentId = versions.startExperiment(kind, versionA, versionB, split,
                Duration.ofHours(durationHours));
        return ResponseEntity.ok(success("experiment_started", Map.of("experimentId", experimentId)));
    }

    @GetMapping("/experiments")
    public ResponseEntity<List<ExperimentResults>> listExperiments() {
        return ResponseEntity.ok(versions.listExperiments());
    }

    @GetMapping("/experiments/{experimentId}")
    public ResponseEntity<ExperimentResults> experiment(@PathVariable String experimentId) {
        return versions.getExperimentResults(experimentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // ======================== CACHE / BREAKERS / LEARNING ========================

    @PostMapping("/cache/invalidate")
    public ResponseEntity<Map<String, Object>> invalidateCache(@RequestParam(defaultValue = "*") String pattern) {
        int removed = cache.invalidate(pattern);
        log.info("[ADMIN] Invalidated {} cache entries matching {}", removed, pattern);
        return ResponseEntity.ok(success("cache_invalidated", Map.of("pattern", pattern, "removed", removed)));
    }

    @PostMapping("/breakers/{kind}/reset")
    public ResponseEntity<Map<String, Object>> resetBreaker(@PathVariable String kind) {
        if (!breakers.reset(kind)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(success("breaker_reset", Map.of("kind", kind)));
    }

    @PostMapping("/learning/retrain")
    public ResponseEntity<Map<String, Object>> retrain() {
        boolean trained = predictor.retrain();
        return ResponseEntity.ok(success("retrain", Map.of("trained", trained, "history", predictor.historySize())));
    }

    private static Map<String, Object> success(String action, Map<String, ?> details) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("action", action);
        response.putAll(details);
        return response;
    }
}
