package com.kotsin.enrichment.controller;

import com.kotsin.enrichment.model.EnrichedSignal;
import com.kotsin.enrichment.orchestrator.EnrichmentOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * EnrichmentController - Signal enrichment endpoint.
 *
 * Endpoints:
 * - POST /api/v1/enrichment        - Enrich one signal
 * - GET  /api/v1/enrichment/stats  - Orchestrator statistics
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/enrichment")
@RequiredArgsConstructor
public class EnrichmentController {

    private final EnrichmentOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<EnrichedSignal> enrich(@RequestBody EnrichmentRequest request) {
        EnrichedSignal result = orchestrator.enrich(request.getSignal(), request.getContext(), request.isForceRefresh());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(orchestrator.getEnrichmentStats());
    }
}
