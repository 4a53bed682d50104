package com.kotsin.enrichment.orchestrator;

import com.kotsin.enrichment.breaker.CircuitBreaker;
import com.kotsin.enrichment.breaker.CircuitBreakerRegistry;
import com.kotsin.enrichment.cache.CacheKeyGenerator;
import com.kotsin.enrichment.cache.ResultCache;
import com.kotsin.enrichment.learning.ErrorPrediction;
import com.kotsin.enrichment.learning.FailurePredictor;
import com.kotsin.enrichment.learning.OperationContext;
import com.kotsin.enrichment.model.EnrichedSignal;
import com.kotsin.enrichment.model.EnrichmentContext;
import com.kotsin.enrichment.model.ProviderDiagnostic;
import com.kotsin.enrichment.model.ProviderFieldBag;
import com.kotsin.enrichment.model.ProviderStatus;
import com.kotsin.enrichment.model.QualityTier;
import com.kotsin.enrichment.model.SanitizedSignal;
import com.kotsin.enrichment.model.Signal;
import com.kotsin.enrichment.monitoring.HealthMonitor;
import com.kotsin.enrichment.monitoring.MetricNames;
import com.kotsin.enrichment.provider.EnrichmentProvider;
import com.kotsin.enrichment.provider.ProviderCallContext;
import com.kotsin.enrichment.provider.ProviderException;
import com.kotsin.enrichment.provider.ProviderRegistry;
import com.kotsin.enrichment.provider.ProviderResult;
import com.kotsin.enrichment.settings.ConfigChange;
import com.kotsin.enrichment.settings.ConfigChangeListener;
import com.kotsin.enrichment.settings.ConfigSnapshot;
import com.kotsin.enrichment.settings.ConfigurationStore;
import com.kotsin.enrichment.version.VersionAssignment;
import com.kotsin.enrichment.version.VersionManager;
import com.kotsin.enrichment.version.VersionRecord;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * EnrichmentOrchestrator - Fans a signal out to enrichment providers and merges the results
 *
 * FLOW:
 * 1. Sanitise the input (never rejects)
 * 2. Resolve available providers and their versions, derive the cache key
 * 3. On a cache hit return the cached result
 * 4. Per provider: load shedding, failure prediction, breaker permission
 * 5. Permitted calls run on the bounded worker pool, each with its own timeout
 * 6. Wait until every call settles or the global timeout passes; stragglers are abandoned
 * 7. Merge results in completion order, score confidence and quality tier
 * 8. Cache when at least one provider contributed; record outcomes and metrics
 *
 * Provider failures never escape {@link #enrich}; they show up as diagnostics and a
 * lower tier and confidence.
 */
@Slf4j
@Service
public class EnrichmentOrchestrator {

    static final long DEFAULT_GLOBAL_TIMEOUT_MS = 30_000L;
    static final long DEFAULT_CALL_TIMEOUT_MS = 10_000L;
    static final double DEFAULT_SHED_BELOW_HEALTH = 0.3;
    static final long DEFAULT_CACHE_TTL_SECONDS = 300L;
    static final String DEFAULT_VERSION = "default";

    private final ProviderRegistry providers;
    private final CircuitBreakerRegistry breakers;
    private final ResultCache cache;
    private final CacheKeyGenerator keyGenerator;
    private final FailurePredictor predictor;
    private final ConfigurationStore config;
    private final VersionManager versions;
    private final HealthMonitor monitor;
    private final SignalValidator validator;
    private final AsyncTaskExecutor executor;
    private final Clock clock;

    private final ConfigChangeListener availabilityListener = this::onConfigChange;
    private volatile List<String> availableKinds = Collections.emptyList();

    // Statistics
    private final AtomicLong totalEnrichments = new AtomicLong(0);
    private final AtomicLong cacheLookups = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong totalProcessingMs = new AtomicLong(0);
    private final AtomicLong globalTimeouts = new AtomicLong(0);
    private final Map<String, ProviderStats> providerStats = new ConcurrentHashMap<>();

    public EnrichmentOrchestrator(ProviderRegistry providers,
                                  CircuitBreakerRegistry breakers,
                                  ResultCache cache,
                                  CacheKeyGenerator keyGenerator,
                                  FailurePredictor predictor,
                                  ConfigurationStore config,
                                  VersionManager versions,
                                  HealthMonitor monitor,
                                  SignalValidator validator,
                                  @Qualifier("enrichmentExecutor") AsyncTaskExecutor executor,
                                  Clock clock) {
        this.providers = providers;
        this.breakers = breakers;
        this.cache = cache;
        this.keyGenerator = keyGenerator;
        this.predictor = predictor;
        this.config = config;
        this.versions = versions;
        this.monitor = monitor;
        this.validator = validator;
        this.executor = executor;
        this.clock = clock;

        refreshAvailability();
        config.onChange(availabilityListener);
    }

    @PreDestroy
    public void shutdown() {
        config.removeListener(availabilityListener);
    }

    // ======================== AVAILABILITY ========================

    private void onConfigChange(Map<String, ConfigChange> changes) {
        boolean relevant = changes.keySet().stream()
                .anyMatch(path -> path.startsWith("providers.") || path.startsWith("features."));
        if (relevant) {
            refreshAvailability();
        }
    }

    private void refreshAvailability() {
        List<String> kinds = providers.kinds().stream()
                .filter(config::isProviderAvailable)
                .sorted()
                .collect(Collectors.toUnmodifiableList());
        if (!kinds.equals(availableKinds)) {
            log.info("[ENRICH] Available providers: {} -> {}", availableKinds, kinds);
        }
        availableKinds = kinds;
    }

    public List<String> getAvailableProviders() {
        return availableKinds;
    }

    // ======================== ENRICH ========================

    public EnrichedSignal enrich(Signal signal, EnrichmentContext context) {
        return enrich(signal, context, false);
    }

    /**
     * Enrich a signal. Always returns within the global timeout plus merge time.
     */
    public EnrichedSignal enrich(Signal signal, EnrichmentContext context, boolean forceRefresh) {
        long startNanos = System.nanoTime();
        totalEnrichments.incrementAndGet();

        EnrichmentContext request = normalizeContext(context);
        ValidationResult validation = validator.validate(signal, request);
        SanitizedSignal sanitized = validation.getSignal();
        ConfigSnapshot settings = config.snapshot();
        List<String> kinds = availableKinds;

        // Versions and cache key
        Map<String, VersionAssignment> assignments = new LinkedHashMap<>();
        Map<String, String> versionKey = new TreeMap<>();
        for (String kind : kinds) {
            VersionAssignment assignment = versions.assign(kind, request.getRequestId());
            assignments.put(kind, assignment);
            versionKey.put(kind, assignment.versionId() != null ? assignment.versionId() : DEFAULT_VERSION);
        }

        String cacheKey = null;
        if (settings.getBoolean("caching.enabled", true)) {
            try {
                cacheKey = keyGenerator.key(keySignal(validation), request, versionKey);
            } catch (RuntimeException e) {
                log.warn("[ENRICH] Could not derive cache key, bypassing cache: {}", e.getMessage());
            }
        }
        if (cacheKey != null && !forceRefresh) {
            Optional<EnrichedSignal> cached = lookupCache(cacheKey);
            if (cached.isPresent()) {
                long elapsedMs = elapsedMs(startNanos);
                log.debug("[ENRICH] Cache hit for {} key={}", sanitized.getAsset(), cacheKey);
                return cached.get().toBuilder()
                        .cacheUsed(true)
                        .processingTimeMs(elapsedMs)
                        .build();
            }
        }

        // Fan out
        long globalTimeoutMs = settings.getLong("system.global_timeout_ms", DEFAULT_GLOBAL_TIMEOUT_MS);
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(globalTimeoutMs);
        boolean shedding = isShedding(settings);

        Map<String, ProviderDiagnostic> diagnostics = new LinkedHashMap<>();
        Map<String, String> usedVersions = new TreeMap<>();
        List<PendingCall> pending = new ArrayList<>();
        ConcurrentLinkedQueue<PendingCall> completed = new ConcurrentLinkedQueue<>();
        int refused = 0;

        for (String kind : kinds) {
            Optional<EnrichmentProvider> provider = providers.get(kind);
            if (provider.isEmpty()) {
                continue;
            }
            ProviderStats stats = statsFor(kind);

            if (shedding && !settings.getBoolean("providers." + kind + ".essential", false)) {
                stats.shed.incrementAndGet();
                diagnostics.put(kind, diagnostic(kind, ProviderStatus.LOAD_SHED, null)
                        .detail("health score below shedding threshold")
                        .build());
                continue;
            }

            OperationContext operation = predictor.buildContext(kind, sanitized, request);
            ErrorPrediction prediction = predictor.predict(operation);
            if (!prediction.isShouldAttempt()) {
                predictor.recordAvoided(operation, prediction);
                stats.skipped.incrementAndGet();
                diagnostics.put(kind, diagnostic(kind, ProviderStatus.PREDICTED_SKIP, null)
                        .errorProbability(prediction.getErrorProbability())
                        .alternatives(prediction.getAlternatives())
                        .detail("proactively avoided")
                        .build());
                continue;
            }

            CircuitBreaker breaker = breakers.get(kind);
            if (!breaker.tryAcquirePermission()) {
                predictor.record(operation, true, "circuit breaker open", null);
                stats.breakerRejections.incrementAndGet();
                refused++;
                diagnostics.put(kind, diagnostic(kind, ProviderStatus.BREAKER_OPEN, null)
                        .detail("circuit breaker open")
                        .build());
                continue;
            }

            VersionAssignment assignment = assignments.get(kind);
            Optional<VersionRecord> version = assignment.versionId() == null
                    ? Optional.empty()
                    : versions.resolveVersion(kind, assignment.versionId());
            String versionId = version.map(VersionRecord::getVersionId).orElse(assignment.versionId());
            if (versionId != null) {
                usedVersions.put(kind, versionId);
            }

            long callTimeoutMs = Math.min(
                    settings.getLong("providers." + kind + ".timeout_ms", DEFAULT_CALL_TIMEOUT_MS), globalTimeoutMs);
            ProviderCallContext callContext = ProviderCallContext.builder()
                    .requestId(request.getRequestId())
                    .versionId(versionId)
                    .versionConfig(version.map(VersionRecord::getConfig).orElse(Collections.emptyMap()))
                    .market(request.getMarket())
                    .timeoutMs(callTimeoutMs)
                    .build();

            String experimentId = assignment.inExperiment() && assignment.versionId().equals(versionId)
                    ? assignment.experimentId() : null;
            PendingCall call = new PendingCall(kind, operation, versionId, experimentId);
            stats.attempts.incrementAndGet();
            if (submit(call, provider.get(), breaker, sanitized, callContext, callTimeoutMs, completed)) {
                pending.add(call);
            } else {
                refused++;
                predictor.record(operation, true, "worker pool rejected call", null);
                stats.failures.incrementAndGet();
                diagnostics.put(kind, diagnostic(kind, ProviderStatus.ERROR, versionId)
                        .detail("worker pool rejected call")
                        .build());
            }
        }

        awaitCalls(pending, deadlineNanos);

        // Merge in completion order
        ProviderFieldBag bag = new ProviderFieldBag();
        List<Double> contributions = new ArrayList<>();
        List<String> contributors = new ArrayList<>();
        Set<PendingCall> finished = new HashSet<>();
        int failed = refused;

        for (PendingCall call : new ArrayList<>(completed)) {
            finished.add(call);
            if (!mergeCall(call, settings, bag, contributions, contributors, diagnostics)) {
                failed++;
            }
        }
        for (PendingCall call : pending) {
            if (!finished.contains(call)) {
                abandonCall(call, diagnostics);
                failed++;
            }
        }

        // Score
        double aggregateConfidence = QualityTierCalculator.aggregateConfidence(contributions);
        QualityTier baseTier = sanitized.getQualityTier();
        double qualityScore = QualityTierCalculator.score(baseTier, contributors.size(), aggregateConfidence);
        QualityTier tier = QualityTier.fromScore(qualityScore);
        long elapsedMs = elapsedMs(startNanos);

        EnrichedSignal result = EnrichedSignal.builder()
                .signalId(sanitized.getSignalId())
                .asset(sanitized.getAsset())
                .direction(sanitized.getDirection())
                .price(sanitized.getPrice())
                .createdAt(sanitized.getCreatedAt())
                .attributes(sanitized.getAttributes())
                .baseQualityTier(baseTier)
                .baseConfidence(sanitized.getConfidence())
                .providerFields(bag.asMap())
                .providersUsed(Collections.unmodifiableList(contributors))
                .providerVersions(Collections.unmodifiableMap(usedVersions))
                .confidence(aggregateConfidence)
                .qualityTier(tier)
                .qualityScore(qualityScore)
                .diagnostics(Collections.unmodifiableMap(orderDiagnostics(kinds, diagnostics)))
                .validationWarnings(validation.getWarnings())
                .dataQualityScore(validation.getSignalQualityScore())
                .marketDataQualityScore(validation.getMarketQualityScore())
                .cacheUsed(false)
                .processingTimeMs(elapsedMs)
                .enrichedAt(clock.instant())
                .build();

        if (cacheKey != null && !contributors.isEmpty()) {
            storeInCache(cacheKey, result, settings);
        }

        int considered = pending.size() + refused;
        recordMetrics(elapsedMs, considered, failed, contributors.size(), validation);
        totalProcessingMs.addAndGet(elapsedMs);

        log.info("[ENRICH] {} {} enriched by {}/{} providers in {}ms, tier {} -> {}, confidence={}",
                sanitized.getAsset(), sanitized.getDirection(), contributors.size(), kinds.size(), elapsedMs,
                baseTier, tier, String.format("%.3f", aggregateConfidence));
        return result;
    }

    // ======================== PROVIDER CALLS ========================

    /**
     * Submit one call. The breaker hears about the outcome exactly once, from the
     * call's completion, including its per-call timeout.
     *
     * @return false if the worker pool refused the task
     */
    private boolean submit(PendingCall call, EnrichmentProvider provider, CircuitBreaker breaker,
                           SanitizedSignal signal, ProviderCallContext callContext, long callTimeoutMs,
                           ConcurrentLinkedQueue<PendingCall> completed) {
        CompletableFuture<ProviderResult> future = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    ProviderResult result = provider.enrich(signal, callContext);
                    if (result == null) {
                        future.completeExceptionally(new ProviderException(call.kind, "provider returned no result"));
                    } else {
                        future.complete(result);
                    }
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[ENRICH] Worker pool rejected call to {}: {}", call.kind, e.getMessage());
            breaker.onFailure(e);
            return false;
        }

        call.completion = future.orTimeout(callTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> {
                    call.finishedNanos = System.nanoTime();
                    call.result = result;
                    call.error = error == null ? null : unwrap(error);
                    if (error == null) {
                        breaker.onSuccess();
                    } else {
                        if (call.error instanceof TimeoutException) {
                            task.cancel(true);
                        }
                        breaker.onFailure(call.error);
                    }
                    completed.add(call);
                });
        return true;
    }

    private void awaitCalls(List<PendingCall> pending, long deadlineNanos) {
        if (pending.isEmpty()) {
            return;
        }
        CompletableFuture<?>[] completions = pending.stream()
                .map(call -> call.completion)
                .toArray(CompletableFuture[]::new);
        long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            CompletableFuture.allOf(completions).get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            globalTimeouts.incrementAndGet();
            log.warn("[ENRICH] Global timeout reached, abandoning outstanding provider calls");
        } catch (ExecutionException e) {
            // Every call settled and at least one failed; failures are handled per call
            log.debug("[ENRICH] Provider fan-out settled with failures: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ENRICH] Interrupted while waiting for providers, merging what completed");
        }
    }

    /**
     * @return true if the call succeeded (merged or below the confidence floor)
     */
    private boolean mergeCall(PendingCall call, ConfigSnapshot settings, ProviderFieldBag bag,
                              List<Double> contributions, List<String> contributors,
                              Map<String, ProviderDiagnostic> diagnostics) {
        String kind = call.kind;
        ProviderStats stats = statsFor(kind);
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(call.finishedNanos - call.submittedNanos);
        stats.totalLatencyMs.addAndGet(latencyMs);
        monitor.record(MetricNames.PROVIDER_CALL_MS, latencyMs, Map.of("provider", kind));

        if (call.error != null) {
            boolean timedOut = call.error instanceof TimeoutException;
            (timedOut ? stats.timeouts : stats.failures).incrementAndGet();
            String detail = timedOut ? "call exceeded its timeout" : describe(call.error);
            predictor.record(call.operation, true, detail, null);
            reportExperiment(call, false, latencyMs);
            reportPerformance(call, false, latencyMs, null);
            diagnostics.put(kind, diagnostic(kind, timedOut ? ProviderStatus.TIMEOUT : ProviderStatus.ERROR,
                    call.versionId)
                    .latencyMs(latencyMs)
                    .detail(detail)
                    .build());
            return false;
        }

        double confidence = Math.max(0.0, Math.min(1.0, call.result.getConfidence()));
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("latency_ms", latencyMs);
        metrics.put("confidence", confidence);
        predictor.record(call.operation, false, null, metrics);
        reportExperiment(call, true, latencyMs);
        reportPerformance(call, true, latencyMs, confidence);
        stats.successes.incrementAndGet();

        double floor = settings.getDouble("providers." + kind + ".confidence_floor", 0.0);
        if (confidence < floor) {
            diagnostics.put(kind, diagnostic(kind, ProviderStatus.BELOW_FLOOR, call.versionId)
                    .latencyMs(latencyMs)
                    .confidence(confidence)
                    .detail("confidence below floor " + floor)
                    .build());
            return true;
        }

        if (bag.put(kind, call.result.getFields())) {
            contributions.add(confidence);
            contributors.add(kind);
        }
        diagnostics.put(kind, diagnostic(kind, ProviderStatus.SUCCESS, call.versionId)
                .latencyMs(latencyMs)
                .confidence(confidence)
                .build());
        return true;
    }

    private void abandonCall(PendingCall call, Map<String, ProviderDiagnostic> diagnostics) {
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - call.submittedNanos);
        statsFor(call.kind).timeouts.incrementAndGet();
        predictor.record(call.operation, true, "abandoned at global timeout", null);
        reportExperiment(call, false, latencyMs);
        reportPerformance(call, false, latencyMs, null);
        diagnostics.put(call.kind, diagnostic(call.kind, ProviderStatus.TIMEOUT, call.versionId)
                .latencyMs(latencyMs)
                .detail("abandoned at global timeout")
                .build());
    }

    private void reportExperiment(PendingCall call, boolean success, long latencyMs) {
        if (call.experimentId == null) {
            return;
        }
        try {
            versions.recordExperimentResult(call.experimentId, call.versionId, success,
                    Map.of("latency_ms", (double) latencyMs));
        } catch (RuntimeException e) {
            log.warn("[EXPERIMENT] Could not record result for {}: {}", call.experimentId, e.getMessage());
        }
    }

    private void reportPerformance(PendingCall call, boolean success, long latencyMs, Double confidence) {
        if (call.versionId == null) {
            return;
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("latency_ms", (double) latencyMs);
        metrics.put("success", success ? 1.0 : 0.0);
        if (confidence != null) {
            metrics.put("confidence", confidence);
        }
        try {
            versions.updateVersionPerformance(call.versionId, metrics);
        } catch (RuntimeException e) {
            log.warn("[VERSION] Could not record performance for {}: {}", call.versionId, e.getMessage());
        }
    }

    // ======================== HELPERS ========================

    private EnrichmentContext normalizeContext(EnrichmentContext context) {
        if (context == null) {
            return EnrichmentContext.builder().requestId(UUID.randomUUID().toString()).build();
        }
        if (context.getRequestId() == null || context.getRequestId().isBlank()) {
            return context.toBuilder().requestId(UUID.randomUUID().toString()).build();
        }
        return context;
    }

    /**
     * Signal as it enters the cache key. A creation time filled in during validation
     * is left out, otherwise identical requests would never share an entry.
     */
    private static SanitizedSignal keySignal(ValidationResult validation) {
        SanitizedSignal signal = validation.getSignal();
        return validation.isCreatedAtDefaulted() ? signal.toBuilder().createdAt(null).build() : signal;
    }

    private boolean isShedding(ConfigSnapshot settings) {
        double threshold = settings.getDouble("system.shed_below_health", DEFAULT_SHED_BELOW_HEALTH);
        double health = monitor.healthScore();
        if (health < threshold) {
            log.warn("[ENRICH] Health score {} below {}, running essential providers only",
                    String.format("%.3f", health), threshold);
            return true;
        }
        return false;
    }

    private Optional<EnrichedSignal> lookupCache(String cacheKey) {
        long lookups = cacheLookups.incrementAndGet();
        Optional<EnrichedSignal> cached;
        try {
            cached = cache.get(cacheKey);
        } catch (RuntimeException e) {
            log.warn("[ENRICH] Cache lookup failed, treating as miss: {}", e.getMessage());
            cached = Optional.empty();
        }
        long hits = cached.isPresent() ? cacheHits.incrementAndGet() : cacheHits.get();
        monitor.record(MetricNames.CACHE_MISS_RATE, 1.0 - (double) hits / lookups);
        return cached;
    }

    private void storeInCache(String cacheKey, EnrichedSignal result, ConfigSnapshot settings) {
        long ttlSeconds = settings.getLong("system.cache_ttl_seconds", DEFAULT_CACHE_TTL_SECONDS);
        try {
            cache.set(cacheKey, result.toBuilder().build(), ttlSeconds);
        } catch (RuntimeException e) {
            log.warn("[ENRICH] Could not cache result for {}: {}", result.getAsset(), e.getMessage());
        }
    }

    private void recordMetrics(long elapsedMs, int considered, int failed, int contributors,
                               ValidationResult validation) {
        monitor.record(MetricNames.ENRICHMENT_TIME_MS, elapsedMs);
        monitor.record(MetricNames.PROVIDERS_USED, contributors);
        monitor.record(MetricNames.CIRCUIT_BREAKERS_OPEN, breakers.openCount());
        monitor.record(MetricNames.SIGNAL_QUALITY_SCORE, validation.getSignalQualityScore());
        monitor.record(MetricNames.MARKET_QUALITY_SCORE, validation.getMarketQualityScore());
        if (considered > 0) {
            monitor.record(MetricNames.ERROR_RATE, (double) failed / considered);
        }
    }

    private static Map<String, ProviderDiagnostic> orderDiagnostics(List<String> kinds,
                                                                    Map<String, ProviderDiagnostic> diagnostics) {
        Map<String, ProviderDiagnostic> ordered = new LinkedHashMap<>();
        for (String kind : kinds) {
            ProviderDiagnostic diagnostic = diagnostics.get(kind);
            if (diagnostic != null) {
                ordered.put(kind, diagnostic);
            }
        }
        return ordered;
    }

    private static ProviderDiagnostic.ProviderDiagnosticBuilder diagnostic(String kind, ProviderStatus status,
                                                                          String versionId) {
        return ProviderDiagnostic.builder().kind(kind).status(status).versionId(versionId);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private ProviderStats statsFor(String kind) {
        return providerStats.computeIfAbsent(kind, k -> new ProviderStats());
    }

    // ======================== STATS ========================

    public Map<String, Object> getEnrichmentStats() {
        long total = totalEnrichments.get();
        long lookups = cacheLookups.get();

        Map<String, Object> perProvider = new TreeMap<>();
        providerStats.forEach((kind, stats) -> perProvider.put(kind, stats.toMap()));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalEnrichments", total);
        stats.put("cacheHits", cacheHits.get());
        stats.put("cacheHitRate", lookups > 0 ? (double) cacheHits.get() / lookups : 0.0);
        long computed = total - cacheHits.get();
        stats.put("averageProcessingMs", computed > 0 ? (double) totalProcessingMs.get() / computed : 0.0);
        stats.put("globalTimeouts", globalTimeouts.get());
        stats.put("availableProviders", availableKinds);
        stats.put("providers", perProvider);
        stats.put("circuitBreakers", breakers.statuses());
        stats.put("circuitBreakersOpen", breakers.openCount());
        stats.put("cache", cache.stats());
        stats.put("healthScore", monitor.healthScore());
        return stats;
    }

    /**
     * One submitted provider call. Completion fields are written before the call
     * is published to the completed queue.
     */
    private static final class PendingCall {
        final String kind;
        final OperationContext operation;
        final String versionId;
        final String experimentId;
        final long submittedNanos = System.nanoTime();

        volatile CompletableFuture<ProviderResult> completion;
        volatile long finishedNanos;
        volatile ProviderResult result;
        volatile Throwable error;

        PendingCall(String kind, OperationContext operation, String versionId, String experimentId) {
            this.kind = kind;
            this.operation = operation;
            this.versionId = versionId;
            this.experimentId = experimentId;
        }
    }

    private static final class ProviderStats {
        final AtomicLong attempts = new AtomicLong(0);
        final AtomicLong successes = new AtomicLong(0);
        final AtomicLong failures = new AtomicLong(0);
        final AtomicLong timeouts = new AtomicLong(0);
        final AtomicLong skipped = new AtomicLong(0);
        final AtomicLong breakerRejections = new AtomicLong(0);
        final AtomicLong shed = new AtomicLong(0);
        final AtomicLong totalLatencyMs = new AtomicLong(0);

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            long settled = successes.get() + failures.get() + timeouts.get();
            map.put("attempts", attempts.get());
            map.put("successes", successes.get());
            map.put("failures", failures.get());
            map.put("timeouts", timeouts.get());
            map.put("predictedSkips", skipped.get());
            map.put("breakerRejections", breakerRejections.get());
            map.put("loadShed", shed.get());
            map.put("averageLatencyMs", settled > 0 ? (double) totalLatencyMs.get() / settled : 0.0);
            return map;
        }
    }
}
