package com.kotsin.enrichment.learning;

import com.kotsin.enrichment.model.EnrichmentContext;
import com.kotsin.enrichment.model.SanitizedSignal;
import com.kotsin.enrichment.settings.ConfigDefaults;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * FailurePredictor - Learns from provider outcomes whether a call is worth attempting
 *
 * LEARNING LOOP:
 * 1. Every attempted call is recorded with its context and whether it failed
 * 2. Every skipped call is recorded as a non-error marked "avoided", so the model
 *    is not left penalising a provider it never lets run
 * 3. Every K records a background retrain fits a logistic model on the bounded history
 * 4. Predictions use the last trained model; the new one is swapped in atomically
 *
 * With too little history the predictor answers with a low fixed probability and
 * always lets the call through.
 */
@Slf4j
@Service
public class FailurePredictor {

    static final int MIN_HISTORY_TO_PREDICT = 10;
    static final int MIN_HISTORY_TO_TRAIN = 20;
    static final double DEFAULT_ERROR_PROBABILITY = 0.1;
    static final double DEFAULT_CONFIDENCE = 0.3;
    static final double FALLBACK_ERROR_PROBABILITY = 0.2;
    static final double FALLBACK_CONFIDENCE = 0.1;
    static final double ALTERNATIVES_THRESHOLD = 0.5;
    static final double L2_PENALTY = 1.0;
    static final int STREAK_WINDOW = 5;
    static final int RECENT_WINDOW = 50;

    private static final Map<String, List<String>> ALTERNATIVES = Map.of(
            ConfigDefaults.PRICE_PREDICTOR,
            List.of("use_cached_prediction", "use_simplified_model", "skip_price_prediction"),
            ConfigDefaults.POLICY_ENGINE,
            List.of("use_conservative_policy", "use_rule_based_policy", "skip_policy_evaluation"),
            ConfigDefaults.SENTIMENT,
            List.of("use_cached_sentiment", "use_neutral_sentiment", "skip_sentiment"),
            ConfigDefaults.CONSENSUS,
            List.of("use_local_consensus", "skip_consensus"));
    private static final List<String> DEFAULT_ALTERNATIVES =
            List.of("use_cached_result", "use_conservative_default", "skip_enrichment");

    private final Clock clock;
    private final Executor learningExecutor;
    private final OutcomeHistoryStore historyStore;
    private final int capacity;
    private final int retrainEvery;
    private final double attemptCeiling;
    private final boolean enabled;

    // Guarded by history
    private final Deque<OutcomeRecord> history = new ArrayDeque<>();
    private final Map<String, Deque<Boolean>> recentByKind = new HashMap<>();

    private final AtomicReference<LogisticErrorModel> model = new AtomicReference<>();
    private final AtomicInteger sinceRetrain = new AtomicInteger(0);
    private final AtomicBoolean retrainInFlight = new AtomicBoolean(false);
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private volatile Instant lastTrainedAt;

    // Statistics
    private final AtomicLong totalRecorded = new AtomicLong(0);
    private final AtomicLong totalAvoided = new AtomicLong(0);
    private final AtomicLong predictionsMade = new AtomicLong(0);
    private final AtomicLong retrainCount = new AtomicLong(0);

    @Autowired
    public FailurePredictor(Clock clock,
                            @Qualifier("learningExecutor") Executor learningExecutor,
                            OutcomeHistoryStore historyStore,
                            @Value("${learning.history.capacity:1000}") int capacity,
                            @Value("${learning.retrain-every:50}") int retrainEvery,
                            @Value("${learning.attempt-ceiling:0.7}") double attemptCeiling,
                            @Value("${learning.enabled:true}") boolean enabled) {
        this.clock = clock;
        this.learningExecutor = learningExecutor;
        this.historyStore = historyStore;
        this.capacity = capacity;
        this.retrainEvery = Math.max(1, retrainEvery);
        this.attemptCeiling = attemptCeiling;
        this.enabled = enabled;
    }

    public FailurePredictor(Clock clock, Executor learningExecutor, OutcomeHistoryStore historyStore,
                            int capacity, int retrainEvery, double attemptCeiling) {
        this(clock, learningExecutor, historyStore, capacity, retrainEvery, attemptCeiling, true);
    }

    // ======================== CONTEXT ========================

    /**
     * Build the context for calling {@code kind} with this signal now.
     */
    public OperationContext buildContext(String kind, SanitizedSignal signal, EnrichmentContext request) {
        Instant now = clock.instant();
        ZonedDateTime local = now.atZone(clock.getZone());
        double volatility = 0.0;
        double systemLoad = 0.0;
        if (request != null) {
            if (request.getMarket() != null && request.getMarket().getVolatility() != null) {
                volatility = request.getMarket().getVolatility();
            }
            if (request.getSystemLoad() != null) {
                systemLoad = request.getSystemLoad();
            }
        }
        return OperationContext.builder()
                .providerKind(kind)
                .asset(signal.getAsset())
                .timestamp(now)
                .hourOfDay(local.getHour())
                .dayOfWeek(local.getDayOfWeek().getValue() - 1)
                .volatility(volatility)
                .errorStreak(currentErrorStreak(kind))
                .systemLoad(systemLoad)
                .qualityScore(signal.getQualityTier().getScore())
                .build();
    }

    /**
     * Errors among the provider's last {@value #STREAK_WINDOW} outcomes. Avoided calls count as non-errors.
     */
    public int currentErrorStreak(String kind) {
        synchronized (history) {
            Deque<Boolean> recent = recentByKind.get(kind);
            if (recent == null) {
                return 0;
            }
            int errors = 0;
            for (Boolean hadError : recent) {
                if (hadError) {
                    errors++;
                }
            }
            return errors;
        }
    }

    // ======================== PREDICT ========================

    public ErrorPrediction predict(OperationContext context) {
        if (!enabled) {
            return defaultPrediction();
        }
        try {
            LogisticErrorModel current = model.get();
            int size = historySize();
            if (current == null || size < MIN_HISTORY_TO_PREDICT) {
                return defaultPrediction();
            }

            double probability = current.probability(FeatureExtractor.extract(context));
            double confidence = size < MIN_HISTORY_TO_TRAIN ? DEFAULT_CONFIDENCE : Math.min(0.9, size / 100.0);
            boolean shouldAttempt = probability <= attemptCeiling;
            List<String> alternatives = probability > ALTERNATIVES_THRESHOLD
                    ? alternativesFor(context.getProviderKind())
                    : Collections.emptyList();
            predictionsMade.incrementAndGet();

            if (!shouldAttempt) {
                log.info("[LEARNING] Predicting failure for {} on {}: p={} > ceiling={}",
                        context.getProviderKind(), context.getAsset(),
                        String.format("%.3f", probability), attemptCeiling);
            }
            return ErrorPrediction.builder()
                    .errorProbability(probability)
                    .confidence(confidence)
                    .shouldAttempt(shouldAttempt)
                    .alternatives(alternatives)
                    .modelBased(true)
                    .build();
        } catch (RuntimeException e) {
            log.warn("[LEARNING] Prediction failed for {}, allowing attempt: {}",
                    context.getProviderKind(), e.getMessage());
            return ErrorPrediction.builder()
                    .errorProbability(FALLBACK_ERROR_PROBABILITY)
                    .confidence(FALLBACK_CONFIDENCE)
                    .shouldAttempt(true)
                    .build();
        }
    }

    private static ErrorPrediction defaultPrediction() {
        return ErrorPrediction.builder()
                .errorProbability(DEFAULT_ERROR_PROBABILITY)
                .confidence(DEFAULT_CONFIDENCE)
                .shouldAttempt(true)
                .build();
    }

    public static List<String> alternativesFor(String kind) {
        return ALTERNATIVES.getOrDefault(kind, DEFAULT_ALTERNATIVES);
    }

    // ======================== RECORD ========================

    public void record(OperationContext context, boolean hadError, String errorDetail,
                       Map<String, Object> successMetrics) {
        append(OutcomeRecord.builder()
                .context(context)
                .hadError(hadError)
                .errorDetail(errorDetail)
                .successMetrics(successMetrics)
                .avoided(false)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Record a call that was skipped on this predictor's advice.
     */
    public void recordAvoided(OperationContext context, ErrorPrediction prediction) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("avoided_error", true);
        metrics.put("error_probability", prediction.getErrorProbability());
        totalAvoided.incrementAndGet();
        append(OutcomeRecord.builder()
                .context(context)
                .hadError(false)
                .successMetrics(metrics)
                .avoided(true)
                .timestamp(clock.instant())
                .build());
    }

    private void append(OutcomeRecord record) {
        if (!enabled) {
            return;
        }
        synchronized (history) {
            addToHistory(record);
        }
        totalRecorded.incrementAndGet();
        dirty.set(true);

        if (sinceRetrain.incrementAndGet() >= retrainEvery) {
            sinceRetrain.set(0);
            scheduleRetrain();
        }
    }

    // Caller holds the history lock
    private void addToHistory(OutcomeRecord record) {
        history.addLast(record);
        while (history.size() > capacity) {
            history.removeFirst();
        }
        String kind = record.getContext() != null ? record.getContext().getProviderKind() : null;
        if (kind != null) {
            Deque<Boolean> recent = recentByKind.computeIfAbsent(kind, k -> new ArrayDeque<>());
            recent.addLast(record.isHadError());
            while (recent.size() > STREAK_WINDOW) {
                recent.removeFirst();
            }
        }
    }

    public int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    private List<OutcomeRecord> historySnapshot() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    // ======================== TRAINING ========================

    /**
     * Queue a retrain on the learning executor unless one is already running.
     */
    public void scheduleRetrain() {
        if (!retrainInFlight.compareAndSet(false, true)) {
            return;
        }
        try {
            learningExecutor.execute(() -> {
                try {
                    retrain();
                } finally {
                    retrainInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            retrainInFlight.set(false);
            log.warn("[LEARNING] Retrain rejected by executor: {}", e.getMessage());
        }
    }

    /**
     * Fit a new model on the current history and swap it in.
     *
     * @return true if a new model was installed
     */
    public boolean retrain() {
        List<OutcomeRecord> snapshot = historySnapshot();
        if (snapshot.size() < MIN_HISTORY_TO_TRAIN) {
            log.debug("[LEARNING] Not enough history to train ({} < {})", snapshot.size(), MIN_HISTORY_TO_TRAIN);
            return false;
        }
        int errors = 0;
        double[][] features = new double[snapshot.size()][];
        int[] labels = new int[snapshot.size()];
        for (int i = 0; i < snapshot.size(); i++) {
            OutcomeRecord record = snapshot.get(i);
            features[i] = FeatureExtractor.extract(record.getContext());
            labels[i] = record.isHadError() ? 1 : 0;
            errors += labels[i];
        }
        if (errors == 0 || errors == snapshot.size()) {
            log.debug("[LEARNING] History has a single outcome class, keeping current model");
            return false;
        }

        try {
            LogisticErrorModel trained = LogisticErrorModel.fit(features, labels, L2_PENALTY);
            model.set(trained);
            lastTrainedAt = clock.instant();
            long count = retrainCount.incrementAndGet();
            log.info("[LEARNING] Retrain #{} on {} outcomes ({} errors)", count, snapshot.size(), errors);
            return true;
        } catch (RuntimeException e) {
            log.warn("[LEARNING] Retrain failed, keeping previous model", e);
            return false;
        }
    }

    public boolean isModelTrained() {
        return model.get() != null;
    }

    // ======================== INSIGHTS ========================

    /**
     * Normalised absolute weight per feature; empty before the first retrain.
     */
    public Map<String, Double> featureImportance() {
        LogisticErrorModel current = model.get();
        if (current == null) {
            return Collections.emptyMap();
        }
        double[] weights = current.getWeights();
        double total = 0.0;
        for (double w : weights) {
            total += Math.abs(w);
        }
        Map<String, Double> importance = new LinkedHashMap<>();
        for (int i = 0; i < weights.length; i++) {
            importance.put(FeatureExtractor.FEATURE_NAMES.get(i), total > 0 ? Math.abs(weights[i]) / total : 0.0);
        }
        return importance;
    }

    public Map<String, ErrorPattern> errorPatterns() {
        Map<String, List<OutcomeRecord>> byKind = historySnapshot().stream()
                .filter(r -> r.getContext() != null && r.getContext().getProviderKind() != null)
                .collect(Collectors.groupingBy(r -> r.getContext().getProviderKind(), TreeMap::new,
                        Collectors.toList()));

        Map<String, ErrorPattern> patterns = new TreeMap<>();
        byKind.forEach((kind, records) -> {
            int errors = 0;
            int avoided = 0;
            List<Integer> errorHours = new ArrayList<>();
            List<OutcomeRecord> successes = new ArrayList<>();
            for (OutcomeRecord record : records) {
                if (record.isHadError()) {
                    errors++;
                    errorHours.add(record.getContext().getHourOfDay());
                } else if (record.isAvoided()) {
                    avoided++;
                } else if (record.getSuccessMetrics() != null) {
                    successes.add(record);
                }
            }
            patterns.put(kind, ErrorPattern.builder()
                    .providerKind(kind)
                    .totalOperations(records.size())
                    .errors(errors)
                    .avoided(avoided)
                    .errorRate((double) errors / records.size())
                    .recentErrorHours(tail(errorHours, 20))
                    .avgSuccessMetrics(averageMetrics(tail(successes, 10)))
                    .build());
        });
        return patterns;
    }

    private static Map<String, Double> averageMetrics(List<OutcomeRecord> records) {
        Map<String, double[]> sums = new TreeMap<>();
        for (OutcomeRecord record : records) {
            record.getSuccessMetrics().forEach((name, value) -> {
                if (value instanceof Number) {
                    double[] acc = sums.computeIfAbsent(name, k -> new double[2]);
                    acc[0] += ((Number) value).doubleValue();
                    acc[1]++;
                }
            });
        }
        Map<String, Double> averages = new TreeMap<>();
        sums.forEach((name, acc) -> averages.put(name, acc[0] / acc[1]));
        return averages;
    }

    private static <T> List<T> tail(List<T> list, int n) {
        return list.size() > n ? new ArrayList<>(list.subList(list.size() - n, list.size())) : list;
    }

    public Map<String, Object> insights() {
        List<OutcomeRecord> snapshot = historySnapshot();
        List<OutcomeRecord> recent = tail(snapshot, RECENT_WINDOW);
        long recentErrors = recent.stream().filter(OutcomeRecord::isHadError).count();

        List<Map<String, Object>> problematic = errorPatterns().values().stream()
                .filter(p -> p.getTotalOperations() >= 5)
                .sorted((a, b) -> Double.compare(b.getErrorRate(), a.getErrorRate()))
                .limit(5)
                .map(p -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("providerKind", p.getProviderKind());
                    entry.put("errorRate", p.getErrorRate());
                    entry.put("totalOperations", p.getTotalOperations());
                    return entry;
                })
                .collect(Collectors.toList());

        Map<String, Object> insights = new LinkedHashMap<>();
        insights.put("historySize", snapshot.size());
        insights.put("totalRecorded", totalRecorded.get());
        insights.put("totalAvoided", totalAvoided.get());
        insights.put("predictionsMade", predictionsMade.get());
        insights.put("recentErrorRate", recent.isEmpty() ? 0.0 : (double) recentErrors / recent.size());
        insights.put("mostProblematic", problematic);
        insights.put("modelTrained", isModelTrained());
        insights.put("retrainCount", retrainCount.get());
        insights.put("lastTrainedAt", lastTrainedAt);
        insights.put("learningProgress", Math.min(1.0, snapshot.size() / (double) capacity));
        insights.put("featureImportance", featureImportance());
        return insights;
    }

    // ======================== PERSISTENCE ========================

    @PostConstruct
    public void loadHistory() {
        List<OutcomeRecord> persisted = historyStore.load();
        if (persisted.isEmpty()) {
            return;
        }
        synchronized (history) {
            for (OutcomeRecord record : persisted) {
                addToHistory(record);
            }
        }
        scheduleRetrain();
    }

    @Scheduled(fixedDelayString = "${learning.history.flush-interval-ms:60000}",
               initialDelayString = "${learning.history.flush-interval-ms:60000}")
    public void flushHistory() {
        if (dirty.compareAndSet(true, false)) {
            historyStore.save(historySnapshot());
        }
    }

    @PreDestroy
    public void shutdown() {
        flushHistory();
    }
}
