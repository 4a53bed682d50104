package com.kotsin.enrichment.learning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.enrichment.model.Direction;
import com.kotsin.enrichment.model.EnrichmentContext;
import com.kotsin.enrichment.model.MarketSnapshot;
import com.kotsin.enrichment.model.QualityTier;
import com.kotsin.enrichment.model.SanitizedSignal;
import com.kotsin.enrichment.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FailurePredictor - Comprehensive Tests")
class FailurePredictorTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private OutcomeHistoryStore store;
    private FailurePredictor predictor;

    @BeforeEach
    void setUp() {
        // Wednesday 14:00 UTC
        clock = MutableClock.at("2024-03-06T14:00:00Z");
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        store = new OutcomeHistoryStore(tempDir.resolve("history.json"), 500, objectMapper);
        predictor = new FailurePredictor(clock, Runnable::run, store, 1000, 10, 0.7);
    }

    private static OperationContext context(String kind) {
        return OperationContext.builder()
                .providerKind(kind)
                .asset("BTC")
                .hourOfDay(14)
                .dayOfWeek(2)
                .volatility(0.02)
                .errorStreak(0)
                .systemLoad(0.4)
                .qualityScore(3)
                .build();
    }

    /**
     * Sentiment always fails, price predictor always succeeds.
     */
    private void seedFailingSentiment(int pairs) {
        for (int i = 0; i < pairs; i++) {
            predictor.record(context("sentiment"), true, "IOException: timeout", null);
            predictor.record(context("price_predictor"), false, null, Map.of("latency_ms", 40));
        }
    }

    // ========== DEFAULT PREDICTION TESTS ==========

    @Test
    @DisplayName("Without a model should allow the attempt with default probability")
    void testDefaultPrediction() {
        ErrorPrediction prediction = predictor.predict(context("sentiment"));

        assertEquals(0.1, prediction.getErrorProbability(), 1e-9);
        assertEquals(0.3, prediction.getConfidence(), 1e-9);
        assertTrue(prediction.isShouldAttempt());
        assertFalse(prediction.isModelBased());
        assertTrue(prediction.getAlternatives().isEmpty());
    }

    @Test
    @DisplayName("Should not train below the minimum history or with a single class")
    void testNoTrainingWithoutEnoughData() {
        for (int i = 0; i < 15; i++) {
            predictor.record(context("sentiment"), true, "err", null);
        }
        assertFalse(predictor.retrain());

        for (int i = 0; i < 10; i++) {
            predictor.record(context("sentiment"), true, "err", null);
        }
        assertFalse(predictor.retrain());
        assertFalse(predictor.isModelTrained());
    }

    // ========== LEARNING TESTS ==========

    @Test
    @DisplayName("Should learn to skip a provider that keeps failing")
    void testPredictsFailure() {
        seedFailingSentiment(30);
        assertTrue(predictor.retrain());

        ErrorPrediction sentiment = predictor.predict(context("sentiment"));
        ErrorPrediction price = predictor.predict(context("price_predictor"));

        assertTrue(sentiment.isModelBased());
        assertTrue(sentiment.getErrorProbability() > 0.7);
        assertFalse(sentiment.isShouldAttempt());
        assertEquals(0.6, sentiment.getConfidence(), 1e-9);
        assertTrue(sentiment.getAlternatives().contains("use_cached_sentiment"));

        assertTrue(price.getErrorProbability() < 0.3);
        assertTrue(price.isShouldAttempt());
        assertTrue(price.getAlternatives().isEmpty());
    }

    @Test
    @DisplayName("Avoided calls should eventually bring a skipped provider back")
    void testLearnsFromAvoidance() {
        seedFailingSentiment(30);
        predictor.retrain();
        assertFalse(predictor.predict(context("sentiment")).isShouldAttempt());

        int avoided = 0;
        ErrorPrediction prediction = predictor.predict(context("sentiment"));
        while (!prediction.isShouldAttempt() && avoided < 200) {
            predictor.recordAvoided(context("sentiment"), prediction);
            avoided++;
            prediction = predictor.predict(context("sentiment"));
        }

        assertTrue(prediction.isShouldAttempt(), "provider should be retried after " + avoided + " avoidances");
        assertTrue(avoided > 0);
    }

    @Test
    @DisplayName("Retrain should be triggered every K records on the learning executor")
    void testRetrainCadence() {
        AtomicInteger runs = new AtomicInteger();
        Executor counting = task -> {
            runs.incrementAndGet();
            task.run();
        };
        FailurePredictor counted = new FailurePredictor(clock, counting, store, 1000, 10, 0.7);

        for (int i = 0; i < 25; i++) {
            counted.record(context("sentiment"), i % 2 == 0, null, null);
        }

        assertEquals(2, runs.get());
        assertTrue(counted.isModelTrained());
    }

    @Test
    @DisplayName("History should be bounded by capacity")
    void testHistoryCapacity() {
        FailurePredictor small = new FailurePredictor(clock, Runnable::run, store, 30, 1000, 0.7);
        for (int i = 0; i < 50; i++) {
            small.record(context("consensus"), false, null, null);
        }

        assertEquals(30, small.historySize());
    }

    // ========== CONTEXT TESTS ==========

    @Test
    @DisplayName("Error streak should count errors among the last five outcomes")
    void testErrorStreak() {
        for (int i = 0; i < 3; i++) {
            predictor.record(context("consensus"), true, "down", null);
        }
        assertEquals(3, predictor.currentErrorStreak("consensus"));

        for (int i = 0; i < 5; i++) {
            predictor.record(context("consensus"), false, null, null);
        }
        assertEquals(0, predictor.currentErrorStreak("consensus"));
        assertEquals(0, predictor.currentErrorStreak("sentiment"));
    }

    @Test
    @DisplayName("Context should capture time, market and signal quality")
    void testBuildContext() {
        predictor.record(context("sentiment"), true, "down", null);
        SanitizedSignal signal = SanitizedSignal.builder()
                .asset("ETH")
                .direction(Direction.SELL)
                .qualityTier(QualityTier.HIGH)
                .confidence(0.7)
                .build();
        EnrichmentContext request = EnrichmentContext.builder()
                .market(MarketSnapshot.builder().volatility(0.05).build())
                .systemLoad(0.6)
                .build();

        OperationContext ctx = predictor.buildContext("sentiment", signal, request);

        assertEquals("sentiment", ctx.getProviderKind());
        assertEquals("ETH", ctx.getAsset());
        assertEquals(14, ctx.getHourOfDay());
        assertEquals(2, ctx.getDayOfWeek());
        assertEquals(0.05, ctx.getVolatility(), 1e-9);
        assertEquals(0.6, ctx.getSystemLoad(), 1e-9);
        assertEquals(3, ctx.getQualityScore());
        assertEquals(1, ctx.getErrorStreak());
    }

    // ========== INSIGHTS / PERSISTENCE TESTS ==========

    @Test
    @DisplayName("Error patterns should summarise outcomes per provider")
    void testErrorPatterns() {
        seedFailingSentiment(10);
        predictor.recordAvoided(context("sentiment"), predictor.predict(context("sentiment")));

        Map<String, ErrorPattern> patterns = predictor.errorPatterns();

        ErrorPattern sentiment = patterns.get("sentiment");
        assertEquals(11, sentiment.getTotalOperations());
        assertEquals(10, sentiment.getErrors());
        assertEquals(1, sentiment.getAvoided());
        assertEquals(0.0, patterns.get("price_predictor").getErrorRate(), 1e-9);
        assertEquals(40.0, patterns.get("price_predictor").getAvgSuccessMetrics().get("latency_ms"), 1e-9);
    }

    @Test
    @DisplayName("Insights should expose history, model state and feature importance")
    void testInsights() {
        seedFailingSentiment(15);
        predictor.retrain();

        Map<String, Object> insights = predictor.insights();

        assertEquals(30, insights.get("historySize"));
        assertEquals(true, insights.get("modelTrained"));
        @SuppressWarnings("unchecked")
        Map<String, Double> importance = (Map<String, Double>) insights.get("featureImportance");
        assertEquals(FeatureExtractor.dimension(), importance.size());
        assertEquals(1.0, importance.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        assertFalse(((List<?>) insights.get("mostProblematic")).isEmpty());
    }

    @Test
    @DisplayName("History should survive a flush and reload")
    void testPersistence() {
        seedFailingSentiment(15);
        predictor.flushHistory();

        FailurePredictor restored = new FailurePredictor(clock, Runnable::run, store, 1000, 10, 0.7);
        restored.loadHistory();

        assertEquals(30, restored.historySize());
        assertTrue(restored.isModelTrained());
        assertEquals(5, restored.currentErrorStreak("sentiment"));
    }

    @Test
    @DisplayName("Store should keep only the most recent records")
    void testStorePersistLimit() {
        OutcomeHistoryStore limited = new OutcomeHistoryStore(tempDir.resolve("limited.json"), 5,
                new ObjectMapper().registerModule(new JavaTimeModule()));
        FailurePredictor source = new FailurePredictor(clock, Runnable::run, limited, 100, 1000, 0.7);
        for (int i = 0; i < 8; i++) {
            source.record(context(i < 4 ? "sentiment" : "consensus"), false, null, null);
        }
        source.flushHistory();

        List<OutcomeRecord> loaded = limited.load();

        assertEquals(5, loaded.size());
        assertEquals("sentiment", loaded.get(0).getContext().getProviderKind());
        assertEquals("consensus", loaded.get(4).getContext().getProviderKind());
    }
}
