package com.kotsin.enrichment.version;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.enrichment.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VersionManager - Comprehensive Tests")
class VersionManagerTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private VersionManager manager;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        clock = MutableClock.at("2024-03-01T10:15:30Z");
        manager = new VersionManager(tempDir, 100, 10, objectMapper, clock);
    }

    // ========== VERSION TESTS ==========

    @Test
    @DisplayName("Created version id should carry kind, timestamp and config hash")
    void testVersionIdFormat() {
        String id = manager.createVersion("sentiment", Map.of("model", "finbert"), null, "baseline");

        assertTrue(id.matches("sentiment_v20240301_101530_[0-9a-f]{8}"), id);
        assertTrue(Files.exists(tempDir.resolve(id + ".json")));
        assertEquals(id, manager.activeVersionId("sentiment").orElseThrow());
    }

    @Test
    @DisplayName("Same config in the same second should get a distinct id")
    void testIdCollision() {
        String first = manager.createVersion("sentiment", Map.of("model", "finbert"), null, null);
        String second = manager.createVersion("sentiment", Map.of("model", "finbert"), first, null);

        assertNotEquals(first, second);
        assertEquals(first + "_1", second);
        assertEquals(first, manager.getVersion("sentiment", second).orElseThrow().getParentVersionId());
    }

    @Test
    @DisplayName("Versions should be readable after a restart")
    void testPersistence() {
        String id = manager.createVersion("consensus", Map.of("quorum", 3), null, "three of five");

        VersionManager restarted = new VersionManager(tempDir, 100, 10, objectMapper, clock);

        VersionRecord record = restarted.getVersion("consensus", null).orElseThrow();
        assertEquals(id, record.getVersionId());
        assertEquals(3, ((Number) record.getConfig().get("quorum")).intValue());
        assertEquals("three of five", record.getDescription());
    }

    @Test
    @DisplayName("Lookups across kinds or for unknown ids should be empty")
    void testUnknownVersions() {
        String id = manager.createVersion("sentiment", Map.of(), null, null);

        assertTrue(manager.getVersion("consensus", id).isEmpty());
        assertTrue(manager.getVersion("sentiment", "sentiment_v_missing").isEmpty());
        assertTrue(manager.getVersion("policy_engine", null).isEmpty());
    }

    @Test
    @DisplayName("Resolve should fall back to the active version")
    void testResolveFallsBack() {
        String active = manager.createVersion("sentiment", Map.of("a", 1), null, null);

        assertEquals(active, manager.resolveVersion("sentiment", "sentiment_v_gone").orElseThrow().getVersionId());
        assertTrue(manager.resolveVersion("consensus", "consensus_v_gone").isEmpty());
    }

    @Test
    @DisplayName("Activate should switch the active version and reject unknown ids")
    void testActivate() {
        String v1 = manager.createVersion("sentiment", Map.of("v", 1), null, null);
        clock.advance(Duration.ofSeconds(1));
        String v2 = manager.createVersion("sentiment", Map.of("v", 2), v1, null);
        assertEquals(v2, manager.activeVersions().get("sentiment"));

        manager.activateVersion("sentiment", v1);

        assertEquals(v1, manager.activeVersionId("sentiment").orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> manager.activateVersion("sentiment", "nope"));
    }

    @Test
    @DisplayName("List should return versions newest first")
    void testListVersions() {
        String v1 = manager.createVersion("sentiment", Map.of("v", 1), null, null);
        clock.advance(Duration.ofMinutes(1));
        String v2 = manager.createVersion("sentiment", Map.of("v", 2), null, null);
        manager.createVersion("consensus", Map.of(), null, null);

        List<VersionRecord> versions = manager.listVersions("sentiment");

        assertEquals(List.of(v2, v1), versions.stream().map(VersionRecord::getVersionId).toList());
    }

    @Test
    @DisplayName("Performance samples should be kept in a bounded window")
    void testPerformanceWindow() {
        String id = manager.createVersion("sentiment", Map.of(), null, null);
        for (int i = 0; i < 150; i++) {
            assertTrue(manager.updateVersionPerformance(id, Map.of("latency_ms", (double) i)));
        }

        List<Double> series = manager.getVersion("sentiment", id).orElseThrow().getPerformance().get("latency_ms");
        assertEquals(100, series.size());
        assertEquals(50.0, series.get(0));
        assertFalse(manager.updateVersionPerformance("unknown", Map.of("x", 1.0)));
    }

    // ========== ROUTING TESTS ==========

    @Test
    @DisplayName("Boundary bucket should route to version A")
    void testBoundaryInclusiveToA() {
        assertTrue(VersionManager.routesToA(30, 0.3));
        assertFalse(VersionManager.routesToA(31, 0.3));
        assertTrue(VersionManager.routesToA(100, 1.0));
        assertFalse(VersionManager.routesToA(1, 0.0));
    }

    @Test
    @DisplayName("Buckets should be stable and within 1..100")
    void testBucketsStable() {
        for (int i = 0; i < 1000; i++) {
            int bucket = VersionManager.bucketFor("req-" + i);
            assertTrue(bucket >= 1 && bucket <= 100);
            assertEquals(bucket, VersionManager.bucketFor("req-" + i));
        }
    }

    @Test
    @DisplayName("Traffic should split close to the configured share and stick per request")
    void testTrafficSplit() {
        String a = manager.createVersion("sentiment", Map.of("v", "a"), null, null);
        String b = manager.createVersion("sentiment", Map.of("v", "b"), null, null);
        manager.startExperiment("sentiment", a, b, 0.3, Duration.ofHours(1));

        int toA = 0;
        int total = 10_000;
        for (int i = 0; i < total; i++) {
            VersionAssignment assignment = manager.assign("sentiment", "request-" + i);
            assertTrue(assignment.inExperiment());
            if (a.equals(assignment.versionId())) {
                toA++;
            }
            assertEquals(assignment.versionId(), manager.versionForRequest("sentiment", "request-" + i));
        }
        assertEquals(0.3, toA / (double) total, 0.05);
    }

    @Test
    @DisplayName("Kinds without an experiment should get the active version")
    void testNoExperimentUsesActive() {
        String active = manager.createVersion("consensus", Map.of(), null, null);

        VersionAssignment assignment = manager.assign("consensus", "r1");

        assertEquals(active, assignment.versionId());
        assertFalse(assignment.inExperiment());
        assertNull(manager.assign("policy_engine", "r1").versionId());
    }

    // ========== EXPERIMENT TESTS ==========

    @Test
    @DisplayName("Should reject invalid experiments")
    void testInvalidExperiments() {
        String a = manager.createVersion("sentiment", Map.of("v", "a"), null, null);
        String b = manager.createVersion("sentiment", Map.of("v", "b"), null, null);

        assertThrows(IllegalArgumentException.class,
                () -> manager.startExperiment("sentiment", a, b, 1.5, Duration.ofHours(1)));
        assertThrows(IllegalArgumentException.class,
                () -> manager.startExperiment("sentiment", a, b, 0.5, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> manager.startExperiment("sentiment", a, "sentiment_v_missing", 0.5, Duration.ofHours(1)));

        manager.startExperiment("sentiment", a, b, 0.5, Duration.ofHours(1));
        assertThrows(IllegalArgumentException.class,
                () -> manager.startExperiment("sentiment", a, b, 0.5, Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Concurrent starts for one kind should leave exactly one experiment running")
    void testConcurrentStartsSingleWinner() throws Exception {
        String a = manager.createVersion("sentiment", Map.of("v", "a"), null, null);
        String b = manager.createVersion("sentiment", Map.of("v", "b"), null, null);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        manager.startExperiment("sentiment", a, b, 0.5, Duration.ofHours(1));
                        started.incrementAndGet();
                    } catch (IllegalArgumentException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, started.get());
        assertEquals(threads - 1, rejected.get());
        assertEquals(1, manager.listExperiments().size());
    }

    @Test
    @DisplayName("Clearly better arm should be recommended and finalized on expiry")
    void testExperimentFinalization() {
        String a = manager.createVersion("sentiment", Map.of("v", "a"), null, null);
        String b = manager.createVersion("sentiment", Map.of("v", "b"), null, null);
        String experimentId = manager.startExperiment("sentiment", a, b, 0.5, Duration.ofHours(1));

        for (int i = 0; i < 20; i++) {
            manager.recordExperimentResult(experimentId, a, i % 10 != 0, Map.of("latency_ms", 50.0));
            manager.recordExperimentResult(experimentId, b, i % 2 == 0, Map.of("latency_ms", 80.0));
        }

        ExperimentResults running = manager.getExperimentResults(experimentId).orElseThrow();
        assertEquals(ExperimentStatus.RUNNING, running.getStatus());
        assertEquals(20, running.getArmA().getRequests());
        assertEquals(0.1, running.getArmA().getErrorRate(), 1e-9);
        assertEquals(0.5, running.getArmB().getErrorRate(), 1e-9);

        clock.advance(Duration.ofHours(2));
        manager.finalizeExpiredExperiments();

        ExperimentResults done = manager.getExperimentResults(experimentId).orElseThrow();
        assertEquals(ExperimentStatus.COMPLETED, done.getStatus());
        assertEquals(a, done.getWinner());
        assertEquals(Recommendation.ADOPT_A, done.getRecommendation());
        assertEquals(0.8, done.getConfidence(), 1e-9);
        assertTrue(done.isSampleSizeSufficient());
        assertNotNull(done.getFinalizedAt());

        // Completed experiments stop routing and ignore late results
        assertFalse(manager.assign("sentiment", "late").inExperiment());
        manager.recordExperimentResult(experimentId, a, false, Map.of());
        assertEquals(20, manager.getExperimentResults(experimentId).orElseThrow().getArmA().getRequests());
    }

    @Test
    @DisplayName("Close arms should yield continue-testing or insufficient-evidence")
    void testInconclusiveRecommendations() {
        String a = manager.createVersion("sentiment", Map.of("v", "a"), null, null);
        String b = manager.createVersion("sentiment", Map.of("v", "b"), null, null);
        String experimentId = manager.startExperiment("sentiment", a, b, 0.5, Duration.ofHours(1));

        for (int i = 0; i < 5; i++) {
            manager.recordExperimentResult(experimentId, a, true, Map.of());
            manager.recordExperimentResult(experimentId, b, true, Map.of());
        }
        ExperimentResults early = manager.getExperimentResults(experimentId).orElseThrow();
        assertEquals(Recommendation.CONTINUE_TESTING, early.getRecommendation());
        assertNull(early.getWinner());
        assertFalse(early.isSampleSizeSufficient());

        for (int i = 0; i < 5; i++) {
            manager.recordExperimentResult(experimentId, a, true, Map.of());
            manager.recordExperimentResult(experimentId, b, true, Map.of());
        }
        assertEquals(Recommendation.INSUFFICIENT_EVIDENCE,
                manager.getExperimentResults(experimentId).orElseThrow().getRecommendation());
    }

    @Test
    @DisplayName("Unknown experiments should be empty")
    void testUnknownExperiment() {
        assertTrue(manager.getExperimentResults("exp_missing").isEmpty());
        assertDoesNotThrow(() -> manager.recordExperimentResult("exp_missing", "v", true, Map.of()));
    }
}
