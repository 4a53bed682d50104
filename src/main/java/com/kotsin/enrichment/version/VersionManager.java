package com.kotsin.enrichment.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * VersionManager - Named provider configurations and A/B rollouts
 *
 * VERSIONS:
 * - Id: {@code <kind>_v<yyyyMMdd_HHmmss>_<md5(config) first 8>}
 * - Stored as {@code <dir>/<id>.json}, read through a bounded Caffeine cache
 * - The newest version of a kind becomes its active version
 *
 * EXPERIMENTS:
 * - Request routing: bucket = md5(requestId) mod 100 + 1, arm A iff bucket <= round(split * 100).
 *   The boundary bucket belongs to A, and a request id always lands in the same arm.
 * - Results are finalised once the experiment window ends
 */
@Slf4j
@Service
public class VersionManager {

    static final int PERFORMANCE_WINDOW = 100;
    private static final String ACTIVE_VERSIONS_FILE = "active_versions.json";
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<Map<String, String>> ACTIVE_TYPE = new TypeReference<>() {};

    private final Path versionsDir;
    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;
    private final int minSampleSize;

    private final Cache<String, VersionRecord> records;
    private final Map<String, String> activeVersions = new ConcurrentHashMap<>();
    private final Map<String, Experiment> experiments = new ConcurrentHashMap<>();
    private final Object createLock = new Object();
    private final AtomicLong experimentSequence = new AtomicLong(0);

    @Autowired
    public VersionManager(@Value("${versions.dir:./data/versions}") String versionsDir,
                          @Value("${versions.cache.max-size:500}") long cacheSize,
                          @Value("${experiments.min-sample-size:100}") int minSampleSize,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this(Paths.get(versionsDir), cacheSize, minSampleSize, objectMapper, clock);
    }

    public VersionManager(Path versionsDir, long cacheSize, int minSampleSize, ObjectMapper objectMapper, Clock clock) {
        this.versionsDir = versionsDir;
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.clock = clock;
        this.minSampleSize = minSampleSize;
        this.records = Caffeine.newBuilder().maximumSize(cacheSize).build();
        loadActiveVersions();
    }

    // ======================== VERSIONS ========================

    /**
     * Create a version and make it the active one for its kind.
     *
     * @return the new version id
     */
    public String createVersion(String kind, Map<String, Object> config, String parentVersionId, String description) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("provider kind must not be blank");
        }
        Map<String, Object> payload = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
        Instant now = clock.instant();

        VersionRecord record;
        synchronized (createLock) {
            String baseId = kind + "_v" + ID_FORMAT.format(now.atZone(clock.getZone())) + "_" + configHash(payload);
            String versionId = baseId;
            int sequence = 1;
            while (exists(versionId)) {
                versionId = baseId + "_" + sequence++;
            }
            record = VersionRecord.builder()
                    .versionId(versionId)
                    .providerKind(kind)
                    .config(payload)
                    .createdAt(now)
                    .parentVersionId(parentVersionId)
                    .description(description)
                    .performance(new TreeMap<>())
                    .build();
            records.put(versionId, record);
            activeVersions.put(kind, versionId);
        }
        saveRecord(record);
        saveActiveVersions();
        log.info("[VERSION] Created {} (parent={})", record.getVersionId(), parentVersionId);
        return record.getVersionId();
    }

    /**
     * @param versionId version to read, or null for the active version of {@code kind}
     */
    public Optional<VersionRecord> getVersion(String kind, String versionId) {
        String id = versionId != null ? versionId : activeVersions.get(kind);
        if (id == null) {
            return Optional.empty();
        }
        VersionRecord record = records.get(id, this::loadRecord);
        if (record == null || (kind != null && !kind.equals(record.getProviderKind()))) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * The record to use for a call: the requested version, or the active one if it
     * cannot be read.
     */
    public Optional<VersionRecord> resolveVersion(String kind, String versionId) {
        try {
            Optional<VersionRecord> requested = getVersion(kind, versionId);
            if (requested.isPresent() || versionId == null) {
                return requested;
            }
            log.warn("[VERSION] {} not found for {}, falling back to active version", versionId, kind);
        } catch (RuntimeException e) {
            log.warn("[VERSION] Lookup of {} failed for {}, falling back to active version: {}",
                    versionId, kind, e.getMessage());
        }
        try {
            return getVersion(kind, null);
        } catch (RuntimeException e) {
            log.warn("[VERSION] Active version lookup failed for {}: {}", kind, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> activeVersionId(String kind) {
        return Optional.ofNullable(activeVersions.get(kind));
    }

    public Map<String, String> activeVersions() {
        return Collections.unmodifiableMap(new TreeMap<>(activeVersions));
    }

    public void activateVersion(String kind, String versionId) {
        if (getVersion(kind, versionId).isEmpty()) {
            throw new IllegalArgumentException("Unknown version " + versionId + " for " + kind);
        }
        String previous = activeVersions.put(kind, versionId);
        saveActiveVersions();
        log.info("[VERSION] Active version for {}: {} -> {}", kind, previous, versionId);
    }

    /**
     * Versions of a kind on disk, newest first.
     */
    public List<VersionRecord> listVersions(String kind) {
        List<VersionRecord> result = new ArrayList<>();
        if (!Files.isDirectory(versionsDir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(versionsDir, kind + "_v*.json")) {
            for (Path file : stream) {
                String id = file.getFileName().toString().replaceFirst("\\.json$", "");
                getVersion(kind, id).ifPresent(result::add);
            }
        } catch (IOException e) {
            log.warn("[VERSION] Could not list versions for {}: {}", kind, e.getMessage());
        }
        result.sort(Comparator.comparing(VersionRecord::getCreatedAt).reversed());
        return result;
    }

    /**
     * Append performance samples to a version, keeping the last {@value #PERFORMANCE_WINDOW} per metric.
     *
     * @return false if the version is unknown
     */
    public boolean updateVersionPerformance(String versionId, Map<String, Double> metrics) {
        VersionRecord record = records.get(versionId, this::loadRecord);
        if (record == null) {
            log.warn("[VERSION] Cannot record performance for unknown version {}", versionId);
            return false;
        }
        synchronized (record) {
            if (record.getPerformance() == null) {
                record.setPerformance(new TreeMap<>());
            }
            metrics.forEach((name, value) -> {
                List<Double> series = record.getPerformance().computeIfAbsent(name, k -> new ArrayList<>());
                series.add(value);
                if (series.size() > PERFORMANCE_WINDOW) {
                    series.subList(0, series.size() - PERFORMANCE_WINDOW).clear();
                }
            });
            saveRecord(record);
        }
        return true;
    }

    private boolean exists(String versionId) {
        return records.getIfPresent(versionId) != null || Files.exists(recordFile(versionId));
    }

    private String configHash(Map<String, Object> config) {
        try {
            byte[] json = canonicalMapper.writeValueAsString(config).getBytes(StandardCharsets.UTF_8);
            return DigestUtils.md5DigestAsHex(json).substring(0, 8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Version config is not serialisable", e);
        }
    }

    // ======================== EXPERIMENTS ========================

    /**
     * @param split share of traffic routed to {@code versionA}, in [0, 1]
     * @return the experiment id
     */
    public String startExperiment(String kind, String versionA, String versionB, double split, Duration duration) {
        if (Double.isNaN(split) || split < 0.0 || split > 1.0) {
            throw new IllegalArgumentException("split must be within [0, 1]");
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be positive");
        }
        if (getVersion(kind, versionA).isEmpty() || getVersion(kind, versionB).isEmpty()) {
            throw new IllegalArgumentException("Both versions must exist for " + kind);
        }

        Instant now = clock.instant();
        Experiment experiment;
        synchronized (createLock) {
            if (runningExperiment(kind) != null) {
                throw new IllegalArgumentException("An experiment is already running for " + kind);
            }
            String id = "exp_" + kind + "_" + ID_FORMAT.format(now.atZone(clock.getZone()))
                    + "_" + experimentSequence.incrementAndGet();
            experiment = new Experiment(id, kind, versionA, versionB, split, now, now.plus(duration));
            experiments.put(id, experiment);
        }
        String experimentId = experiment.getExperimentId();
        log.info("[EXPERIMENT] Started {}: {} vs {} split={} until {}",
                experimentId, versionA, versionB, split, experiment.getEndsAt());
        return experimentId;
    }

    public String versionForRequest(String kind, String requestId) {
        return assign(kind, requestId).versionId();
    }

    /**
     * Version for a request, with the experiment that chose it. Falls back to the
     * active version on any lookup failure.
     */
    public VersionAssignment assign(String kind, String requestId) {
        try {
            Experiment experiment = runningExperiment(kind);
            if (experiment != null && requestId != null) {
                String versionId = routesToA(bucketFor(requestId), experiment.getTrafficSplit())
                        ? experiment.getVersionA()
                        : experiment.getVersionB();
                return new VersionAssignment(versionId, experiment.getExperimentId());
            }
        } catch (RuntimeException e) {
            log.warn("[EXPERIMENT] Routing failed for {}, using active version: {}", kind, e.getMessage());
        }
        return new VersionAssignment(activeVersions.get(kind), null);
    }

    /**
     * Stable bucket in 1..100 for a request id.
     */
    static int bucketFor(String requestId) {
        byte[] digest = DigestUtils.md5Digest(requestId.getBytes(StandardCharsets.UTF_8));
        return new BigInteger(1, digest).mod(BigInteger.valueOf(100)).intValue() + 1;
    }

    static boolean routesToA(int bucket, double split) {
        return bucket <= Math.round(split * 100);
    }

    public void recordExperimentResult(String experimentId, String versionId, boolean success,
                                       Map<String, Double> metrics) {
        Experiment experiment = experiments.get(experimentId);
        if (experiment == null) {
            log.warn("[EXPERIMENT] Result for unknown experiment {}", experimentId);
            return;
        }
        if (experiment.getStatus() != ExperimentStatus.RUNNING) {
            return;
        }
        if (!experiment.record(versionId, success, metrics)) {
            log.warn("[EXPERIMENT] Version {} is not part of {}", versionId, experimentId);
        }
    }

    public Optional<ExperimentResults> getExperimentResults(String experimentId) {
        Experiment experiment = experiments.get(experimentId);
        if (experiment == null) {
            return Optional.empty();
        }
        if (experiment.getStatus() == ExperimentStatus.RUNNING && experiment.isExpired(clock.instant())) {
            finalizeExperiment(experiment);
        }
        if (experiment.getStatus() == ExperimentStatus.COMPLETED) {
            return Optional.of(experiment.getFinalResults());
        }
        return Optional.of(evaluate(experiment, ExperimentStatus.RUNNING, null));
    }

    public List<ExperimentResults> listExperiments() {
        List<ExperimentResults> results = new ArrayList<>();
        for (String id : new TreeMap<>(experiments).keySet()) {
            getExperimentResults(id).ifPresent(results::add);
        }
        return results;
    }

    @Scheduled(fixedDelayString = "${experiments.sweep-interval-ms:60000}")
    public void finalizeExpiredExperiments() {
        Instant now = clock.instant();
        for (Experiment experiment : experiments.values()) {
            if (experiment.getStatus() == ExperimentStatus.RUNNING && experiment.isExpired(now)) {
                finalizeExperiment(experiment);
            }
        }
    }

    private Experiment runningExperiment(String kind) {
        Instant now = clock.instant();
        for (Experiment experiment : experiments.values()) {
            if (!experiment.getProviderKind().equals(kind)
                    || experiment.getStatus() != ExperimentStatus.RUNNING) {
                continue;
            }
            if (experiment.isExpired(now)) {
                finalizeExperiment(experiment);
                continue;
            }
            return experiment;
        }
        return null;
    }

    private void finalizeExperiment(Experiment experiment) {
        synchronized (experiment) {
            if (experiment.getStatus() == ExperimentStatus.COMPLETED) {
                return;
            }
            ExperimentResults results = evaluate(experiment, ExperimentStatus.COMPLETED, clock.instant());
            experiment.complete(results);
            log.info("[EXPERIMENT] Finalized {}: winner={}, recommendation={}, sampleSizeSufficient={}",
                    experiment.getExperimentId(), results.getWinner(), results.getRecommendation(),
                    results.isSampleSizeSufficient());
        }
    }

    private ExperimentResults evaluate(Experiment experiment, ExperimentStatus status, Instant finalizedAt) {
        ArmStats a = experiment.statsA();
        ArmStats b = experiment.statsB();
        double errorA = a.getErrorRate();
        double errorB = b.getErrorRate();

        String winner = null;
        if (errorA < errorB) {
            winner = a.getVersionId();
        } else if (errorB < errorA) {
            winner = b.getVersionId();
        }
        double confidence = Math.abs(errorA - errorB) / Math.max(Math.max(errorA, errorB), 0.01);
        boolean sufficient = Math.min(a.getRequests(), b.getRequests()) >= minSampleSize;

        Recommendation recommendation;
        if (errorA < 0.9 * errorB) {
            recommendation = Recommendation.ADOPT_A;
        } else if (errorB < 0.9 * errorA) {
            recommendation = Recommendation.ADOPT_B;
        } else if (sufficient) {
            recommendation = Recommendation.INSUFFICIENT_EVIDENCE;
        } else {
            recommendation = Recommendation.CONTINUE_TESTING;
        }

        return ExperimentResults.builder()
                .experimentId(experiment.getExperimentId())
                .providerKind(experiment.getProviderKind())
                .status(status)
                .trafficSplit(experiment.getTrafficSplit())
                .startedAt(experiment.getStartedAt())
                .endsAt(experiment.getEndsAt())
                .armA(a)
                .armB(b)
                .winner(winner)
                .confidence(confidence)
                .recommendation(recommendation)
                .sampleSizeSufficient(sufficient)
                .finalizedAt(finalizedAt)
                .build();
    }

    // ======================== PERSISTENCE ========================

    private Path recordFile(String versionId) {
        return versionsDir.resolve(versionId + ".json");
    }

    private VersionRecord loadRecord(String versionId) {
        Path file = recordFile(versionId);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return objectMapper.readValue(file.toFile(), VersionRecord.class);
        } catch (IOException e) {
            log.warn("[VERSION] Could not read {}: {}", file, e.getMessage());
            return null;
        }
    }

    private void saveRecord(VersionRecord record) {
        writeJson(recordFile(record.getVersionId()), record);
    }

    private void saveActiveVersions() {
        writeJson(versionsDir.resolve(ACTIVE_VERSIONS_FILE), new TreeMap<>(activeVersions));
    }

    private void loadActiveVersions() {
        Path file = versionsDir.resolve(ACTIVE_VERSIONS_FILE);
        if (!Files.exists(file)) {
            return;
        }
        try {
            activeVersions.putAll(objectMapper.readValue(file.toFile(), ACTIVE_TYPE));
            log.info("[VERSION] Loaded active versions: {}", activeVersions);
        } catch (IOException e) {
            log.warn("[VERSION] Could not read active versions from {}: {}", file, e.getMessage());
        }
    }

    private void writeJson(Path target, Object value) {
        try {
            Files.createDirectories(versionsDir);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("[VERSION] Could not write {}: {}", target, e.getMessage());
        }
    }
}
