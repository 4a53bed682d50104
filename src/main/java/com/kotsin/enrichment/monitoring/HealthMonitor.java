package com.kotsin.enrichment.monitoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HealthMonitor - Rolling metrics, threshold alerts and a composite health score
 *
 * OBSERVABILITY: Bounded series per metric, stats over a time window
 * ALERTING: Threshold checks run at most once per alert interval, triggered by
 *           incoming metrics and by the periodic report
 * HEALTH SCORE: Mean of inverted, normalised signals (error rate, latency against
 *           its learned baseline, open breakers, memory pressure), each in [0, 1]
 */
@Slf4j
@Service
public class HealthMonitor {

    static final double BASELINE_SMOOTHING = 0.05;
    static final int MAX_ALERTS = 100;
    static final Duration ACTIVE_ALERT_WINDOW = Duration.ofHours(1);
    static final double NO_DATA_SCORE = 0.5;

    private final Clock clock;
    private final int maxPointsPerMetric;
    private final long alertIntervalMs;
    private final AlertThresholds thresholds;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    private final Map<String, Deque<MetricSample>> series = new ConcurrentHashMap<>();
    private final Deque<Alert> alerts = new ArrayDeque<>();   // guarded by itself
    private final AtomicLong lastAlertCheck = new AtomicLong(-1L);

    private final Object baselineLock = new Object();
    private volatile Double explicitBaseline;
    private volatile Double learnedBaseline;

    @Autowired
    public HealthMonitor(Clock clock,
                         @Value("${monitoring.max-points-per-metric:1000}") int maxPointsPerMetric,
                         @Value("${monitoring.alert-interval-ms:60000}") long alertIntervalMs,
                         @Value("${monitoring.threshold.error-rate:0.1}") double errorRate,
                         @Value("${monitoring.threshold.latency-factor:2.0}") double latencyFactor,
                         @Value("${monitoring.threshold.open-breakers:2}") int openBreakers,
                         @Value("${monitoring.threshold.memory-usage:0.8}") double memoryUsage,
                         @Value("${monitoring.threshold.cache-miss-rate:0.9}") double cacheMissRate) {
        this(clock, maxPointsPerMetric, alertIntervalMs, AlertThresholds.builder()
                .errorRate(errorRate)
                .latencyDegradationFactor(latencyFactor)
                .openBreakers(openBreakers)
                .memoryUsage(memoryUsage)
                .cacheMissRate(cacheMissRate)
                .build());
    }

    public HealthMonitor(Clock clock, int maxPointsPerMetric, long alertIntervalMs, AlertThresholds thresholds) {
        this.clock = clock;
        this.maxPointsPerMetric = maxPointsPerMetric;
        this.alertIntervalMs = alertIntervalMs;
        this.thresholds = thresholds;
    }

    // ======================== RECORDING ========================

    public void record(String metric, double value) {
        record(metric, value, Collections.emptyMap());
    }

    public void record(String metric, double value, Map<String, String> tags) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.debug("[MONITOR] Ignoring non-finite value for {}", metric);
            return;
        }
        Deque<MetricSample> points = series.computeIfAbsent(metric, k -> new ArrayDeque<>());
        synchronized (points) {
            points.addLast(new MetricSample(value, clock.millis(),
                    tags == null ? Collections.emptyMap() : Map.copyOf(tags)));
            while (points.size() > maxPointsPerMetric) {
                points.removeFirst();
            }
        }
        if (MetricNames.ENRICHMENT_TIME_MS.equals(metric)) {
            updateBaseline(value);
        }
        maybeEvaluateAlerts();
    }

    private void updateBaseline(double latency) {
        synchronized (baselineLock) {
            Double current = learnedBaseline;
            learnedBaseline = current == null ? latency
                    : current + BASELINE_SMOOTHING * (latency - current);
        }
    }

    /**
     * Pin the latency baseline instead of learning it.
     */
    public void setBaseline(double baselineMs) {
        this.explicitBaseline = baselineMs;
    }

    public Optional<Double> getBaseline() {
        Double explicit = explicitBaseline;
        return Optional.ofNullable(explicit != null ? explicit : learnedBaseline);
    }

    // ======================== STATS ========================

    public Optional<Double> latest(String metric) {
        Deque<MetricSample> points = series.get(metric);
        if (points == null) {
            return Optional.empty();
        }
        synchronized (points) {
            return points.isEmpty() ? Optional.empty() : Optional.of(points.getLast().value());
        }
    }

    /**
     * @param window only points recorded within this window; null for all retained points
     */
    public MetricStats stats(String metric, Duration window) {
        Deque<MetricSample> points = series.get(metric);
        if (points == null) {
            return MetricStats.empty(metric);
        }
        long cutoff = window == null ? Long.MIN_VALUE : clock.millis() - window.toMillis();
        List<Double> values = new ArrayList<>();
        synchronized (points) {
            for (MetricSample sample : points) {
                if (sample.timestampMs() >= cutoff) {
                    values.add(sample.value());
                }
            }
        }
        if (values.isEmpty()) {
            return MetricStats.empty(metric);
        }

        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.size();
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return MetricStats.builder()
                .metric(metric)
                .count(values.size())
                .mean(mean)
                .min(min)
                .max(max)
                .latest(values.get(values.size() - 1))
                .stdDev(Math.sqrt(variance / values.size()))
                .build();
    }

    // ======================== ALERTS ========================

    private void maybeEvaluateAlerts() {
        long now = clock.millis();
        long last = lastAlertCheck.get();
        if (last >= 0 && now - last < alertIntervalMs) {
            return;
        }
        if (lastAlertCheck.compareAndSet(last, now)) {
            evaluateAlerts();
        }
    }

    /**
     * Run one threshold pass immediately.
     *
     * @return alerts raised by this pass
     */
    public List<Alert> evaluateAlerts() {
        List<Alert> raised = new ArrayList<>();

        latest(MetricNames.ERROR_RATE)
                .filter(v -> v > thresholds.getErrorRate())
                .ifPresent(v -> raised.add(alert(AlertType.ERROR_RATE_HIGH, v, thresholds.getErrorRate(),
                        String.format("Error rate %.1f%% above %.1f%%", v * 100, thresholds.getErrorRate() * 100))));

        Optional<Double> baseline = getBaseline().filter(b -> b > 0);
        if (baseline.isPresent()) {
            double limit = baseline.get() * thresholds.getLatencyDegradationFactor();
            latest(MetricNames.ENRICHMENT_TIME_MS)
                    .filter(v -> v > limit)
                    .ifPresent(v -> raised.add(alert(AlertType.PERFORMANCE_DEGRADATION, v, limit,
                            String.format("Enrichment time %.0fms vs baseline %.0fms", v, baseline.get()))));
        }

        latest(MetricNames.CIRCUIT_BREAKERS_OPEN)
                .filter(v -> v >= thresholds.getOpenBreakers())
                .ifPresent(v -> raised.add(alert(AlertType.CIRCUIT_BREAKERS_OPEN, v, thresholds.getOpenBreakers(),
                        String.format("%.0f circuit breakers open", v))));

        latest(MetricNames.MEMORY_USAGE)
                .filter(v -> v > thresholds.getMemoryUsage())
                .ifPresent(v -> raised.add(alert(AlertType.MEMORY_USAGE_HIGH, v, thresholds.getMemoryUsage(),
                        String.format("Heap usage %.1f%%", v * 100))));

        latest(MetricNames.CACHE_MISS_RATE)
                .filter(v -> v > thresholds.getCacheMissRate())
                .ifPresent(v -> raised.add(alert(AlertType.CACHE_MISS_RATE_HIGH, v, thresholds.getCacheMissRate(),
                        String.format("Cache miss rate %.1f%%", v * 100))));

        for (Alert alert : raised) {
            raise(alert);
        }
        return raised;
    }

    private Alert alert(AlertType type, double value, double threshold, String message) {
        return Alert.builder()
                .type(type)
                .severity(type.getSeverity())
                .message(message)
                .value(value)
                .threshold(threshold)
                .raisedAt(clock.instant())
                .build();
    }

    private void raise(Alert alert) {
        synchronized (alerts) {
            alerts.addLast(alert);
            while (alerts.size() > MAX_ALERTS) {
                alerts.removeFirst();
            }
        }
        switch (alert.getSeverity()) {
            case CRITICAL:
                log.error("[ALERT] {} {}: {}", alert.getSeverity(), alert.getType(), alert.getMessage());
                break;
            case WARNING:
                log.warn("[ALERT] {} {}: {}", alert.getSeverity(), alert.getType(), alert.getMessage());
                break;
            default:
                log.info("[ALERT] {} {}: {}", alert.getSeverity(), alert.getType(), alert.getMessage());
        }
    }

    /**
     * Alerts raised within the last hour.
     *
     * @param severity only this severity; null for all
     */
    public List<Alert> activeAlerts(AlertSeverity severity) {
        Instant cutoff = clock.instant().minus(ACTIVE_ALERT_WINDOW);
        List<Alert> active = new ArrayList<>();
        synchronized (alerts) {
            for (Alert alert : alerts) {
                if (alert.getRaisedAt().isAfter(cutoff) && (severity == null || alert.getSeverity() == severity)) {
                    active.add(alert);
                }
            }
        }
        return active;
    }

    // ======================== HEALTH SCORE ========================

    public double healthScore() {
        List<Double> factors = new ArrayList<>();

        latest(MetricNames.ERROR_RATE).ifPresent(err -> factors.add(clamp01(1.0 - 2.0 * err)));

        Optional<Double> baseline = getBaseline().filter(b -> b > 0);
        Optional<Double> latency = latest(MetricNames.ENRICHMENT_TIME_MS);
        if (baseline.isPresent() && latency.isPresent()) {
            factors.add(clamp01(2.0 - latency.get() / baseline.get()));
        }

        latest(MetricNames.CIRCUIT_BREAKERS_OPEN).ifPresent(open -> factors.add(clamp01(1.0 - 0.2 * open)));
        latest(MetricNames.MEMORY_USAGE).ifPresent(mem -> factors.add(clamp01(1.0 - mem)));

        if (factors.isEmpty()) {
            return NO_DATA_SCORE;
        }
        return factors.stream().mapToDouble(Double::doubleValue).average().orElse(NO_DATA_SCORE);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    // ======================== REPORTING ========================

    /**
     * Sample heap usage and run the alert pass if one is due.
     */
    @Scheduled(fixedRateString = "${monitoring.report-interval-ms:60000}")
    public void report() {
        double memory = sampleMemoryUsage();
        record(MetricNames.MEMORY_USAGE, memory);
        log.info("[MONITOR] health={} memory={}% activeAlerts={}",
                String.format("%.3f", healthScore()),
                String.format("%.1f", memory * 100),
                activeAlerts(null).size());
    }

    double sampleMemoryUsage() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        return max > 0 ? (double) heap.getUsed() / max : 0.0;
    }

    public Map<String, Object> monitoringReport() {
        Map<String, Object> metrics = new TreeMap<>();
        for (String metric : series.keySet()) {
            metrics.put(metric, stats(metric, Duration.ofHours(1)));
        }

        List<Alert> active = activeAlerts(null);
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        for (AlertSeverity severity : AlertSeverity.values()) {
            bySeverity.put(severity, 0);
        }
        active.forEach(a -> bySeverity.merge(a.getSeverity(), 1, Integer::sum));

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp", clock.instant());
        report.put("healthScore", healthScore());
        report.put("latencyBaselineMs", getBaseline().orElse(null));
        report.put("metrics", metrics);
        report.put("activeAlerts", active);
        report.put("alertCounts", bySeverity);
        return report;
    }
}
