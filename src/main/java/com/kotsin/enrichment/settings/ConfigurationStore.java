package com.kotsin.enrichment.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ConfigurationStore - Hot-reloadable settings and feature flags
 *
 * Features:
 * - Nested document addressed by dot paths, defaults merged under the file
 * - Immutable snapshots published by reference swap, so readers never see a half-applied change
 * - Background watcher reloads on file mtime change; a bad file keeps the last good snapshot
 * - Listeners receive only the changed paths
 * - Feature flags in a separate file, toggled without touching the main document
 */
@Slf4j
@Service
public class ConfigurationStore {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Boolean>> FLAGS_TYPE = new TypeReference<>() {};

    private static final long MAX_TIMEOUT_MS = 300_000L;
    private static final int MAX_FAILURE_THRESHOLD = 10;

    private final Path configFile;
    private final Path featuresFile;
    private final long reloadIntervalMs;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<ConfigSnapshot> current = new AtomicReference<>();
    private final AtomicReference<Map<String, Boolean>> featureFlags =
            new AtomicReference<>(Collections.emptyMap());
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    private volatile long lastConfigModified = -1L;
    private volatile long lastFeaturesModified = -1L;
    private volatile long backoffUntil;
    private long versionCounter;

    private ScheduledExecutorService watcher;
    private ScheduledFuture<?> watchTask;

    @Autowired
    public ConfigurationStore(@Value("${enrichment.config.file:./data/enrichment-config.json}") String configFile,
                              @Value("${enrichment.config.reload-interval-ms:5000}") long reloadIntervalMs,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this(Paths.get(configFile), reloadIntervalMs, objectMapper, clock);
    }

    public ConfigurationStore(Path configFile, long reloadIntervalMs, ObjectMapper objectMapper, Clock clock) {
        this.configFile = configFile;
        this.featuresFile = featuresFileFor(configFile);
        this.reloadIntervalMs = reloadIntervalMs;
        this.objectMapper = objectMapper;
        this.clock = clock;
        loadInitial();
    }

    private static Path featuresFileFor(Path configFile) {
        String name = configFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return configFile.resolveSibling(base + "-features.json");
    }

    // ======================== LIFECYCLE ========================

    private void loadInitial() {
        Map<String, Object> document = ConfigDefaults.document();
        if (Files.exists(configFile)) {
            try {
                Map<String, Object> merged = ConfigDocuments.deepMerge(document, readDocument());
                List<String> errors = validate(merged);
                if (errors.isEmpty()) {
                    document = merged;
                } else {
                    log.error("[CONFIG] {} failed validation, starting from defaults: {}", configFile, errors);
                }
                lastConfigModified = modifiedTime(configFile);
            } catch (ConfigurationException e) {
                log.error("[CONFIG] Could not read {}, starting from defaults", configFile, e);
            }
        } else {
            try {
                writeJson(configFile, document);
                lastConfigModified = modifiedTime(configFile);
                log.info("[CONFIG] Wrote default configuration to {}", configFile);
            } catch (ConfigurationException e) {
                log.warn("[CONFIG] Could not write default configuration to {}: {}", configFile, e.getMessage());
            }
        }
        current.set(newSnapshot(document));

        if (Files.exists(featuresFile)) {
            try {
                featureFlags.set(Collections.unmodifiableMap(new TreeMap<>(readFlags())));
                lastFeaturesModified = modifiedTime(featuresFile);
            } catch (ConfigurationException e) {
                log.error("[CONFIG] Could not read feature flags {}, all features enabled", featuresFile, e);
            }
        }
        log.info("[CONFIG] Loaded configuration version={} from {} ({} feature flags)",
                current.get().getVersion(), configFile, featureFlags.get().size());
    }

    /**
     * Start the background watcher. Disabled when the reload interval is not positive.
     */
    @PostConstruct
    public void start() {
        if (reloadIntervalMs <= 0 || watcher != null) {
            return;
        }
        watcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        watchTask = watcher.scheduleWithFixedDelay(this::checkForChanges,
                reloadIntervalMs, reloadIntervalMs, TimeUnit.MILLISECONDS);
        log.info("[CONFIG] Watching {} every {}ms", configFile, reloadIntervalMs);
    }

    @PreDestroy
    public void stop() {
        if (watchTask != null) {
            watchTask.cancel(false);
        }
        if (watcher != null) {
            watcher.shutdownNow();
            watcher = null;
        }
    }

    // ======================== WATCHER ========================

    /**
     * Reload the document and the feature flags if their files changed on disk.
     * Runs on the watcher thread; safe to call directly.
     */
    public void checkForChanges() {
        if (clock.millis() < backoffUntil) {
            return;
        }
        try {
            long configModified = modifiedTime(configFile);
            if (configModified > 0 && configModified != lastConfigModified) {
                reloadFromFile(configModified);
            }
            long featuresModified = modifiedTime(featuresFile);
            if (featuresModified > 0 && featuresModified != lastFeaturesModified) {
                reloadFlagsFromFile(featuresModified);
            }
        } catch (RuntimeException e) {
            // Back off for one extra interval before looking again
            backoffUntil = clock.millis() + 2 * Math.max(reloadIntervalMs, 1L);
            log.error("[CONFIG] Reload failed, keeping last known good configuration", e);
        }
    }

    private void reloadFromFile(long modified) {
        Map<String, ConfigChange> changes;
        synchronized (writeLock) {
            lastConfigModified = modified;
            Map<String, Object> merged = ConfigDocuments.deepMerge(ConfigDefaults.document(), readDocument());
            List<String> errors = validate(merged);
            if (!errors.isEmpty()) {
                log.warn("[CONFIG] Ignoring invalid configuration change in {}: {}", configFile, errors);
                return;
            }
            ConfigSnapshot previous = current.get();
            changes = ConfigDocuments.diff(previous.asMap(), merged);
            if (changes.isEmpty()) {
                return;
            }
            current.set(newSnapshot(merged));
        }
        log.info("[CONFIG] Reloaded {} with {} changed paths", configFile, changes.size());
        notifyListeners(changes);
    }

    private void reloadFlagsFromFile(long modified) {
        Map<String, ConfigChange> changes;
        synchronized (writeLock) {
            lastFeaturesModified = modified;
            Map<String, Boolean> updated = Collections.unmodifiableMap(new TreeMap<>(readFlags()));
            changes = diffFlags(featureFlags.get(), updated);
            featureFlags.set(updated);
        }
        if (!changes.isEmpty()) {
            log.info("[CONFIG] Reloaded feature flags, changed={}", changes.keySet());
            notifyListeners(changes);
        }
    }

    // ======================== READ ========================

    public ConfigSnapshot snapshot() {
        return current.get();
    }

    public Object get(String path, Object defaultValue) {
        return current.get().get(path, defaultValue);
    }

    public String getString(String path, String defaultValue) {
        return current.get().getString(path, defaultValue);
    }

    public int getInt(String path, int defaultValue) {
        return current.get().getInt(path, defaultValue);
    }

    public long getLong(String path, long defaultValue) {
        return current.get().getLong(path, defaultValue);
    }

    public double getDouble(String path, double defaultValue) {
        return current.get().getDouble(path, defaultValue);
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        return current.get().getBoolean(path, defaultValue);
    }

    /**
     * Unset flags are enabled.
     */
    public boolean isEnabled(String featureName) {
        return featureFlags.get().getOrDefault(featureName, Boolean.TRUE);
    }

    public Map<String, Boolean> getFeatureFlags() {
        return featureFlags.get();
    }

    /**
     * A provider is available when its config section is enabled AND its feature flag is on.
     */
    public boolean isProviderAvailable(String kind) {
        return getBoolean("providers." + kind + ".enabled", false) && isEnabled(kind);
    }

    // ======================== WRITE ========================

    /**
     * Set a value, persist the document and notify listeners.
     *
     * @throws IllegalArgumentException if the resulting document fails validation
     */
    public void set(String path, Object value) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        Map<String, ConfigChange> changes;
        synchronized (writeLock) {
            ConfigSnapshot previous = current.get();
            Map<String, Object> updated = previous.mutableCopy();
            ConfigDocuments.put(updated, path, value);
            List<String> errors = validate(updated);
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid configuration: " + String.join("; ", errors));
            }
            changes = ConfigDocuments.diff(previous.asMap(), updated);
            if (changes.isEmpty()) {
                return;
            }
            current.set(newSnapshot(updated));
            persistDocument(updated);
        }
        log.info("[CONFIG] Set {}={} ({} changed paths)", path, value, changes.size());
        notifyListeners(changes);
    }

    public void enableFeature(String featureName) {
        setFeature(featureName, true);
    }

    public void disableFeature(String featureName) {
        setFeature(featureName, false);
    }

    private void setFeature(String featureName, boolean enabled) {
        Map<String, ConfigChange> changes;
        synchronized (writeLock) {
            Map<String, Boolean> previous = featureFlags.get();
            Map<String, Boolean> updated = new TreeMap<>(previous);
            updated.put(featureName, enabled);
            changes = diffFlags(previous, updated);
            featureFlags.set(Collections.unmodifiableMap(updated));
            try {
                writeJson(featuresFile, updated);
                lastFeaturesModified = modifiedTime(featuresFile);
            } catch (ConfigurationException e) {
                log.warn("[CONFIG] Feature flag {} applied in memory only: {}", featureName, e.getMessage());
            }
        }
        log.info("[CONFIG] Feature '{}' {}", featureName, enabled ? "enabled" : "disabled");
        if (!changes.isEmpty()) {
            notifyListeners(changes);
        }
    }

    /**
     * Replace the document with the defaults, persist and notify.
     */
    public void resetToDefaults() {
        Map<String, ConfigChange> changes;
        synchronized (writeLock) {
            Map<String, Object> defaults = ConfigDefaults.document();
            changes = ConfigDocuments.diff(current.get().asMap(), defaults);
            current.set(newSnapshot(defaults));
            persistDocument(defaults);
        }
        log.warn("[CONFIG] Reset to defaults ({} changed paths)", changes.size());
        if (!changes.isEmpty()) {
            notifyListeners(changes);
        }
    }

    // ======================== LISTENERS ========================

    public void onChange(ConfigChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(Map<String, ConfigChange> changes) {
        Map<String, ConfigChange> view = Collections.unmodifiableMap(changes);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onChange(view);
            } catch (RuntimeException e) {
                log.error("[CONFIG] Listener {} failed on change {}", listener, view.keySet(), e);
            }
        }
    }

    private static Map<String, ConfigChange> diffFlags(Map<String, Boolean> previous, Map<String, Boolean> updated) {
        Map<String, ConfigChange> changes = new TreeMap<>();
        TreeSet<String> names = new TreeSet<>(previous.keySet());
        names.addAll(updated.keySet());
        for (String name : names) {
            boolean before = previous.getOrDefault(name, Boolean.TRUE);
            boolean after = updated.getOrDefault(name, Boolean.TRUE);
            if (before != after) {
                changes.put("features." + name, new ConfigChange(before, after));
            }
        }
        return changes;
    }

    // ======================== VALIDATION ========================

    /**
     * Validate the current document.
     */
    public List<String> validate() {
        return validate(current.get().asMap());
    }

    @SuppressWarnings("unchecked")
    static List<String> validate(Map<String, Object> document) {
        List<String> errors = new ArrayList<>();

        checkRange(document, "system.global_timeout_ms", 1, MAX_TIMEOUT_MS, errors);
        checkRange(document, "system.shed_below_health", 0.0, 1.0, errors);
        checkRange(document, "system.cache_ttl_seconds", 1, 86_400, errors);

        Object providers = ConfigDocuments.lookup(document, "providers");
        if (providers instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) providers).entrySet()) {
                if (!(entry.getValue() instanceof Map)) {
                    errors.add("providers." + entry.getKey() + " must be a section");
                    continue;
                }
                String prefix = "providers." + entry.getKey();
                if (Boolean.TRUE.equals(ConfigDocuments.lookup(document, prefix + ".enabled"))) {
                    checkRange(document, prefix + ".timeout_ms", 1, MAX_TIMEOUT_MS, errors);
                }
                checkRange(document, prefix + ".confidence_floor", 0.0, 1.0, errors);
            }
        }

        checkRange(document, "circuit_breakers.failure_threshold", 1, MAX_FAILURE_THRESHOLD, errors);
        Object breakers = ConfigDocuments.lookup(document, "circuit_breakers");
        if (breakers instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) breakers).entrySet()) {
                if (entry.getValue() instanceof Map) {
                    String prefix = "circuit_breakers." + entry.getKey();
                    checkRange(document, prefix + ".failure_threshold", 1, MAX_FAILURE_THRESHOLD, errors);
                    checkRange(document, prefix + ".recovery_timeout_ms", 0, 3_600_000, errors);
                }
            }
        }
        return errors;
    }

    private static void checkRange(Map<String, Object> document, String path, double min, double max,
                                   List<String> errors) {
        Object value = ConfigDocuments.lookup(document, path);
        if (value == null) {
            return;
        }
        if (!(value instanceof Number)) {
            errors.add(path + " must be a number");
            return;
        }
        double number = ((Number) value).doubleValue();
        if (number < min || number > max) {
            errors.add(path + " must be between " + min + " and " + max + " (was " + number + ")");
        }
    }

    // ======================== IO ========================

    private ConfigSnapshot newSnapshot(Map<String, Object> document) {
        return new ConfigSnapshot(document, ++versionCounter, clock.instant());
    }

    private void persistDocument(Map<String, Object> document) {
        try {
            writeJson(configFile, document);
            lastConfigModified = modifiedTime(configFile);
        } catch (ConfigurationException e) {
            log.warn("[CONFIG] Change applied in memory only: {}", e.getMessage());
        }
    }

    private Map<String, Object> readDocument() {
        try {
            Map<String, Object> document = objectMapper.readValue(configFile.toFile(), DOCUMENT_TYPE);
            return document != null ? document : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + configFile, e);
        }
    }

    private Map<String, Boolean> readFlags() {
        try {
            Map<String, Boolean> flags = objectMapper.readValue(featuresFile.toFile(), FLAGS_TYPE);
            return flags != null ? flags : Collections.emptyMap();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + featuresFile, e);
        }
    }

    private void writeJson(Path target, Object value) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write " + target, e);
        }
    }

    private static long modifiedTime(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to stat " + file, e);
        }
    }

    public Path getConfigFile() {
        return configFile;
    }

    public Path getFeaturesFile() {
        return featuresFile;
    }
}
