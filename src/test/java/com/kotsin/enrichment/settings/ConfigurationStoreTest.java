package com.kotsin.enrichment.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.enrichment.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigurationStore - Comprehensive Tests")
class ConfigurationStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private Path configFile;
    private ConfigurationStore store;
    private List<Map<String, ConfigChange>> notifications;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        configFile = tempDir.resolve("enrichment-config.json");
        store = new ConfigurationStore(configFile, 0, objectMapper, clock);
        notifications = new ArrayList<>();
        store.onChange(notifications::add);
    }

    /**
     * Overwrite the config file and push its mtime forward so the watcher sees it.
     */
    private void rewrite(Path file, String json) throws IOException {
        long previous = Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : 0L;
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(file, FileTime.fromMillis(previous + 10_000));
    }

    // ========== LOADING TESTS ==========

    @Test
    @DisplayName("Missing file should be created from defaults")
    void testDefaultsWritten() {
        assertTrue(Files.exists(configFile));
        assertEquals(30_000, store.getInt("system.global_timeout_ms", -1));
        assertEquals(5, store.getInt("circuit_breakers.sentiment.failure_threshold", -1));
        assertTrue(store.getBoolean("providers.price_predictor.essential", false));
        assertFalse(store.getBoolean("providers.sentiment.essential", true));
        assertTrue(store.getBoolean("caching.enabled", false));
    }

    @Test
    @DisplayName("Defaults should only carry keys the service reads")
    void testDefaultsHaveNoUnusedSystemKeys() {
        Map<?, ?> system = (Map<?, ?>) ConfigDefaults.document().get("system");

        assertEquals(Set.of("global_timeout_ms", "cache_ttl_seconds", "shed_below_health"), system.keySet());
        assertNull(store.get("system.max_workers", null));
    }

    @Test
    @DisplayName("File values should be merged over defaults")
    void testFileMergedOverDefaults() throws IOException {
        Path file = tempDir.resolve("custom.json");
        Files.writeString(file, "{\"system\":{\"global_timeout_ms\":2000}}");

        ConfigurationStore custom = new ConfigurationStore(file, 0, objectMapper, clock);

        assertEquals(2000, custom.getInt("system.global_timeout_ms", -1));
        assertEquals(300, custom.getInt("system.cache_ttl_seconds", -1));
    }

    @Test
    @DisplayName("Invalid file at startup should fall back to defaults")
    void testInvalidFileAtStartup() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"system\":{\"global_timeout_ms\":-5}}");

        ConfigurationStore custom = new ConfigurationStore(file, 0, objectMapper, clock);

        assertEquals(30_000, custom.getInt("system.global_timeout_ms", -1));
    }

    @Test
    @DisplayName("Missing paths should return the supplied default")
    void testDefaultsForMissingPaths() {
        assertEquals("fallback", store.getString("nope.nothing", "fallback"));
        assertEquals(7, store.getInt("system.nope", 7));
        assertNull(store.get("providers.unknown.enabled", null));
    }

    // ========== SET TESTS ==========

    @Test
    @DisplayName("Set should persist, bump the version and notify only changed paths")
    void testSetNotifiesDiff() throws IOException {
        long version = store.snapshot().getVersion();

        store.set("providers.sentiment.timeout_ms", 2500);

        assertEquals(2500, store.getInt("providers.sentiment.timeout_ms", -1));
        assertTrue(store.snapshot().getVersion() > version);
        assertEquals(1, notifications.size());
        Map<String, ConfigChange> change = notifications.get(0);
        assertEquals(1, change.size());
        ConfigChange sentiment = change.get("providers.sentiment.timeout_ms");
        assertEquals(5000, ((Number) sentiment.oldValue()).intValue());
        assertEquals(2500, ((Number) sentiment.newValue()).intValue());

        Map<?, ?> persisted = objectMapper.readValue(configFile.toFile(), Map.class);
        assertEquals(2500, ((Map<?, ?>) ((Map<?, ?>) persisted.get("providers")).get("sentiment")).get("timeout_ms"));
    }

    @Test
    @DisplayName("Setting an identical value should not notify")
    void testSetSameValueNoNotification() {
        store.set("system.global_timeout_ms", 30_000);

        assertTrue(notifications.isEmpty());
    }

    @Test
    @DisplayName("Invalid set should be rejected and leave the snapshot untouched")
    void testInvalidSetRejected() {
        ConfigSnapshot before = store.snapshot();

        assertThrows(IllegalArgumentException.class, () -> store.set("system.shed_below_health", 1.5));
        assertThrows(IllegalArgumentException.class,
                () -> store.set("circuit_breakers.consensus.failure_threshold", 0));
        assertThrows(IllegalArgumentException.class, () -> store.set("providers.sentiment.timeout_ms", "fast"));

        assertSame(before, store.snapshot());
        assertTrue(notifications.isEmpty());
    }

    @Test
    @DisplayName("Snapshots should be immutable")
    void testSnapshotImmutable() {
        Map<String, Object> document = store.snapshot().asMap();

        assertThrows(UnsupportedOperationException.class, () -> document.put("x", 1));
    }

    // ========== RELOAD TESTS ==========

    @Test
    @DisplayName("Watcher should reload a changed file and report the diff")
    void testReloadOnChange() throws IOException {
        Map<String, Object> document = new LinkedHashMap<>(store.snapshot().mutableCopy());
        ConfigDocuments.put(document, "system.global_timeout_ms", 1500);
        rewrite(configFile, objectMapper.writeValueAsString(document));

        store.checkForChanges();

        assertEquals(1500, store.getInt("system.global_timeout_ms", -1));
        assertEquals(1, notifications.size());
        assertEquals(Set.of("system.global_timeout_ms"), notifications.get(0).keySet());
    }

    @Test
    @DisplayName("Invalid reload should keep the last known good snapshot")
    void testInvalidReloadKeepsLastGood() throws IOException {
        ConfigSnapshot before = store.snapshot();
        rewrite(configFile, "{\"system\":{\"global_timeout_ms\":999999999}}");

        store.checkForChanges();

        assertSame(before, store.snapshot());
        assertTrue(notifications.isEmpty());
    }

    @Test
    @DisplayName("Malformed file should keep the last snapshot and back off")
    void testMalformedReload() throws IOException {
        ConfigSnapshot before = store.snapshot();
        rewrite(configFile, "{not json");

        assertDoesNotThrow(() -> store.checkForChanges());
        assertSame(before, store.snapshot());

        // Fixed on disk, picked up once the backoff has passed
        rewrite(configFile, "{\"system\":{\"cache_ttl_seconds\":60}}");
        clock.advanceMillis(10);
        store.checkForChanges();
        assertEquals(60, store.getInt("system.cache_ttl_seconds", -1));
    }

    @Test
    @DisplayName("Unchanged mtime should not reload")
    void testNoChangeNoReload() {
        long version = store.snapshot().getVersion();

        store.checkForChanges();

        assertEquals(version, store.snapshot().getVersion());
    }

    // ========== FEATURE FLAG TESTS ==========

    @Test
    @DisplayName("Unset flags should be enabled")
    void testUnsetFlagEnabled() {
        assertTrue(store.isEnabled("sentiment"));
        assertTrue(store.isProviderAvailable("sentiment"));
    }

    @Test
    @DisplayName("Disabling a flag should make the provider unavailable and notify")
    void testDisableFeature() {
        store.disableFeature("sentiment");

        assertFalse(store.isEnabled("sentiment"));
        assertFalse(store.isProviderAvailable("sentiment"));
        assertTrue(Files.exists(store.getFeaturesFile()));
        assertTrue(notifications.get(0).containsKey("features.sentiment"));

        store.enableFeature("sentiment");
        assertTrue(store.isProviderAvailable("sentiment"));
    }

    @Test
    @DisplayName("Provider availability requires the config section to be enabled")
    void testAvailabilityRequiresEnabledSection() {
        store.set("providers.consensus.enabled", false);

        assertFalse(store.isProviderAvailable("consensus"));
        assertFalse(store.isProviderAvailable("not_configured"));
    }

    @Test
    @DisplayName("Feature flags file edited on disk should be reloaded")
    void testFlagsReloaded() throws IOException {
        rewrite(store.getFeaturesFile(), "{\"policy_engine\":false}");

        store.checkForChanges();

        assertFalse(store.isEnabled("policy_engine"));
        assertTrue(notifications.get(0).containsKey("features.policy_engine"));
    }

    // ========== VALIDATION / RESET TESTS ==========

    @Test
    @DisplayName("Defaults should validate cleanly")
    void testDefaultsValid() {
        assertTrue(ConfigurationStore.validate(ConfigDefaults.document()).isEmpty());
        assertTrue(store.validate().isEmpty());
    }

    @Test
    @DisplayName("Disabled providers should not need a timeout")
    void testDisabledProviderTimeoutIgnored() {
        Map<String, Object> document = ConfigDefaults.document();
        ConfigDocuments.put(document, "providers.sentiment.enabled", false);
        ConfigDocuments.put(document, "providers.sentiment.timeout_ms", 0);

        assertTrue(ConfigurationStore.validate(document).isEmpty());
    }

    @Test
    @DisplayName("Reset should restore defaults and notify")
    void testResetToDefaults() {
        store.set("system.cache_ttl_seconds", 30);
        notifications.clear();

        store.resetToDefaults();

        assertEquals(300, store.getInt("system.cache_ttl_seconds", -1));
        assertTrue(notifications.get(0).containsKey("system.cache_ttl_seconds"));
    }

    @Test
    @DisplayName("A failing listener should not stop other listeners")
    void testListenerIsolation() {
        List<String> seen = new ArrayList<>();
        store.onChange(changes -> {
            throw new IllegalStateException("listener bug");
        });
        store.onChange(changes -> seen.addAll(changes.keySet()));

        store.set("system.cache_ttl_seconds", 42);

        assertEquals(List.of("system.cache_ttl_seconds"), seen);
    }
}
