package com.kotsin.enrichment.settings;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable configuration document. Readers hold a snapshot for as long as they
 * need a consistent view; the store replaces it wholesale on change.
 */
public final class ConfigSnapshot {

    private final Map<String, Object> document;
    private final long version;
    private final Instant loadedAt;

    ConfigSnapshot(Map<String, Object> document, long version, Instant loadedAt) {
        this.document = ConfigDocuments.deepUnmodifiable(document);
        this.version = version;
        this.loadedAt = loadedAt;
    }

    public Object get(String path) {
        return ConfigDocuments.lookup(document, path);
    }

    public Object get(String path, Object defaultValue) {
        Object value = get(path);
        return value != null ? value : defaultValue;
    }

    public String getString(String path, String defaultValue) {
        Object value = get(path);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String path, int defaultValue) {
        Object value = get(path);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public long getLong(String path, long defaultValue) {
        Object value = get(path);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(String path, double defaultValue) {
        Object value = get(path);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        Object value = get(path);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * @return the unmodifiable document
     */
    public Map<String, Object> asMap() {
        return document;
    }

    /**
     * @return a mutable deep copy, for building the next snapshot
     */
    Map<String, Object> mutableCopy() {
        return ConfigDocuments.deepCopy(document);
    }

    public long getVersion() {
        return version;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }
}
