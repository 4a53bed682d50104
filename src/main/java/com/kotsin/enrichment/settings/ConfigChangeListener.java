package com.kotsin.enrichment.settings;

import java.util.Map;

/**
 * Receives only the paths that changed, keyed by dot path
 * (for example {@code providers.sentiment.enabled} or {@code features.consensus}).
 */
@FunctionalInterface
public interface ConfigChangeListener {

    void onChange(Map<String, ConfigChange> changes);
}
