package com.kotsin.enrichment.settings;

/**
 * Old and new value of one configuration path. Either side is null when the path
 * was added or removed.
 */
public record ConfigChange(Object oldValue, Object newValue) {
}
