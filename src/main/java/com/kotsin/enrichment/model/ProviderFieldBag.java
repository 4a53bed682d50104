package com.kotsin.enrichment.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only holder for provider results, one namespace per provider kind.
 * Entries keep insertion order, which is the order providers completed.
 */
public class ProviderFieldBag {

    private final Map<String, Map<String, Object>> namespaces = new LinkedHashMap<>();

    /**
     * Add a provider's fields under its namespace.
     *
     * @return false if the namespace was already written
     */
    public synchronized boolean put(String namespace, Map<String, Object> fields) {
        if (namespaces.containsKey(namespace)) {
            return false;
        }
        Map<String, Object> copy = fields == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        namespaces.put(namespace, copy);
        return true;
    }

    public synchronized boolean contains(String namespace) {
        return namespaces.containsKey(namespace);
    }

    public synchronized int size() {
        return namespaces.size();
    }

    public synchronized Map<String, Map<String, Object>> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
    }
}
