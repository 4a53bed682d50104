package com.kotsin.enrichment.settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Helpers for nested map documents addressed by dot paths.
 */
final class ConfigDocuments {

    private ConfigDocuments() {
    }

    static Object lookup(Map<String, Object> document, String path) {
        Object current = document;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    static void put(Map<String, Object> document, String path, Object value) {
        String[] parts = path.split("\\.");
        Map<String, Object> current = document;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(parts[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(parts[parts.length - 1], value);
    }

    /**
     * Recursively merge {@code overlay} onto a copy of {@code base}. Nested maps merge,
     * everything else in the overlay replaces the base value.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> result = deepCopy(base);
        if (overlay == null) {
            return result;
        }
        overlay.forEach((key, value) -> {
            Object existing = result.get(key);
            if (existing instanceof Map && value instanceof Map) {
                result.put(key, deepMerge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else {
                result.put(key, deepCopyValue(value));
            }
        });
        return result;
    }

    static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, deepCopyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> deepUnmodifiable(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value instanceof Map) {
                copy.put(key, deepUnmodifiable((Map<String, Object>) value));
            } else if (value instanceof List) {
                copy.put(key, Collections.unmodifiableList(new ArrayList<>((List<Object>) value)));
            } else {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Leaf-level differences between two documents, keyed by dot path.
     */
    static Map<String, ConfigChange> diff(Map<String, Object> oldDoc, Map<String, Object> newDoc) {
        Map<String, ConfigChange> changes = new TreeMap<>();
        diffInto("", oldDoc, newDoc, changes);
        return changes;
    }

    @SuppressWarnings("unchecked")
    private static void diffInto(String prefix, Map<String, Object> oldDoc, Map<String, Object> newDoc,
                                 Map<String, ConfigChange> changes) {
        TreeSet<String> keys = new TreeSet<>();
        if (oldDoc != null) {
            keys.addAll(oldDoc.keySet());
        }
        if (newDoc != null) {
            keys.addAll(newDoc.keySet());
        }
        for (String key : keys) {
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            Object oldValue = oldDoc == null ? null : oldDoc.get(key);
            Object newValue = newDoc == null ? null : newDoc.get(key);
            if (oldValue instanceof Map || newValue instanceof Map) {
                if (oldValue instanceof Map && newValue instanceof Map) {
                    diffInto(path, (Map<String, Object>) oldValue, (Map<String, Object>) newValue, changes);
                } else if (oldValue instanceof Map) {
                    diffInto(path, (Map<String, Object>) oldValue, null, changes);
                    if (newValue != null) {
                        changes.put(path, new ConfigChange(null, newValue));
                    }
                } else {
                    if (oldValue != null) {
                        changes.put(path, new ConfigChange(oldValue, null));
                    }
                    diffInto(path, null, (Map<String, Object>) newValue, changes);
                }
            } else if (!valuesEqual(oldValue, newValue)) {
                changes.put(path, new ConfigChange(oldValue, newValue));
            }
        }
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }
}
