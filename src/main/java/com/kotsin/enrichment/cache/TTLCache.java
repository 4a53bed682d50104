package com.kotsin.enrichment.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.LinkedHashSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * TTLCache - Thread-safe in-process cache with per-entry expiry
 *
 * Features:
 * - TTL per entry, expired entries evicted lazily on read
 * - Periodic cleanup of expired entries
 * - Size limit with least-recently-accessed eviction
 * - Predicate removal for pattern invalidation
 * - Hit/miss/eviction statistics
 *
 * @param <K> Key type
 * @param <V> Value type
 */
@Slf4j
public class TTLCache<K, V> {

    private final ConcurrentHashMap<K, CacheEntry<V>> cache = new ConcurrentHashMap<>();
    private final String cacheName;
    private final long defaultTtlMs;
    private final int maxSize;
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);

    private static final class CacheEntry<V> {
        final V value;
        final long writtenAt;
        final long expiryTime;
        volatile long lastAccessTime;

        CacheEntry(V value, long now, long ttlMs) {
            this.value = value;
            this.writtenAt = now;
            this.expiryTime = now + ttlMs;
            this.lastAccessTime = now;
        }

        boolean isExpired(long now) {
            return now >= expiryTime;
        }
    }

    /**
     * @param cacheName name for logging
     * @param defaultTtlMs default TTL in milliseconds
     * @param maxSize maximum number of entries (0 = unlimited)
     * @param cleanupIntervalMs cleanup interval in milliseconds (0 = no background cleanup)
     * @param clock time source
     */
    public TTLCache(String cacheName, long defaultTtlMs, int maxSize, long cleanupIntervalMs, Clock clock) {
        this.cacheName = cacheName;
        this.defaultTtlMs = defaultTtlMs;
        this.maxSize = maxSize;
        this.clock = clock;

        if (cleanupIntervalMs > 0) {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "TTLCache-" + cacheName + "-cleanup");
                t.setDaemon(true);
                return t;
            });
            cleanupExecutor.scheduleAtFixedRate(this::cleanup,
                    cleanupIntervalMs, cleanupIntervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.cleanupExecutor = null;
        }

        log.info("[CACHE] Created TTLCache '{}' with TTL={}ms, maxSize={}", cacheName, defaultTtlMs, maxSize);
    }

    public void put(K key, V value) {
        put(key, value, defaultTtlMs);
    }

    public void put(K key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) return;

        if (maxSize > 0 && cache.size() >= maxSize && !cache.containsKey(key)) {
            evictOldest();
        }

        cache.put(key, new CacheEntry<>(value, clock.millis(), ttlMs));
    }

    /**
     * Get value (null if not found or expired)
     */
    public V get(K key) {
        if (key == null) {
            misses.incrementAndGet();
            return null;
        }

        CacheEntry<V> entry = cache.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }

        long now = clock.millis();
        if (entry.isExpired(now)) {
            cache.remove(key, entry);
            misses.incrementAndGet();
            evictions.incrementAndGet();
            return null;
        }

        entry.lastAccessTime = now;
        hits.incrementAndGet();
        return entry.value;
    }

    public V remove(K key) {
        CacheEntry<V> entry = cache.remove(key);
        return entry != null ? entry.value : null;
    }

    /**
     * Remove every entry whose key matches.
     *
     * @return the keys removed
     */
    public Set<K> removeIf(Predicate<K> keyMatcher) {
        Set<K> removed = new LinkedHashSet<>();
        Iterator<K> it = cache.keySet().iterator();
        while (it.hasNext()) {
            K key = it.next();
            if (keyMatcher.test(key)) {
                it.remove();
                removed.add(key);
            }
        }
        return removed;
    }

    public void clear() {
        int size = cache.size();
        cache.clear();
        log.info("[CACHE] Cleared cache '{}', removed {} entries", cacheName, size);
    }

    public int size() {
        return cache.size();
    }

    /**
     * Remove expired entries.
     */
    void cleanup() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<K, CacheEntry<V>>> it = cache.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
                evictions.incrementAndGet();
            }
        }
        if (removed > 0) {
            log.debug("[CACHE] '{}' cleanup: removed {} expired, size now {}", cacheName, removed, cache.size());
        }
    }

    private void evictOldest() {
        K oldestKey = null;
        long oldestTime = Long.MAX_VALUE;

        for (Map.Entry<K, CacheEntry<V>> entry : cache.entrySet()) {
            if (entry.getValue().lastAccessTime < oldestTime) {
                oldestTime = entry.getValue().lastAccessTime;
                oldestKey = entry.getKey();
            }
        }

        if (oldestKey != null) {
            cache.remove(oldestKey);
            evictions.incrementAndGet();
            log.debug("[CACHE] '{}' evicted oldest key: {}", cacheName, oldestKey);
        }
    }

    // ======================== STATS ========================

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total > 0 ? (double) hits.get() / total : 0.0;
    }

    public String getStats() {
        return String.format("Cache '%s': size=%d, hits=%d, misses=%d, evictions=%d, hitRate=%.1f%%",
                cacheName, cache.size(), hits.get(), misses.get(), evictions.get(), getHitRate() * 100);
    }

    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[CACHE] '{}' shutdown complete", cacheName);
    }
}
