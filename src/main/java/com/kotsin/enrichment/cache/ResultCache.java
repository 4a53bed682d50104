package com.kotsin.enrichment.cache;

import com.kotsin.enrichment.model.EnrichedSignal;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * ResultCache - Two-tier cache of enrichment results
 *
 * The in-process {@link TTLCache} is consulted first and is authoritative on write.
 * The Redis mirror, when enabled, lets several instances share results; a value
 * found only in Redis is promoted into memory.
 */
@Slf4j
@Service
public class ResultCache {

    private final TTLCache<String, EnrichedSignal> memory;
    private final RedisResultMirror mirror;
    private final long defaultTtlSeconds;

    private final AtomicLong mirrorHits = new AtomicLong(0);
    private final AtomicLong invalidations = new AtomicLong(0);

    @Autowired
    public ResultCache(RedisResultMirror mirror,
                       Clock clock,
                       @Value("${enrichment.cache.max-entries:1000}") int maxEntries,
                       @Value("${enrichment.cache.ttl-seconds:300}") long defaultTtlSeconds,
                       @Value("${enrichment.cache.cleanup-interval-ms:60000}") long cleanupIntervalMs) {
        this(new TTLCache<>("enrichment-results", defaultTtlSeconds * 1000L, maxEntries, cleanupIntervalMs, clock),
                mirror, defaultTtlSeconds);
    }

    public ResultCache(TTLCache<String, EnrichedSignal> memory, RedisResultMirror mirror, long defaultTtlSeconds) {
        this.memory = memory;
        this.mirror = mirror;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public Optional<EnrichedSignal> get(String key) {
        EnrichedSignal value = memory.get(key);
        if (value != null) {
            return Optional.of(value);
        }
        Optional<EnrichedSignal> mirrored = mirror.get(key);
        mirrored.ifPresent(v -> {
            mirrorHits.incrementAndGet();
            memory.put(key, v, defaultTtlSeconds * 1000L);
        });
        return mirrored;
    }

    public void set(String key, EnrichedSignal value) {
        set(key, value, defaultTtlSeconds);
    }

    public void set(String key, EnrichedSignal value, long ttlSeconds) {
        memory.put(key, value, ttlSeconds * 1000L);
        mirror.set(key, value, Duration.ofSeconds(ttlSeconds));
    }

    /**
     * Remove every entry matching a glob pattern from both tiers.
     *
     * @param pattern Redis-style glob, matched the same way in both tiers
     * @return number of distinct keys removed
     */
    public int invalidate(String pattern) {
        Pattern regex = globToRegex(pattern);
        Set<String> removed = new TreeSet<>(memory.removeIf(key -> regex.matcher(key).matches()));

        Set<String> mirrored = mirror.keys(pattern);
        mirror.delete(mirrored);
        removed.addAll(mirrored);

        invalidations.incrementAndGet();
        log.info("[CACHE] Invalidated pattern='{}', removed {} keys", pattern, removed.size());
        return removed.size();
    }

    /**
     * Redis glob syntax: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]}
     * and a backslash to escape the next character.
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                literal.append(glob.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
                i++;
                continue;
            }
            if (c == '[') {
                int close = glob.indexOf(']', i + 1);
                if (close > i + 1) {
                    flushLiteral(regex, literal);
                    regex.append(characterClass(glob.substring(i + 1, close)));
                    i = close + 1;
                    continue;
                }
            }
            literal.append(c);
            i++;
        }
        flushLiteral(regex, literal);
        return Pattern.compile(regex.toString());
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int j = 0;
        if (body.charAt(0) == '^' && body.length() > 1) {
            cls.append('^');
            j = 1;
        }
        int start = j;
        for (; j < body.length(); j++) {
            char ch = body.charAt(j);
            boolean range = ch == '-' && j > start && j < body.length() - 1;
            if (ch == '\\' && j + 1 < body.length()) {
                ch = body.charAt(++j);
            } else if (range) {
                cls.append(ch);
                continue;
            }
            if (Character.isLetterOrDigit(ch)) {
                cls.append(ch);
            } else {
                cls.append('\\').append(ch);
            }
        }
        return cls.append(']').toString();
    }

    public void clear() {
        memory.clear();
        invalidate("*");
    }

    public double hitRate() {
        return memory.getHitRate();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("size", memory.size());
        stats.put("hits", memory.getHits());
        stats.put("misses", memory.getMisses());
        stats.put("evictions", memory.getEvictions());
        stats.put("hitRate", memory.getHitRate());
        stats.put("mirrorEnabled", mirror.isEnabled());
        stats.put("mirrorHits", mirrorHits.get());
        stats.put("invalidations", invalidations.get());
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        memory.shutdown();
    }
}
