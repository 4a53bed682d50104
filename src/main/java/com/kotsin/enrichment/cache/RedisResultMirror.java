package com.kotsin.enrichment.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.enrichment.model.EnrichedSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Optional shared tier for enrichment results, stored in Redis as JSON.
 *
 * Every Redis failure is logged and treated as a miss, so an unreachable Redis
 * only costs cache hits.
 */
@Slf4j
@Component
public class RedisResultMirror {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    @Autowired
    public RedisResultMirror(ObjectProvider<StringRedisTemplate> redisTemplate,
                             ObjectMapper objectMapper,
                             @Value("${enrichment.cache.redis.enabled:false}") boolean enabled) {
        this(redisTemplate.getIfAvailable(), objectMapper, enabled);
    }

    public RedisResultMirror(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled && redisTemplate != null;
        log.info("[CACHE] Redis mirror {}", this.enabled ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<EnrichedSignal> get(String key) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, EnrichedSignal.class));
        } catch (Exception e) {
            log.warn("[REDIS-CACHE] Failed to read key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void set(String key, EnrichedSignal value, Duration ttl) {
        if (!enabled) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (Exception e) {
            log.warn("[REDIS-CACHE] Failed to write key={}: {}", key, e.getMessage());
        }
    }

    /**
     * Keys matching a glob pattern ({@code *} wildcard).
     */
    public Set<String> keys(String pattern) {
        if (!enabled) {
            return Collections.emptySet();
        }
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            return keys != null ? keys : Collections.emptySet();
        } catch (Exception e) {
            log.warn("[REDIS-CACHE] Failed to list keys for pattern={}: {}", pattern, e.getMessage());
            return Collections.emptySet();
        }
    }

    public void delete(Collection<String> keys) {
        if (!enabled || keys.isEmpty()) {
            return;
        }
        try {
            redisTemplate.delete(keys);
        } catch (Exception e) {
            log.warn("[REDIS-CACHE] Failed to delete {} keys: {}", keys.size(), e.getMessage());
        }
    }
}
