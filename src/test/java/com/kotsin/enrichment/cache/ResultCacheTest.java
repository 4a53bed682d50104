package com.kotsin.enrichment.cache;

import com.kotsin.enrichment.model.EnrichedSignal;
import com.kotsin.enrichment.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResultCache - Comprehensive Tests")
class ResultCacheTest {

    @Mock
    private RedisResultMirror mirror;

    private MutableClock clock;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        cache = new ResultCache(new TTLCache<>("results", 300_000, 100, 0, clock), mirror, 300);
    }

    private static EnrichedSignal result(String asset) {
        return EnrichedSignal.builder().asset(asset).confidence(0.8).build();
    }

    @Test
    @DisplayName("Memory hit should not consult the mirror")
    void testMemoryHit() {
        EnrichedSignal value = result("BTC");
        cache.set("enrichment:BTC:abc", value);

        assertSame(value, cache.get("enrichment:BTC:abc").orElseThrow());
        verify(mirror, never()).get(anyString());
    }

    @Test
    @DisplayName("Set should write through to the mirror with the TTL")
    void testSetWritesThrough() {
        EnrichedSignal value = result("BTC");

        cache.set("enrichment:BTC:abc", value, 60);

        verify(mirror).set("enrichment:BTC:abc", value, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Mirror hit should be promoted into memory")
    void testMirrorHitPromoted() {
        EnrichedSignal value = result("ETH");
        when(mirror.get("enrichment:ETH:1")).thenReturn(Optional.of(value));

        assertTrue(cache.get("enrichment:ETH:1").isPresent());
        assertTrue(cache.get("enrichment:ETH:1").isPresent());

        verify(mirror, times(1)).get("enrichment:ETH:1");
        assertEquals(1L, cache.stats().get("mirrorHits"));
    }

    @Test
    @DisplayName("Miss in both tiers should be empty")
    void testMiss() {
        when(mirror.get(anyString())).thenReturn(Optional.empty());

        assertTrue(cache.get("enrichment:BTC:none").isEmpty());
    }

    @Test
    @DisplayName("Expired memory entries should miss")
    void testExpiry() {
        when(mirror.get(anyString())).thenReturn(Optional.empty());
        cache.set("enrichment:BTC:abc", result("BTC"), 10);

        clock.advanceMillis(10_000);

        assertTrue(cache.get("enrichment:BTC:abc").isEmpty());
    }

    @Test
    @DisplayName("Invalidate should remove matching keys from both tiers and count distinct keys")
    void testInvalidate() {
        cache.set("enrichment:BTC:1", result("BTC"));
        cache.set("enrichment:BTC:2", result("BTC"));
        cache.set("enrichment:ETH:1", result("ETH"));
        when(mirror.keys("enrichment:BTC:*")).thenReturn(Set.of("enrichment:BTC:1", "enrichment:BTC:9"));

        int removed = cache.invalidate("enrichment:BTC:*");

        assertEquals(3, removed);
        verify(mirror).delete(Set.of("enrichment:BTC:1", "enrichment:BTC:9"));
        when(mirror.get(anyString())).thenReturn(Optional.empty());
        assertTrue(cache.get("enrichment:BTC:1").isEmpty());
        assertTrue(cache.get("enrichment:ETH:1").isPresent());
    }

    @Test
    @DisplayName("Glob conversion should quote regex metacharacters")
    void testGlobToRegex() {
        assertTrue(ResultCache.globToRegex("enrichment:BTC.X:*").matcher("enrichment:BTC.X:abc").matches());
        assertFalse(ResultCache.globToRegex("enrichment:BTC.X:*").matcher("enrichment:BTCYX:abc").matches());
        assertTrue(ResultCache.globToRegex("*").matcher("anything").matches());
        assertFalse(ResultCache.globToRegex("exact").matcher("exactly").matches());
    }

    @Test
    @DisplayName("Glob conversion should follow Redis wildcards, classes and escapes")
    void testGlobRedisSyntax() {
        assertTrue(ResultCache.globToRegex("enrichment:BT?:1").matcher("enrichment:BTC:1").matches());
        assertFalse(ResultCache.globToRegex("enrichment:BT?:1").matcher("enrichment:BT:1").matches());
        assertTrue(ResultCache.globToRegex("enrichment:[BE]TC:*").matcher("enrichment:ETC:x").matches());
        assertFalse(ResultCache.globToRegex("enrichment:[BE]TC:*").matcher("enrichment:LTC:x").matches());
        assertTrue(ResultCache.globToRegex("key[^a]").matcher("keyb").matches());
        assertFalse(ResultCache.globToRegex("key[^a]").matcher("keya").matches());
        assertTrue(ResultCache.globToRegex("shard[0-9]").matcher("shard7").matches());
        assertFalse(ResultCache.globToRegex("shard[0-9]").matcher("shardx").matches());
        assertTrue(ResultCache.globToRegex("literal\\*").matcher("literal*").matches());
        assertFalse(ResultCache.globToRegex("literal\\*").matcher("literalX").matches());
        assertTrue(ResultCache.globToRegex("open[").matcher("open[").matches());
    }

    @Test
    @DisplayName("Invalidate should remove the same memory keys a Redis glob would match")
    void testInvalidateSingleCharacterGlob() {
        cache.set("enrichment:BTC:1", result("BTC"));
        cache.set("enrichment:BTC:12", result("BTC"));
        cache.set("enrichment:ETH:1", result("ETH"));

        int removed = cache.invalidate("enrichment:???:1");

        assertEquals(2, removed);
        when(mirror.get(anyString())).thenReturn(Optional.empty());
        assertTrue(cache.get("enrichment:BTC:1").isEmpty());
        assertTrue(cache.get("enrichment:ETH:1").isEmpty());
        assertTrue(cache.get("enrichment:BTC:12").isPresent());
    }

    @Test
    @DisplayName("Disabled mirror should leave the memory tier working alone")
    void testDisabledMirrorIsNoop() {
        RedisResultMirror disabled = new RedisResultMirror((StringRedisTemplate) null, null, true);
        ResultCache local = new ResultCache(new TTLCache<>("local", 1_000, 10, 0, clock), disabled, 1);

        assertFalse(disabled.isEnabled());
        local.set("k", result("BTC"));
        assertTrue(local.get("k").isPresent());
        assertEquals(1, local.invalidate("*"));
        verify(mirror, never()).set(anyString(), any(), any());
    }
}
