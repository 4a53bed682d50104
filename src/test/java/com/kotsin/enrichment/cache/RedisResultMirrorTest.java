package com.kotsin.enrichment.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.enrichment.model.EnrichedSignal;
import com.kotsin.enrichment.model.QualityTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisResultMirror - Comprehensive Tests")
class RedisResultMirrorTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private ObjectMapper objectMapper;
    private RedisResultMirror mirror;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mirror = new RedisResultMirror(redisTemplate, objectMapper, true);
    }

    @Test
    @DisplayName("Should store results as JSON with the TTL")
    void testSetStoresJson() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        EnrichedSignal value = EnrichedSignal.builder()
                .asset("BTC")
                .qualityTier(QualityTier.HIGH)
                .enrichedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();

        mirror.set("enrichment:BTC:1", value, Duration.ofSeconds(300));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("enrichment:BTC:1"), json.capture(), eq(Duration.ofSeconds(300)));
        assertEquals("BTC", objectMapper.readValue(json.getValue(), EnrichedSignal.class).getAsset());
    }

    @Test
    @DisplayName("Should read stored JSON back")
    void testGetParsesJson() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        String json = objectMapper.writeValueAsString(EnrichedSignal.builder()
                .asset("ETH").providersUsed(List.of("sentiment")).build());
        when(valueOps.get("k")).thenReturn(json);

        Optional<EnrichedSignal> result = mirror.get("k");

        assertEquals(List.of("sentiment"), result.orElseThrow().getProvidersUsed());
    }

    @Test
    @DisplayName("Redis failures should be treated as misses")
    void testFailureIsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(mirror.get("k").isEmpty());
    }

    @Test
    @DisplayName("Corrupt JSON should be treated as a miss")
    void testCorruptJsonIsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("k")).thenReturn("{not json");

        assertTrue(mirror.get("k").isEmpty());
    }

    @Test
    @DisplayName("Key listing failures should return no keys")
    void testKeysFailure() {
        when(redisTemplate.keys("enrichment:*")).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(mirror.keys("enrichment:*").isEmpty());
    }

    @Test
    @DisplayName("Disabled mirror should never touch Redis")
    void testDisabled() {
        RedisResultMirror disabled = new RedisResultMirror(redisTemplate, objectMapper, false);

        assertTrue(disabled.get("k").isEmpty());
        disabled.delete(Set.of("k"));
        verifyNoInteractions(redisTemplate);
    }
}
