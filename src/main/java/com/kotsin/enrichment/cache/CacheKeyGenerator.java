package com.kotsin.enrichment.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.enrichment.model.EnrichmentContext;
import com.kotsin.enrichment.model.SanitizedSignal;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives cache keys from the canonical JSON form of a request.
 *
 * Key shape: {@code enrichment:<ASSET>:<md5>}. The hash covers the sanitized signal,
 * the market context and the enabled provider set with resolved versions. The
 * request id is left out so repeated requests share an entry.
 */
@Component
public class CacheKeyGenerator {

    public static final String PREFIX = "enrichment:";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /**
     * @param providerVersions enabled provider kind to resolved version id
     */
    public String key(SanitizedSignal signal, EnrichmentContext context, Map<String, String> providerVersions) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("signal", signal);
        if (context != null) {
            canonical.put("market", context.getMarket());
            canonical.put("systemLoad", context.getSystemLoad());
        }
        canonical.put("providers", new TreeMap<>(providerVersions));

        String json;
        try {
            json = canonicalMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize enrichment request", e);
        }
        String hash = DigestUtils.md5DigestAsHex(json.getBytes(StandardCharsets.UTF_8));
        return PREFIX + assetSegment(signal.getAsset()) + ":" + hash;
    }

    /**
     * Pattern matching every entry for one asset.
     */
    public static String assetPattern(String asset) {
        return PREFIX + assetSegment(asset) + ":*";
    }

    private static String assetSegment(String asset) {
        return asset == null ? "UNKNOWN" : asset.trim().toUpperCase(Locale.ROOT);
    }
}
