package com.kotsin.enrichment.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.enrichment.model.Direction;
import com.kotsin.enrichment.model.QualityTier;
import com.kotsin.enrichment.model.SanitizedSignal;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpEnrichmentProvider - Comprehensive Tests")
class HttpEnrichmentProviderTest {

    private MockWebServer server;
    private ObjectMapper objectMapper;
    private HttpEnrichmentProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        provider = new HttpEnrichmentProvider("sentiment", server.url("/enrich").toString(),
                new OkHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private SanitizedSignal signal() {
        return SanitizedSignal.builder()
                .signalId("sig-1")
                .asset("ETH")
                .direction(Direction.SELL)
                .qualityTier(QualityTier.HIGH)
                .confidence(0.6)
                .createdAt(Instant.parse("2024-03-01T10:00:00Z"))
                .attributes(Map.of())
                .build();
    }

    private ProviderCallContext context(long timeoutMs) {
        return ProviderCallContext.builder()
                .requestId("req-1")
                .versionId("sentiment_v1")
                .versionConfig(Map.of("model", "finbert"))
                .timeoutMs(timeoutMs)
                .build();
    }

    // ========== SUCCESS TESTS ==========

    @Test
    @DisplayName("Should post signal and context and parse the result")
    void testSuccessfulCall() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"confidence\":0.72,\"fields\":{\"label\":\"bearish\",\"score\":-0.4}}"));

        ProviderResult result = provider.enrich(signal(), context(1_000));

        assertEquals(0.72, result.getConfidence(), 1e-9);
        assertEquals("bearish", result.getFields().get("label"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("ETH", body.path("signal").path("asset").asText());
        assertEquals("SELL", body.path("signal").path("direction").asText());
        assertEquals("sentiment_v1", body.path("context").path("versionId").asText());
        assertEquals("finbert", body.path("context").path("versionConfig").path("model").asText());
    }

    @Test
    @DisplayName("Kind and URL should be exposed")
    void testAccessors() {
        assertEquals("sentiment", provider.kind());
        assertTrue(provider.getUrl().endsWith("/enrich"));
    }

    // ========== FAILURE TESTS ==========

    @Test
    @DisplayName("Non-2xx response should raise a provider exception")
    void testHttpError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.enrich(signal(), context(1_000)));

        assertEquals("sentiment", ex.getProviderKind());
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    @DisplayName("Malformed body should fail the call")
    void testMalformedBody() {
        server.enqueue(new MockResponse().setBody("not json"));

        assertThrows(IOException.class, () -> provider.enrich(signal(), context(1_000)));
    }

    @Test
    @DisplayName("Slow endpoint should hit the call timeout")
    void testCallTimeout() {
        server.enqueue(new MockResponse()
                .setBody("{\"confidence\":0.5,\"fields\":{}}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        assertThrows(InterruptedIOException.class, () -> provider.enrich(signal(), context(200)));
    }
}
