package com.kotsin.enrichment.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.enrichment.model.SanitizedSignal;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Provider backed by a remote HTTP endpoint.
 *
 * POSTs {@code {"signal": ..., "context": ...}} as JSON and expects
 * {@code {"confidence": <0..1>, "fields": {...}}} back. No retries here; the
 * breaker and predictor decide whether to call again.
 */
@Slf4j
public class HttpEnrichmentProvider implements EnrichmentProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String kind;
    private final String url;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpEnrichmentProvider(String kind, String url, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.kind = kind;
        this.url = url;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public ProviderResult enrich(SanitizedSignal signal, ProviderCallContext context) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("signal", signal);
        payload.put("context", context);

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsBytes(payload), JSON))
                .build();

        Call call = httpClient.newCall(request);
        if (context.getTimeoutMs() > 0) {
            call.timeout().timeout(context.getTimeoutMs(), TimeUnit.MILLISECONDS);
        }

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new ProviderException(kind, "HTTP " + response.code() + " from " + url);
            }
            ProviderResult result = objectMapper.readValue(body.byteStream(), ProviderResult.class);
            log.debug("[PROVIDER] {} responded confidence={} fields={}",
                    kind, result.getConfidence(), result.getFields() == null ? 0 : result.getFields().size());
            return result;
        }
    }

    public String getUrl() {
        return url;
    }
}
