package com.kotsin.enrichment.provider;

import com.kotsin.enrichment.model.MarketSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * What a provider is told about the call it is serving.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderCallContext {

    private String requestId;
    private String versionId;
    private Map<String, Object> versionConfig;
    private MarketSnapshot market;
    private long timeoutMs;
}
