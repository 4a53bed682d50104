package com.kotsin.enrichment.version;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Named provider configuration. Only {@code performance} changes after creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionRecord {

    private String versionId;
    private String providerKind;
    private Map<String, Object> config;
    private Instant createdAt;
    private String parentVersionId;
    private String description;
    private Map<String, List<Double>> performance;
}
