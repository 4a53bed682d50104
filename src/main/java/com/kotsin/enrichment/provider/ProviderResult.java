package com.kotsin.enrichment.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderResult {

    /** Provider's confidence in its contribution, expected in [0, 1]. */
    private double confidence;
    private Map<String, Object> fields;
}
