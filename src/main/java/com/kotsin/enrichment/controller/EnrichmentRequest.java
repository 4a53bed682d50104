package com.kotsin.enrichment.controller;

import com.kotsin.enrichment.model.EnrichmentContext;
import com.kotsin.enrichment.model.Signal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentRequest {

    private Signal signal;
    private EnrichmentContext context;
    private boolean forceRefresh;
}
