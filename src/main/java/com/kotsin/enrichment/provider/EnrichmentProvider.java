package com.kotsin.enrichment.provider;

import com.kotsin.enrichment.model.SanitizedSignal;

/**
 * An external enrichment service, one implementation per provider kind.
 *
 * <p>Implementations must not retry internally and must be idempotent for a given
 * signal and context. They are called from worker threads and may be interrupted
 * when their call times out.
 */
public interface EnrichmentProvider {

    /**
     * Provider kind, also the namespace its fields are written under.
     */
    String kind();

    ProviderResult enrich(SanitizedSignal signal, ProviderCallContext context) throws Exception;
}
