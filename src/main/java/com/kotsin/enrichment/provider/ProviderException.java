package com.kotsin.enrichment.provider;

/**
 * A provider call failed.
 */
public class ProviderException extends RuntimeException {

    private final String providerKind;

    public ProviderException(String providerKind, String message) {
        super(message);
        this.providerKind = providerKind;
    }

    public ProviderException(String providerKind, String message, Throwable cause) {
        super(message, cause);
        this.providerKind = providerKind;
    }

    public String getProviderKind() {
        return providerKind;
    }
}
