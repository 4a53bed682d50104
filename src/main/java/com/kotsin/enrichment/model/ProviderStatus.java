package com.kotsin.enrichment.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one provider within an enrichment call.
 */
public enum ProviderStatus {
    SUCCESS("success"),
    ERROR("error"),
    TIMEOUT("timeout"),
    BREAKER_OPEN("breaker_open"),
    PREDICTED_SKIP("predicted_skip"),
    LOAD_SHED("load_shed"),
    BELOW_FLOOR("below_floor");

    private final String code;

    ProviderStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ProviderStatus fromCode(String code) {
        for (ProviderStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown provider status: " + code);
    }
}
