package com.taskgateway.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Classification of every failure the gateway records.
 * The codes are stable and surfaced to the workflow engine.
 */
public enum ErrorClass {

    VALIDATION("VALIDATION_ERROR", false),
    TRANSIENT_TRANSPORT("TRANSIENT_ERROR", true),
    AUTHENTICATION_EXPIRED("AUTHENTICATION_ERROR", true),
    BUSINESS_REJECTED("BUSINESS_REJECTED", false),
    INFRASTRUCTURE_DEGRADED("INFRASTRUCTURE_DEGRADED", true),
    INTERNAL("INTERNAL_ERROR", true);

    private final String code;
    private final boolean retryable;

    ErrorClass(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    /**
     * Whether the dispatcher may spend another attempt on this class of error.
     */
    public boolean isRetryable() {
        return retryable;
    }

    public static Optional<ErrorClass> fromCode(String code) {
        return Arrays.stream(values())
            .filter(c -> c.code.equals(code))
            .findFirst();
    }
}
