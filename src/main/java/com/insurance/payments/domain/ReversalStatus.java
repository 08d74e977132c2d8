package com.insurance.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Request-then-approve lifecycle of a reversal.
 */
public enum ReversalStatus {
    PENDING("Reversal request is pending approval"),
    APPROVED("Reversal has been approved"),
    REJECTED("Reversal request was rejected"),
    COMPLETED("Reversal has been completed successfully");

    private final String message;

    ReversalStatus(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
