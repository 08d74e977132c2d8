package com.insurance.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of a policy payment transaction. Only {@link #COMPLETED} payments can be reversed;
 * {@link #REVERSED} is terminal.
 */
public enum PaymentStatus {
    /** Recorded and awaiting confirmation from the payment rail. */
    PENDING("Payment is being processed"),
    /** Confirmed by the payment rail; receipt applied. */
    COMPLETED("Payment completed successfully"),
    FAILED("Payment failed"),
    CANCELLED("Payment was cancelled"),
    /** Undone by a completed reversal. */
    REVERSED("Payment has been reversed");

    private final String message;

    PaymentStatus(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Resolves a wire code such as {@code "completed"}; empty for anything unknown. */
    public static Optional<PaymentStatus> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        for (PaymentStatus status : values()) {
            if (status.getCode().equals(code.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
