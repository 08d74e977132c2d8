package com.insurance.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Allocation state of a receipt. Moves to {@link #APPLIED} when its payment completes and to
 * {@link #REVERSED} only through a completed reversal.
 */
public enum ReceiptStatus {
    PENDING,
    APPLIED,
    REVERSED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
