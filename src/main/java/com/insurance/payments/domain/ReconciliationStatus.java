package com.insurance.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Settlement matching state of a transaction.
 */
public enum ReconciliationStatus {
    PENDING,
    MATCHED,
    UNMATCHED,
    DISPUTED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
