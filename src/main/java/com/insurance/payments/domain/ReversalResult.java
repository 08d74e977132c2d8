package com.insurance.payments.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Reversal as returned to callers and mirrored in reversal webhooks.
 */
@Value
@Builder
public class ReversalResult {

    String reversalReference;
    String originalExternalReference;
    String originalTxnReference;
    String receiptNumber;
    String policyNumber;
    BigDecimal amount;
    String currency;
    String reason;
    String initiatedBy;
    Instant requestedAt;
    Instant processedAt;
    ReversalStatus status;
    String message;

    /** Callback registered on the original payment; never serialized. */
    @JsonIgnore
    String callbackUrl;
}
