package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Request to reverse a completed payment. Creates a pending reversal; nothing is undone until
 * the reversal is approved.
 */
@Value
@Builder
public class ReversalRequest {

    /** Caller's reference for the reversal itself; generated when absent. */
    String externalReference;

    /** External reference of the payment being reversed. */
    String originalExternalReference;

    /** Receipt to reverse along with the payment (optional). */
    String receiptNumber;

    String reason;
    String initiatedBy;
    Instant requestedAt;

    String requestId;
}
