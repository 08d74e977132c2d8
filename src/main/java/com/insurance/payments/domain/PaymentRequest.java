package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Canonical payment notification for an insurance policy, as asserted by an upstream payment rail.
 * The external reference is the caller's idempotency key.
 */
@Value
@Builder
public class PaymentRequest {

    /** Caller-supplied idempotency key; globally unique. */
    String externalReference;

    String policyHolderId;
    String policyNumber;

    /** ISO 4217 code, USD or ZWG. */
    String currency;

    BigDecimal amount;
    String paymentMethod;

    String customerName;
    String customerEmail;
    String customerMobileNo;

    String insuranceType;
    String policyType;

    /** Where state-change webhooks are delivered (optional). */
    String callbackUrl;
    String returnUrl;

    /** When the rail processed the payment; defaults to the time of recording. */
    Instant processedAt;

    /** Partner that submitted the payment, from the authenticated identity. */
    String clientId;

    /** Correlation id of the originating HTTP request. */
    String requestId;
}
