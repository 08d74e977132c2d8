package com.insurance.payments.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published to Kafka on every payment or reversal state change, for audit and
 * downstream settlement consumers.
 */
@Value
@Builder
@Jacksonized
public class PaymentEvent {

    String eventId;
    /** PAYMENT_CREATED, PAYMENT_STATUS_CHANGED, REVERSAL_REQUESTED, REVERSAL_COMPLETED, REVERSAL_REJECTED */
    String eventType;
    String externalReference;
    String txnReference;
    String receiptNumber;
    String reversalReference;
    String policyNumber;
    String status;
    BigDecimal amount;
    String currency;
    String requestId;
    Instant timestamp;
}
