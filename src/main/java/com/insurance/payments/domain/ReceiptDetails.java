package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A receipt together with the payment it was issued for.
 */
@Value
@Builder
public class ReceiptDetails {

    String receiptNumber;
    ReceiptStatus status;
    Instant allocatedAt;
    Long policyId;
    String reversalReason;
    Instant reversedAt;
    String reversedBy;

    String externalReference;
    String txnReference;
    BigDecimal amount;
    String currency;
    String paymentMethod;
    PaymentStatus paymentStatus;
    String policyNumber;
    String policyType;
}
