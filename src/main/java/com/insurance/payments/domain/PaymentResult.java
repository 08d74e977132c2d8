package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of recording a payment: the stored transaction and the receipt issued with it.
 */
@Value
@Builder
public class PaymentResult {

    Long paymentId;
    String txnReference;
    String externalReference;
    String receiptNumber;
    ReceiptStatus receiptStatus;
    Instant allocatedAt;
    BigDecimal amount;
    String currency;
    PaymentStatus status;
    Instant processedAt;
    String paymentMethod;
    String policyNumber;
    String insuranceType;
    String policyType;
    String callbackUrl;
}
