package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read model of a payment joined with its receipt and, where available, its policy.
 * Served by status lookups and reconciliation reports.
 */
@Value
@Builder
public class PaymentView {

    PolicyHolder policyHolder;
    PaymentDetails paymentDetails;
    /** Null when the transaction has no receipt. */
    ReceiptDetails receiptDetails;
    PolicyDetails policyDetails;

    @Value
    @Builder
    public static class PolicyHolder {
        String fullName;
        String identifier;
    }

    @Value
    @Builder
    public static class PaymentDetails {
        String currency;
        BigDecimal amount;
        String externalReference;
        String txnReference;
        Instant processedAt;
        PaymentStatus status;
        String paymentMethod;
        String message;
    }

    @Value
    @Builder
    public static class ReceiptDetails {
        String receiptNumber;
        Instant allocatedAt;
        ReceiptStatus status;
    }

    @Value
    @Builder
    public static class PolicyDetails {
        String policyNumber;
        String insuranceType;
        String policyType;
    }
}
