package com.insurance.payments.api;

import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentStatus;
import com.insurance.payments.domain.ReceiptStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response data for a recorded payment.
 */
@Value
@Builder
public class ProcessPaymentResponseDto {

    PaymentDetails paymentDetails;
    PolicyDetails policyDetails;
    ReceiptDetails receiptDetails;

    @Value
    @Builder
    public static class PaymentDetails {
        Long paymentId;
        String txnReference;
        String externalReference;
        BigDecimal amount;
        String currency;
        String paymentMethod;
        PaymentStatus status;
        String message;
        Instant processedAt;
    }

    @Value
    @Builder
    public static class PolicyDetails {
        String policyNumber;
        String insuranceType;
        String policyType;
    }

    @Value
    @Builder
    public static class ReceiptDetails {
        String receiptNumber;
        ReceiptStatus status;
        Instant allocatedAt;
    }

    public static ProcessPaymentResponseDto from(PaymentResult result) {
        return ProcessPaymentResponseDto.builder()
                .paymentDetails(PaymentDetails.builder()
                        .paymentId(result.getPaymentId())
                        .txnReference(result.getTxnReference())
                        .externalReference(result.getExternalReference())
                        .amount(result.getAmount())
                        .currency(result.getCurrency())
                        .paymentMethod(result.getPaymentMethod())
                        .status(result.getStatus())
                        .message(result.getStatus() != null ? result.getStatus().getMessage() : null)
                        .processedAt(result.getProcessedAt())
                        .build())
                .policyDetails(PolicyDetails.builder()
                        .policyNumber(result.getPolicyNumber())
                        .insuranceType(result.getInsuranceType())
                        .policyType(result.getPolicyType())
                        .build())
                .receiptDetails(ReceiptDetails.builder()
                        .receiptNumber(result.getReceiptNumber())
                        .status(result.getReceiptStatus())
                        .allocatedAt(result.getAllocatedAt())
                        .build())
                .build();
    }
}
