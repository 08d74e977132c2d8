package com.insurance.payments.persistence.service;

import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.persistence.entity.PaymentTransactionEntity;
import com.insurance.payments.persistence.entity.PolicyEntity;
import com.insurance.payments.persistence.entity.ReceiptEntity;

/**
 * Builds {@link PaymentView}s from stored rows. Holder name and id from the policy view, when
 * present, take precedence over the customer details captured with the payment.
 */
public final class PaymentViewMapper {

    private PaymentViewMapper() {
    }

    public static PaymentView toView(PaymentTransactionEntity txn, ReceiptEntity receipt, PolicyEntity policy) {
        String customerName = txn.getCustomer() != null ? txn.getCustomer().getName() : null;
        return PaymentView.builder()
                .policyHolder(PaymentView.PolicyHolder.builder()
                        .fullName(firstNonBlank(policy != null ? policy.getPolicyHolderName() : null, customerName))
                        .identifier(firstNonBlank(policy != null ? policy.getPolicyHolderIdNumber() : null,
                                txn.getPolicyHolderId()))
                        .build())
                .paymentDetails(PaymentView.PaymentDetails.builder()
                        .currency(txn.getCurrency())
                        .amount(txn.getAmount())
                        .externalReference(txn.getExternalReference())
                        .txnReference(txn.getTxnReference())
                        .processedAt(txn.getProcessedAt())
                        .status(txn.getStatus())
                        .paymentMethod(txn.getPaymentMethod())
                        .message(txn.getStatus() != null ? txn.getStatus().getMessage() : null)
                        .build())
                .receiptDetails(receipt == null ? null : PaymentView.ReceiptDetails.builder()
                        .receiptNumber(receipt.getReceiptNumber())
                        .allocatedAt(receipt.getAllocatedAt())
                        .status(receipt.getStatus())
                        .build())
                .policyDetails(PaymentView.PolicyDetails.builder()
                        .policyNumber(txn.getPolicyNumber())
                        .insuranceType(firstNonBlank(txn.getInsuranceType(),
                                policy != null ? policy.getInsuranceType() : null))
                        .policyType(firstNonBlank(txn.getPolicyType(),
                                policy != null ? policy.getPolicyType() : null))
                        .build())
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
