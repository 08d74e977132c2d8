package com.insurance.payments.core;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.domain.ReceiptDetails;
import com.insurance.payments.domain.ReceiptStatus;
import com.insurance.payments.persistence.entity.PaymentTransactionEntity;
import com.insurance.payments.persistence.entity.ReceiptEntity;
import com.insurance.payments.persistence.repository.PaymentTransactionRepository;
import com.insurance.payments.persistence.repository.ReceiptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Issues and maintains the single receipt that belongs to each payment transaction.
 * A receipt goes {@code pending -> applied -> reversed}; reversal happens only through an
 * approved payment reversal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceiptIssuer {

    private final ReceiptRepository receiptRepository;
    private final PaymentTransactionRepository transactionRepository;

    /**
     * Creates the pending receipt for a newly inserted transaction. Must run inside the
     * transaction that inserted the payment so both rows commit or neither does.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReceiptEntity createReceipt(Long paymentTransactionId, Long policyId) {
        ReceiptEntity receipt = ReceiptEntity.builder()
                .receiptNumber(ReferenceGenerator.receiptNumber())
                .paymentTransactionId(paymentTransactionId)
                .policyId(policyId)
                .allocatedAt(Instant.now())
                .status(ReceiptStatus.PENDING)
                .build();
        ReceiptEntity saved = receiptRepository.save(receipt);
        log.info("Receipt created: receiptNumber={}, paymentTransactionId={}",
                saved.getReceiptNumber(), paymentTransactionId);
        return saved;
    }

    /**
     * Marks the receipt applied. Applying an applied receipt changes nothing; a reversed receipt
     * cannot be applied again.
     */
    @Transactional
    public ReceiptEntity applyReceipt(String receiptNumber) {
        ReceiptEntity receipt = load(receiptNumber);
        if (receipt.getStatus() == ReceiptStatus.APPLIED) {
            return receipt;
        }
        if (receipt.getStatus() == ReceiptStatus.REVERSED) {
            throw new PaymentException(ErrorCode.RECEIPT_ALREADY_REVERSED,
                    "Receipt " + receiptNumber + " has already been reversed");
        }
        receipt.setStatus(ReceiptStatus.APPLIED);
        receipt.setAllocatedAt(Instant.now());
        log.info("Receipt applied: receiptNumber={}", receiptNumber);
        return receiptRepository.save(receipt);
    }

    @Transactional
    public ReceiptEntity reverseReceipt(String receiptNumber, String reason, String reversedBy) {
        ReceiptEntity receipt = load(receiptNumber);
        if (receipt.getStatus() == ReceiptStatus.REVERSED) {
            throw new PaymentException(ErrorCode.RECEIPT_ALREADY_REVERSED,
                    "Receipt " + receiptNumber + " has already been reversed");
        }
        receipt.setStatus(ReceiptStatus.REVERSED);
        receipt.setReversalReason(reason);
        receipt.setReversedBy(reversedBy);
        receipt.setReversedAt(Instant.now());
        log.info("Receipt reversed: receiptNumber={}, reversedBy={}", receiptNumber, reversedBy);
        return receiptRepository.save(receipt);
    }

    @Transactional(readOnly = true)
    public ReceiptDetails getReceiptWithDetails(String receiptNumber) {
        ReceiptEntity receipt = load(receiptNumber);
        PaymentTransactionEntity txn = transactionRepository.findById(receipt.getPaymentTransactionId())
                .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment for receipt " + receiptNumber + " not found"));
        return ReceiptDetails.builder()
                .receiptNumber(receipt.getReceiptNumber())
                .status(receipt.getStatus())
                .allocatedAt(receipt.getAllocatedAt())
                .policyId(receipt.getPolicyId())
                .reversalReason(receipt.getReversalReason())
                .reversedAt(receipt.getReversedAt())
                .reversedBy(receipt.getReversedBy())
                .externalReference(txn.getExternalReference())
                .txnReference(txn.getTxnReference())
                .amount(txn.getAmount())
                .currency(txn.getCurrency())
                .paymentMethod(txn.getPaymentMethod())
                .paymentStatus(txn.getStatus())
                .policyNumber(txn.getPolicyNumber())
                .policyType(txn.getPolicyType())
                .build();
    }

    private ReceiptEntity load(String receiptNumber) {
        return receiptRepository.findByReceiptNumber(receiptNumber)
                .orElseThrow(() -> new PaymentException(ErrorCode.RECEIPT_NOT_FOUND,
                        "Receipt " + receiptNumber + " not found"));
    }
}
