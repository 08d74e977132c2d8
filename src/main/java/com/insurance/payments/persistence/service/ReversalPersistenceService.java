package com.insurance.payments.persistence.service;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.core.ReceiptIssuer;
import com.insurance.payments.core.ReferenceGenerator;
import com.insurance.payments.domain.PaymentStatus;
import com.insurance.payments.domain.ReceiptStatus;
import com.insurance.payments.domain.ReversalRequest;
import com.insurance.payments.domain.ReversalResult;
import com.insurance.payments.domain.ReversalStatus;
import com.insurance.payments.persistence.entity.PaymentTransactionEntity;
import com.insurance.payments.persistence.entity.ReceiptEntity;
import com.insurance.payments.persistence.entity.ReversalEntity;
import com.insurance.payments.persistence.repository.PaymentTransactionRepository;
import com.insurance.payments.persistence.repository.ReceiptRepository;
import com.insurance.payments.persistence.repository.ReversalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Persists reversal requests and their outcomes. Both the request and the approval take a
 * write lock on the original transaction row, so the status check and the write it guards
 * cannot interleave with another reversal of the same payment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReversalPersistenceService {

    private final ReversalRepository reversalRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final ReceiptRepository receiptRepository;
    private final ReceiptIssuer receiptIssuer;

    /**
     * Records a pending reversal. The payment and receipt are left untouched.
     */
    @Transactional
    public ReversalResult createReversal(ReversalRequest request) {
        PaymentTransactionEntity txn = transactionRepository
                .findByExternalReferenceForUpdate(request.getOriginalExternalReference())
                .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment with externalReference " + request.getOriginalExternalReference() + " not found"));

        if (txn.getStatus() == PaymentStatus.REVERSED) {
            throw alreadyReversed(txn);
        }
        if (txn.getStatus() != PaymentStatus.COMPLETED) {
            throw new PaymentException(ErrorCode.REVERSAL_NOT_ALLOWED,
                    "Payment " + txn.getExternalReference() + " is " + txn.getStatus().getCode()
                            + "; only completed payments can be reversed");
        }

        if (request.getReceiptNumber() != null && !request.getReceiptNumber().isBlank()) {
            ReceiptEntity receipt = receiptRepository
                    .findByReceiptNumberAndPaymentTransactionId(request.getReceiptNumber(), txn.getId())
                    .orElseThrow(() -> new PaymentException(ErrorCode.RECEIPT_NOT_FOUND,
                            "Receipt " + request.getReceiptNumber() + " not found for payment "
                                    + txn.getExternalReference()));
            if (receipt.getStatus() == ReceiptStatus.REVERSED) {
                throw new PaymentException(ErrorCode.RECEIPT_ALREADY_REVERSED,
                        "Receipt " + receipt.getReceiptNumber() + " has already been reversed");
            }
        }

        String reference = request.getExternalReference() != null && !request.getExternalReference().isBlank()
                ? request.getExternalReference()
                : ReferenceGenerator.reversalReference();
        if (reversalRepository.existsByReversalReference(reference)) {
            throw duplicate(reference);
        }

        ReversalEntity reversal = ReversalEntity.builder()
                .reversalReference(reference)
                .originalPaymentId(txn.getId())
                .originalExternalReference(txn.getExternalReference())
                .receiptNumber(blankToNull(request.getReceiptNumber()))
                .reason(request.getReason())
                .initiatedBy(request.getInitiatedBy())
                .reversalAmount(txn.getAmount())
                .status(ReversalStatus.PENDING)
                .requestedAt(request.getRequestedAt() != null ? request.getRequestedAt() : Instant.now())
                .build();
        try {
            reversal = reversalRepository.saveAndFlush(reversal);
        } catch (DataIntegrityViolationException e) {
            log.warn("Duplicate reversal reference rejected by unique index: reversalReference={}", reference);
            throw duplicate(reference);
        }
        log.debug("Persisted reversal: reversalReference={}, originalExternalReference={}",
                reference, txn.getExternalReference());
        return toResult(reversal, txn);
    }

    /**
     * Completes a pending reversal: the payment becomes reversed, the attached receipt (if any)
     * is reversed and the reversal is stamped completed.
     */
    @Transactional
    public ReversalResult completeReversal(String reversalReference) {
        ReversalEntity reversal = loadForUpdate(reversalReference);
        if (reversal.getStatus() == ReversalStatus.COMPLETED) {
            throw new PaymentException(ErrorCode.REVERSAL_ALREADY_PROCESSED,
                    "Reversal " + reversalReference + " has already been processed");
        }
        if (reversal.getStatus() == ReversalStatus.REJECTED) {
            throw new PaymentException(ErrorCode.REVERSAL_NOT_ALLOWED,
                    "Reversal " + reversalReference + " was rejected and cannot be processed");
        }

        PaymentTransactionEntity txn = transactionRepository.findByIdForUpdate(reversal.getOriginalPaymentId())
                .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment for reversal " + reversalReference + " not found"));
        if (txn.getStatus() == PaymentStatus.REVERSED) {
            throw alreadyReversed(txn);
        }

        txn.setStatus(PaymentStatus.REVERSED);
        transactionRepository.save(txn);

        if (reversal.getReceiptNumber() != null) {
            receiptIssuer.reverseReceipt(reversal.getReceiptNumber(), reversal.getReason(), reversal.getInitiatedBy());
        }

        reversal.setStatus(ReversalStatus.COMPLETED);
        reversal.setProcessedAt(Instant.now());
        reversal = reversalRepository.save(reversal);
        log.debug("Completed reversal: reversalReference={}, txnReference={}", reversalReference, txn.getTxnReference());
        return toResult(reversal, txn);
    }

    @Transactional
    public ReversalResult rejectReversal(String reversalReference) {
        ReversalEntity reversal = loadForUpdate(reversalReference);
        if (reversal.getStatus() == ReversalStatus.COMPLETED || reversal.getStatus() == ReversalStatus.REJECTED) {
            throw new PaymentException(ErrorCode.REVERSAL_ALREADY_PROCESSED,
                    "Reversal " + reversalReference + " has already been " + reversal.getStatus().getCode());
        }
        reversal.setStatus(ReversalStatus.REJECTED);
        reversal.setProcessedAt(Instant.now());
        reversal = reversalRepository.save(reversal);
        return toResult(reversal, originalOf(reversal));
    }

    @Transactional(readOnly = true)
    public ReversalResult getReversal(String reversalReference) {
        ReversalEntity reversal = reversalRepository.findByReversalReference(reversalReference)
                .orElseThrow(() -> notFound(reversalReference));
        return toResult(reversal, originalOf(reversal));
    }

    private ReversalEntity loadForUpdate(String reversalReference) {
        return reversalRepository.findByReversalReferenceForUpdate(reversalReference)
                .orElseThrow(() -> notFound(reversalReference));
    }

    private PaymentTransactionEntity originalOf(ReversalEntity reversal) {
        return transactionRepository.findById(reversal.getOriginalPaymentId()).orElse(null);
    }

    static ReversalResult toResult(ReversalEntity reversal, PaymentTransactionEntity txn) {
        BigDecimal amount = reversal.getReversalAmount() != null
                ? reversal.getReversalAmount()
                : txn != null ? txn.getAmount() : null;
        return ReversalResult.builder()
                .reversalReference(reversal.getReversalReference())
                .originalExternalReference(reversal.getOriginalExternalReference())
                .originalTxnReference(txn != null ? txn.getTxnReference() : null)
                .receiptNumber(reversal.getReceiptNumber())
                .policyNumber(txn != null ? txn.getPolicyNumber() : null)
                .amount(amount != null ? amount.setScale(2, RoundingMode.HALF_UP) : null)
                .currency(txn != null ? txn.getCurrency() : null)
                .reason(reversal.getReason())
                .initiatedBy(reversal.getInitiatedBy())
                .requestedAt(reversal.getRequestedAt())
                .processedAt(reversal.getProcessedAt())
                .status(reversal.getStatus())
                .message(reversal.getStatus().getMessage())
                .callbackUrl(txn != null ? txn.getCallbackUrl() : null)
                .build();
    }

    private static PaymentException alreadyReversed(PaymentTransactionEntity txn) {
        return new PaymentException(ErrorCode.PAYMENT_ALREADY_REVERSED,
                "Payment " + txn.getExternalReference() + " has already been reversed");
    }

    private static PaymentException duplicate(String reference) {
        return new PaymentException(ErrorCode.DUPLICATE_REFERENCE,
                "Reversal with reference " + reference + " already exists");
    }

    private static PaymentException notFound(String reversalReference) {
        return new PaymentException(ErrorCode.REVERSAL_NOT_FOUND,
                "Reversal " + reversalReference + " not found");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
