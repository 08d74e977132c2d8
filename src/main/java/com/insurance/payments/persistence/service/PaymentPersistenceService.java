package com.insurance.payments.persistence.service;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.core.ReceiptIssuer;
import com.insurance.payments.core.ReferenceGenerator;
import com.insurance.payments.domain.GatewayResponse;
import com.insurance.payments.domain.PaymentRequest;
import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentStatus;
import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.domain.ReconciliationStatus;
import com.insurance.payments.persistence.entity.CustomerDetails;
import com.insurance.payments.persistence.entity.PaymentTransactionEntity;
import com.insurance.payments.persistence.entity.PolicyEntity;
import com.insurance.payments.persistence.entity.ReceiptEntity;
import com.insurance.payments.persistence.repository.PaymentTransactionRepository;
import com.insurance.payments.persistence.repository.ReceiptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes and reads payment transactions. A transaction and its receipt are inserted in the
 * same database transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentPersistenceService {

    private final PaymentTransactionRepository transactionRepository;
    private final ReceiptRepository receiptRepository;
    private final ReceiptIssuer receiptIssuer;
    private final PolicyLookupService policyLookupService;

    /**
     * Inserts a pending transaction and its receipt. A reference that already exists, whether
     * seen by the pre-check or by the unique index under a concurrent insert, is reported as
     * {@link ErrorCode#DUPLICATE_REFERENCE} and nothing is written.
     */
    @Transactional
    public PaymentResult createPayment(PaymentRequest request) {
        if (transactionRepository.existsByExternalReference(request.getExternalReference())) {
            throw duplicate(request.getExternalReference());
        }

        Long policyId = policyLookupService.findByPolicyNumber(request.getPolicyNumber())
                .map(PolicyEntity::getPolicyId)
                .orElse(null);

        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .externalReference(request.getExternalReference())
                .txnReference(ReferenceGenerator.transactionReference())
                .policyId(policyId)
                .policyNumber(request.getPolicyNumber())
                .policyHolderId(request.getPolicyHolderId())
                .insuranceType(request.getInsuranceType())
                .policyType(request.getPolicyType())
                .amount(request.getAmount().setScale(2, RoundingMode.HALF_UP))
                .currency(request.getCurrency())
                .paymentMethod(request.getPaymentMethod())
                .status(PaymentStatus.PENDING)
                .customer(CustomerDetails.builder()
                        .name(request.getCustomerName())
                        .email(request.getCustomerEmail())
                        .mobile(request.getCustomerMobileNo())
                        .build())
                .returnUrl(request.getReturnUrl())
                .callbackUrl(request.getCallbackUrl())
                .reconciliationStatus(ReconciliationStatus.PENDING)
                .clientId(request.getClientId())
                .processedAt(request.getProcessedAt() != null ? request.getProcessedAt() : Instant.now())
                .build();

        PaymentTransactionEntity saved;
        try {
            saved = transactionRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            log.warn("Duplicate externalReference rejected by unique index: externalReference={}",
                    request.getExternalReference());
            throw duplicate(request.getExternalReference());
        }

        ReceiptEntity receipt = receiptIssuer.createReceipt(saved.getId(), policyId);
        log.debug("Persisted payment transaction: externalReference={}, txnReference={}, receiptNumber={}",
                saved.getExternalReference(), saved.getTxnReference(), receipt.getReceiptNumber());

        return PaymentResult.builder()
                .paymentId(saved.getId())
                .txnReference(saved.getTxnReference())
                .externalReference(saved.getExternalReference())
                .receiptNumber(receipt.getReceiptNumber())
                .receiptStatus(receipt.getStatus())
                .allocatedAt(receipt.getAllocatedAt())
                .amount(saved.getAmount())
                .currency(saved.getCurrency())
                .status(saved.getStatus())
                .processedAt(saved.getProcessedAt())
                .paymentMethod(saved.getPaymentMethod())
                .policyNumber(saved.getPolicyNumber())
                .insuranceType(saved.getInsuranceType())
                .policyType(saved.getPolicyType())
                .callbackUrl(saved.getCallbackUrl())
                .build();
    }

    /**
     * Moves a transaction to {@code status}. Completion also marks it reconciled and applies
     * its receipt. A reversed transaction is final and rejects every update. The row is locked
     * so the check cannot interleave with a reversal approval.
     */
    @Transactional
    public PaymentView updateStatus(String txnReference, PaymentStatus status, GatewayResponse gatewayResponse) {
        PaymentTransactionEntity txn = transactionRepository.findByTxnReferenceForUpdate(txnReference)
                .orElseThrow(() -> notFound("txnReference", txnReference));
        if (txn.getStatus() == PaymentStatus.REVERSED) {
            throw new PaymentException(ErrorCode.PAYMENT_ALREADY_REVERSED,
                    "Payment " + txn.getExternalReference() + " has been reversed and its status cannot change");
        }

        txn.setStatus(status);
        if (gatewayResponse != null) {
            txn.setGatewayResponse(gatewayResponse);
            if (gatewayResponse.getGatewayReference() != null) {
                txn.setGatewayReference(gatewayResponse.getGatewayReference());
            }
        }

        Optional<ReceiptEntity> receipt = receiptRepository.findByPaymentTransactionId(txn.getId());
        if (status == PaymentStatus.COMPLETED) {
            Instant now = Instant.now();
            txn.setProcessedAt(now);
            txn.setReconciliationStatus(ReconciliationStatus.MATCHED);
            txn.setReconciliationDate(now);
            if (receipt.isPresent()) {
                receipt = Optional.of(receiptIssuer.applyReceipt(receipt.get().getReceiptNumber()));
            }
        }
        PaymentTransactionEntity saved = transactionRepository.save(txn);
        log.debug("Updated payment status: txnReference={}, status={}", txnReference, status);

        return PaymentViewMapper.toView(saved, receipt.orElse(null),
                policyLookupService.findByPolicyNumber(saved.getPolicyNumber()).orElse(null));
    }

    @Transactional(readOnly = true)
    public PaymentView getByExternalReference(String externalReference) {
        return toView(transactionRepository.findByExternalReference(externalReference)
                .orElseThrow(() -> notFound("externalReference", externalReference)));
    }

    @Transactional(readOnly = true)
    public PaymentView getByTxnReference(String txnReference) {
        return toView(transactionRepository.findByTxnReference(txnReference)
                .orElseThrow(() -> notFound("txnReference", txnReference)));
    }

    private PaymentView toView(PaymentTransactionEntity txn) {
        ReceiptEntity receipt = receiptRepository.findByPaymentTransactionId(txn.getId()).orElse(null);
        PolicyEntity policy = policyLookupService.findByPolicyNumber(txn.getPolicyNumber()).orElse(null);
        return PaymentViewMapper.toView(txn, receipt, policy);
    }

    private static PaymentException duplicate(String externalReference) {
        return new PaymentException(ErrorCode.DUPLICATE_REFERENCE,
                "Payment with externalReference " + externalReference + " already exists");
    }

    private static PaymentException notFound(String field, String value) {
        return new PaymentException(ErrorCode.PAYMENT_NOT_FOUND,
                "Payment with " + field + " " + value + " not found");
    }
}
