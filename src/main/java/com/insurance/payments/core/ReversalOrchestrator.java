package com.insurance.payments.core;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.compliance.PaymentAuditLogger;
import com.insurance.payments.domain.ReversalRequest;
import com.insurance.payments.domain.ReversalResult;
import com.insurance.payments.messaging.PaymentEventProducer;
import com.insurance.payments.messaging.WebhookEvent;
import com.insurance.payments.messaging.WebhookService;
import com.insurance.payments.persistence.service.ReversalPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.insurance.payments.core.PaymentOrchestrator.withPersistence;

/**
 * Request-then-approve reversal workflow. A request only records a pending reversal; approval
 * reverses the payment and its receipt in one database transaction and then notifies the
 * payment's callback URL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReversalOrchestrator {

    private final ReversalPersistenceService persistenceService;
    private final PaymentEventProducer eventProducer;
    private final WebhookService webhookService;
    private final PaymentAuditLogger auditLogger;

    public ReversalResult requestReversal(ReversalRequest request) {
        require(request.getOriginalExternalReference(), "originalExternalReference");
        require(request.getReason(), "reason");
        require(request.getInitiatedBy(), "initiatedBy");

        log.info("Requesting reversal: originalExternalReference={}, receiptNumber={}, initiatedBy={}",
                request.getOriginalExternalReference(), request.getReceiptNumber(), request.getInitiatedBy());
        ReversalResult result = withPersistence(() -> persistenceService.createReversal(request));

        auditLogger.logReversal("REQUESTED", result);
        eventProducer.publishReversal(PaymentEventProducer.REVERSAL_REQUESTED, result, request.getRequestId());
        return result;
    }

    public ReversalResult processReversal(String reversalReference, String requestId) {
        log.info("Processing reversal: reversalReference={}", reversalReference);
        ReversalResult result = withPersistence(() -> persistenceService.completeReversal(reversalReference));

        log.info("Reversal completed: reversalReference={}, originalExternalReference={}",
                reversalReference, result.getOriginalExternalReference());
        auditLogger.logReversal("COMPLETED", result);
        eventProducer.publishReversal(PaymentEventProducer.REVERSAL_COMPLETED, result, requestId);
        if (result.getCallbackUrl() != null && !result.getCallbackUrl().isBlank()) {
            webhookService.sendReversalEvent(WebhookEvent.REVERSAL_COMPLETED, result);
        }
        return result;
    }

    public ReversalResult rejectReversal(String reversalReference, String requestId) {
        ReversalResult result = withPersistence(() -> persistenceService.rejectReversal(reversalReference));
        log.info("Reversal rejected: reversalReference={}", reversalReference);
        auditLogger.logReversal("REJECTED", result);
        eventProducer.publishReversal(PaymentEventProducer.REVERSAL_REJECTED, result, requestId);
        return result;
    }

    public ReversalResult getReversal(String reversalReference) {
        return withPersistence(() -> persistenceService.getReversal(reversalReference));
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PaymentException(ErrorCode.MISSING_REQUIRED_FIELD, field + " is required");
        }
    }
}
