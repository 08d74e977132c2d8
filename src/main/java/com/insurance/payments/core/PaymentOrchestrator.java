package com.insurance.payments.core;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.compliance.PaymentAuditLogger;
import com.insurance.payments.domain.GatewayResponse;
import com.insurance.payments.domain.PaymentRequest;
import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentStatus;
import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.domain.SupportedCurrency;
import com.insurance.payments.messaging.PaymentEventProducer;
import com.insurance.payments.messaging.WebhookEvent;
import com.insurance.payments.messaging.WebhookService;
import com.insurance.payments.persistence.service.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Entry point for recording policy payments and moving them through their lifecycle.
 * Validates input, delegates the atomic write to {@link PaymentPersistenceService}, then emits
 * the audit line, the Kafka event and, when a callback URL is registered, the webhook.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final PaymentPersistenceService persistenceService;
    private final PaymentEventProducer eventProducer;
    private final WebhookService webhookService;
    private final PaymentAuditLogger auditLogger;

    public PaymentResult processPayment(PaymentRequest request) {
        validate(request);
        auditLogger.logPaymentRequest(request);
        log.info("Processing payment: externalReference={}, policyNumber={}, amount={} {}",
                request.getExternalReference(), request.getPolicyNumber(), request.getAmount(), request.getCurrency());

        PaymentResult result = withPersistence(() -> persistenceService.createPayment(request));

        log.info("Payment recorded: externalReference={}, txnReference={}, receiptNumber={}",
                result.getExternalReference(), result.getTxnReference(), result.getReceiptNumber());
        auditLogger.logPaymentCreated(result);
        eventProducer.publishPaymentCreated(result, request.getRequestId());
        if (result.getCallbackUrl() != null && !result.getCallbackUrl().isBlank()) {
            webhookService.sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, result);
        }
        return result;
    }

    /**
     * Sets the status of a transaction from a wire code such as {@code "completed"}.
     */
    public PaymentView updateStatus(String txnReference, String statusCode, GatewayResponse gatewayResponse,
                                    String requestId) {
        PaymentStatus status = PaymentStatus.fromCode(statusCode)
                .orElseThrow(() -> new PaymentException(ErrorCode.INVALID_FIELD_VALUE,
                        "Invalid status '" + statusCode + "'; expected one of pending, completed, failed, cancelled, reversed"));

        PaymentView view = withPersistence(() -> persistenceService.updateStatus(txnReference, status, gatewayResponse));

        log.info("Payment status updated: txnReference={}, status={}", txnReference, status.getCode());
        auditLogger.logStatusChange(view);
        eventProducer.publishStatusChanged(view, requestId);
        return view;
    }

    public PaymentView getByExternalReference(String externalReference) {
        return withPersistence(() -> persistenceService.getByExternalReference(externalReference));
    }

    public PaymentView getByTxnReference(String txnReference) {
        return withPersistence(() -> persistenceService.getByTxnReference(txnReference));
    }

    private void validate(PaymentRequest request) {
        require(request.getExternalReference(), "externalReference");
        require(request.getPolicyHolderId(), "policyHolderId");
        require(request.getPolicyNumber(), "policyNumber");
        require(request.getCurrency(), "currency");
        require(request.getPaymentMethod(), "paymentMethod");
        require(request.getCustomerName(), "customerName");
        require(request.getCustomerEmail(), "customerEmail");
        require(request.getCustomerMobileNo(), "customerMobileNo");
        require(request.getInsuranceType(), "insuranceType");
        require(request.getPolicyType(), "policyType");
        if (request.getAmount() == null) {
            throw new PaymentException(ErrorCode.MISSING_REQUIRED_FIELD, "amount is required");
        }
        if (request.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new PaymentException(ErrorCode.VALIDATION_ERROR, "amount must be greater than zero");
        }
        if (!SupportedCurrency.isSupported(request.getCurrency())) {
            throw new PaymentException(ErrorCode.VALIDATION_ERROR,
                    "Unsupported currency '" + request.getCurrency() + "'; expected USD or ZWG");
        }
        if (!EMAIL.matcher(request.getCustomerEmail()).matches()) {
            throw new PaymentException(ErrorCode.VALIDATION_ERROR, "customerEmail is not a valid e-mail address");
        }
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PaymentException(ErrorCode.MISSING_REQUIRED_FIELD, field + " is required");
        }
    }

    static <T> T withPersistence(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Payment store operation failed", e);
            throw new PaymentException(ErrorCode.PERSISTENCE_ERROR, "Payment store is unavailable", e);
        }
    }
}
