package com.insurance.payments.compliance;

import com.insurance.payments.domain.PaymentRequest;
import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.domain.ReversalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one {@code [AUDIT]} line per payment or reversal state change. Customer contact
 * details pass through {@link CustomerDataMasker} first.
 */
@Slf4j
@Component
public class PaymentAuditLogger {

    public void logPaymentRequest(PaymentRequest request) {
        log.info("[AUDIT] PAYMENT_REQUEST externalReference={} policyNumber={} amount={} currency={} method={} customer={} email={} mobile={} clientId={}",
                request.getExternalReference(),
                request.getPolicyNumber(),
                request.getAmount(),
                request.getCurrency(),
                request.getPaymentMethod(),
                CustomerDataMasker.maskName(request.getCustomerName()),
                CustomerDataMasker.maskEmail(request.getCustomerEmail()),
                CustomerDataMasker.maskMobile(request.getCustomerMobileNo()),
                request.getClientId());
    }

    public void logPaymentCreated(PaymentResult result) {
        log.info("[AUDIT] PAYMENT_CREATED externalReference={} txnReference={} receiptNumber={} status={}",
                result.getExternalReference(),
                result.getTxnReference(),
                result.getReceiptNumber(),
                result.getStatus());
    }

    public void logStatusChange(PaymentView view) {
        log.info("[AUDIT] PAYMENT_STATUS_CHANGED externalReference={} txnReference={} status={} receiptStatus={}",
                view.getPaymentDetails().getExternalReference(),
                view.getPaymentDetails().getTxnReference(),
                view.getPaymentDetails().getStatus(),
                view.getReceiptDetails() != null ? view.getReceiptDetails().getStatus() : null);
    }

    public void logReversal(String action, ReversalResult result) {
        log.info("[AUDIT] REVERSAL_{} reversalReference={} originalExternalReference={} receiptNumber={} status={} initiatedBy={}",
                action,
                result.getReversalReference(),
                result.getOriginalExternalReference(),
                result.getReceiptNumber(),
                result.getStatus(),
                result.getInitiatedBy());
    }
}
