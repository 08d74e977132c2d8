package com.insurance.payments.core;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.compliance.PaymentAuditLogger;
import com.insurance.payments.domain.*;
import com.insurance.payments.messaging.PaymentEventProducer;
import com.insurance.payments.messaging.WebhookEvent;
import com.insurance.payments.messaging.WebhookService;
import com.insurance.payments.persistence.service.PaymentPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentOrchestratorTest {

    @Mock private PaymentPersistenceService persistenceService;
    @Mock private PaymentEventProducer eventProducer;
    @Mock private WebhookService webhookService;
    @Mock private PaymentAuditLogger auditLogger;

    private PaymentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new PaymentOrchestrator(persistenceService, eventProducer, webhookService, auditLogger);
    }

    private PaymentRequest.PaymentRequestBuilder request() {
        return PaymentRequest.builder()
                .externalReference("EXT-1")
                .policyHolderId("63-123456A78")
                .policyNumber("POL-001")
                .currency("USD")
                .amount(new BigDecimal("150.00"))
                .paymentMethod("ecocash")
                .customerName("Jane Doe")
                .customerEmail("jane@example.com")
                .customerMobileNo("+263771234567")
                .insuranceType("motor")
                .policyType("comprehensive")
                .requestId("GW-1-ABCDEF");
    }

    private PaymentResult result(String callbackUrl) {
        return PaymentResult.builder()
                .paymentId(1L)
                .txnReference("TXN-1-0000000A")
                .externalReference("EXT-1")
                .receiptNumber("RCP-1-0000000A")
                .receiptStatus(ReceiptStatus.PENDING)
                .amount(new BigDecimal("150.00"))
                .currency("USD")
                .status(PaymentStatus.PENDING)
                .processedAt(Instant.now())
                .callbackUrl(callbackUrl)
                .build();
    }

    @Test
    void processPaymentPersistsAndPublishes() {
        PaymentRequest request = request().build();
        when(persistenceService.createPayment(request)).thenReturn(result(null));

        PaymentResult result = orchestrator.processPayment(request);

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(result.getReceiptNumber()).startsWith("RCP-");
        verify(auditLogger).logPaymentRequest(request);
        verify(eventProducer).publishPaymentCreated(result, "GW-1-ABCDEF");
        verifyNoInteractions(webhookService);
    }

    @Test
    void processPaymentSendsPendingWebhookWhenCallbackRegistered() {
        PaymentRequest request = request().callbackUrl("https://partner.example.com/hook").build();
        PaymentResult stored = result("https://partner.example.com/hook");
        when(persistenceService.createPayment(request)).thenReturn(stored);

        orchestrator.processPayment(request);

        verify(webhookService).sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, stored);
    }

    @Test
    void unsupportedCurrencyIsRejectedBeforeAnyWrite() {
        PaymentRequest request = request().currency("EUR").build();

        assertThatThrownBy(() -> orchestrator.processPayment(request))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
        verifyNoInteractions(persistenceService, eventProducer, webhookService);
    }

    @Test
    void lowercaseCurrencyIsNotAccepted() {
        assertThatThrownBy(() -> orchestrator.processPayment(request().currency("usd").build()))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
        verifyNoInteractions(persistenceService);
    }

    @Test
    void nonPositiveAmountIsRejected() {
        assertThatThrownBy(() -> orchestrator.processPayment(request().amount(BigDecimal.ZERO).build()))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void missingFieldIsReportedByName() {
        assertThatThrownBy(() -> orchestrator.processPayment(request().policyNumber(" ").build()))
                .isInstanceOf(PaymentException.class)
                .hasMessageContaining("policyNumber")
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.MISSING_REQUIRED_FIELD);
    }

    @Test
    void invalidEmailIsRejected() {
        assertThatThrownBy(() -> orchestrator.processPayment(request().customerEmail("not-an-email").build()))
                .isInstanceOf(PaymentException.class)
                .hasMessageContaining("customerEmail");
    }

    @Test
    void duplicateFromStoreIsPropagatedWithoutEvents() {
        PaymentRequest request = request().build();
        when(persistenceService.createPayment(request))
                .thenThrow(new PaymentException(ErrorCode.DUPLICATE_REFERENCE, "exists"));

        assertThatThrownBy(() -> orchestrator.processPayment(request))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.DUPLICATE_REFERENCE);
        verifyNoInteractions(eventProducer, webhookService);
    }

    @Test
    void storeFailureIsWrappedAsPersistenceError() {
        PaymentRequest request = request().build();
        when(persistenceService.createPayment(request))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> orchestrator.processPayment(request))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.PERSISTENCE_ERROR);
    }

    @Test
    void updateStatusRejectsUnknownStatus() {
        assertThatThrownBy(() -> orchestrator.updateStatus("TXN-1", "settled", null, null))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_FIELD_VALUE);
        verifyNoInteractions(persistenceService);
    }

    @Test
    void updateStatusResolvesWireCodeAndPublishes() {
        PaymentView view = PaymentView.builder()
                .paymentDetails(PaymentView.PaymentDetails.builder()
                        .externalReference("EXT-1")
                        .txnReference("TXN-1")
                        .status(PaymentStatus.COMPLETED)
                        .build())
                .build();
        when(persistenceService.updateStatus(eq("TXN-1"), eq(PaymentStatus.COMPLETED), any())).thenReturn(view);

        PaymentView updated = orchestrator.updateStatus("TXN-1", "Completed", null, "GW-2");

        assertThat(updated.getPaymentDetails().getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        verify(auditLogger).logStatusChange(view);
        verify(eventProducer).publishStatusChanged(view, "GW-2");
    }
}
