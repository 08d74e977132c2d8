package com.insurance.payments;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.core.PaymentOrchestrator;
import com.insurance.payments.core.ReceiptIssuer;
import com.insurance.payments.core.ReconciliationService;
import com.insurance.payments.core.ReversalOrchestrator;
import com.insurance.payments.domain.*;
import com.insurance.payments.persistence.repository.PaymentTransactionRepository;
import com.insurance.payments.persistence.repository.ReceiptRepository;
import com.insurance.payments.persistence.repository.ReversalRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full payment lifecycle against an in-memory database: record, complete, reverse.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PaymentLifecycleIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PaymentOrchestrator paymentOrchestrator;

    @Autowired
    private ReversalOrchestrator reversalOrchestrator;

    @Autowired
    private ReceiptIssuer receiptIssuer;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private PaymentTransactionRepository transactionRepository;

    @Autowired
    private ReceiptRepository receiptRepository;

    @Autowired
    private ReversalRepository reversalRepository;

    @AfterEach
    void cleanUp() {
        reversalRepository.deleteAll();
        receiptRepository.deleteAll();
        transactionRepository.deleteAll();
    }

    private static PaymentRequest request(String externalReference) {
        return requestBuilder(externalReference).build();
    }

    private static PaymentRequest.PaymentRequestBuilder requestBuilder(String externalReference) {
        return PaymentRequest.builder()
                .externalReference(externalReference)
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
                .clientId("partner-1")
                .requestId("REQ-1");
    }

    private static ReversalRequest reversalOf(String externalReference, String receiptNumber) {
        return ReversalRequest.builder()
                .originalExternalReference(externalReference)
                .receiptNumber(receiptNumber)
                .reason("customer request")
                .initiatedBy("ops")
                .requestId("REQ-2")
                .build();
    }

    @Test
    void processPaymentStoresPendingTransactionAndReceipt() {
        PaymentResult result = paymentOrchestrator.processPayment(request("EXT-100"));

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(result.getTxnReference()).matches("TXN-\\d+-[0-9A-F]{8}");
        assertThat(result.getReceiptNumber()).matches("RCP-\\d+-[0-9A-F]{8}");
        assertThat(result.getReceiptStatus()).isEqualTo(ReceiptStatus.PENDING);

        PaymentView view = paymentOrchestrator.getByExternalReference("EXT-100");
        assertThat(view.getPaymentDetails().getTxnReference()).isEqualTo(result.getTxnReference());
        assertThat(view.getPaymentDetails().getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(view.getPaymentDetails().getAmount()).isEqualByComparingTo("150.00");
        assertThat(view.getReceiptDetails().getReceiptNumber()).isEqualTo(result.getReceiptNumber());
        assertThat(view.getPolicyHolder().getFullName()).isEqualTo("Jane Doe");
    }

    @Test
    void duplicateExternalReferenceIsRejectedWithoutSecondRow() {
        paymentOrchestrator.processPayment(request("EXT-200"));

        assertThatThrownBy(() -> paymentOrchestrator.processPayment(request("EXT-200")))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.DUPLICATE_REFERENCE);

        assertThat(transactionRepository.count()).isEqualTo(1);
        assertThat(receiptRepository.count()).isEqualTo(1);
    }

    @Test
    void concurrentSubmissionsOfSameReferenceCreateOneTransaction() throws Exception {
        int submitters = 4;
        ExecutorService pool = Executors.newFixedThreadPool(submitters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PaymentResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < submitters; i++) {
                Callable<PaymentResult> submit = () -> {
                    start.await();
                    return paymentOrchestrator.processPayment(request("EXT-RACE"));
                };
                futures.add(pool.submit(submit));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<PaymentResult> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(PaymentException.class);
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(transactionRepository.count()).isEqualTo(1);
        assertThat(receiptRepository.count()).isEqualTo(1);
    }

    @Test
    void reversalOfPendingPaymentIsNotAllowed() {
        paymentOrchestrator.processPayment(request("EXT-300"));

        assertThatThrownBy(() -> reversalOrchestrator.requestReversal(reversalOf("EXT-300", null)))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REVERSAL_NOT_ALLOWED);
        assertThat(reversalRepository.count()).isZero();
    }

    @Test
    void completeThenReverseUpdatesPaymentAndReceipt() {
        PaymentResult created = paymentOrchestrator.processPayment(request("EXT-400"));

        PaymentView completed = paymentOrchestrator.updateStatus(created.getTxnReference(), "completed",
                GatewayResponse.builder().gatewayReference("PN-400").responseCode("00").build(), "REQ-1");
        assertThat(completed.getPaymentDetails().getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(completed.getReceiptDetails().getStatus()).isEqualTo(ReceiptStatus.APPLIED);
        assertThat(transactionRepository.findByTxnReference(created.getTxnReference()))
                .get()
                .satisfies(txn -> {
                    assertThat(txn.getReconciliationStatus()).isEqualTo(ReconciliationStatus.MATCHED);
                    assertThat(txn.getReconciliationDate()).isNotNull();
                    assertThat(txn.getGatewayReference()).isEqualTo("PN-400");
                });

        ReversalResult pending = reversalOrchestrator.requestReversal(reversalOf("EXT-400", created.getReceiptNumber()));
        assertThat(pending.getStatus()).isEqualTo(ReversalStatus.PENDING);
        assertThat(pending.getReversalReference()).matches("REV-\\d+-[0-9A-F]{8}");
        assertThat(paymentOrchestrator.getByExternalReference("EXT-400").getPaymentDetails().getStatus())
                .isEqualTo(PaymentStatus.COMPLETED);

        ReversalResult done = reversalOrchestrator.processReversal(pending.getReversalReference(), "REQ-3");
        assertThat(done.getStatus()).isEqualTo(ReversalStatus.COMPLETED);
        assertThat(done.getProcessedAt()).isNotNull();
        assertThat(done.getAmount()).isEqualByComparingTo("150.00");

        assertThat(paymentOrchestrator.getByExternalReference("EXT-400").getPaymentDetails().getStatus())
                .isEqualTo(PaymentStatus.REVERSED);
        ReceiptDetails receipt = receiptIssuer.getReceiptWithDetails(created.getReceiptNumber());
        assertThat(receipt.getStatus()).isEqualTo(ReceiptStatus.REVERSED);
        assertThat(receipt.getReversedBy()).isEqualTo("ops");
        assertThat(receipt.getReversalReason()).isEqualTo("customer request");
        assertThat(receipt.getPaymentStatus()).isEqualTo(PaymentStatus.REVERSED);

        assertThatThrownBy(() -> reversalOrchestrator.processReversal(pending.getReversalReference(), "REQ-4"))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.REVERSAL_ALREADY_PROCESSED);
        assertThatThrownBy(() -> reversalOrchestrator.requestReversal(reversalOf("EXT-400", null)))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_ALREADY_REVERSED);
    }

    @Test
    void reversedPaymentCannotBeCompletedAndReversedAgain() {
        PaymentResult created = paymentOrchestrator.processPayment(request("EXT-450"));
        paymentOrchestrator.updateStatus(created.getTxnReference(), "completed", null, "REQ-1");
        ReversalResult reversal = reversalOrchestrator.requestReversal(reversalOf("EXT-450", created.getReceiptNumber()));
        reversalOrchestrator.processReversal(reversal.getReversalReference(), "REQ-2");

        assertThatThrownBy(() -> paymentOrchestrator.updateStatus(created.getTxnReference(), "completed", null, "REQ-3"))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_ALREADY_REVERSED);

        PaymentView view = paymentOrchestrator.getByExternalReference("EXT-450");
        assertThat(view.getPaymentDetails().getStatus()).isEqualTo(PaymentStatus.REVERSED);
        assertThat(view.getReceiptDetails().getStatus()).isEqualTo(ReceiptStatus.REVERSED);

        assertThatThrownBy(() -> reversalOrchestrator.requestReversal(reversalOf("EXT-450", null)))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_ALREADY_REVERSED);
        assertThat(reversalRepository.findAll())
                .filteredOn(r -> r.getStatus() == ReversalStatus.COMPLETED)
                .hasSize(1);
    }

    @Test
    void secondApprovalOfCompetingReversalFails() {
        PaymentResult created = paymentOrchestrator.processPayment(request("EXT-500"));
        paymentOrchestrator.updateStatus(created.getTxnReference(), "completed", null, "REQ-1");

        ReversalResult first = reversalOrchestrator.requestReversal(reversalOf("EXT-500", null));
        ReversalResult second = reversalOrchestrator.requestReversal(reversalOf("EXT-500", null));

        reversalOrchestrator.processReversal(first.getReversalReference(), "REQ-2");

        assertThatThrownBy(() -> reversalOrchestrator.processReversal(second.getReversalReference(), "REQ-3"))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.PAYMENT_ALREADY_REVERSED);
        assertThat(reversalOrchestrator.getReversal(second.getReversalReference()).getStatus())
                .isEqualTo(ReversalStatus.PENDING);

        ReversalResult rejected = reversalOrchestrator.rejectReversal(second.getReversalReference(), "REQ-4");
        assertThat(rejected.getStatus()).isEqualTo(ReversalStatus.REJECTED);
    }

    @Test
    void reconciliationListsCompletedPaymentsOfTheDay() {
        PaymentResult created = paymentOrchestrator.processPayment(request("EXT-600"));
        paymentOrchestrator.updateStatus(created.getTxnReference(), "completed", null, "REQ-1");
        paymentOrchestrator.processPayment(request("EXT-601"));

        String today = LocalDate.now(ZoneOffset.UTC).toString();
        ReconciliationPage page = reconciliationService.listForReconciliation(today, today, 1, 1);

        assertThat(page.getPagination().getTotal()).isEqualTo(2);
        assertThat(page.getPagination().getTotalPages()).isEqualTo(2);
        assertThat(page.getPagination().isHasNext()).isTrue();
        assertThat(page.getPayments()).hasSize(1);
    }

    @Test
    void processEndpointRejectsUnsupportedCurrency() throws Exception {
        mockMvc.perform(post("/api/v1/payment/process")
                        .header("X-Client-Id", "partner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "externalReference": "EXT-700",
                                  "policyHolderId": "63-123456A78",
                                  "policyNumber": "POL-001",
                                  "currency": "usd",
                                  "amount": 10.00,
                                  "paymentMethod": "ecocash",
                                  "customerName": "Jane Doe",
                                  "customerEmail": "jane@example.com",
                                  "customerMobileNo": "+263771234567",
                                  "insurance_type": "motor",
                                  "policyType": "comprehensive"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        assertThatThrownBy(() -> paymentOrchestrator.processPayment(
                requestBuilder("EXT-701").currency("ZWL").build()))
                .isInstanceOf(PaymentException.class)
                .extracting(e -> ((PaymentException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);

        assertThat(transactionRepository.count()).isZero();
        assertThat(receiptRepository.count()).isZero();
    }

    @Test
    void processEndpointRoundTripsThroughStatusLookup() throws Exception {
        mockMvc.perform(post("/api/v1/payment/process")
                        .header("X-Client-Id", "partner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "externalReference": "EXT-800",
                                  "policyHolderId": "63-123456A78",
                                  "policyNumber": "POL-001",
                                  "currency": "ZWG",
                                  "amount": 25.5,
                                  "paymentMethod": "card",
                                  "customerName": "Jane Doe",
                                  "customerEmail": "jane@example.com",
                                  "customerMobileNo": "+263771234567",
                                  "insuranceType": "funeral",
                                  "policyType": "family"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.paymentDetails.status").value("pending"))
                .andExpect(jsonPath("$.data.policyDetails.insuranceType").value("funeral"));

        mockMvc.perform(get("/api/v1/payments/status/externalReference/EXT-800").header("X-Client-Id", "partner-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.paymentDetails.currency").value("ZWG"))
                .andExpect(jsonPath("$.data.paymentDetails.amount").value(25.5))
                .andExpect(jsonPath("$.data.receiptDetails.status").value("pending"));
    }
}
