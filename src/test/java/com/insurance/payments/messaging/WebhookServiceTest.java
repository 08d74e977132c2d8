package com.insurance.payments.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentStatus;
import com.insurance.payments.domain.ReversalResult;
import com.insurance.payments.domain.ReversalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.client.ExpectedCount.never;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookServiceTest {

    private static final String CALLBACK = "https://partner.example.com/hook";
    private static final Executor SAME_THREAD = Runnable::run;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private WebhookService service(boolean enabled, String secret) {
        return new WebhookService(restTemplate, SAME_THREAD, objectMapper, enabled, secret, "Test-Agent/1.0");
    }

    private PaymentResult payment(String callbackUrl) {
        return PaymentResult.builder()
                .txnReference("TXN-1")
                .externalReference("EXT-1")
                .receiptNumber("RCP-1")
                .policyNumber("POL-001")
                .amount(new BigDecimal("150.00"))
                .currency("USD")
                .status(PaymentStatus.PENDING)
                .processedAt(Instant.parse("2024-01-10T10:00:00Z"))
                .callbackUrl(callbackUrl)
                .build();
    }

    @Test
    void paymentEventIsPostedWithEnvelopeAndHeaders() {
        server.expect(once(), requestTo(CALLBACK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", MediaType.APPLICATION_JSON_VALUE))
                .andExpect(header("User-Agent", "Test-Agent/1.0"))
                .andExpect(header(WebhookSignature.TIMESTAMP_HEADER, matchesPattern(".+")))
                .andExpect(jsonPath("$.event").value("payment.pending"))
                .andExpect(jsonPath("$.eventId").isNotEmpty())
                .andExpect(jsonPath("$.data.txnReference").value("TXN-1"))
                .andExpect(jsonPath("$.data.externalReference").value("EXT-1"))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.amount").value(150.0))
                .andRespond(withSuccess());

        service(true, "").sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, payment(CALLBACK));

        server.verify();
    }

    @Test
    void signatureHeaderIsAddedWhenSecretConfigured() {
        server.expect(once(), requestTo(CALLBACK))
                .andExpect(header(WebhookSignature.HEADER, matchesPattern("[0-9a-f]{64}")))
                .andRespond(withSuccess());

        service(true, "s3cret").sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, payment(CALLBACK));

        server.verify();
    }

    @Test
    void failedDeliveryIsAttemptedOnceAndNotPropagated() {
        server.expect(once(), requestTo(CALLBACK)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        ReversalResult reversal = ReversalResult.builder()
                .reversalReference("REV-1")
                .originalExternalReference("EXT-1")
                .amount(new BigDecimal("150.00"))
                .status(ReversalStatus.COMPLETED)
                .callbackUrl(CALLBACK)
                .build();

        assertThatCode(() -> service(true, "").sendReversalEvent(WebhookEvent.REVERSAL_COMPLETED, reversal))
                .doesNotThrowAnyException();
        server.verify();
    }

    @Test
    void nothingIsSentWhenDisabledOrWithoutCallback() {
        server.expect(never(), requestTo(CALLBACK));

        service(false, "").sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, payment(CALLBACK));
        service(true, "").sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, payment(null));

        server.verify();
    }

    @Test
    void saturatedPoolDropsEventWithoutFailingCaller() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("full");
        };
        WebhookService service = new WebhookService(restTemplate, rejecting, objectMapper, true, "", "Test-Agent/1.0");

        assertThatCode(() -> service.sendPaymentEvent(WebhookEvent.PAYMENT_PENDING, payment(CALLBACK)))
                .doesNotThrowAnyException();
    }

    @Test
    void signatureIsDeterministicHmacSha256() {
        // RFC 4231 test case 2
        assertThat(WebhookSignature.sign("Jefe", "what do ya want for nothing?"))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }
}
