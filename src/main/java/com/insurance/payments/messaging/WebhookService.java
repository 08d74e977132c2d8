package com.insurance.payments.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.ReversalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Notifies a payment's callback URL of state changes. Delivery is fire-and-forget on a bounded
 * worker pool with a single attempt; failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class WebhookService {

    private final RestTemplate restTemplate;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String secret;
    private final String userAgent;

    public WebhookService(@Qualifier("webhookRestTemplate") RestTemplate restTemplate,
                          @Qualifier("webhookExecutor") Executor executor,
                          ObjectMapper objectMapper,
                          @Value("${payment.webhook.enabled:true}") boolean enabled,
                          @Value("${payment.webhook.secret:}") String secret,
                          @Value("${payment.webhook.user-agent:Insurance-Payment-Gateway/1.0}") String userAgent) {
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.secret = secret;
        this.userAgent = userAgent;
    }

    public void sendPaymentEvent(String event, PaymentResult payment) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("txnReference", payment.getTxnReference());
        data.put("externalReference", payment.getExternalReference());
        data.put("policyNumber", payment.getPolicyNumber());
        data.put("amount", payment.getAmount());
        data.put("currency", payment.getCurrency());
        data.put("status", payment.getStatus());
        data.put("receiptNumber", payment.getReceiptNumber());
        data.put("processedAt", payment.getProcessedAt());
        dispatch(payment.getCallbackUrl(), event, data);
    }

    public void sendReversalEvent(String event, ReversalResult reversal) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reversalReference", reversal.getReversalReference());
        data.put("originalExternalReference", reversal.getOriginalExternalReference());
        data.put("txnReference", reversal.getOriginalTxnReference());
        data.put("receiptNumber", reversal.getReceiptNumber());
        data.put("policyNumber", reversal.getPolicyNumber());
        data.put("amount", reversal.getAmount());
        data.put("currency", reversal.getCurrency());
        data.put("status", reversal.getStatus());
        data.put("reason", reversal.getReason());
        data.put("processedAt", reversal.getProcessedAt());
        dispatch(reversal.getCallbackUrl(), event, data);
    }

    private void dispatch(String callbackUrl, String event, Map<String, Object> data) {
        if (!enabled || callbackUrl == null || callbackUrl.isBlank()) {
            return;
        }
        WebhookEvent webhook = WebhookEvent.builder()
                .event(event)
                .eventId(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .data(data)
                .build();
        try {
            CompletableFuture.runAsync(() -> deliver(callbackUrl, webhook), executor)
                    .exceptionally(ex -> {
                        log.error("Webhook delivery task failed: event={}, eventId={}, url={}",
                                event, webhook.getEventId(), callbackUrl, ex);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.error("Webhook pool saturated, dropping event={} eventId={} url={}",
                    event, webhook.getEventId(), callbackUrl);
        }
    }

    private void deliver(String callbackUrl, WebhookEvent webhook) {
        String body;
        try {
            body = objectMapper.writeValueAsString(webhook);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize webhook event={} eventId={}", webhook.getEvent(), webhook.getEventId(), e);
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.set(WebhookSignature.TIMESTAMP_HEADER, webhook.getTimestamp().toString());
        if (secret != null && !secret.isBlank()) {
            headers.set(WebhookSignature.HEADER, WebhookSignature.sign(secret, body));
        }

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(callbackUrl, new HttpEntity<>(body, headers), String.class);
            log.info("Webhook delivered: event={}, eventId={}, url={}, status={}",
                    webhook.getEvent(), webhook.getEventId(), callbackUrl, response.getStatusCode().value());
        } catch (Exception e) {
            log.warn("Webhook delivery failed: event={}, eventId={}, url={}: {}",
                    webhook.getEvent(), webhook.getEventId(), callbackUrl, e.getMessage());
        }
    }
}
