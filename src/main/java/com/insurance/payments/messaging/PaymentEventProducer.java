package com.insurance.payments.messaging;

import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.domain.ReversalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payment and reversal lifecycle events to Kafka, keyed by the payment's external
 * reference so all events for one payment land on the same partition. Publishing never fails
 * the caller.
 */
@Slf4j
@Component
public class PaymentEventProducer {

    public static final String PAYMENT_CREATED = "PAYMENT_CREATED";
    public static final String PAYMENT_STATUS_CHANGED = "PAYMENT_STATUS_CHANGED";
    public static final String REVERSAL_REQUESTED = "REVERSAL_REQUESTED";
    public static final String REVERSAL_COMPLETED = "REVERSAL_COMPLETED";
    public static final String REVERSAL_REJECTED = "REVERSAL_REJECTED";

    private final ObjectProvider<KafkaTemplate<String, PaymentEvent>> kafkaTemplate;
    private final boolean enabled;
    private final String topic;

    public PaymentEventProducer(ObjectProvider<KafkaTemplate<String, PaymentEvent>> kafkaTemplate,
                                @Value("${payment.kafka.enabled:false}") boolean enabled,
                                @Value("${payment.kafka.topic.payment-events:payment-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.enabled = enabled;
        this.topic = topic;
    }

    public void publishPaymentCreated(PaymentResult result, String requestId) {
        send(PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(PAYMENT_CREATED)
                .externalReference(result.getExternalReference())
                .txnReference(result.getTxnReference())
                .receiptNumber(result.getReceiptNumber())
                .policyNumber(result.getPolicyNumber())
                .status(result.getStatus().getCode())
                .amount(result.getAmount())
                .currency(result.getCurrency())
                .requestId(requestId)
                .timestamp(Instant.now())
                .build());
    }

    public void publishStatusChanged(PaymentView view, String requestId) {
        PaymentView.PaymentDetails payment = view.getPaymentDetails();
        send(PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(PAYMENT_STATUS_CHANGED)
                .externalReference(payment.getExternalReference())
                .txnReference(payment.getTxnReference())
                .receiptNumber(view.getReceiptDetails() != null ? view.getReceiptDetails().getReceiptNumber() : null)
                .policyNumber(view.getPolicyDetails() != null ? view.getPolicyDetails().getPolicyNumber() : null)
                .status(payment.getStatus().getCode())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .requestId(requestId)
                .timestamp(Instant.now())
                .build());
    }

    public void publishReversal(String eventType, ReversalResult result, String requestId) {
        send(PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .externalReference(result.getOriginalExternalReference())
                .txnReference(result.getOriginalTxnReference())
                .receiptNumber(result.getReceiptNumber())
                .reversalReference(result.getReversalReference())
                .policyNumber(result.getPolicyNumber())
                .status(result.getStatus().getCode())
                .amount(result.getAmount())
                .currency(result.getCurrency())
                .requestId(requestId)
                .timestamp(Instant.now())
                .build());
    }

    private void send(PaymentEvent event) {
        if (!enabled) {
            log.debug("Kafka publishing disabled, skipping eventType={} externalReference={}",
                    event.getEventType(), event.getExternalReference());
            return;
        }
        KafkaTemplate<String, PaymentEvent> template = kafkaTemplate.getIfAvailable();
        if (template == null) {
            log.warn("No KafkaTemplate available, dropping eventType={} externalReference={}",
                    event.getEventType(), event.getExternalReference());
            return;
        }
        String key = event.getExternalReference();
        log.info("Publishing payment event: key={}, eventId={}, eventType={}, status={}",
                key, event.getEventId(), event.getEventType(), event.getStatus());
        try {
            CompletableFuture<SendResult<String, PaymentEvent>> future = template.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish payment event key={} eventId={}", key, event.getEventId(), ex);
                } else {
                    log.debug("Published payment event: key={}, eventId={}, partition={}, offset={}",
                            key, event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to hand payment event to Kafka key={} eventId={}", key, event.getEventId(), e);
        }
    }
}
