package com.insurance.payments.messaging;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body POSTed to a payment's callback URL.
 */
@Value
@Builder
public class WebhookEvent {

    public static final String PAYMENT_PENDING = "payment.pending";
    public static final String REVERSAL_COMPLETED = "reversal.completed";

    /** Discriminator such as {@code payment.pending}. */
    String event;
    String eventId;
    Instant timestamp;
    Map<String, Object> data;
}
