package com.insurance.payments.messaging;

import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.nio.charset.StandardCharsets;

/**
 * HMAC-SHA256 signature over a webhook body, hex encoded. Receivers recompute it with the
 * shared secret to authenticate the sender.
 */
public final class WebhookSignature {

    public static final String HEADER = "X-Webhook-Signature";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";

    private WebhookSignature() {}

    public static String sign(String secret, String body) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret.getBytes(StandardCharsets.UTF_8))
                .hmacHex(body);
    }
}
