package com.insurance.payments.core;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates system references of the form {@code PREFIX-<epochMillis>-<random upper hex>}.
 */
public final class ReferenceGenerator {

    public static final String TRANSACTION_PREFIX = "TXN";
    public static final String RECEIPT_PREFIX = "RCP";
    public static final String REVERSAL_PREFIX = "REV";
    public static final String REQUEST_PREFIX = "GW";

    private static final SecureRandom RANDOM = new SecureRandom();

    private ReferenceGenerator() {
    }

    public static String transactionReference() {
        return generate(TRANSACTION_PREFIX, 4);
    }

    public static String receiptNumber() {
        return generate(RECEIPT_PREFIX, 4);
    }

    public static String reversalReference() {
        return generate(REVERSAL_PREFIX, 4);
    }

    /** Correlation id assigned to requests that arrive without one. */
    public static String requestId() {
        return generate(REQUEST_PREFIX, 3);
    }

    private static String generate(String prefix, int randomBytes) {
        byte[] bytes = new byte[randomBytes];
        RANDOM.nextBytes(bytes);
        return prefix + "-" + System.currentTimeMillis() + "-"
                + HexFormat.of().formatHex(bytes).toUpperCase(Locale.ROOT);
    }
}
