package com.insurance.payments.api;

import lombok.Getter;

/**
 * Raised by the payment, receipt, reversal and reconciliation services for any failure a caller
 * can act on. Translated to an error envelope by {@link GlobalExceptionHandler}.
 */
@Getter
public class PaymentException extends RuntimeException {

    private final ErrorCode errorCode;

    public PaymentException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PaymentException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
