package com.insurance.payments.api;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to API clients, each bound to its HTTP status.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    MISSING_REQUIRED_FIELD(HttpStatus.BAD_REQUEST),
    INVALID_FIELD_VALUE(HttpStatus.BAD_REQUEST),
    INVALID_DATE_FORMAT(HttpStatus.BAD_REQUEST),
    DUPLICATE_REFERENCE(HttpStatus.BAD_REQUEST),
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND),
    RECEIPT_NOT_FOUND(HttpStatus.NOT_FOUND),
    REVERSAL_NOT_FOUND(HttpStatus.NOT_FOUND),
    PAYMENT_ALREADY_REVERSED(HttpStatus.BAD_REQUEST),
    REVERSAL_NOT_ALLOWED(HttpStatus.BAD_REQUEST),
    RECEIPT_ALREADY_REVERSED(HttpStatus.BAD_REQUEST),
    REVERSAL_ALREADY_PROCESSED(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED),
    UNSUPPORTED_MEDIA_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
