package com.insurance.payments.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates exceptions into the error envelope. Server-side failures are logged with their
 * stack trace and reported to the caller as a generic INTERNAL_ERROR.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String GENERIC_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleValidation(MethodArgumentNotValidException ex,
                                                              HttpServletRequest request) {
        List<Map<String, String>> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::fieldError)
                .toList();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", errors);
        return respond(ErrorCode.VALIDATION_ERROR, "Request validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleUnreadable(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, "Request body is missing or malformed", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                HttpServletRequest request) {
        return respond(ErrorCode.INVALID_FIELD_VALUE, ex.getName() + " has an invalid value", null, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                    HttpServletRequest request) {
        return respond(ErrorCode.MISSING_REQUIRED_FIELD, ex.getParameterName() + " is required", null, request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleMediaType(HttpMediaTypeNotSupportedException ex,
                                                             HttpServletRequest request) {
        return respond(ErrorCode.UNSUPPORTED_MEDIA_TYPE,
                "Content type " + ex.getContentType() + " is not supported; use application/json", null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiEnvelope<Void>> handleMethod(HttpRequestMethodNotSupportedException ex,
                                                          HttpServletRequest request) {
        ResponseEntity<ApiEnvelope<Void>> response = respond(ErrorCode.METHOD_NOT_ALLOWED,
                "Method " + ex.getMethod() + " is not supported for this path", null, request);
        if (ex.getSupportedHttpMethods() == null) {
            return response;
        }
        return ResponseEntity.status(response.getStatusCode())
                .allow(ex.getSupportedHttpMethods().toArray(new HttpMethod[0]))
                .body(response.getBody());
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ApiEnvelope<Void>> handleNoResource(Exception ex, HttpServletRequest request) {
        return respond(ErrorCode.RESOURCE_NOT_FOUND, "No endpoint " + request.getMethod() + " " + request.getRequestURI(),
                null, request);
    }

    @ExceptionHandler(PaymentException.class)
    public ResponseEntity<ApiEnvelope<Void>> handlePayment(PaymentException ex, HttpServletRequest request) {
        if (ex.getErrorCode().getHttpStatus().is5xxServerError()) {
            log.error("Request failed: code={}, uri={}", ex.getErrorCode(), request.getRequestURI(), ex);
            return respond(ErrorCode.INTERNAL_ERROR, GENERIC_MESSAGE, null, request);
        }
        log.info("Request rejected: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiEnvelope<Void>> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error: uri={}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, GENERIC_MESSAGE, null, request);
    }

    private static ResponseEntity<ApiEnvelope<Void>> respond(ErrorCode code, String message,
                                                             Map<String, Object> details,
                                                             HttpServletRequest request) {
        Object requestId = request.getAttribute(RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE);
        HttpStatus status = code.getHttpStatus();
        return ResponseEntity.status(status)
                .body(ApiEnvelope.error(code, message, details, requestId != null ? requestId.toString() : null));
    }

    private static Map<String, String> fieldError(FieldError error) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("field", error.getField());
        entry.put("message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid");
        return entry;
    }
}
