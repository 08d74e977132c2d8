package com.insurance.payments.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Instant;

/**
 * REST API request body for reversing a completed payment.
 */
@Data
public class ReversalRequestDto {

    @NotBlank(message = "originalExternalReference is required")
    private String originalExternalReference;

    /** Optional; reversed together with the payment when supplied. */
    private String receiptNumber;

    @NotBlank(message = "reason is required")
    private String reason;

    @NotBlank(message = "initiatedBy is required")
    private String initiatedBy;

    /** Caller's reference for the reversal; generated when absent. */
    private String externalReference;

    private Instant requestedAt;
}
