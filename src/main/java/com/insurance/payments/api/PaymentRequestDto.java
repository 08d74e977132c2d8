package com.insurance.payments.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST API request body for recording a policy payment.
 */
@Data
public class PaymentRequestDto {

    /** Caller's idempotency key. Resubmitting it is rejected as a duplicate. */
    @NotBlank(message = "externalReference is required")
    private String externalReference;

    @NotBlank(message = "policyHolderId is required")
    private String policyHolderId;

    @NotBlank(message = "policyNumber is required")
    private String policyNumber;

    @NotBlank(message = "currency is required")
    @Pattern(regexp = "USD|ZWG", message = "currency must be USD or ZWG")
    private String currency;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be greater than zero")
    @Digits(integer = 17, fraction = 2, message = "amount must have at most two decimal places")
    private BigDecimal amount;

    @NotBlank(message = "paymentMethod is required")
    private String paymentMethod;

    @NotBlank(message = "customerName is required")
    private String customerName;

    @NotBlank(message = "customerEmail is required")
    @Email(message = "customerEmail must be a valid e-mail address")
    private String customerEmail;

    @NotBlank(message = "customerMobileNo is required")
    private String customerMobileNo;

    @NotBlank(message = "insurance_type is required")
    @JsonProperty("insurance_type")
    @JsonAlias("insuranceType")
    private String insuranceType;

    @NotBlank(message = "policyType is required")
    private String policyType;

    private String callbackUrl;
    private String returnUrl;
    private Instant processedAt;
}
