package com.insurance.payments.api;

import com.insurance.payments.core.PaymentOrchestrator;
import com.insurance.payments.domain.PaymentRequest;
import com.insurance.payments.domain.PaymentResult;
import com.insurance.payments.domain.PaymentView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for recording policy payments and querying their status.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Record policy payments and query their status")
public class PaymentController {

    private final PaymentOrchestrator orchestrator;

    @PostMapping("/payment/process")
    @Operation(
            summary = "Process payment",
            description = "Records a payment for an insurance policy and issues its receipt in one step. "
                    + "externalReference is the idempotency key: a second submission with the same value is rejected "
                    + "with DUPLICATE_REFERENCE. When callbackUrl is set a payment.pending webhook is sent after commit.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment recorded with status pending; body carries paymentDetails, policyDetails and receiptDetails"),
            @ApiResponse(responseCode = "400", description = "VALIDATION_ERROR, INVALID_FIELD_VALUE or DUPLICATE_REFERENCE"),
            @ApiResponse(responseCode = "401", description = "UNAUTHORIZED: missing X-Client-Id"),
            @ApiResponse(responseCode = "500", description = "INTERNAL_ERROR")
    })
    public ResponseEntity<ApiEnvelope<ProcessPaymentResponseDto>> processPayment(
            @Valid @RequestBody PaymentRequestDto dto,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId,
            @RequestAttribute(name = RequestCorrelationFilter.CLIENT_ID_ATTRIBUTE, required = false) String clientId) {
        PaymentRequest request = PaymentRequest.builder()
                .externalReference(dto.getExternalReference())
                .policyHolderId(dto.getPolicyHolderId())
                .policyNumber(dto.getPolicyNumber())
                .currency(dto.getCurrency())
                .amount(dto.getAmount())
                .paymentMethod(dto.getPaymentMethod())
                .customerName(dto.getCustomerName())
                .customerEmail(dto.getCustomerEmail())
                .customerMobileNo(dto.getCustomerMobileNo())
                .insuranceType(dto.getInsuranceType())
                .policyType(dto.getPolicyType())
                .callbackUrl(dto.getCallbackUrl())
                .returnUrl(dto.getReturnUrl())
                .processedAt(dto.getProcessedAt())
                .clientId(clientId)
                .requestId(requestId)
                .build();

        PaymentResult result = orchestrator.processPayment(request);
        return ResponseEntity.ok(ApiEnvelope.ok(ProcessPaymentResponseDto.from(result), requestId));
    }

    @GetMapping("/payments/status/externalReference/{externalReference}")
    @Operation(summary = "Payment status by external reference")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment view with policy holder, payment, receipt and policy details"),
            @ApiResponse(responseCode = "404", description = "PAYMENT_NOT_FOUND")
    })
    public ResponseEntity<ApiEnvelope<PaymentView>> getByExternalReference(
            @PathVariable String externalReference,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        return ResponseEntity.ok(ApiEnvelope.ok(orchestrator.getByExternalReference(externalReference), requestId));
    }

    @GetMapping("/payments/status/txnReference/{txnReference}")
    @Operation(summary = "Payment status by transaction reference")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment view"),
            @ApiResponse(responseCode = "404", description = "PAYMENT_NOT_FOUND")
    })
    public ResponseEntity<ApiEnvelope<PaymentView>> getByTxnReference(
            @PathVariable String txnReference,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        return ResponseEntity.ok(ApiEnvelope.ok(orchestrator.getByTxnReference(txnReference), requestId));
    }

    @PutMapping("/payments/status/txnReference/{txnReference}")
    @Operation(
            summary = "Update payment status",
            description = "Applies a status reported by the payment rail. Moving to completed marks the payment "
                    + "reconciled and applies its receipt.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated payment view"),
            @ApiResponse(responseCode = "400", description = "INVALID_FIELD_VALUE for an unknown status, PAYMENT_ALREADY_REVERSED once reversed"),
            @ApiResponse(responseCode = "404", description = "PAYMENT_NOT_FOUND")
    })
    public ResponseEntity<ApiEnvelope<PaymentView>> updateStatus(
            @PathVariable String txnReference,
            @Valid @RequestBody StatusUpdateRequestDto dto,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        PaymentView view = orchestrator.updateStatus(txnReference, dto.getStatus(), dto.getGatewayResponse(), requestId);
        return ResponseEntity.ok(ApiEnvelope.ok(view, requestId));
    }
}
