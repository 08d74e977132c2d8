package com.insurance.payments.api;

import com.insurance.payments.core.ReversalOrchestrator;
import com.insurance.payments.domain.ReversalRequest;
import com.insurance.payments.domain.ReversalResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the request-then-approve reversal workflow.
 */
@RestController
@RequestMapping("/api/v1/payments/reversal")
@RequiredArgsConstructor
@Tag(name = "Reversals", description = "Request, approve and reject payment reversals")
public class ReversalController {

    private final ReversalOrchestrator orchestrator;

    @PostMapping
    @Operation(
            summary = "Request reversal",
            description = "Records a pending reversal of a completed payment. Nothing is undone until the reversal is processed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pending reversal"),
            @ApiResponse(responseCode = "400", description = "PAYMENT_ALREADY_REVERSED, REVERSAL_NOT_ALLOWED, RECEIPT_ALREADY_REVERSED, DUPLICATE_REFERENCE or VALIDATION_ERROR"),
            @ApiResponse(responseCode = "404", description = "PAYMENT_NOT_FOUND or RECEIPT_NOT_FOUND")
    })
    public ResponseEntity<ApiEnvelope<ReversalResult>> requestReversal(
            @Valid @RequestBody ReversalRequestDto dto,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        ReversalRequest request = ReversalRequest.builder()
                .externalReference(dto.getExternalReference())
                .originalExternalReference(dto.getOriginalExternalReference())
                .receiptNumber(dto.getReceiptNumber())
                .reason(dto.getReason())
                .initiatedBy(dto.getInitiatedBy())
                .requestedAt(dto.getRequestedAt())
                .requestId(requestId)
                .build();
        return ResponseEntity.ok(ApiEnvelope.ok(orchestrator.requestReversal(request), requestId));
    }

    @GetMapping("/{reversalReference}")
    @Operation(summary = "Get reversal")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reversal"),
            @ApiResponse(responseCode = "404", description = "REVERSAL_NOT_FOUND")
    })
    public ResponseEntity<ApiEnvelope<ReversalResult>> getReversal(
            @PathVariable String reversalReference,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        return ResponseEntity.ok(ApiEnvelope.ok(orchestrator.getReversal(reversalReference), requestId));
    }

    @PostMapping("/{reversalReference}/process")
    @Operation(
            summary = "Process reversal",
            description = "Approves a pending reversal: the payment and its receipt become reversed. "
                    + "Sends a reversal.completed webhook when the payment has a callback URL.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Completed reversal"),
            @ApiResponse(responseCode = "400", description = "PAYMENT_ALREADY_REVERSED or REVERSAL_NOT_ALLOWED"),
            @ApiResponse(responseCode = "404", description = "REVERSAL_NOT_FOUND"),
            @ApiResponse(responseCode = "409", description = "REVERSAL_ALREADY_PROCESSED")
    })
    public ResponseEntity<ApiEnvelope<ReversalResult>> processReversal(
            @PathVariable String reversalReference,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        return ResponseEntity.ok(ApiEnvelope.ok(orchestrator.processReversal(reversalReference, requestId), requestId));
    }

    @PostMapping("/{reversalReference}/reject")
    @Operation(summary = "Reject reversal", description = "Closes a pending reversal without touching the payment.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rejected reversal"),
            @ApiResponse(responseCode = "404", description = "REVERSAL_NOT_FOUND"),
            @ApiResponse(responseCode = "409", description = "REVERSAL_ALREADY_PROCESSED")
    })
    public ResponseEntity<ApiEnvelope<ReversalResult>> rejectReversal(
            @PathVariable String reversalReference,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        return ResponseEntity.ok(ApiEnvelope.ok(orchestrator.rejectReversal(reversalReference, requestId), requestId));
    }
}
