package com.insurance.payments.api;

import com.insurance.payments.core.ReceiptIssuer;
import com.insurance.payments.domain.ReceiptDetails;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/receipts")
@RequiredArgsConstructor
@Tag(name = "Receipts", description = "Look up payment receipts")
public class ReceiptController {

    private final ReceiptIssuer receiptIssuer;

    @GetMapping("/{receiptNumber}")
    @Operation(summary = "Receipt with payment details")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Receipt and the payment it was issued for"),
            @ApiResponse(responseCode = "404", description = "RECEIPT_NOT_FOUND")
    })
    public ResponseEntity<ApiEnvelope<ReceiptDetails>> getReceipt(
            @PathVariable String receiptNumber,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        return ResponseEntity.ok(ApiEnvelope.ok(receiptIssuer.getReceiptWithDetails(receiptNumber), requestId));
    }
}
