package com.insurance.payments.api;

import com.insurance.payments.core.ReconciliationService;
import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.domain.ReconciliationPage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/payments/reconciliations")
@RequiredArgsConstructor
@Tag(name = "Reconciliation", description = "Paged settlement reports")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @GetMapping
    @Operation(
            summary = "List payments for reconciliation",
            description = "Payments processed between from and to (UTC calendar dates, both inclusive, at most 31 days apart), "
                    + "newest first. pageSize defaults to and is capped at 500.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "One page of payment views with pagination"),
            @ApiResponse(responseCode = "400", description = "MISSING_REQUIRED_FIELD, INVALID_DATE_FORMAT or INVALID_FIELD_VALUE")
    })
    public ResponseEntity<ApiEnvelope<List<PaymentView>>> list(
            @Parameter(description = "yyyy-MM-dd") @RequestParam(required = false) String from,
            @Parameter(description = "yyyy-MM-dd") @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @RequestAttribute(name = RequestCorrelationFilter.REQUEST_ID_ATTRIBUTE, required = false) String requestId) {
        ReconciliationPage result = reconciliationService.listForReconciliation(from, to, page, pageSize);
        return ResponseEntity.ok(ApiEnvelope.ok(result.getPayments(), result.getPagination(), requestId));
    }
}
