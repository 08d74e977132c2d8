package com.insurance.payments.api;

import com.insurance.payments.domain.GatewayResponse;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Status transition reported by the payment rail, e.g. {@code {"status": "completed"}}.
 */
@Data
public class StatusUpdateRequestDto {

    @NotBlank(message = "status is required")
    private String status;

    private GatewayResponse gatewayResponse;
}
