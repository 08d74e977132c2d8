package com.insurance.payments.api;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ResponseMeta {

    String requestId;
    Instant generatedAt;
}
