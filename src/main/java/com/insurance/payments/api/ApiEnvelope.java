package com.insurance.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.insurance.payments.domain.Pagination;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Body of every API response: either {@code data} or {@code error}, never both.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiEnvelope<T> {

    boolean success;
    T data;
    ApiError error;
    Pagination pagination;
    ResponseMeta meta;

    public static <T> ApiEnvelope<T> ok(T data, String requestId) {
        return ApiEnvelope.<T>builder()
                .success(true)
                .data(data)
                .meta(meta(requestId))
                .build();
    }

    public static <T> ApiEnvelope<T> ok(T data, Pagination pagination, String requestId) {
        return ApiEnvelope.<T>builder()
                .success(true)
                .data(data)
                .pagination(pagination)
                .meta(meta(requestId))
                .build();
    }

    public static ApiEnvelope<Void> error(ErrorCode code, String message, Map<String, Object> details,
                                          String requestId) {
        return ApiEnvelope.<Void>builder()
                .success(false)
                .error(ApiError.builder()
                        .code(code.name())
                        .message(message)
                        .details(details)
                        .build())
                .meta(meta(requestId))
                .build();
    }

    private static ResponseMeta meta(String requestId) {
        return ResponseMeta.builder()
                .requestId(requestId)
                .generatedAt(Instant.now())
                .build();
    }
}
