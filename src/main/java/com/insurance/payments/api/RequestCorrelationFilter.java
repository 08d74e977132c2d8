package com.insurance.payments.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insurance.payments.core.ReferenceGenerator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Assigns each request a correlation id and records the calling partner. The id is taken from
 * {@code X-Request-Id} when present, echoed on the response and put in the logging MDC. API
 * requests without the {@code X-Client-Id} identity set by the authentication layer are
 * rejected with 401.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CLIENT_ID_HEADER = "X-Client-Id";
    public static final String REQUEST_ID_ATTRIBUTE = "requestId";
    public static final String CLIENT_ID_ATTRIBUTE = "clientId";

    private final ObjectMapper objectMapper;
    private final boolean requireClientId;

    public RequestCorrelationFilter(ObjectMapper objectMapper,
                                @Value("${payment.security.require-client-id:true}") boolean requireClientId) {
        this.objectMapper = objectMapper;
        this.requireClientId = requireClientId;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = ReferenceGenerator.requestId();
        }
        String clientId = request.getHeader(CLIENT_ID_HEADER);

        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(REQUEST_ID_ATTRIBUTE, requestId);
        try {
            if (clientId != null && !clientId.isBlank()) {
                request.setAttribute(CLIENT_ID_ATTRIBUTE, clientId);
                MDC.put(CLIENT_ID_ATTRIBUTE, clientId);
            } else if (requireClientId && request.getRequestURI().startsWith("/api/")) {
                log.warn("Rejected unauthenticated request: method={}, uri={}", request.getMethod(), request.getRequestURI());
                response.setStatus(ErrorCode.UNAUTHORIZED.getHttpStatus().value());
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                objectMapper.writeValue(response.getOutputStream(),
                        ApiEnvelope.error(ErrorCode.UNAUTHORIZED, "Missing partner identity", null, requestId));
                return;
            }
            chain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_ATTRIBUTE);
            MDC.remove(CLIENT_ID_ATTRIBUTE);
        }
    }
}
