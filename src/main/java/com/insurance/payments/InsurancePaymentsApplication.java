package com.insurance.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the insurance payment gateway:
 * <ul>
 *   <li>Idempotent payment recording with receipt issuance</li>
 *   <li>Request-then-approve reversals</li>
 *   <li>Callback webhooks and Kafka audit events</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class InsurancePaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsurancePaymentsApplication.class, args);
    }
}
