package com.insurance.payments.persistence.entity;

import com.insurance.payments.domain.GatewayResponse;
import com.insurance.payments.domain.PaymentStatus;
import com.insurance.payments.domain.ReconciliationStatus;
import com.insurance.payments.persistence.converter.GatewayResponseConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A policy payment as recorded by the gateway. The external reference is the caller's
 * idempotency key and is never rewritten after insert.
 */
@Entity
@Table(name = "payment_transactions", indexes = {
    @Index(name = "idx_payment_policy_number", columnList = "policy_number"),
    @Index(name = "idx_payment_processed_at", columnList = "processed_at"),
    @Index(name = "idx_payment_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_reference", unique = true, nullable = false, updatable = false)
    private String externalReference;

    @Column(name = "txn_reference", unique = true, nullable = false, updatable = false)
    private String txnReference;

    @Column(name = "gateway_reference")
    private String gatewayReference;

    @Column(name = "policy_id")
    private Long policyId;

    @Column(name = "policy_number", nullable = false)
    private String policyNumber;

    @Column(name = "policy_holder_id", nullable = false)
    private String policyHolderId;

    @Column(name = "insurance_type")
    private String insuranceType;

    @Column(name = "policy_type")
    private String policyType;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "payment_method", nullable = false)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @Embedded
    private CustomerDetails customer;

    @Column(name = "return_url", length = 1000)
    private String returnUrl;

    @Column(name = "callback_url", length = 1000)
    private String callbackUrl;

    @Convert(converter = GatewayResponseConverter.class)
    @Column(name = "gateway_response", columnDefinition = "text")
    private GatewayResponse gatewayResponse;

    @Enumerated(EnumType.STRING)
    @Column(name = "reconciliation_status", nullable = false, length = 16)
    private ReconciliationStatus reconciliationStatus;

    @Column(name = "reconciliation_date")
    private Instant reconciliationDate;

    @Column(name = "client_id")
    private String clientId;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (processedAt == null) {
            processedAt = createdAt;
        }
        if (status == null) {
            status = PaymentStatus.PENDING;
        }
        if (reconciliationStatus == null) {
            reconciliationStatus = ReconciliationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
