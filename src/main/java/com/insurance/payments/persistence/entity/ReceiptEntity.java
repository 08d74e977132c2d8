package com.insurance.payments.persistence.entity;

import com.insurance.payments.domain.ReceiptStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Receipt issued for a payment. The unique constraint on the owning transaction id allows one
 * receipt per payment.
 */
@Entity
@Table(name = "payment_receipts", indexes = {
    @Index(name = "idx_receipt_policy_id", columnList = "policy_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "receipt_number", unique = true, nullable = false, updatable = false)
    private String receiptNumber;

    @Column(name = "payment_transaction_id", unique = true, nullable = false, updatable = false)
    private Long paymentTransactionId;

    @Column(name = "policy_id")
    private Long policyId;

    @Column(name = "allocated_at")
    private Instant allocatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReceiptStatus status;

    @Column(name = "reversal_reason", length = 1000)
    private String reversalReason;

    @Column(name = "reversed_at")
    private Instant reversedAt;

    @Column(name = "reversed_by")
    private String reversedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
