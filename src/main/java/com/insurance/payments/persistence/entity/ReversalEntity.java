package com.insurance.payments.persistence.entity;

import com.insurance.payments.domain.ReversalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Reversal of a completed payment, created pending and completed by an explicit approval.
 */
@Entity
@Table(name = "payment_reversals", indexes = {
    @Index(name = "idx_reversal_original_payment", columnList = "original_payment_id"),
    @Index(name = "idx_reversal_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReversalEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reversal_reference", unique = true, nullable = false, updatable = false)
    private String reversalReference;

    @Column(name = "original_payment_id", nullable = false, updatable = false)
    private Long originalPaymentId;

    @Column(name = "original_external_reference", nullable = false, updatable = false)
    private String originalExternalReference;

    @Column(name = "receipt_number")
    private String receiptNumber;

    @Column(name = "reason", nullable = false, length = 1000)
    private String reason;

    @Column(name = "initiated_by", nullable = false)
    private String initiatedBy;

    @Column(name = "reversal_amount", precision = 19, scale = 2)
    private BigDecimal reversalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReversalStatus status;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (requestedAt == null) {
            requestedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
