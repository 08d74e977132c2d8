package com.insurance.payments.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Read-only projection of the policy administration system. Payments join it by policy number
 * to enrich views; a payment for an unknown policy is still recorded.
 */
@Entity
@Immutable
@Table(name = "policy_lookup_view")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyEntity {

    @Id
    @Column(name = "policy_id")
    private Long policyId;

    @Column(name = "policy_number")
    private String policyNumber;

    @Column(name = "policy_holder_name")
    private String policyHolderName;

    @Column(name = "policy_holder_id_number")
    private String policyHolderIdNumber;

    @Column(name = "insurance_type")
    private String insuranceType;

    @Column(name = "policy_type")
    private String policyType;
}
