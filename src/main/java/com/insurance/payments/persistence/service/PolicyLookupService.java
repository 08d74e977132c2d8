package com.insurance.payments.persistence.service;

import com.insurance.payments.persistence.entity.PolicyEntity;
import com.insurance.payments.persistence.repository.PolicyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Best-effort lookup in the policy view. Runs outside any caller transaction so a failing
 * lookup cannot mark a payment write for rollback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyLookupService {

    private final PolicyRepository policyRepository;

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Optional<PolicyEntity> findByPolicyNumber(String policyNumber) {
        if (policyNumber == null || policyNumber.isBlank()) {
            return Optional.empty();
        }
        try {
            return policyRepository.findFirstByPolicyNumber(policyNumber);
        } catch (DataAccessException e) {
            log.warn("Policy lookup failed for policyNumber={}, continuing without policy context: {}",
                    policyNumber, e.getMessage());
            return Optional.empty();
        }
    }
}
