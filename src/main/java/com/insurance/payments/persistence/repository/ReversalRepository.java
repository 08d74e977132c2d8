package com.insurance.payments.persistence.repository;

import com.insurance.payments.persistence.entity.ReversalEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for payment reversals.
 */
@Repository
public interface ReversalRepository extends JpaRepository<ReversalEntity, Long> {

    Optional<ReversalEntity> findByReversalReference(String reversalReference);

    boolean existsByReversalReference(String reversalReference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReversalEntity r WHERE r.reversalReference = :reversalReference")
    Optional<ReversalEntity> findByReversalReferenceForUpdate(@Param("reversalReference") String reversalReference);
}
