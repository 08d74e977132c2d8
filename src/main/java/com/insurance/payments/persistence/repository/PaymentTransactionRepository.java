package com.insurance.payments.persistence.repository;

import com.insurance.payments.persistence.entity.PaymentTransactionEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for payment transactions.
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransactionEntity, Long> {

    Optional<PaymentTransactionEntity> findByExternalReference(String externalReference);

    Optional<PaymentTransactionEntity> findByTxnReference(String txnReference);

    boolean existsByExternalReference(String externalReference);

    /** Row-locks the transaction until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentTransactionEntity p WHERE p.externalReference = :externalReference")
    Optional<PaymentTransactionEntity> findByExternalReferenceForUpdate(@Param("externalReference") String externalReference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentTransactionEntity p WHERE p.txnReference = :txnReference")
    Optional<PaymentTransactionEntity> findByTxnReferenceForUpdate(@Param("txnReference") String txnReference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentTransactionEntity p WHERE p.id = :id")
    Optional<PaymentTransactionEntity> findByIdForUpdate(@Param("id") Long id);

    /** Transactions processed in {@code [from, to)}, newest first. */
    @Query(value = "SELECT p FROM PaymentTransactionEntity p WHERE p.processedAt >= :from AND p.processedAt < :to ORDER BY p.processedAt DESC, p.id DESC",
            countQuery = "SELECT COUNT(p) FROM PaymentTransactionEntity p WHERE p.processedAt >= :from AND p.processedAt < :to")
    Page<PaymentTransactionEntity> findProcessedBetween(@Param("from") Instant from,
                                                       @Param("to") Instant to,
                                                       Pageable pageable);
}
