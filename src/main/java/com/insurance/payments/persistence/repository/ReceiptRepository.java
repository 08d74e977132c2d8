package com.insurance.payments.persistence.repository;

import com.insurance.payments.persistence.entity.ReceiptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReceiptRepository extends JpaRepository<ReceiptEntity, Long> {

    Optional<ReceiptEntity> findByReceiptNumber(String receiptNumber);

    Optional<ReceiptEntity> findByPaymentTransactionId(Long paymentTransactionId);

    Optional<ReceiptEntity> findByReceiptNumberAndPaymentTransactionId(String receiptNumber, Long paymentTransactionId);

    List<ReceiptEntity> findByPaymentTransactionIdIn(Collection<Long> paymentTransactionIds);
}
