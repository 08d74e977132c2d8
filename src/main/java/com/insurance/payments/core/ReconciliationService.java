package com.insurance.payments.core;

import com.insurance.payments.api.ErrorCode;
import com.insurance.payments.api.PaymentException;
import com.insurance.payments.domain.Pagination;
import com.insurance.payments.domain.PaymentView;
import com.insurance.payments.domain.ReconciliationPage;
import com.insurance.payments.persistence.entity.PaymentTransactionEntity;
import com.insurance.payments.persistence.entity.ReceiptEntity;
import com.insurance.payments.persistence.repository.PaymentTransactionRepository;
import com.insurance.payments.persistence.repository.ReceiptRepository;
import com.insurance.payments.persistence.service.PaymentViewMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only report of transactions processed between two calendar dates (UTC, both
 * inclusive), paged and newest first, for settlement reconciliation.
 */
@Slf4j
@Service
public class ReconciliationService {

    private final PaymentTransactionRepository transactionRepository;
    private final ReceiptRepository receiptRepository;
    private final int maxPageSize;
    private final int maxRangeDays;

    public ReconciliationService(PaymentTransactionRepository transactionRepository,
                                 ReceiptRepository receiptRepository,
                                 @Value("${payment.reconciliation.max-page-size:500}") int maxPageSize,
                                 @Value("${payment.reconciliation.max-range-days:31}") int maxRangeDays) {
        this.transactionRepository = transactionRepository;
        this.receiptRepository = receiptRepository;
        this.maxPageSize = maxPageSize;
        this.maxRangeDays = maxRangeDays;
    }

    /**
     * @param page     one-based; null means the first page
     * @param pageSize null means the maximum; out-of-range values are clamped
     */
    @Transactional(readOnly = true)
    public ReconciliationPage listForReconciliation(String from, String to, Integer page, Integer pageSize) {
        LocalDate fromDate = parseDate(from, "from");
        LocalDate toDate = parseDate(to, "to");
        if (fromDate.isAfter(toDate)) {
            throw new PaymentException(ErrorCode.INVALID_FIELD_VALUE, "from must not be after to");
        }
        if (ChronoUnit.DAYS.between(fromDate, toDate) > maxRangeDays) {
            throw new PaymentException(ErrorCode.INVALID_FIELD_VALUE,
                    "Date range must not exceed " + maxRangeDays + " days");
        }
        int pageNumber = page != null ? page : 1;
        if (pageNumber < 1) {
            throw new PaymentException(ErrorCode.INVALID_FIELD_VALUE, "page must be 1 or greater");
        }
        int size = pageSize == null ? maxPageSize : Math.max(1, Math.min(pageSize, maxPageSize));

        Instant start = fromDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = toDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        try {
            Page<PaymentTransactionEntity> rows = transactionRepository.findProcessedBetween(
                    start, end, PageRequest.of(pageNumber - 1, size));
            Map<Long, ReceiptEntity> receipts = rows.isEmpty() ? Map.of()
                    : receiptRepository.findByPaymentTransactionIdIn(
                                    rows.stream().map(PaymentTransactionEntity::getId).toList())
                            .stream()
                            .collect(Collectors.toMap(ReceiptEntity::getPaymentTransactionId, Function.identity()));

            List<PaymentView> payments = rows.stream()
                    .map(txn -> PaymentViewMapper.toView(txn, receipts.get(txn.getId()), null))
                    .toList();
            log.debug("Reconciliation page: from={}, to={}, page={}, size={}, total={}",
                    fromDate, toDate, pageNumber, size, rows.getTotalElements());
            return ReconciliationPage.builder()
                    .payments(payments)
                    .pagination(Pagination.of(pageNumber, size, rows.getTotalElements()))
                    .build();
        } catch (DataAccessException e) {
            log.error("Reconciliation query failed: from={}, to={}", fromDate, toDate, e);
            throw new PaymentException(ErrorCode.PERSISTENCE_ERROR, "Payment store is unavailable", e);
        }
    }

    private static LocalDate parseDate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PaymentException(ErrorCode.MISSING_REQUIRED_FIELD, field + " is required");
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new PaymentException(ErrorCode.INVALID_DATE_FORMAT,
                    field + " must be a date in yyyy-MM-dd format");
        }
    }
}
