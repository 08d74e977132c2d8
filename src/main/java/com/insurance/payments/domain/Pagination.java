package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One-based page metadata for list responses.
 */
@Value
@Builder
public class Pagination {

    int page;
    int pageSize;
    long total;
    int totalPages;
    boolean hasNext;
    boolean hasPrevious;

    public static Pagination of(int page, int pageSize, long total) {
        int totalPages = (int) ((total + pageSize - 1) / pageSize);
        return Pagination.builder()
                .page(page)
                .pageSize(pageSize)
                .total(total)
                .totalPages(totalPages)
                .hasNext(page < totalPages)
                .hasPrevious(page > 1)
                .build();
    }
}
