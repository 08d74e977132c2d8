package com.insurance.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of transactions processed within a reconciliation window.
 */
@Value
@Builder
public class ReconciliationPage {

    List<PaymentView> payments;
    Pagination pagination;
}
