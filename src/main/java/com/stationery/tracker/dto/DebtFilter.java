package com.stationery.tracker.dto;

import com.stationery.tracker.model.DebtStatus;

public record DebtFilter(DebtStatus status, Long customerId, String search, int page) {

    public static final int PAGE_SIZE = 20;
}
