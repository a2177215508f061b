package com.stationery.tracker.dto;

import java.math.BigDecimal;
import java.util.List;

public record DebtListing(
        List<DebtResponse> debts,
        int page,
        int totalPages,
        long totalElements,
        BigDecimal totalAmount,
        BigDecimal totalPaid,
        BigDecimal totalRemaining) {
}
