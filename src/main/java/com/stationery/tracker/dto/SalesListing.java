package com.stationery.tracker.dto;

import java.math.BigDecimal;
import java.util.List;

public record SalesListing(
        List<SaleResponse> sales,
        int page,
        int totalPages,
        long totalElements,
        BigDecimal totalAmount,
        BigDecimal totalProfit,
        BigDecimal totalExpenditure) {
}
