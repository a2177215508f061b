package com.stationery.tracker.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DebtRequest(
        @NotNull Long customerId,
        Long saleId,
        @NotNull Long itemId,
        @Min(1) int quantity,
        @DecimalMin("0.00") BigDecimal amount,
        @NotNull LocalDate dueDate,
        String description) {
}
