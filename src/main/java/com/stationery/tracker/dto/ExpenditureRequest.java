package com.stationery.tracker.dto;

import com.stationery.tracker.model.ExpenditureCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExpenditureRequest(
        @NotNull ExpenditureCategory category,
        @NotBlank @Size(max = 500) String description,
        @NotNull @DecimalMin("0.01") BigDecimal amount,
        LocalDate expenseDate) { // null = today
}
