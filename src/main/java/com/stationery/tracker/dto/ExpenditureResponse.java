package com.stationery.tracker.dto;

import com.stationery.tracker.model.Expenditure;
import com.stationery.tracker.model.ExpenditureCategory;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExpenditureResponse(
        Long id,
        ExpenditureCategory category,
        String categoryLabel,
        String description,
        BigDecimal amount,
        LocalDate expenseDate,
        String createdBy) {

    public static ExpenditureResponse from(Expenditure expenditure) {
        return new ExpenditureResponse(
                expenditure.getId(),
                expenditure.getCategory(),
                expenditure.getCategory().getLabel(),
                expenditure.getDescription(),
                expenditure.getAmount(),
                expenditure.getExpenseDate(),
                expenditure.getCreatedBy() != null ? expenditure.getCreatedBy().getUsername() : null);
    }
}
