package com.stationery.tracker.dto;

import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record DebtResponse(
        Long id,
        Long customerId,
        String customerName,
        String customerPhone,
        Long saleId,
        Long itemId,
        String itemName,
        int quantity,
        BigDecimal amount,
        BigDecimal paidAmount,
        BigDecimal remainingAmount,
        LocalDate dueDate,
        DebtStatus status,
        boolean overdue,
        boolean autoCreated,
        String description,
        LocalDateTime createdAt) {

    public static DebtResponse from(Debt debt, LocalDate today) {
        return new DebtResponse(
                debt.getId(),
                debt.getCustomer().getId(),
                debt.getCustomer().getName(),
                debt.getCustomer().getPhone(),
                debt.getSale() != null ? debt.getSale().getId() : null,
                debt.getItem().getId(),
                debt.getItem().getName(),
                debt.getQuantity(),
                debt.getAmount(),
                debt.getPaidAmount(),
                debt.getRemainingAmount(),
                debt.getDueDate(),
                debt.effectiveStatus(today),
                debt.isOverdue(today),
                debt.isAutoCreated(),
                debt.getDescription(),
                debt.getCreatedAt());
    }
}
