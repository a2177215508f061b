package com.stationery.tracker.model;

import java.math.BigDecimal;

public enum DebtStatus {
    PENDING,
    PARTIAL,
    PAID,
    OVERDUE; // Never stored, derived from the due date

    public static DebtStatus fromPaidAmount(BigDecimal paidAmount, BigDecimal amount) {
        if (paidAmount.compareTo(amount) >= 0) {
            return PAID;
        }
        if (paidAmount.compareTo(BigDecimal.ZERO) > 0) {
            return PARTIAL;
        }
        return PENDING;
    }
}
