package com.stationery.tracker.dto;

import com.stationery.tracker.model.Payment;
import com.stationery.tracker.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentResponse(
        Long id,
        Long debtId,
        BigDecimal amount,
        LocalDateTime paymentDate,
        PaymentMethod paymentMethod,
        String notes,
        String recordedBy) {

    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getDebt().getId(),
                payment.getAmount(),
                payment.getPaymentDate(),
                payment.getPaymentMethod(),
                payment.getNotes(),
                payment.getRecordedBy() != null ? payment.getRecordedBy().getUsername() : null);
    }
}
