package com.stationery.tracker.dto;

import com.stationery.tracker.model.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record PaymentRequest(
        @NotNull @DecimalMin("0.01") BigDecimal amount,
        PaymentMethod paymentMethod,
        String notes) {
}
