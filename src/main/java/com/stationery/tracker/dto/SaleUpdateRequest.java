package com.stationery.tracker.dto;

import com.stationery.tracker.model.PaymentMethod;

public record SaleUpdateRequest(
        Long customerId,
        PaymentMethod paymentMethod,
        Boolean paid,
        String notes) {
}
