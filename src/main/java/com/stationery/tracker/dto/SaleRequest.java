package com.stationery.tracker.dto;

import com.stationery.tracker.model.PaymentMethod;
import jakarta.validation.Valid;

public record SaleRequest(
        Long customerId,
        PaymentMethod paymentMethod,
        Boolean paid,
        String notes,
        @Valid LineItemRequest firstLine) {
}
