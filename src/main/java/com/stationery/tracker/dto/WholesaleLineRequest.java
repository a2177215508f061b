package com.stationery.tracker.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record WholesaleLineRequest(
        @NotNull Long productId,
        @Min(1) int quantity,
        @DecimalMin("0.00") BigDecimal unitPrice) implements LineItemRequest {
}
