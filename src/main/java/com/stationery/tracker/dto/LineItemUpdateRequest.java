package com.stationery.tracker.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

import java.math.BigDecimal;

public record LineItemUpdateRequest(@Min(1) int quantity, @DecimalMin("0.00") BigDecimal unitPrice) {
}
