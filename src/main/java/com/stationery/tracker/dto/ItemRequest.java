package com.stationery.tracker.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record ItemRequest(
        @NotBlank @Size(max = 200) String name,
        String description,
        Long categoryId,
        @Size(max = 50) String sku, // blank = generate
        @NotNull @DecimalMin("0.01") BigDecimal unitPrice,
        @NotNull @DecimalMin("0.01") BigDecimal costPrice,
        @Min(0) int stockQuantity,
        @Min(0) Integer minimumStock,
        String supplierName,
        Boolean active) {
}
