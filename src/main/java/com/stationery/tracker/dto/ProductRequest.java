package com.stationery.tracker.dto;

import com.stationery.tracker.model.UnitType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record ProductRequest(
        @NotBlank @Size(max = 200) String name,
        String description,
        Long categoryId,
        @Size(max = 50) String sku,
        Long supplierId,
        @NotNull @DecimalMin("0.01") BigDecimal supplierPrice,
        @NotNull @DecimalMin("0.01") BigDecimal sellingPrice,
        @Min(1) int unitsPerCarton,
        BigDecimal cartonWeight,
        UnitType unitType,
        @Min(0) int cartonsInStock,
        @Min(0) Integer minimumCartons,
        String notes,
        Boolean active) {
}
