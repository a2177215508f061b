package com.stationery.tracker.dto;

import com.stationery.tracker.model.LineItemType;
import com.stationery.tracker.model.SaleLineItem;

import java.math.BigDecimal;

public record LineItemResponse(
        Long id,
        LineItemType type,
        Long stockId,
        String name,
        String sku,
        int quantity,
        String unit,
        BigDecimal unitPrice,
        BigDecimal totalPrice) {

    public static LineItemResponse from(SaleLineItem line) {
        return new LineItemResponse(
                line.getId(),
                line.getType(),
                line.getStocked().getId(),
                line.getStocked().getName(),
                line.getStocked().getSku(),
                line.getQuantity(),
                line.getStocked().stockUnit(),
                line.getUnitPrice(),
                line.getTotalPrice());
    }
}
