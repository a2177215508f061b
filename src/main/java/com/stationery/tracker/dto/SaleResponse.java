package com.stationery.tracker.dto;

import com.stationery.tracker.model.PaymentMethod;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.model.SaleKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public record SaleResponse(
        Long id,
        Instant saleDate,
        Long customerId,
        String customerName,
        BigDecimal totalAmount,
        PaymentMethod paymentMethod,
        boolean paid,
        String notes,
        SaleKind kind,
        Long paymentForDebtId,
        String createdBy,
        List<LineItemResponse> items,
        BigDecimal profit) {

    public static SaleResponse from(Sale sale, BigDecimal profit) {
        return new SaleResponse(
                sale.getId(),
                sale.getSaleDate(),
                sale.getCustomer() != null ? sale.getCustomer().getId() : null,
                sale.getCustomerName(),
                sale.getTotalAmount(),
                sale.getPaymentMethod(),
                sale.isPaid(),
                sale.getNotes(),
                sale.getKind(),
                sale.getPaymentForDebt() != null ? sale.getPaymentForDebt().getId() : null,
                sale.getCreatedBy() != null ? sale.getCreatedBy().getUsername() : null,
                sale.getItems().stream().map(LineItemResponse::from).collect(Collectors.toList()),
                profit);
    }
}
