package com.stationery.tracker.service;

import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.model.SaleLineItem;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Profit of a sale.
 * <p>
 * Normal sales: total minus the cost of their retail lines (wholesale lines carry no cost).
 * Payment-record sales: the share {@code payment / debt amount} of the originating sale's
 * profit, or of {@code debt amount - item cost x quantity} when the debt has no sale.
 */
@Component
public class ProfitCalculator {

    public BigDecimal profitOf(Sale sale) {
        if (sale.isPaymentRecord()) {
            return paymentProfit(sale);
        }
        return lineProfit(sale);
    }

    private BigDecimal lineProfit(Sale sale) {
        BigDecimal cost = BigDecimal.ZERO;
        for (SaleLineItem line : sale.getItems()) {
            BigDecimal unitCost = line.getUnitCost();
            if (unitCost != null) {
                cost = cost.add(unitCost.multiply(BigDecimal.valueOf(line.getQuantity())));
            }
        }
        return sale.getTotalAmount().subtract(cost);
    }

    private BigDecimal paymentProfit(Sale sale) {
        Debt debt = sale.getPaymentForDebt();
        if (debt == null || debt.getAmount() == null || debt.getAmount().signum() <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal originProfit;
        Sale origin = debt.getSale();
        if (origin != null && !origin.isPaymentRecord()) {
            originProfit = lineProfit(origin);
        } else if (debt.getItem() != null && debt.getItem().getCostPrice() != null) {
            originProfit = debt.getAmount().subtract(
                    debt.getItem().getCostPrice().multiply(BigDecimal.valueOf(debt.getQuantity())));
        } else {
            return BigDecimal.ZERO;
        }

        BigDecimal ratio = sale.getTotalAmount().divide(debt.getAmount(), 10, RoundingMode.HALF_UP);
        return originProfit.multiply(ratio).setScale(2, RoundingMode.HALF_UP);
    }
}
