package com.stationery.tracker.service;

import com.stationery.tracker.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ProfitCalculatorTest {

    private final ProfitCalculator calculator = new ProfitCalculator();

    private Item pen;
    private Product paperCarton;

    @BeforeEach
    void setUp() {
        pen = new Item();
        pen.setId(1L);
        pen.setName("Blue Pen");
        pen.setUnitPrice(new BigDecimal("1000"));
        pen.setCostPrice(new BigDecimal("600"));

        paperCarton = new Product();
        paperCarton.setId(2L);
        paperCarton.setName("A4 Paper");
        paperCarton.setSupplierPrice(new BigDecimal("15000"));
        paperCarton.setSellingPrice(new BigDecimal("20000"));
        paperCarton.setUnitsPerCarton(5);
    }

    private static <T extends SaleLineItem> T line(T line, int quantity, String unitPrice) {
        line.setQuantity(quantity);
        line.setUnitPrice(new BigDecimal(unitPrice));
        line.refreshTotal();
        return line;
    }

    private Sale saleOf(SaleLineItem... lines) {
        Sale sale = new Sale();
        BigDecimal total = BigDecimal.ZERO;
        for (SaleLineItem l : lines) {
            l.setSale(sale);
            sale.getItems().add(l);
            total = total.add(l.getTotalPrice());
        }
        sale.setTotalAmount(total);
        return sale;
    }

    @Test
    void normalSale_ShouldSubtractRetailCostOnly() {
        Sale sale = saleOf(line(new RetailLineItem(pen), 3, "1000"),
                line(new WholesaleLineItem(paperCarton), 2, "20000"));

        // 43000 - 3 x 600; wholesale lines carry no cost
        assertEquals(0, new BigDecimal("41200").compareTo(calculator.profitOf(sale)));
    }

    @Test
    void paymentSale_ShouldTakeShareOfOriginatingSaleProfit() {
        Sale origin = saleOf(line(new RetailLineItem(pen), 10, "1000"));

        Debt debt = new Debt();
        debt.setAmount(new BigDecimal("10000"));
        debt.setSale(origin);
        debt.setItem(pen);
        debt.setQuantity(10);

        Sale payment = new Sale();
        payment.setKind(SaleKind.PAYMENT_RECORD);
        payment.setPaymentForDebt(debt);
        payment.setTotalAmount(new BigDecimal("2500"));

        // Origin profit 4000, a quarter of it paid
        assertEquals(new BigDecimal("1000.00"), calculator.profitOf(payment));
    }

    @Test
    void paymentSale_WithoutOrigin_ShouldUseDebtItemCost() {
        Debt debt = new Debt();
        debt.setAmount(new BigDecimal("10000"));
        debt.setItem(pen);
        debt.setQuantity(10);

        Sale payment = new Sale();
        payment.setKind(SaleKind.PAYMENT_RECORD);
        payment.setPaymentForDebt(debt);
        payment.setTotalAmount(new BigDecimal("5000"));

        assertEquals(new BigDecimal("2000.00"), calculator.profitOf(payment));
    }

    @Test
    void paymentSale_WithZeroDebtAmount_ShouldHaveNoProfit() {
        Debt debt = new Debt();
        debt.setAmount(BigDecimal.ZERO);
        debt.setItem(pen);

        Sale payment = new Sale();
        payment.setKind(SaleKind.PAYMENT_RECORD);
        payment.setPaymentForDebt(debt);
        payment.setTotalAmount(new BigDecimal("5000"));

        assertEquals(0, BigDecimal.ZERO.compareTo(calculator.profitOf(payment)));
    }
}
