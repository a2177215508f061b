package com.stationery.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {
    private BigDecimal todaySales;
    private long todaySalesCount;
    private BigDecimal todayExpenditure;
    private BigDecimal todayNet;

    private BigDecimal monthSales;
    private long monthSalesCount;
    private BigDecimal monthExpenditure;
    private BigDecimal monthNet;

    private BigDecimal outstandingDebt;
    private List<DebtResponse> overdueDebts;
    private List<LowStockEntry> lowStock;
    private List<SaleResponse> recentSales;
}
