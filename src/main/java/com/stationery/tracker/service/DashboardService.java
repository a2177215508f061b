package com.stationery.tracker.service;

import com.stationery.tracker.config.TrackerProperties;
import com.stationery.tracker.dto.DashboardSummary;
import com.stationery.tracker.dto.DebtResponse;
import com.stationery.tracker.model.DebtStatus;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.ExpenditureRepository;
import com.stationery.tracker.repository.SaleRepository;
import com.stationery.tracker.repository.SaleSpecifications;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class DashboardService {

    private static final int RECENT_SALES = 10;

    private final SaleRepository saleRepository;
    private final ExpenditureRepository expenditureRepository;
    private final DebtRepository debtRepository;
    private final InventoryService inventoryService;
    private final SalesService salesService;
    private final TrackerProperties properties;
    private final Clock clock;

    public DashboardService(SaleRepository saleRepository, ExpenditureRepository expenditureRepository,
            DebtRepository debtRepository, InventoryService inventoryService, SalesService salesService,
            TrackerProperties properties, Clock clock) {
        this.saleRepository = saleRepository;
        this.expenditureRepository = expenditureRepository;
        this.debtRepository = debtRepository;
        this.inventoryService = inventoryService;
        this.salesService = salesService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DashboardSummary summary() {
        ZoneId zone = properties.getTimeZone();
        LocalDate today = LocalDate.now(clock);
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate nextMonth = monthStart.plusMonths(1);

        Instant dayFrom = today.atStartOfDay(zone).toInstant();
        Instant dayTo = today.plusDays(1).atStartOfDay(zone).toInstant();
        Instant monthFrom = monthStart.atStartOfDay(zone).toInstant();
        Instant monthTo = nextMonth.atStartOfDay(zone).toInstant();

        BigDecimal todaySales = saleRepository.sumPaidBetween(dayFrom, dayTo);
        BigDecimal todayExpenditure = expenditureRepository.sumBetween(today, today);
        BigDecimal monthSales = saleRepository.sumPaidBetween(monthFrom, monthTo);
        BigDecimal monthExpenditure = expenditureRepository.sumBetween(monthStart, nextMonth.minusDays(1));

        List<DebtResponse> overdue = debtRepository.findOverdue(today, DebtStatus.PAID).stream()
                .map(debt -> DebtResponse.from(debt, today))
                .collect(Collectors.toList());

        Specification<Sale> recent = Specification.where(SaleSpecifications.paid(Boolean.TRUE))
                .and(SaleSpecifications.hasLines());
        List<Sale> recentSales = saleRepository.findAll(recent,
                PageRequest.of(0, RECENT_SALES, Sort.by(Sort.Direction.DESC, "saleDate"))).getContent();

        return DashboardSummary.builder()
                .todaySales(todaySales)
                .todaySalesCount(saleRepository.countPaidBetween(dayFrom, dayTo))
                .todayExpenditure(todayExpenditure)
                .todayNet(todaySales.subtract(todayExpenditure))
                .monthSales(monthSales)
                .monthSalesCount(saleRepository.countPaidBetween(monthFrom, monthTo))
                .monthExpenditure(monthExpenditure)
                .monthNet(monthSales.subtract(monthExpenditure))
                .outstandingDebt(debtRepository.sumOutstanding(DebtStatus.PAID))
                .overdueDebts(overdue)
                .lowStock(inventoryService.lowStock())
                .recentSales(recentSales.stream().map(salesService::toResponse).collect(Collectors.toList()))
                .build();
    }
}
