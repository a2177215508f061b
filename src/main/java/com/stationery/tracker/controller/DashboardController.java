package com.stationery.tracker.controller;

import com.stationery.tracker.dto.DashboardSummary;
import com.stationery.tracker.dto.LowStockEntry;
import com.stationery.tracker.service.DashboardService;
import com.stationery.tracker.service.InventoryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;
    private final InventoryService inventoryService;

    public DashboardController(DashboardService dashboardService, InventoryService inventoryService) {
        this.dashboardService = dashboardService;
        this.inventoryService = inventoryService;
    }

    @GetMapping
    public DashboardSummary summary() {
        return dashboardService.summary();
    }

    @GetMapping("/low-stock")
    public List<LowStockEntry> lowStock() {
        return inventoryService.lowStock();
    }
}
