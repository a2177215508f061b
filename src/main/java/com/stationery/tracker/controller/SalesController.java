package com.stationery.tracker.controller;

import com.stationery.tracker.dto.LineItemRequest;
import com.stationery.tracker.dto.LineItemUpdateRequest;
import com.stationery.tracker.dto.RestoredStock;
import com.stationery.tracker.dto.SaleDeletionResult;
import com.stationery.tracker.dto.SaleFilter;
import com.stationery.tracker.dto.SaleIdsRequest;
import com.stationery.tracker.dto.SaleRequest;
import com.stationery.tracker.dto.SaleResponse;
import com.stationery.tracker.dto.SaleUpdateRequest;
import com.stationery.tracker.dto.SalesListing;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.SalesService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/sales")
public class SalesController {

    private static final Logger logger = LoggerFactory.getLogger(SalesController.class);

    private final SalesService salesService;

    public SalesController(SalesService salesService) {
        this.salesService = salesService;
    }

    @GetMapping
    public SalesListing list(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "paid") String status,
            @RequestParam(required = false) String product,
            @RequestParam(defaultValue = "0") int page) {
        return salesService.listSales(new SaleFilter(from, to, status, product, page));
    }

    @GetMapping("/{id}")
    public SaleResponse get(@PathVariable Long id) {
        return salesService.toResponse(salesService.getSale(id));
    }

    @PostMapping
    public ResponseEntity<SaleResponse> create(@Valid @RequestBody SaleRequest request, Actor actor) {
        Long saleId = salesService.createSale(request, actor).getId();
        return ResponseEntity.status(HttpStatus.CREATED).body(reload(saleId));
    }

    @PutMapping("/{id}")
    public SaleResponse update(@PathVariable Long id, @Valid @RequestBody SaleUpdateRequest request, Actor actor) {
        salesService.updateSale(id, request, actor);
        return reload(id);
    }

    @PostMapping("/{id}/items")
    public SaleResponse addItem(@PathVariable Long id, @Valid @RequestBody LineItemRequest request, Actor actor) {
        salesService.addLineItem(id, request, actor);
        return reload(id);
    }

    @PutMapping("/{id}/items/{lineId}")
    public SaleResponse updateItem(@PathVariable Long id, @PathVariable Long lineId,
            @Valid @RequestBody LineItemUpdateRequest request, Actor actor) {
        salesService.updateLineItem(id, lineId, request, actor);
        return reload(id);
    }

    @DeleteMapping("/{id}/items/{lineId}")
    public SaleResponse removeItem(@PathVariable Long id, @PathVariable Long lineId, Actor actor) {
        salesService.removeLineItem(id, lineId, actor);
        return reload(id);
    }

    @DeleteMapping("/{id}/items")
    public List<RestoredStock> clearItems(@PathVariable Long id, Actor actor) {
        return salesService.clearLineItems(id, actor);
    }

    @DeleteMapping("/{id}")
    public SaleDeletionResult delete(@PathVariable Long id, Actor actor) {
        SaleDeletionResult result = salesService.deleteSale(id, actor);
        logger.debug(result.summary());
        return result;
    }

    @PostMapping("/bulk-delete")
    public SaleDeletionResult bulkDelete(@Valid @RequestBody SaleIdsRequest request, Actor actor) {
        return salesService.deleteSales(request.saleIds(), actor);
    }

    // Fresh read after the mutating transaction has committed
    private SaleResponse reload(Long saleId) {
        return salesService.toResponse(salesService.getSale(saleId));
    }
}
