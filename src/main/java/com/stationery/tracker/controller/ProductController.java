package com.stationery.tracker.controller;

import com.stationery.tracker.dto.ProductRequest;
import com.stationery.tracker.dto.StockAdjustmentRequest;
import com.stationery.tracker.model.Product;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.InventoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final InventoryService inventoryService;

    public ProductController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    @GetMapping
    public List<Product> list() {
        return inventoryService.listProducts();
    }

    @GetMapping("/{id}")
    public Product get(@PathVariable Long id) {
        return inventoryService.getProduct(id);
    }

    @PostMapping
    public ResponseEntity<Product> create(@Valid @RequestBody ProductRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryService.createProduct(request, actor));
    }

    @PutMapping("/{id}")
    public Product update(@PathVariable Long id, @Valid @RequestBody ProductRequest request, Actor actor) {
        return inventoryService.updateProduct(id, request, actor);
    }

    @PostMapping("/{id}/cartons")
    public Product adjustCartons(@PathVariable Long id, @Valid @RequestBody StockAdjustmentRequest request,
            Actor actor) {
        return inventoryService.adjustProductCartons(id, request.delta(), request.reason(), actor);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        inventoryService.deleteProduct(id, actor);
        return ResponseEntity.noContent().build();
    }
}
