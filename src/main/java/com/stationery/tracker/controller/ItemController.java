package com.stationery.tracker.controller;

import com.stationery.tracker.dto.ItemRequest;
import com.stationery.tracker.dto.StockAdjustmentRequest;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.InventoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/items")
public class ItemController {

    private final InventoryService inventoryService;

    public ItemController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    @GetMapping
    public List<Item> list(@RequestParam(required = false) String search) {
        return inventoryService.listItems(search);
    }

    @GetMapping("/{id}")
    public Item get(@PathVariable Long id) {
        return inventoryService.getItem(id);
    }

    @PostMapping
    public ResponseEntity<Item> create(@Valid @RequestBody ItemRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryService.createItem(request, actor));
    }

    @PutMapping("/{id}")
    public Item update(@PathVariable Long id, @Valid @RequestBody ItemRequest request, Actor actor) {
        return inventoryService.updateItem(id, request, actor);
    }

    @PostMapping("/{id}/stock")
    public Item adjustStock(@PathVariable Long id, @Valid @RequestBody StockAdjustmentRequest request, Actor actor) {
        return inventoryService.adjustItemStock(id, request.delta(), request.reason(), actor);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        inventoryService.deleteItem(id, actor);
        return ResponseEntity.noContent().build();
    }
}
