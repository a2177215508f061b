package com.stationery.tracker.controller;

import com.stationery.tracker.dto.SupplierRequest;
import com.stationery.tracker.model.Supplier;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.ReferenceDataService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/suppliers")
public class SupplierController {

    private final ReferenceDataService referenceDataService;

    public SupplierController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @GetMapping
    public List<Supplier> list() {
        return referenceDataService.listSuppliers();
    }

    @GetMapping("/{id}")
    public Supplier get(@PathVariable Long id) {
        return referenceDataService.getSupplier(id);
    }

    @PostMapping
    public ResponseEntity<Supplier> create(@Valid @RequestBody SupplierRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(referenceDataService.saveSupplier(null, request, actor));
    }

    @PutMapping("/{id}")
    public Supplier update(@PathVariable Long id, @Valid @RequestBody SupplierRequest request, Actor actor) {
        return referenceDataService.saveSupplier(id, request, actor);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        referenceDataService.deleteSupplier(id, actor);
        return ResponseEntity.noContent().build();
    }
}
