package com.stationery.tracker.controller;

import com.stationery.tracker.dto.CustomerRequest;
import com.stationery.tracker.model.Customer;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.ReferenceDataService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/customers")
public class CustomerController {

    private final ReferenceDataService referenceDataService;

    public CustomerController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @GetMapping
    public List<Customer> list(@RequestParam(required = false) String search) {
        return referenceDataService.listCustomers(search);
    }

    @GetMapping("/{id}")
    public Customer get(@PathVariable Long id) {
        return referenceDataService.getCustomer(id);
    }

    @PostMapping
    public ResponseEntity<Customer> create(@Valid @RequestBody CustomerRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(referenceDataService.saveCustomer(null, request, actor));
    }

    @PutMapping("/{id}")
    public Customer update(@PathVariable Long id, @Valid @RequestBody CustomerRequest request, Actor actor) {
        return referenceDataService.saveCustomer(id, request, actor);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        referenceDataService.deleteCustomer(id, actor);
        return ResponseEntity.noContent().build();
    }
}
