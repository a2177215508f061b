package com.stationery.tracker.controller;

import com.stationery.tracker.dto.CategoryRequest;
import com.stationery.tracker.model.Category;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.ReferenceDataService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/categories")
public class CategoryController {

    private final ReferenceDataService referenceDataService;

    public CategoryController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @GetMapping
    public List<Category> list() {
        return referenceDataService.listCategories();
    }

    @PostMapping
    public ResponseEntity<Category> create(@Valid @RequestBody CategoryRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(referenceDataService.saveCategory(null, request, actor));
    }

    @PutMapping("/{id}")
    public Category update(@PathVariable Long id, @Valid @RequestBody CategoryRequest request, Actor actor) {
        return referenceDataService.saveCategory(id, request, actor);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        referenceDataService.deleteCategory(id, actor);
        return ResponseEntity.noContent().build();
    }
}
