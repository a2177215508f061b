package com.stationery.tracker.controller;

import com.stationery.tracker.dto.ExpenditureRequest;
import com.stationery.tracker.dto.ExpenditureResponse;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.ExpenditureService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/expenditures")
public class ExpenditureController {

    private final ExpenditureService expenditureService;

    public ExpenditureController(ExpenditureService expenditureService) {
        this.expenditureService = expenditureService;
    }

    @GetMapping
    public List<ExpenditureResponse> list(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return expenditureService.listExpenditures(from, to).stream()
                .map(ExpenditureResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ExpenditureResponse get(@PathVariable Long id) {
        return ExpenditureResponse.from(expenditureService.getExpenditure(id));
    }

    @PostMapping
    public ResponseEntity<ExpenditureResponse> create(@Valid @RequestBody ExpenditureRequest request, Actor actor) {
        Long id = expenditureService.createExpenditure(request, actor).getId();
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenditureResponse.from(expenditureService.getExpenditure(id)));
    }

    @PutMapping("/{id}")
    public ExpenditureResponse update(@PathVariable Long id, @Valid @RequestBody ExpenditureRequest request,
            Actor actor) {
        return ExpenditureResponse.from(expenditureService.updateExpenditure(id, request, actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        expenditureService.deleteExpenditure(id, actor);
        return ResponseEntity.noContent().build();
    }
}
