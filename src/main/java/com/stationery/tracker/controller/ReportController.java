package com.stationery.tracker.controller;

import com.stationery.tracker.dto.SaleFilter;
import com.stationery.tracker.report.ExportedReport;
import com.stationery.tracker.report.ReportFormat;
import com.stationery.tracker.service.ReportService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/sales")
    public ResponseEntity<byte[]> sales(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "paid") String status,
            @RequestParam(required = false) String product,
            @RequestParam(defaultValue = "CSV") ReportFormat format) {
        return download(reportService.exportSales(new SaleFilter(from, to, status, product, 0), format));
    }

    @GetMapping("/expenditures")
    public ResponseEntity<byte[]> expenditures(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "CSV") ReportFormat format) {
        return download(reportService.exportExpenditures(from, to, format));
    }

    private static ResponseEntity<byte[]> download(ExportedReport report) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(report.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(report.filename()).build().toString())
                .body(report.content());
    }
}
