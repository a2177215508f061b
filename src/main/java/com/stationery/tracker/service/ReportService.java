package com.stationery.tracker.service;

import com.stationery.tracker.config.TrackerProperties;
import com.stationery.tracker.dto.SaleFilter;
import com.stationery.tracker.exception.ReportUnavailableException;
import com.stationery.tracker.model.Expenditure;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.report.CsvReportWriter;
import com.stationery.tracker.report.ExportedReport;
import com.stationery.tracker.report.PdfReportRenderer;
import com.stationery.tracker.report.ReportColumn;
import com.stationery.tracker.report.ReportFormat;
import com.stationery.tracker.report.ReportTable;
import com.stationery.tracker.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

@Service
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private static final DateTimeFormatter SALE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<ReportColumn> SALE_COLUMNS = List.of(
            ReportColumn.text("Sale ID"),
            ReportColumn.text("Date"),
            ReportColumn.text("Customer"),
            ReportColumn.number("Amount"),
            ReportColumn.number("Profit"),
            ReportColumn.text("Payment Method"),
            ReportColumn.text("Status"),
            ReportColumn.text("Created By"));

    private static final List<ReportColumn> EXPENDITURE_COLUMNS = List.of(
            ReportColumn.text("ID"),
            ReportColumn.text("Category"),
            ReportColumn.text("Description"),
            ReportColumn.text("Date"),
            ReportColumn.number("Amount"),
            ReportColumn.text("Created By"));

    private final SalesService salesService;
    private final ExpenditureService expenditureService;
    private final ProfitCalculator profitCalculator;
    private final SettingsService settingsService;
    private final CsvReportWriter csvWriter;
    private final ObjectProvider<PdfReportRenderer> pdfRenderer;
    private final TrackerProperties properties;

    public ReportService(SalesService salesService, ExpenditureService expenditureService,
            ProfitCalculator profitCalculator, SettingsService settingsService, CsvReportWriter csvWriter,
            ObjectProvider<PdfReportRenderer> pdfRenderer, TrackerProperties properties) {
        this.salesService = salesService;
        this.expenditureService = expenditureService;
        this.profitCalculator = profitCalculator;
        this.settingsService = settingsService;
        this.csvWriter = csvWriter;
        this.pdfRenderer = pdfRenderer;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public ExportedReport exportSales(SaleFilter filter, ReportFormat format) {
        List<List<String>> rows = new ArrayList<>();
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal totalProfit = BigDecimal.ZERO;

        for (Sale sale : salesService.findSales(filter)) {
            BigDecimal profit = profitCalculator.profitOf(sale);
            totalAmount = totalAmount.add(sale.getTotalAmount());
            totalProfit = totalProfit.add(profit);
            rows.add(List.of(
                    String.valueOf(sale.getId()),
                    SALE_DATE.format(sale.getSaleDate().atZone(properties.getTimeZone())),
                    sale.getCustomerName(),
                    Amounts.format(sale.getTotalAmount()),
                    Amounts.format(profit),
                    sale.getPaymentMethod().getLabel(),
                    sale.isPaid() ? "Paid" : "Unpaid",
                    sale.getCreatedBy() != null ? displayName(sale.getCreatedBy().getFullName(),
                            sale.getCreatedBy().getUsername()) : ""));
        }

        String currency = settingsService.getCurrency();
        List<String> summary = List.of(
                "Total sales: " + currency + " " + Amounts.format(totalAmount),
                "Total profit: " + currency + " " + Amounts.format(totalProfit));
        ReportTable table = new ReportTable(settingsService.getCompanyName() + " - Sales Report"
                + period(filter.from(), filter.to()), SALE_COLUMNS, rows, summary);
        logger.info("Exporting {} sales as {}", rows.size(), format);
        return render("sales", table, format);
    }

    @Transactional(readOnly = true)
    public ExportedReport exportExpenditures(LocalDate from, LocalDate to, ReportFormat format) {
        List<List<String>> rows = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Expenditure expenditure : expenditureService.listExpenditures(from, to)) {
            total = total.add(expenditure.getAmount());
            rows.add(List.of(
                    String.valueOf(expenditure.getId()),
                    expenditure.getCategory().getLabel(),
                    expenditure.getDescription() != null ? expenditure.getDescription() : "",
                    expenditure.getExpenseDate().toString(),
                    expenditure.getAmount().toPlainString(),
                    expenditure.getCreatedBy() != null ? expenditure.getCreatedBy().getUsername() : ""));
        }

        List<String> summary = List.of("Total: " + settingsService.getCurrency() + " " + Amounts.format(total));
        ReportTable table = new ReportTable(settingsService.getCompanyName() + " - Expenditures Report"
                + period(from, to), EXPENDITURE_COLUMNS, rows, summary);
        logger.info("Exporting {} expenditures as {}", rows.size(), format);
        return render("expenditures", table, format);
    }

    private ExportedReport render(String baseName, ReportTable table, ReportFormat format) {
        byte[] content;
        if (format == ReportFormat.PDF) {
            PdfReportRenderer renderer = pdfRenderer.getIfAvailable();
            if (renderer == null) {
                logger.warn("PDF export of {} requested but OpenPDF is not on the classpath", baseName);
                throw new ReportUnavailableException("PDF export requires the OpenPDF library. Use CSV export instead.");
            }
            content = renderer.render(table);
        } else {
            content = csvWriter.write(table);
        }
        return new ExportedReport(baseName + "." + format.getExtension(), format.getContentType(), content);
    }

    private static String period(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return "";
        }
        return " (" + (from != null ? from : "start") + " to " + (to != null ? to : "today") + ")";
    }

    private static String displayName(String fullName, String username) {
        return fullName != null && !fullName.isBlank() ? fullName : username;
    }
}
