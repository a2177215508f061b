package com.stationery.tracker.service;

import com.stationery.tracker.config.TrackerProperties;
import com.stationery.tracker.dto.SaleFilter;
import com.stationery.tracker.exception.ReportUnavailableException;
import com.stationery.tracker.model.*;
import com.stationery.tracker.report.CsvReportWriter;
import com.stationery.tracker.report.ExportedReport;
import com.stationery.tracker.report.PdfReportRenderer;
import com.stationery.tracker.report.ReportFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    @Mock
    private SalesService salesService;
    @Mock
    private ExpenditureService expenditureService;
    @Mock
    private ProfitCalculator profitCalculator;
    @Mock
    private SettingsService settingsService;
    @Mock
    private ObjectProvider<PdfReportRenderer> pdfRenderer;

    private ReportService reportService;

    @BeforeEach
    void setUp() {
        reportService = new ReportService(salesService, expenditureService, profitCalculator, settingsService,
                new CsvReportWriter(), pdfRenderer, new TrackerProperties());
        when(settingsService.getCompanyName()).thenReturn("Kalamu Stationers");
        when(settingsService.getCurrency()).thenReturn("TZS");
    }

    private Sale sale() {
        User clerk = new User();
        clerk.setUsername("neema");
        clerk.setFullName("Neema K");

        Customer customer = new Customer();
        customer.setName("Mama \"Juma\" Shop");

        Sale sale = new Sale();
        sale.setId(5L);
        sale.setSaleDate(Instant.parse("2024-03-10T22:30:00Z"));
        sale.setCustomer(customer);
        sale.setTotalAmount(new BigDecimal("12500"));
        sale.setPaymentMethod(PaymentMethod.BANK_TRANSFER);
        sale.setPaid(false);
        sale.setCreatedBy(clerk);
        return sale;
    }

    @Test
    void exportSales_Csv_ShouldRenderLocalTimesAndEscapedNames() {
        SaleFilter filter = new SaleFilter(null, null, "all", null, 0);
        Sale sale = sale();
        when(salesService.findSales(filter)).thenReturn(List.of(sale));
        when(profitCalculator.profitOf(sale)).thenReturn(new BigDecimal("3500"));

        ExportedReport report = reportService.exportSales(filter, ReportFormat.CSV);

        assertEquals("sales.csv", report.filename());
        assertEquals("text/csv", report.contentType());
        String csv = new String(report.content(), StandardCharsets.UTF_8);
        assertEquals("Sale ID,Date,Customer,Amount,Profit,Payment Method,Status,Created By\r\n"
                + "5,2024-03-11 01:30:00,\"Mama \"\"Juma\"\" Shop\",\"12,500\",\"3,500\",Bank Transfer,Unpaid,Neema K\r\n",
                csv);
    }

    @Test
    void exportSales_PdfWithoutOpenPdf_ShouldBeUnavailable() {
        SaleFilter filter = new SaleFilter(null, null, "paid", null, 0);
        when(salesService.findSales(filter)).thenReturn(List.of());
        when(pdfRenderer.getIfAvailable()).thenReturn(null);

        assertThrows(ReportUnavailableException.class, () -> reportService.exportSales(filter, ReportFormat.PDF));
    }

    @Test
    void exportSales_Pdf_ShouldProducePdfDocument() {
        SaleFilter filter = new SaleFilter(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), "all", null, 0);
        Sale sale = sale();
        when(salesService.findSales(filter)).thenReturn(List.of(sale));
        when(profitCalculator.profitOf(sale)).thenReturn(new BigDecimal("3500"));
        when(pdfRenderer.getIfAvailable()).thenReturn(new PdfReportRenderer());

        ExportedReport report = reportService.exportSales(filter, ReportFormat.PDF);

        assertEquals("sales.pdf", report.filename());
        assertEquals("%PDF", new String(report.content(), 0, 4, StandardCharsets.US_ASCII));
    }

    @Test
    void exportExpenditures_Csv_ShouldListPlainAmounts() {
        Expenditure rent = new Expenditure();
        rent.setId(3L);
        rent.setCategory(ExpenditureCategory.RENT);
        rent.setDescription("Shop rent, March");
        rent.setExpenseDate(LocalDate.of(2024, 3, 1));
        rent.setAmount(new BigDecimal("250000.00"));
        LocalDate from = LocalDate.of(2024, 3, 1);
        LocalDate to = LocalDate.of(2024, 3, 31);
        when(expenditureService.listExpenditures(from, to)).thenReturn(List.of(rent));

        ExportedReport report = reportService.exportExpenditures(from, to, ReportFormat.CSV);

        String csv = new String(report.content(), StandardCharsets.UTF_8);
        assertTrue(csv.startsWith("ID,Category,Description,Date,Amount,Created By\r\n"));
        assertTrue(csv.contains("3,Rent,\"Shop rent, March\",2024-03-01,250000.00,\r\n"));
    }
}
