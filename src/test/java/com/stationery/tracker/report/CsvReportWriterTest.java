package com.stationery.tracker.report;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportWriterTest {

    private final CsvReportWriter writer = new CsvReportWriter();

    @Test
    void write_ShouldEmitHeaderAndRowsWithCrlf() {
        ReportTable table = new ReportTable("Sales",
                List.of(ReportColumn.text("Sale ID"), ReportColumn.number("Amount")),
                List.of(List.of("1", "1,500"), List.of("2", "700")),
                List.of("Total sales: TZS 2,200"));

        String csv = new String(writer.write(table), StandardCharsets.UTF_8);

        assertEquals("Sale ID,Amount\r\n1,\"1,500\"\r\n2,700\r\n", csv);
    }

    @Test
    void escape_ShouldQuoteAndDoubleEmbeddedQuotes() {
        assertEquals("\"Mama \"\"Juma\"\" Shop\"", CsvReportWriter.escape("Mama \"Juma\" Shop"));
        assertEquals("\"line1\nline2\"", CsvReportWriter.escape("line1\nline2"));
        assertEquals("plain", CsvReportWriter.escape("plain"));
        assertEquals("", CsvReportWriter.escape(null));
    }
}
