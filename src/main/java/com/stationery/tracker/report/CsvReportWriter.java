package com.stationery.tracker.report;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

// RFC 4180: CRLF line ends, fields quoted when they hold a comma, quote or line break
@Component
public class CsvReportWriter {

    public byte[] write(ReportTable table) {
        StringBuilder out = new StringBuilder();
        appendRow(out, table.headers());
        for (List<String> row : table.rows()) {
            appendRow(out, row);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void appendRow(StringBuilder out, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(escape(cells.get(i)));
        }
        out.append("\r\n");
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
