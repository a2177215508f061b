package com.stationery.tracker.report;

import java.util.List;
import java.util.stream.Collectors;

public record ReportTable(String title, List<ReportColumn> columns, List<List<String>> rows, List<String> summary) {

    public List<String> headers() {
        return columns.stream().map(ReportColumn::header).collect(Collectors.toList());
    }
}
