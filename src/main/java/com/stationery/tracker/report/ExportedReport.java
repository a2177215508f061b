package com.stationery.tracker.report;

public record ExportedReport(String filename, String contentType, byte[] content) {
}
