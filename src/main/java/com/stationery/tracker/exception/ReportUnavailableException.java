package com.stationery.tracker.exception;

public class ReportUnavailableException extends RuntimeException {

    public ReportUnavailableException(String message) {
        super(message);
    }

    public ReportUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
