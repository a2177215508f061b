package com.stationery.tracker.dto;

import java.time.LocalDate;

public record SaleFilter(LocalDate from, LocalDate to, String status, String product, int page) {

    public static final int PAGE_SIZE = 20;

    public Boolean paidFlag() {
        if ("all".equalsIgnoreCase(status)) {
            return null;
        }
        if ("unpaid".equalsIgnoreCase(status)) {
            return Boolean.FALSE;
        }
        return Boolean.TRUE;
    }
}
