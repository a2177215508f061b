package com.stationery.tracker.model;

public enum SaleKind {
    NORMAL,
    PAYMENT_RECORD // Synthetic zero-line sale standing for cash received against a debt
}
