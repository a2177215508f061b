package com.stationery.tracker.model;

public enum LineItemType {
    RETAIL, WHOLESALE
}
