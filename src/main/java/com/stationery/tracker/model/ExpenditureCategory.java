package com.stationery.tracker.model;

public enum ExpenditureCategory {
    SUPPLIES("Supplies"),
    RENT("Rent"),
    UTILITIES("Utilities"),
    SALARY("Salary"),
    MARKETING("Marketing"),
    OTHER("Other");

    private final String label;

    ExpenditureCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
