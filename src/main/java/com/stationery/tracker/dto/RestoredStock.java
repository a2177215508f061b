package com.stationery.tracker.dto;

import com.stationery.tracker.model.LineItemType;

public record RestoredStock(LineItemType type, Long stockId, String name, int quantity, String unit) {

    @Override
    public String toString() {
        return name + " (+" + quantity + " " + unit + ")";
    }
}
