package com.stationery.tracker.dto;

import java.util.List;

public record SaleDeletionResult(List<Long> deletedSaleIds, List<RestoredStock> restoredStock) {

    public String summary() {
        if (restoredStock.isEmpty()) {
            return "Sale deleted.";
        }
        StringBuilder sb = new StringBuilder("Sale deleted. Restored stock: ");
        for (int i = 0; i < restoredStock.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(restoredStock.get(i));
        }
        return sb.toString();
    }
}
