package com.stationery.tracker.dto;

import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.LineItemType;
import com.stationery.tracker.model.Product;

public record LowStockEntry(LineItemType type, Long id, String name, String sku, int stock, int minimum,
        String unit) {

    public static LowStockEntry of(Item item) {
        return new LowStockEntry(LineItemType.RETAIL, item.getId(), item.getName(), item.getSku(),
                item.getStockQuantity(), item.getMinimumStock(), item.stockUnit());
    }

    public static LowStockEntry of(Product product) {
        return new LowStockEntry(LineItemType.WHOLESALE, product.getId(), product.getName(), product.getSku(),
                product.getCartonsInStock(), product.getMinimumCartons(), product.stockUnit());
    }
}
