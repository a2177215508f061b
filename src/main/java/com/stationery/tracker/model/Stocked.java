package com.stationery.tracker.model;

public interface Stocked {

    Long getId();

    String getName();

    String getSku();

    // Pieces for items, cartons for products
    int availableStock();

    void decreaseStock(int quantity);

    void increaseStock(int quantity);

    String stockUnit();
}
