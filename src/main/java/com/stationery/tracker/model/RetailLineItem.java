package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import java.math.BigDecimal;

@Entity
@DiscriminatorValue("RETAIL")
@Getter
@Setter
public class RetailLineItem extends SaleLineItem {

    @ManyToOne
    @JoinColumn(name = "item_id")
    private Item item;

    protected RetailLineItem() {
    }

    public RetailLineItem(Item item) {
        if (item == null)
            throw new IllegalArgumentException("Retail line requires an item");
        this.item = item;
    }

    @Override
    public Stocked getStocked() {
        return item;
    }

    @Override
    public LineItemType getType() {
        return LineItemType.RETAIL;
    }

    @Override
    public BigDecimal getUnitCost() {
        return item.getCostPrice();
    }

    @Override
    public Item getDebtItem() {
        return item;
    }
}
