package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import java.math.BigDecimal;

@Entity
@DiscriminatorValue("WHOLESALE")
@Getter
@Setter
public class WholesaleLineItem extends SaleLineItem {

    @ManyToOne
    @JoinColumn(name = "product_id")
    private Product product;

    protected WholesaleLineItem() {
    }

    public WholesaleLineItem(Product product) {
        if (product == null)
            throw new IllegalArgumentException("Wholesale line requires a product");
        this.product = product;
    }

    @Override
    public Stocked getStocked() {
        return product;
    }

    @Override
    public LineItemType getType() {
        return LineItemType.WHOLESALE;
    }

    // Wholesale lines contribute no cost to sale profit
    @Override
    public BigDecimal getUnitCost() {
        return null;
    }

    @Override
    public Item getDebtItem() {
        return product.getLinkedItem();
    }

    // Cartons converted to pieces of the linked item
    @Override
    public int getDebtItemQuantity() {
        return getQuantity() * product.getUnitsPerCarton();
    }
}
