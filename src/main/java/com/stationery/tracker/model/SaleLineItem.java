package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import java.math.BigDecimal;

@Entity
@Table(name = "sale_line_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_line_sale_item", columnNames = { "sale_id", "item_id" }),
        @UniqueConstraint(name = "uk_line_sale_product", columnNames = { "sale_id", "product_id" })
})
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "line_type", length = 20)
@Getter
@Setter
public abstract class SaleLineItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sale_id", nullable = false)
    private Sale sale;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @PrePersist
    @PreUpdate
    protected void computeTotal() {
        totalPrice = unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public abstract Stocked getStocked();

    public abstract LineItemType getType();

    // null when the line carries no cost (wholesale lines)
    public abstract BigDecimal getUnitCost();

    public abstract Item getDebtItem();

    public int getDebtItemQuantity() {
        return quantity;
    }

    public String getItemName() {
        return getStocked().getName();
    }

    public void refreshTotal() {
        computeTotal();
    }
}
