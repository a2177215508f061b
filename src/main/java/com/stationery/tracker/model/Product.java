package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import java.math.BigDecimal;
import java.time.LocalDateTime;

// The linked item's piece count mirrors cartonsInStock * unitsPerCarton
@Entity
@Table(name = "products")
@Data
public class Product implements Stocked {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 1000)
    private String description;

    @ManyToOne
    @JoinColumn(name = "category_id")
    private Category category;

    @Column(unique = true, nullable = false, length = 50)
    private String sku;

    @ManyToOne
    @JoinColumn(name = "supplier_id")
    private Supplier supplier;

    @OneToOne
    @JoinColumn(name = "item_id", unique = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Item linkedItem;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal supplierPrice; // per carton

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal sellingPrice; // per carton

    @Column(nullable = false)
    private int unitsPerCarton = 1;

    @Column(precision = 8, scale = 2)
    private BigDecimal cartonWeight;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UnitType unitType = UnitType.CARTON;

    @Column(nullable = false)
    private int cartonsInStock;

    private int minimumCartons = 5;

    @Column(length = 1000)
    private String notes;

    private boolean active = true;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public int getTotalUnitsInStock() {
        return cartonsInStock * unitsPerCarton;
    }

    public BigDecimal getProfitPerCarton() {
        if (sellingPrice == null || supplierPrice == null) {
            return BigDecimal.ZERO;
        }
        return sellingPrice.subtract(supplierPrice);
    }

    public boolean isLowStock() {
        return cartonsInStock <= minimumCartons;
    }

    public void syncLinkedItemStock() {
        if (linkedItem != null) {
            linkedItem.setStockQuantity(getTotalUnitsInStock());
        }
    }

    @Override
    public int availableStock() {
        return cartonsInStock;
    }

    @Override
    public void decreaseStock(int quantity) {
        if (quantity > cartonsInStock) {
            throw new IllegalStateException("Cartons of " + name + " would go negative");
        }
        cartonsInStock -= quantity;
        syncLinkedItemStock();
    }

    @Override
    public void increaseStock(int quantity) {
        cartonsInStock += quantity;
        syncLinkedItemStock();
    }

    @Override
    public String stockUnit() {
        return "cartons";
    }
}
