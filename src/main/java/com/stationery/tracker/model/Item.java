package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Entity
@Table(name = "items")
@Data
public class Item implements Stocked {
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

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal costPrice;

    @Column(nullable = false)
    private int stockQuantity;

    private int minimumStock = 10;

    private String supplierName;

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

    public boolean isLowStock() {
        return stockQuantity <= minimumStock;
    }

    public BigDecimal getProfitMargin() {
        if (costPrice == null || unitPrice == null || costPrice.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return unitPrice.subtract(costPrice)
                .multiply(BigDecimal.valueOf(100))
                .divide(costPrice, 2, RoundingMode.HALF_UP);
    }

    @Override
    public int availableStock() {
        return stockQuantity;
    }

    @Override
    public void decreaseStock(int quantity) {
        if (quantity > stockQuantity) {
            throw new IllegalStateException("Stock of " + name + " would go negative");
        }
        stockQuantity -= quantity;
    }

    @Override
    public void increaseStock(int quantity) {
        stockQuantity += quantity;
    }

    @Override
    public String stockUnit() {
        return "units";
    }
}
