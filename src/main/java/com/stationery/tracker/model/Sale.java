package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "sales")
@Data
public class Sale {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "customer_id")
    private Customer customer; // null = walk-in

    @Column(nullable = false)
    private Instant saleDate;

    // Written only by SaleTotalService.recompute
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMethod paymentMethod = PaymentMethod.CASH;

    private boolean paid = true;

    @Column(length = 2000)
    private String notes;

    @ManyToOne
    @JoinColumn(name = "created_by_id")
    @ToString.Exclude
    private User createdBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SaleKind kind = SaleKind.NORMAL;

    // Set only on PAYMENT_RECORD sales
    @ManyToOne
    @JoinColumn(name = "payment_for_debt_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Debt paymentForDebt;

    @OneToMany(mappedBy = "sale", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<SaleLineItem> items = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (saleDate == null)
            saleDate = Instant.now();
        if (kind == null)
            kind = SaleKind.NORMAL;
        if (totalAmount == null)
            totalAmount = BigDecimal.ZERO;
    }

    public boolean isPaymentRecord() {
        return kind == SaleKind.PAYMENT_RECORD;
    }

    public String getCustomerName() {
        return customer != null ? customer.getName() : "Walk-in";
    }
}
