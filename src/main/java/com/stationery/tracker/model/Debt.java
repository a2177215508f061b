package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "debts")
@Data
public class Debt {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    // Originating sale; cleared when that sale is deleted
    @ManyToOne
    @JoinColumn(name = "sale_id")
    @ToString.Exclude
    private Sale sale;

    @ManyToOne
    @JoinColumn(name = "created_by_id")
    @ToString.Exclude
    private User createdBy;

    @ManyToOne
    @JoinColumn(name = "item_id", nullable = false)
    private Item item;

    @Column(nullable = false)
    private int quantity = 1;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal paidAmount = BigDecimal.ZERO;

    @Column(nullable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DebtStatus status = DebtStatus.PENDING;

    // True when the debt was opened by sale synchronisation rather than by hand
    private boolean autoCreated;

    @Column(length = 1000)
    private String description;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (paidAmount == null)
            paidAmount = BigDecimal.ZERO;
        if (status == null)
            status = DebtStatus.PENDING;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public BigDecimal getRemainingAmount() {
        return amount.subtract(paidAmount);
    }

    public boolean isOverdue(LocalDate today) {
        return dueDate.isBefore(today) && status != DebtStatus.PAID;
    }

    public DebtStatus effectiveStatus(LocalDate today) {
        return isOverdue(today) ? DebtStatus.OVERDUE : status;
    }

    public void recomputeStatus() {
        status = DebtStatus.fromPaidAmount(paidAmount, amount);
    }
}
