package com.stationery.tracker.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "payments")
@Data
public class Payment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "debt_id", nullable = false)
    @ToString.Exclude
    private Debt debt;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    private LocalDateTime paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMethod paymentMethod = PaymentMethod.CASH;

    @Column(length = 1000)
    private String notes;

    @ManyToOne
    @JoinColumn(name = "recorded_by_id")
    @ToString.Exclude
    private User recordedBy;

    @PrePersist
    protected void onCreate() {
        if (paymentDate == null)
            paymentDate = LocalDateTime.now();
    }
}
