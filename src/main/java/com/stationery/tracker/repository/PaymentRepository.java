package com.stationery.tracker.repository;

import com.stationery.tracker.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PaymentRepository extends JpaRepository<Payment, Long> {
    List<Payment> findByDebtIdOrderByPaymentDateDesc(Long debtId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Payment p WHERE p.debt.id = :debtId")
    int deleteByDebtId(@Param("debtId") Long debtId);
}
