package com.stationery.tracker.repository;

import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DebtRepository extends JpaRepository<Debt, Long>, JpaSpecificationExecutor<Debt> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Debt d WHERE d.id = :id")
    Optional<Debt> findByIdForUpdate(@Param("id") Long id);

    List<Debt> findBySaleIdOrderByIdAsc(Long saleId);

    Optional<Debt> findFirstBySaleIdAndAutoCreatedTrueOrderByIdAsc(Long saleId);

    List<Debt> findByAutoCreatedTrueAndSaleIsNotNull();

    boolean existsByItemId(Long itemId);

    boolean existsByCustomerId(Long customerId);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Debt d SET d.sale = null WHERE d.sale.id IN :saleIds")
    int detachFromSales(@Param("saleIds") Collection<Long> saleIds);

    @Query("SELECT COALESCE(SUM(d.amount - d.paidAmount), 0) FROM Debt d WHERE d.status <> :paid")
    BigDecimal sumOutstanding(@Param("paid") DebtStatus paid);

    @Query("SELECT d FROM Debt d WHERE d.dueDate < :today AND d.status <> :paid ORDER BY d.dueDate ASC")
    List<Debt> findOverdue(@Param("today") LocalDate today, @Param("paid") DebtStatus paid);

    // Outstanding debts whose customer can be reached by phone, soonest due first
    @Query("SELECT d FROM Debt d JOIN FETCH d.customer c WHERE d.status <> :paid "
            + "AND c.phone IS NOT NULL AND c.phone <> '' ORDER BY d.dueDate ASC")
    List<Debt> findReminderCandidates(@Param("paid") DebtStatus paid);
}
