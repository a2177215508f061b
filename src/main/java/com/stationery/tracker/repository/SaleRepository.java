package com.stationery.tracker.repository;

import com.stationery.tracker.model.Sale;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SaleRepository extends JpaRepository<Sale, Long>, JpaSpecificationExecutor<Sale> {

    // Taken before any stock row lock
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Sale s WHERE s.id = :id")
    Optional<Sale> findByIdForUpdate(@Param("id") Long id);

    // Narrow write: touches only the total so no entity lifecycle logic runs
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Sale s SET s.totalAmount = :total WHERE s.id = :id")
    int updateTotalAmount(@Param("id") Long id, @Param("total") BigDecimal total);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Sale s WHERE s.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<Long> ids);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Sale s SET s.paymentForDebt = null WHERE s.paymentForDebt.id = :debtId")
    int clearPaymentForDebt(@Param("debtId") Long debtId);

    List<Sale> findByIdIn(Collection<Long> ids);

    List<Sale> findByPaymentForDebtId(Long debtId);

    boolean existsByCustomerId(Long customerId);

    @Query("SELECT COALESCE(SUM(s.totalAmount), 0) FROM Sale s WHERE s.paid = true AND s.saleDate >= :from AND s.saleDate < :to")
    BigDecimal sumPaidBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT COUNT(s) FROM Sale s WHERE s.paid = true AND s.saleDate >= :from AND s.saleDate < :to")
    long countPaidBetween(@Param("from") Instant from, @Param("to") Instant to);
}
