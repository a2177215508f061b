package com.stationery.tracker.repository;

import com.stationery.tracker.model.Expenditure;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface ExpenditureRepository extends JpaRepository<Expenditure, Long> {
    List<Expenditure> findByExpenseDateBetweenOrderByExpenseDateDesc(LocalDate from, LocalDate to);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM Expenditure e WHERE e.expenseDate BETWEEN :from AND :to")
    BigDecimal sumBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
