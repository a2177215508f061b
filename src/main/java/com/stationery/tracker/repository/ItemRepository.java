package com.stationery.tracker.repository;

import com.stationery.tracker.model.Item;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ItemRepository extends JpaRepository<Item, Long> {
    Optional<Item> findBySku(String sku);

    boolean existsBySku(String sku);

    boolean existsBySkuAndIdNot(String sku, Long id);

    long countByCreatedAtBetween(LocalDateTime start, LocalDateTime end);

    List<Item> findByActiveTrueOrderByNameAsc();

    boolean existsByCategoryId(Long categoryId);

    List<Item> findByNameContainingIgnoreCaseOrderByNameAsc(String name);

    @Query("SELECT i FROM Item i WHERE i.active = true AND i.stockQuantity <= i.minimumStock ORDER BY i.stockQuantity ASC")
    List<Item> findLowStock();
}
