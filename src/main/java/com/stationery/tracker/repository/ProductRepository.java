package com.stationery.tracker.repository;

import com.stationery.tracker.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
    Optional<Product> findBySku(String sku);

    boolean existsBySku(String sku);

    boolean existsBySkuAndIdNot(String sku, Long id);

    long countByCreatedAtBetween(LocalDateTime start, LocalDateTime end);

    Optional<Product> findByLinkedItemId(Long itemId);

    List<Product> findByActiveTrueOrderByNameAsc();

    boolean existsByCategoryId(Long categoryId);

    boolean existsBySupplierId(Long supplierId);

    @Query("SELECT p FROM Product p WHERE p.active = true AND p.cartonsInStock <= p.minimumCartons ORDER BY p.cartonsInStock ASC")
    List<Product> findLowStock();

    @Query("SELECT p.linkedItem.id FROM Product p WHERE p.linkedItem IS NOT NULL")
    List<Long> findLinkedItemIds();
}
