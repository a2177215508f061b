package com.stationery.tracker.repository;

import com.stationery.tracker.model.RetailLineItem;
import com.stationery.tracker.model.SaleLineItem;
import com.stationery.tracker.model.WholesaleLineItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SaleLineItemRepository extends JpaRepository<SaleLineItem, Long> {

    @Query("SELECT COALESCE(SUM(l.totalPrice), 0) FROM SaleLineItem l WHERE l.sale.id = :saleId")
    BigDecimal sumTotalPriceBySaleId(@Param("saleId") Long saleId);

    @Query("SELECT l FROM SaleLineItem l WHERE l.sale.id = :saleId ORDER BY l.id ASC")
    List<SaleLineItem> findBySaleIdOrderById(@Param("saleId") Long saleId);

    @Query("SELECT l FROM SaleLineItem l WHERE l.sale.id IN :saleIds ORDER BY l.id ASC")
    List<SaleLineItem> findBySaleIdIn(@Param("saleIds") Collection<Long> saleIds);

    @Query("SELECT r FROM RetailLineItem r WHERE r.sale.id = :saleId AND r.item.id = :itemId")
    Optional<RetailLineItem> findRetailLine(@Param("saleId") Long saleId, @Param("itemId") Long itemId);

    @Query("SELECT w FROM WholesaleLineItem w WHERE w.sale.id = :saleId AND w.product.id = :productId")
    Optional<WholesaleLineItem> findWholesaleLine(@Param("saleId") Long saleId, @Param("productId") Long productId);

    @Query("SELECT l FROM SaleLineItem l WHERE l.id = :id AND l.sale.id = :saleId")
    Optional<SaleLineItem> findByIdAndSaleId(@Param("id") Long id, @Param("saleId") Long saleId);

    // Bulk delete: callers restore stock for the affected lines first
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SaleLineItem l WHERE l.sale.id IN :saleIds")
    int deleteAllBySaleIdIn(@Param("saleIds") Collection<Long> saleIds);

    @Query("SELECT COUNT(r) > 0 FROM RetailLineItem r WHERE r.item.id = :itemId")
    boolean existsByItemId(@Param("itemId") Long itemId);

    @Query("SELECT COUNT(w) > 0 FROM WholesaleLineItem w WHERE w.product.id = :productId")
    boolean existsByProductId(@Param("productId") Long productId);
}
