package com.stationery.tracker.service;

import com.stationery.tracker.model.Sale;
import com.stationery.tracker.repository.SaleLineItemRepository;
import com.stationery.tracker.repository.SaleRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

@Service
public class SaleTotalService {

    private final SaleRepository saleRepository;
    private final SaleLineItemRepository lineItemRepository;
    private final EntityManager entityManager;

    public SaleTotalService(SaleRepository saleRepository, SaleLineItemRepository lineItemRepository,
            EntityManager entityManager) {
        this.saleRepository = saleRepository;
        this.lineItemRepository = lineItemRepository;
        this.entityManager = entityManager;
    }

    /**
     * Sums the persisted lines and writes only the total column, then reloads {@code sale}
     * so the in-memory aggregate matches the row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal recompute(Sale sale) {
        BigDecimal total = recompute(sale.getId());
        entityManager.refresh(sale);
        return total;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal recompute(Long saleId) {
        // Pending line inserts, merges and orphan deletes must be visible to the sum
        entityManager.flush();
        BigDecimal total = lineItemRepository.sumTotalPriceBySaleId(saleId);
        saleRepository.updateTotalAmount(saleId, total);
        return total;
    }
}
