package com.stationery.tracker.repository;

import com.stationery.tracker.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class SaleLineItemRepositoryTest {

    @Autowired
    private SaleLineItemRepository lineItemRepository;

    @Autowired
    private SaleRepository saleRepository;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private ProductRepository productRepository;

    private Sale sale;
    private Item pen;
    private Product carton;

    @BeforeEach
    void setUp() {
        pen = new Item();
        pen.setName("Pen");
        pen.setSku("REPO-PEN-001");
        pen.setUnitPrice(new BigDecimal("500.00"));
        pen.setCostPrice(new BigDecimal("300.00"));
        pen.setStockQuantity(50);
        itemRepository.save(pen);

        carton = new Product();
        carton.setName("Pen Carton");
        carton.setSku("REPO-PENC-001");
        carton.setSupplierPrice(new BigDecimal("18000.00"));
        carton.setSellingPrice(new BigDecimal("22000.00"));
        carton.setUnitsPerCarton(50);
        carton.setCartonsInStock(5);
        productRepository.save(carton);

        sale = saleRepository.save(new Sale());
    }

    private <T extends SaleLineItem> T save(T line, int quantity, String unitPrice) {
        line.setSale(sale);
        line.setQuantity(quantity);
        line.setUnitPrice(new BigDecimal(unitPrice));
        return lineItemRepository.save(line);
    }

    @Test
    void sumTotalPriceBySaleId_ShouldAddBothLineTypes() {
        save(new RetailLineItem(pen), 4, "500.00");
        save(new WholesaleLineItem(carton), 2, "22000.00");

        assertEquals(0, new BigDecimal("46000").compareTo(lineItemRepository.sumTotalPriceBySaleId(sale.getId())));
    }

    @Test
    void sumTotalPriceBySaleId_EmptySale_ShouldBeZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(lineItemRepository.sumTotalPriceBySaleId(sale.getId())));
    }

    @Test
    void findRetailLineAndWholesaleLine_ShouldMatchByStockRecord() {
        RetailLineItem retail = save(new RetailLineItem(pen), 1, "500.00");
        WholesaleLineItem wholesale = save(new WholesaleLineItem(carton), 1, "22000.00");

        Optional<RetailLineItem> foundRetail = lineItemRepository.findRetailLine(sale.getId(), pen.getId());
        Optional<WholesaleLineItem> foundWholesale = lineItemRepository.findWholesaleLine(sale.getId(), carton.getId());

        assertEquals(retail.getId(), foundRetail.orElseThrow().getId());
        assertEquals(wholesale.getId(), foundWholesale.orElseThrow().getId());
        assertTrue(lineItemRepository.existsByItemId(pen.getId()));
        assertTrue(lineItemRepository.existsByProductId(carton.getId()));
    }

    @Test
    void deleteAllBySaleIdIn_ShouldRemoveOnlyThoseSalesLines() {
        Sale other = saleRepository.save(new Sale());
        save(new RetailLineItem(pen), 1, "500.00");
        RetailLineItem kept = new RetailLineItem(pen);
        kept.setSale(other);
        kept.setQuantity(2);
        kept.setUnitPrice(new BigDecimal("500.00"));
        lineItemRepository.save(kept);

        int deleted = lineItemRepository.deleteAllBySaleIdIn(List.of(sale.getId()));

        assertEquals(1, deleted);
        assertEquals(1, lineItemRepository.findBySaleIdOrderById(other.getId()).size());
        assertTrue(lineItemRepository.findBySaleIdOrderById(sale.getId()).isEmpty());
    }

    @Test
    void findByIdForUpdate_ShouldReturnSale() {
        Optional<Sale> locked = saleRepository.findByIdForUpdate(sale.getId());

        assertTrue(locked.isPresent());
        assertEquals(SaleKind.NORMAL, locked.get().getKind());
    }
}
