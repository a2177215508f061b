package com.stationery.tracker.service;

import com.stationery.tracker.dto.LineItemUpdateRequest;
import com.stationery.tracker.dto.RestoredStock;
import com.stationery.tracker.dto.RetailLineRequest;
import com.stationery.tracker.dto.SaleDeletionResult;
import com.stationery.tracker.dto.SaleRequest;
import com.stationery.tracker.dto.SaleUpdateRequest;
import com.stationery.tracker.dto.WholesaleLineRequest;
import com.stationery.tracker.exception.InsufficientStockException;
import com.stationery.tracker.model.*;
import com.stationery.tracker.repository.*;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@SpringBootTest
@Transactional
public class SaleLifecycleIntegrationTest {

    @Autowired
    private SalesService salesService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private DebtRepository debtRepository;

    @Autowired
    private SaleRepository saleRepository;

    @MockBean
    private AuditService auditService; // Keep audit rows out of the shared database

    private Item pen;
    private Customer customer;

    @BeforeEach
    void setUp() {
        pen = createItem("Lifecycle Pen", "LIFE-PEN-001", 10);

        customer = new Customer();
        customer.setName("Juma Stores");
        customer.setPhone("0712345678");
        customer = customerRepository.save(customer);
    }

    private Item createItem(String name, String sku, int stock) {
        Item item = new Item();
        item.setName(name);
        item.setSku(sku);
        item.setUnitPrice(new BigDecimal("1000.00"));
        item.setCostPrice(new BigDecimal("600.00"));
        item.setStockQuantity(stock);
        return itemRepository.save(item);
    }

    private Sale unpaidSaleOf(int pens) {
        return salesService.createSale(new SaleRequest(customer.getId(), PaymentMethod.CASH, false, null,
                new RetailLineRequest(pen.getId(), pens, null)), Actor.SYSTEM);
    }

    private int penStock() {
        return itemRepository.findById(pen.getId()).orElseThrow().getStockQuantity();
    }

    @Test
    public void testUnpaidSaleTracksStockTotalAndDebt() {
        Sale sale = unpaidSaleOf(3);

        Assertions.assertEquals(7, penStock());
        Assertions.assertEquals(0, new BigDecimal("3000").compareTo(sale.getTotalAmount()));
        List<Debt> debts = debtRepository.findBySaleIdOrderByIdAsc(sale.getId());
        Assertions.assertEquals(1, debts.size());
        Debt debt = debts.get(0);
        Assertions.assertTrue(debt.isAutoCreated());
        Assertions.assertEquals(0, new BigDecimal("3000").compareTo(debt.getAmount()));
        Assertions.assertEquals(DebtStatus.PENDING, debt.getStatus());

        // Same item again merges at the new price
        salesService.addLineItem(sale.getId(), new RetailLineRequest(pen.getId(), 2, new BigDecimal("1100.00")),
                Actor.SYSTEM);

        Sale reloaded = salesService.getSale(sale.getId());
        Assertions.assertEquals(1, reloaded.getItems().size());
        Assertions.assertEquals(5, reloaded.getItems().get(0).getQuantity());
        Assertions.assertEquals(0, new BigDecimal("5500").compareTo(reloaded.getTotalAmount()));
        Assertions.assertEquals(5, penStock());
        Assertions.assertEquals(0, new BigDecimal("5500").compareTo(debt.getAmount()));
    }

    @Test
    public void testLineQuantityChangeMovesOnlyDelta() {
        Sale sale = unpaidSaleOf(4);
        Long lineId = salesService.getSale(sale.getId()).getItems().get(0).getId();

        salesService.updateLineItem(sale.getId(), lineId, new LineItemUpdateRequest(6, null), Actor.SYSTEM);
        Assertions.assertEquals(4, penStock());

        salesService.updateLineItem(sale.getId(), lineId, new LineItemUpdateRequest(1, null), Actor.SYSTEM);
        Assertions.assertEquals(9, penStock());
        Assertions.assertEquals(0, new BigDecimal("1000").compareTo(salesService.getSale(sale.getId()).getTotalAmount()));
    }

    @Test
    public void testInsufficientStockLeavesStockUnchanged() {
        Sale sale = unpaidSaleOf(8);

        InsufficientStockException ex = Assertions.assertThrows(InsufficientStockException.class,
                () -> salesService.addLineItem(sale.getId(), new RetailLineRequest(pen.getId(), 3, null),
                        Actor.SYSTEM));

        Assertions.assertEquals(2, ex.getAvailable());
        Assertions.assertEquals(3, ex.getRequested());
        Assertions.assertEquals(2, penStock());
    }

    @Test
    public void testRemovingLastLineDropsAutoDebt() {
        Sale sale = unpaidSaleOf(2);
        Long lineId = salesService.getSale(sale.getId()).getItems().get(0).getId();

        salesService.removeLineItem(sale.getId(), lineId, Actor.SYSTEM);

        Assertions.assertEquals(10, penStock());
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(salesService.getSale(sale.getId()).getTotalAmount()));
        Assertions.assertTrue(debtRepository.findBySaleIdOrderByIdAsc(sale.getId()).isEmpty());
    }

    @Test
    public void testMarkingSalePaidSettlesDebt() {
        Sale sale = unpaidSaleOf(2);

        salesService.updateSale(sale.getId(), new SaleUpdateRequest(customer.getId(), PaymentMethod.CASH, true, null),
                Actor.SYSTEM);

        Debt debt = debtRepository.findBySaleIdOrderByIdAsc(sale.getId()).get(0);
        Assertions.assertEquals(DebtStatus.PAID, debt.getStatus());
        Assertions.assertEquals(0, debt.getAmount().compareTo(debt.getPaidAmount()));
    }

    @Test
    public void testWholesaleLineMirrorsCartonsOntoLinkedItem() {
        Item loosePaper = createItem("A4 Sheet", "LIFE-A4-001", 40);
        Product carton = new Product();
        carton.setName("A4 Paper Carton");
        carton.setSku("LIFE-A4C-001");
        carton.setSupplierPrice(new BigDecimal("30000.00"));
        carton.setSellingPrice(new BigDecimal("40000.00"));
        carton.setUnitsPerCarton(10);
        carton.setCartonsInStock(4);
        carton.setLinkedItem(loosePaper);
        carton = productRepository.save(carton);

        Sale sale = salesService.createSale(new SaleRequest(null, PaymentMethod.CASH, true, null,
                new WholesaleLineRequest(carton.getId(), 1, null)), Actor.SYSTEM);

        Assertions.assertEquals(3, productRepository.findById(carton.getId()).orElseThrow().getCartonsInStock());
        Assertions.assertEquals(30, itemRepository.findById(loosePaper.getId()).orElseThrow().getStockQuantity());
        Assertions.assertEquals(0, new BigDecimal("40000").compareTo(sale.getTotalAmount()));
    }

    @Test
    public void testClearingLinesRestoresEveryLine() {
        Item eraser = createItem("Eraser", "LIFE-ERA-001", 5);
        Sale sale = unpaidSaleOf(3);
        salesService.addLineItem(sale.getId(), new RetailLineRequest(eraser.getId(), 5, null), Actor.SYSTEM);

        List<RestoredStock> restored = salesService.clearLineItems(sale.getId(), Actor.SYSTEM);

        Assertions.assertEquals(2, restored.size());
        Assertions.assertEquals(10, penStock());
        Assertions.assertEquals(5, itemRepository.findById(eraser.getId()).orElseThrow().getStockQuantity());
        Sale cleared = salesService.getSale(sale.getId());
        Assertions.assertTrue(cleared.getItems().isEmpty());
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(cleared.getTotalAmount()));
        Assertions.assertTrue(debtRepository.findBySaleIdOrderByIdAsc(sale.getId()).isEmpty());
    }

    @Test
    public void testDeletingSaleRestoresStockAndDetachesDebt() {
        Sale sale = unpaidSaleOf(4);
        Long debtId = debtRepository.findBySaleIdOrderByIdAsc(sale.getId()).get(0).getId();

        SaleDeletionResult result = salesService.deleteSale(sale.getId(), Actor.SYSTEM);

        Assertions.assertEquals(List.of(sale.getId()), result.deletedSaleIds());
        Assertions.assertEquals(10, penStock());
        Assertions.assertFalse(saleRepository.existsById(sale.getId()));
        Assertions.assertNull(debtRepository.findById(debtId).orElseThrow().getSale());
    }

    @Test
    public void testDeletingSaleRestoresEveryLine() {
        Item eraser = createItem("Eraser", "LIFE-ERA-002", 10);
        Sale sale = unpaidSaleOf(3);
        salesService.addLineItem(sale.getId(), new RetailLineRequest(eraser.getId(), 2, null), Actor.SYSTEM);
        Assertions.assertEquals(7, penStock());
        Assertions.assertEquals(8, itemRepository.findById(eraser.getId()).orElseThrow().getStockQuantity());

        SaleDeletionResult result = salesService.deleteSale(sale.getId(), Actor.SYSTEM);

        Assertions.assertEquals(2, result.restoredStock().size());
        Assertions.assertEquals(10, penStock());
        Assertions.assertEquals(10, itemRepository.findById(eraser.getId()).orElseThrow().getStockQuantity());
        Assertions.assertFalse(saleRepository.existsById(sale.getId()));
    }

    @Test
    public void testDeletingPaymentSaleReversesPayment() {
        Sale sale = unpaidSaleOf(3);
        Debt debt = debtRepository.findBySaleIdOrderByIdAsc(sale.getId()).get(0);

        paymentService.recordPayment(debt.getId(), new BigDecimal("1000"), PaymentMethod.CASH, null, Actor.SYSTEM);
        Assertions.assertEquals(DebtStatus.PARTIAL, debt.getStatus());
        Sale paymentSale = saleRepository.findByPaymentForDebtId(debt.getId()).get(0);
        Assertions.assertEquals(SaleKind.PAYMENT_RECORD, paymentSale.getKind());

        salesService.deleteSale(paymentSale.getId(), Actor.SYSTEM);

        Debt reloaded = debtRepository.findById(debt.getId()).orElseThrow();
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(reloaded.getPaidAmount()));
        Assertions.assertEquals(DebtStatus.PENDING, reloaded.getStatus());
        // The debt's quantity goes back to its item
        Assertions.assertEquals(10, penStock());
    }
}
