package com.stationery.tracker.service;

import com.stationery.tracker.model.*;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.PaymentRepository;
import com.stationery.tracker.repository.SaleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DebtServiceTest {

    @Mock
    private DebtRepository debtRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private SaleRepository saleRepository;
    @Mock
    private StockService stockService;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private DebtService debtService;

    private Item notebook;
    private Debt debt;

    @BeforeEach
    void setUp() {
        notebook = new Item();
        notebook.setId(3L);
        notebook.setName("Notebook");
        notebook.setUnitPrice(new BigDecimal("2500"));
        notebook.setStockQuantity(10);

        Customer customer = new Customer();
        customer.setId(1L);
        customer.setName("Mama Asha");

        debt = new Debt();
        debt.setId(9L);
        debt.setCustomer(customer);
        debt.setItem(notebook);
        debt.setQuantity(4);
        debt.setAmount(new BigDecimal("10000"));
        debt.setDueDate(LocalDate.of(2024, 5, 1));
    }

    @Test
    void resolveAmount_BlankOrZero_ShouldPriceFromItem() {
        assertEquals(new BigDecimal("7500"), DebtService.resolveAmount(null, new BigDecimal("2500"), 3));
        assertEquals(new BigDecimal("7500"), DebtService.resolveAmount(BigDecimal.ZERO, new BigDecimal("2500"), 3));
    }

    @Test
    void resolveAmount_EqualToUnitPrice_ShouldMultiply() {
        assertEquals(new BigDecimal("7500"),
                DebtService.resolveAmount(new BigDecimal("2500"), new BigDecimal("2500"), 3));
    }

    @Test
    void resolveAmount_OtherValue_ShouldBeTakenAsTotal() {
        assertEquals(new BigDecimal("6000"),
                DebtService.resolveAmount(new BigDecimal("6000"), new BigDecimal("2500"), 3));
    }

    @Test
    void deleteDebt_ManualWithoutSale_ShouldRestoreStock() {
        debt.setAutoCreated(false);
        when(debtRepository.findByIdForUpdate(9L)).thenReturn(Optional.of(debt));
        when(stockService.lockItem(3L)).thenReturn(notebook);

        debtService.deleteDebt(9L, Actor.SYSTEM);

        verify(stockService).restore(notebook, 4);
        verify(saleRepository).clearPaymentForDebt(9L);
        verify(paymentRepository).deleteByDebtId(9L);
        verify(debtRepository).delete(debt);
        verify(auditService).log(eq(Actor.SYSTEM), eq("DELETE_DEBT"), anyString());
    }

    @Test
    void deleteDebt_AutoCreated_ShouldLeaveStockAlone() {
        debt.setAutoCreated(true);
        debt.setSale(new Sale());
        when(debtRepository.findByIdForUpdate(9L)).thenReturn(Optional.of(debt));

        debtService.deleteDebt(9L, Actor.SYSTEM);

        verify(stockService, never()).restore(any(), anyInt());
        verify(debtRepository).delete(debt);
    }
}
