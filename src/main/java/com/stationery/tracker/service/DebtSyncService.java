package com.stationery.tracker.service;

import com.stationery.tracker.config.TrackerProperties;
import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.model.SaleLineItem;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.SaleLineItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the debt of a sale in line with the sale's customer, total and paid flag.
 *
 * <ul>
 * <li>No customer or a zero total: the auto-created debt of the sale is removed.</li>
 * <li>Paid: the linked debt is settled in full, except for payment-record sales, whose
 * debt is managed by {@link PaymentService}.</li>
 * <li>Unpaid with a customer: a debt is created, or its amount, customer and item
 * refreshed. The paid amount is never touched.</li>
 * </ul>
 */
@Service
public class DebtSyncService {

    private static final Logger logger = LoggerFactory.getLogger(DebtSyncService.class);

    static final String AUTO_DESCRIPTION_PREFIX = "Auto-created from sale #";

    private final DebtRepository debtRepository;
    private final SaleLineItemRepository lineItemRepository;
    private final InventoryService inventoryService;
    private final DebtService debtService;
    private final EntityLocker entityLocker;
    private final TrackerProperties properties;

    public DebtSyncService(DebtRepository debtRepository, SaleLineItemRepository lineItemRepository,
            InventoryService inventoryService, DebtService debtService, EntityLocker entityLocker,
            TrackerProperties properties) {
        this.debtRepository = debtRepository;
        this.lineItemRepository = lineItemRepository;
        this.inventoryService = inventoryService;
        this.debtService = debtService;
        this.entityLocker = entityLocker;
        this.properties = properties;
    }

    @Transactional
    public Optional<Debt> syncForSale(Sale sale) {
        if (sale.getCustomer() == null || sale.getTotalAmount().signum() <= 0) {
            removeAutoDebts(sale);
            return Optional.empty();
        }

        if (sale.isPaid() && sale.isPaymentRecord()) {
            return Optional.empty();
        }

        // Locked and re-read, so a payment committed since the debt was first loaded is kept
        Optional<Debt> linked = debtRepository.findBySaleIdOrderByIdAsc(sale.getId()).stream().findFirst()
                .flatMap(found -> entityLocker.lock(Debt.class, found.getId()));

        if (sale.isPaid()) {
            linked.ifPresent(debt -> {
                debt.setPaidAmount(debt.getAmount());
                debt.setStatus(DebtStatus.PAID);
                logger.info("Debt #{} settled by paid sale #{}", debt.getId(), sale.getId());
            });
            return linked;
        }

        List<SaleLineItem> lines = lineItemRepository.findBySaleIdOrderById(sale.getId());
        SaleLineItem first = lines.isEmpty() ? null : lines.get(0);

        Debt debt;
        if (linked.isEmpty()) {
            debt = new Debt();
            debt.setSale(sale);
            debt.setCustomer(sale.getCustomer());
            debt.setCreatedBy(sale.getCreatedBy());
            debt.setAmount(sale.getTotalAmount());
            debt.setDueDate(dueDateFor(sale.getSaleDate()));
            debt.setStatus(DebtStatus.PENDING);
            debt.setAutoCreated(true);
            debt.setDescription(AUTO_DESCRIPTION_PREFIX + sale.getId());
            applyItem(debt, first);
            debt = debtRepository.save(debt);
            logger.info("Auto-created debt #{} of {} for sale #{}", debt.getId(), debt.getAmount(), sale.getId());
        } else {
            debt = linked.get();
            debt.setCustomer(sale.getCustomer());
            debt.setAmount(sale.getTotalAmount());
            if (first != null || debt.getItem() == null) {
                applyItem(debt, first);
            }
            debt.recomputeStatus();
            if (debt.isAutoCreated()) {
                debt.setDueDate(dueDateFor(sale.getSaleDate()));
            }
        }
        return Optional.of(debt);
    }

    public LocalDate dueDateFor(Instant saleDate) {
        return saleDate.atZone(properties.getTimeZone()).toLocalDate()
                .plusDays(properties.getDebt().getDueDays());
    }

    @Transactional
    public int realignAutoDebtDueDates() {
        int changed = 0;
        for (Debt debt : debtRepository.findByAutoCreatedTrueAndSaleIsNotNull()) {
            LocalDate expected = dueDateFor(debt.getSale().getSaleDate());
            if (!expected.equals(debt.getDueDate())) {
                logger.info("Debt #{}: due date {} -> {}", debt.getId(), debt.getDueDate(), expected);
                debt.setDueDate(expected);
                changed++;
            }
        }
        return changed;
    }

    private void removeAutoDebts(Sale sale) {
        for (Debt debt : debtRepository.findBySaleIdOrderByIdAsc(sale.getId())) {
            if (debt.isAutoCreated()) {
                logger.info("Removing auto-created debt #{}: sale #{} no longer owes anything",
                        debt.getId(), sale.getId());
                debtService.discard(debt);
            }
        }
    }

    private void applyItem(Debt debt, SaleLineItem first) {
        Item item = first != null ? first.getDebtItem() : null;
        if (item == null) {
            debt.setItem(inventoryService.miscellaneousItem());
            debt.setQuantity(first != null ? first.getQuantity() : 1);
        } else {
            debt.setItem(item);
            debt.setQuantity(first.getDebtItemQuantity());
        }
    }
}
