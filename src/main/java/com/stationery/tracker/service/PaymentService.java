package com.stationery.tracker.service;

import com.stationery.tracker.dto.RestoredStock;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.LineItemType;
import com.stationery.tracker.model.Payment;
import com.stationery.tracker.model.PaymentMethod;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.model.SaleKind;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.PaymentRepository;
import com.stationery.tracker.repository.SaleRepository;
import com.stationery.tracker.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private final DebtRepository debtRepository;
    private final PaymentRepository paymentRepository;
    private final SaleRepository saleRepository;
    private final StockService stockService;
    private final EntityLocker entityLocker;
    private final UserService userService;
    private final SettingsService settingsService;
    private final AuditService auditService;

    public PaymentService(DebtRepository debtRepository, PaymentRepository paymentRepository,
            SaleRepository saleRepository, StockService stockService, EntityLocker entityLocker,
            UserService userService, SettingsService settingsService, AuditService auditService) {
        this.debtRepository = debtRepository;
        this.paymentRepository = paymentRepository;
        this.saleRepository = saleRepository;
        this.stockService = stockService;
        this.entityLocker = entityLocker;
        this.userService = userService;
        this.settingsService = settingsService;
        this.auditService = auditService;
    }

    @Transactional
    public Payment recordPayment(Long debtId, BigDecimal amount, PaymentMethod method, String notes, Actor actor) {
        Debt debt = debtRepository.findByIdForUpdate(debtId).orElseThrow(() -> new NotFoundException("Debt", debtId));

        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("amount", "Payment amount must be greater than zero");
        }
        BigDecimal remaining = debt.getRemainingAmount();
        if (amount.compareTo(remaining) > 0) {
            throw new ValidationException("amount", "Payment amount cannot exceed the remaining debt amount of "
                    + settingsService.getCurrency() + " " + Amounts.format(remaining));
        }

        PaymentMethod paymentMethod = method != null ? method : PaymentMethod.CASH;

        Payment payment = new Payment();
        payment.setDebt(debt);
        payment.setAmount(amount);
        payment.setPaymentMethod(paymentMethod);
        payment.setNotes(notes);
        payment.setRecordedBy(userService.referenceFor(actor));
        Payment saved = paymentRepository.save(payment);

        debt.setPaidAmount(debt.getPaidAmount().add(amount));
        debt.recomputeStatus();

        Sale sale = new Sale();
        sale.setKind(SaleKind.PAYMENT_RECORD);
        sale.setPaymentForDebt(debt);
        sale.setCustomer(debt.getCustomer());
        sale.setTotalAmount(amount);
        sale.setPaymentMethod(paymentMethod);
        sale.setPaid(true);
        sale.setNotes(paymentSaleNotes(debt));
        sale.setCreatedBy(userService.referenceFor(actor));
        Sale paymentSale = saleRepository.save(sale);

        logger.info("Payment of {} on debt #{} ({} -> {}), booked as sale #{}", amount, debt.getId(),
                remaining, debt.getRemainingAmount(), paymentSale.getId());
        auditService.log(actor, "RECORD_PAYMENT", "Debt #" + debt.getId() + ": " + amount + " via "
                + paymentMethod.getLabel() + ", status " + debt.getStatus());
        return saved;
    }

    /**
     * Undoes a payment-record sale that is being deleted: the debt's item gets its quantity
     * back and the paid amount drops by the sale total, never below zero.
     */
    @Transactional
    public Optional<RestoredStock> reversePaymentSale(Sale sale) {
        if (!sale.isPaymentRecord() || sale.getPaymentForDebt() == null) {
            return Optional.empty();
        }
        Long debtId = sale.getPaymentForDebt().getId();
        // Stock row before debt row, the order sale edits take them in
        stockService.lockItem(sale.getPaymentForDebt().getItem().getId());
        Optional<Debt> found = entityLocker.lock(Debt.class, debtId);
        if (found.isEmpty()) {
            logger.warn("Payment sale #{} points at missing debt #{}", sale.getId(), debtId);
            return Optional.empty();
        }
        Debt debt = found.get();

        Item item = stockService.lockItem(debt.getItem().getId());
        stockService.restore(item, debt.getQuantity());

        BigDecimal paid = debt.getPaidAmount().subtract(sale.getTotalAmount());
        debt.setPaidAmount(paid.signum() < 0 ? BigDecimal.ZERO : paid);
        debt.recomputeStatus();

        logger.info("Reversed payment sale #{}: debt #{} paid now {}, status {}", sale.getId(), debt.getId(),
                debt.getPaidAmount(), debt.getStatus());
        return Optional.of(new RestoredStock(LineItemType.RETAIL, item.getId(), item.getName(),
                debt.getQuantity(), item.stockUnit()));
    }

    // Payment for Debt #7: Blue Pen (Qty: 3) - Total: TZS 1,500 - description
    String paymentSaleNotes(Debt debt) {
        StringBuilder notes = new StringBuilder("Payment for Debt #").append(debt.getId()).append(": ")
                .append(debt.getItem().getName());
        if (debt.getQuantity() > 1) {
            notes.append(" (Qty: ").append(debt.getQuantity()).append(")");
        }
        notes.append(" - Total: ").append(settingsService.getCurrency()).append(" ")
                .append(Amounts.format(debt.getAmount()));
        if (debt.getDescription() != null && !debt.getDescription().isBlank()) {
            notes.append(" - ").append(debt.getDescription());
        }
        return notes.toString();
    }
}
