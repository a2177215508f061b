package com.stationery.tracker.service;

import com.stationery.tracker.dto.DebtFilter;
import com.stationery.tracker.dto.DebtListing;
import com.stationery.tracker.dto.DebtRequest;
import com.stationery.tracker.dto.DebtResponse;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.model.Customer;
import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.Payment;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.repository.CustomerRepository;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.DebtSpecifications;
import com.stationery.tracker.repository.PaymentRepository;
import com.stationery.tracker.repository.SaleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class DebtService {

    private static final Logger logger = LoggerFactory.getLogger(DebtService.class);

    private final DebtRepository debtRepository;
    private final PaymentRepository paymentRepository;
    private final CustomerRepository customerRepository;
    private final SaleRepository saleRepository;
    private final StockService stockService;
    private final UserService userService;
    private final AuditService auditService;
    private final Clock clock;

    public DebtService(DebtRepository debtRepository, PaymentRepository paymentRepository,
            CustomerRepository customerRepository, SaleRepository saleRepository, StockService stockService,
            UserService userService, AuditService auditService, Clock clock) {
        this.debtRepository = debtRepository;
        this.paymentRepository = paymentRepository;
        this.customerRepository = customerRepository;
        this.saleRepository = saleRepository;
        this.stockService = stockService;
        this.userService = userService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public Debt createDebt(DebtRequest request, Actor actor) {
        Customer customer = customerRepository.findById(request.customerId())
                .orElseThrow(() -> new NotFoundException("Customer", request.customerId()));
        Item item = stockService.lockItem(request.itemId());
        Sale sale = request.saleId() == null ? null
                : saleRepository.findById(request.saleId())
                        .orElseThrow(() -> new NotFoundException("Sale", request.saleId()));

        stockService.take(item, request.quantity());

        Debt debt = new Debt();
        debt.setCustomer(customer);
        debt.setSale(sale);
        debt.setItem(item);
        debt.setQuantity(request.quantity());
        debt.setAmount(resolveAmount(request.amount(), item.getUnitPrice(), request.quantity()));
        debt.setPaidAmount(BigDecimal.ZERO);
        debt.setDueDate(request.dueDate());
        debt.setStatus(DebtStatus.PENDING);
        debt.setAutoCreated(false);
        debt.setDescription(request.description());
        debt.setCreatedBy(userService.referenceFor(actor));
        Debt saved = debtRepository.save(debt);

        auditService.log(actor, "CREATE_DEBT", "Debt #" + saved.getId() + ": " + customer.getName() + ", "
                + item.getName() + " x" + saved.getQuantity() + ", amount " + saved.getAmount());
        return saved;
    }

    /**
     * Blank or zero means "price it from the item"; an amount equal to the unit price is
     * read as per-unit and multiplied.
     */
    static BigDecimal resolveAmount(BigDecimal entered, BigDecimal unitPrice, int quantity) {
        BigDecimal price = unitPrice != null ? unitPrice : BigDecimal.ZERO;
        if (entered == null || entered.signum() == 0) {
            return price.multiply(BigDecimal.valueOf(quantity));
        }
        if (entered.compareTo(price) == 0) {
            return entered.multiply(BigDecimal.valueOf(quantity));
        }
        return entered;
    }

    @Transactional(readOnly = true)
    public Debt getDebt(Long id) {
        return debtRepository.findById(id).orElseThrow(() -> new NotFoundException("Debt", id));
    }

    public DebtResponse toResponse(Debt debt) {
        return DebtResponse.from(debt, LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public List<Payment> paymentsOf(Long debtId) {
        getDebt(debtId);
        return paymentRepository.findByDebtIdOrderByPaymentDateDesc(debtId);
    }

    @Transactional(readOnly = true)
    public DebtListing listDebts(DebtFilter filter) {
        LocalDate today = LocalDate.now(clock);
        Specification<Debt> spec = Specification
                .where(DebtSpecifications.hasStatus(filter.status(), today))
                .and(DebtSpecifications.forCustomer(filter.customerId()))
                .and(DebtSpecifications.matches(filter.search(), filter.customerId() == null));

        List<Debt> matching = debtRepository.findAll(spec);
        BigDecimal totalAmount = matching.stream().map(Debt::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalPaid = matching.stream().map(Debt::getPaidAmount).reduce(BigDecimal.ZERO, BigDecimal::add);

        int page = Math.max(filter.page(), 0);
        Page<Debt> debts = debtRepository.findAll(spec,
                PageRequest.of(page, DebtFilter.PAGE_SIZE, Sort.by(Sort.Direction.DESC, "createdAt")));

        return new DebtListing(
                debts.map(d -> DebtResponse.from(d, today)).getContent(),
                debts.getNumber(),
                debts.getTotalPages(),
                debts.getTotalElements(),
                totalAmount,
                totalPaid,
                totalAmount.subtract(totalPaid));
    }

    @Transactional
    public void deleteDebt(Long id, Actor actor) {
        Debt debt = debtRepository.findByIdForUpdate(id).orElseThrow(() -> new NotFoundException("Debt", id));
        if (!debt.isAutoCreated() && debt.getSale() == null) {
            stockService.restore(stockService.lockItem(debt.getItem().getId()), debt.getQuantity());
        }
        discard(debt);
        auditService.log(actor, "DELETE_DEBT", "Debt #" + id + ": " + debt.getCustomer().getName()
                + ", amount " + debt.getAmount());
    }

    @Transactional
    public void discard(Debt debt) {
        int unlinked = saleRepository.clearPaymentForDebt(debt.getId());
        int payments = paymentRepository.deleteByDebtId(debt.getId());
        debtRepository.delete(debt);
        logger.debug("Deleted debt #{} ({} payments, {} payment sales unlinked)", debt.getId(), payments, unlinked);
    }
}
