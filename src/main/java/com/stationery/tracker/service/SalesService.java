package com.stationery.tracker.service;

import com.stationery.tracker.config.TrackerProperties;
import com.stationery.tracker.dto.LineItemRequest;
import com.stationery.tracker.dto.LineItemUpdateRequest;
import com.stationery.tracker.dto.RestoredStock;
import com.stationery.tracker.dto.RetailLineRequest;
import com.stationery.tracker.dto.SaleDeletionResult;
import com.stationery.tracker.dto.SaleFilter;
import com.stationery.tracker.dto.SaleRequest;
import com.stationery.tracker.dto.SaleResponse;
import com.stationery.tracker.dto.SaleUpdateRequest;
import com.stationery.tracker.dto.SalesListing;
import com.stationery.tracker.dto.WholesaleLineRequest;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.Customer;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.PaymentMethod;
import com.stationery.tracker.model.Product;
import com.stationery.tracker.model.RetailLineItem;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.model.SaleKind;
import com.stationery.tracker.model.SaleLineItem;
import com.stationery.tracker.model.Stocked;
import com.stationery.tracker.model.WholesaleLineItem;
import com.stationery.tracker.repository.CustomerRepository;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.ExpenditureRepository;
import com.stationery.tracker.repository.SaleLineItemRepository;
import com.stationery.tracker.repository.SaleRepository;
import com.stationery.tracker.repository.SaleSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class SalesService {

    private static final Logger logger = LoggerFactory.getLogger(SalesService.class);

    private final SaleRepository saleRepository;
    private final SaleLineItemRepository lineItemRepository;
    private final CustomerRepository customerRepository;
    private final DebtRepository debtRepository;
    private final ExpenditureRepository expenditureRepository;
    private final StockService stockService;
    private final SaleTotalService saleTotalService;
    private final DebtSyncService debtSyncService;
    private final PaymentService paymentService;
    private final ProfitCalculator profitCalculator;
    private final UserService userService;
    private final AuditService auditService;
    private final TrackerProperties properties;

    public SalesService(SaleRepository saleRepository, SaleLineItemRepository lineItemRepository,
            CustomerRepository customerRepository, DebtRepository debtRepository,
            ExpenditureRepository expenditureRepository, StockService stockService,
            SaleTotalService saleTotalService, DebtSyncService debtSyncService, PaymentService paymentService,
            ProfitCalculator profitCalculator, UserService userService, AuditService auditService,
            TrackerProperties properties) {
        this.saleRepository = saleRepository;
        this.lineItemRepository = lineItemRepository;
        this.customerRepository = customerRepository;
        this.debtRepository = debtRepository;
        this.expenditureRepository = expenditureRepository;
        this.stockService = stockService;
        this.saleTotalService = saleTotalService;
        this.debtSyncService = debtSyncService;
        this.paymentService = paymentService;
        this.profitCalculator = profitCalculator;
        this.userService = userService;
        this.auditService = auditService;
        this.properties = properties;
    }

    @Transactional
    public Sale createSale(SaleRequest request, Actor actor) {
        Sale sale = new Sale();
        sale.setCustomer(resolveCustomer(request.customerId()));
        sale.setPaymentMethod(request.paymentMethod() != null ? request.paymentMethod() : PaymentMethod.CASH);
        sale.setPaid(request.paid() == null || request.paid());
        sale.setNotes(request.notes());
        sale.setKind(SaleKind.NORMAL);
        sale.setCreatedBy(userService.referenceFor(actor));
        sale = saleRepository.save(sale);

        // A failed stock check here rolls the new sale back with it
        if (request.firstLine() != null) {
            applyLine(sale, request.firstLine());
        }
        saleTotalService.recompute(sale);
        debtSyncService.syncForSale(sale);

        auditService.log(actor, "CREATE_SALE", "Sale #" + sale.getId() + " for " + sale.getCustomerName()
                + ", total " + sale.getTotalAmount());
        return sale;
    }

    @Transactional
    public Sale addLineItem(Long saleId, LineItemRequest request, Actor actor) {
        Sale sale = lockSale(saleId);
        requireNormal(sale);

        SaleLineItem line = applyLine(sale, request);
        saleTotalService.recompute(sale);
        debtSyncService.syncForSale(sale);

        auditService.log(actor, "ADD_LINE_ITEM", "Sale #" + saleId + ": " + request.quantity() + " x "
                + line.getItemName() + " @ " + line.getUnitPrice());
        return sale;
    }

    @Transactional
    public Sale updateLineItem(Long saleId, Long lineId, LineItemUpdateRequest request, Actor actor) {
        Sale sale = lockSale(saleId);
        requireNormal(sale);
        if (request.quantity() < 1) {
            throw new ValidationException("quantity", "Quantity must be at least 1");
        }
        SaleLineItem line = findLine(saleId, lineId);
        Stocked stocked = stockService.lockFor(line);

        int previous = line.getQuantity();
        int delta = request.quantity() - previous;
        if (delta > 0) {
            stockService.take(stocked, delta);
        } else if (delta < 0) {
            stockService.restore(stocked, -delta);
        }
        line.setQuantity(request.quantity());
        if (request.unitPrice() != null) {
            line.setUnitPrice(request.unitPrice());
        }
        line.refreshTotal();

        saleTotalService.recompute(sale);
        debtSyncService.syncForSale(sale);

        auditService.log(actor, "UPDATE_LINE_ITEM", "Sale #" + saleId + ": " + line.getItemName() + " "
                + previous + " -> " + line.getQuantity() + " @ " + line.getUnitPrice());
        return sale;
    }

    @Transactional
    public Sale removeLineItem(Long saleId, Long lineId, Actor actor) {
        Sale sale = lockSale(saleId);
        requireNormal(sale);
        SaleLineItem line = findLine(saleId, lineId);
        Stocked stocked = stockService.lockFor(line);

        stockService.restore(stocked, line.getQuantity());
        sale.getItems().remove(line);

        saleTotalService.recompute(sale);
        debtSyncService.syncForSale(sale);

        auditService.log(actor, "REMOVE_LINE_ITEM", "Sale #" + saleId + ": " + line.getQuantity() + " x "
                + line.getItemName() + " returned to stock");
        return sale;
    }

    @Transactional
    public List<RestoredStock> clearLineItems(Long saleId, Actor actor) {
        Sale sale = lockSale(saleId);
        requireNormal(sale);

        List<SaleLineItem> lines = lineItemRepository.findBySaleIdOrderById(saleId);
        List<RestoredStock> restored = stockService.restoreAll(lines);
        lineItemRepository.deleteAllBySaleIdIn(List.of(saleId));

        saleTotalService.recompute(saleId);
        Sale reloaded = getSale(saleId);
        debtSyncService.syncForSale(reloaded);

        auditService.log(actor, "CLEAR_LINE_ITEMS", "Sale #" + saleId + ": " + lines.size() + " lines removed");
        return restored;
    }

    @Transactional
    public Sale updateSale(Long saleId, SaleUpdateRequest request, Actor actor) {
        Sale sale = lockSale(saleId);
        if (sale.isPaymentRecord() && Boolean.FALSE.equals(request.paid())) {
            throw new ValidationException("paid", "A payment record cannot be marked unpaid");
        }
        sale.setCustomer(resolveCustomer(request.customerId()));
        if (request.paymentMethod() != null) {
            sale.setPaymentMethod(request.paymentMethod());
        }
        if (request.paid() != null) {
            sale.setPaid(request.paid());
        }
        sale.setNotes(request.notes());

        debtSyncService.syncForSale(sale);

        auditService.log(actor, "UPDATE_SALE", "Sale #" + saleId + ": customer " + sale.getCustomerName()
                + ", paid " + sale.isPaid() + ", method " + sale.getPaymentMethod());
        return sale;
    }

    @Transactional
    public SaleDeletionResult deleteSale(Long saleId, Actor actor) {
        return deleteSales(List.of(saleId), actor);
    }

    /**
     * Deletes sales in bulk. Before any delete statement runs, stock of every affected line
     * is restored, payment-record sales are reversed against their debt, and debts lose
     * their reference to the sales.
     */
    @Transactional
    public SaleDeletionResult deleteSales(Collection<Long> saleIds, Actor actor) {
        if (saleIds == null || saleIds.isEmpty()) {
            throw new ValidationException("No sales selected");
        }
        List<Long> ids = saleIds.stream().distinct().sorted().collect(Collectors.toList());

        List<Sale> sales = new ArrayList<>();
        for (Long id : ids) {
            sales.add(lockSale(id));
        }

        List<SaleLineItem> lines = lineItemRepository.findBySaleIdIn(ids);
        List<RestoredStock> restored = new ArrayList<>(stockService.restoreAll(lines));
        for (Sale sale : sales) {
            if (sale.isPaymentRecord()) {
                paymentService.reversePaymentSale(sale).ifPresent(restored::add);
            }
        }

        int detached = debtRepository.detachFromSales(ids);
        int deletedLines = lineItemRepository.deleteAllBySaleIdIn(ids);
        saleRepository.deleteAllByIdIn(ids);

        logger.info("Deleted sales {} ({} lines, {} debts detached)", ids, deletedLines, detached);
        SaleDeletionResult result = new SaleDeletionResult(ids, restored);
        auditService.log(actor, "DELETE_SALE", "Sales " + ids + ". " + result.summary());
        return result;
    }

    @Transactional(readOnly = true)
    public Sale getSale(Long saleId) {
        return saleRepository.findById(saleId).orElseThrow(() -> new NotFoundException("Sale", saleId));
    }

    @Transactional(readOnly = true)
    public SaleResponse toResponse(Sale sale) {
        return SaleResponse.from(sale, profitCalculator.profitOf(sale));
    }

    @Transactional(readOnly = true)
    public SalesListing listSales(SaleFilter filter) {
        Specification<Sale> spec = filterSpec(filter);

        List<Sale> matching = saleRepository.findAll(spec);
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal totalProfit = BigDecimal.ZERO;
        for (Sale sale : matching) {
            totalAmount = totalAmount.add(sale.getTotalAmount());
            totalProfit = totalProfit.add(profitCalculator.profitOf(sale));
        }

        LocalDate expenseFrom = filter.from() != null ? filter.from() : LocalDate.of(1970, 1, 1);
        LocalDate expenseTo = filter.to() != null ? filter.to() : LocalDate.of(9999, 12, 31);
        BigDecimal totalExpenditure = expenditureRepository.sumBetween(expenseFrom, expenseTo);

        Page<Sale> page = saleRepository.findAll(spec, PageRequest.of(Math.max(filter.page(), 0),
                SaleFilter.PAGE_SIZE, Sort.by(Sort.Direction.DESC, "saleDate")));

        return new SalesListing(
                page.map(this::toResponse).getContent(),
                page.getNumber(),
                page.getTotalPages(),
                page.getTotalElements(),
                totalAmount,
                totalProfit,
                totalExpenditure);
    }

    @Transactional(readOnly = true)
    public List<Sale> findSales(SaleFilter filter) {
        return saleRepository.findAll(filterSpec(filter), Sort.by(Sort.Direction.DESC, "saleDate"));
    }

    private Specification<Sale> filterSpec(SaleFilter filter) {
        Instant from = filter.from() != null
                ? filter.from().atStartOfDay(properties.getTimeZone()).toInstant() : null;
        Instant to = filter.to() != null
                ? filter.to().plusDays(1).atStartOfDay(properties.getTimeZone()).toInstant() : null;
        return Specification.where(SaleSpecifications.listable())
                .and(SaleSpecifications.soldBetween(from, to))
                .and(SaleSpecifications.paid(filter.paidFlag()))
                .and(SaleSpecifications.containsProduct(filter.product()));
    }

    // --- line handling ---

    // A merge adopts the new unit price
    private SaleLineItem applyLine(Sale sale, LineItemRequest request) {
        if (request.quantity() < 1) {
            throw new ValidationException("quantity", "Quantity must be at least 1");
        }
        if (request instanceof RetailLineRequest) {
            RetailLineRequest retail = (RetailLineRequest) request;
            Item item = stockService.lockItem(retail.itemId());
            BigDecimal price = retail.unitPrice() != null ? retail.unitPrice() : item.getUnitPrice();
            Optional<RetailLineItem> existing = lineItemRepository.findRetailLine(sale.getId(), item.getId());
            stockService.take(item, retail.quantity());
            if (existing.isPresent()) {
                return merge(existing.get(), retail.quantity(), price);
            }
            return attach(sale, new RetailLineItem(item), retail.quantity(), price);
        }
        if (request instanceof WholesaleLineRequest) {
            WholesaleLineRequest wholesale = (WholesaleLineRequest) request;
            Product product = stockService.lockProduct(wholesale.productId());
            BigDecimal price = wholesale.unitPrice() != null ? wholesale.unitPrice() : product.getSellingPrice();
            Optional<WholesaleLineItem> existing = lineItemRepository.findWholesaleLine(sale.getId(),
                    product.getId());
            stockService.take(product, wholesale.quantity());
            if (existing.isPresent()) {
                return merge(existing.get(), wholesale.quantity(), price);
            }
            return attach(sale, new WholesaleLineItem(product), wholesale.quantity(), price);
        }
        throw new ValidationException("type", "Unknown line item type");
    }

    private SaleLineItem merge(SaleLineItem line, int additional, BigDecimal price) {
        line.setQuantity(line.getQuantity() + additional);
        line.setUnitPrice(price);
        line.refreshTotal();
        logger.debug("Merged {} into line #{} of sale #{}", additional, line.getId(), line.getSale().getId());
        return line;
    }

    private SaleLineItem attach(Sale sale, SaleLineItem line, int quantity, BigDecimal price) {
        line.setSale(sale);
        line.setQuantity(quantity);
        line.setUnitPrice(price);
        line.refreshTotal();
        sale.getItems().add(line);
        return lineItemRepository.save(line);
    }

    private Sale lockSale(Long saleId) {
        return saleRepository.findByIdForUpdate(saleId).orElseThrow(() -> new NotFoundException("Sale", saleId));
    }

    private SaleLineItem findLine(Long saleId, Long lineId) {
        return lineItemRepository.findByIdAndSaleId(lineId, saleId)
                .orElseThrow(() -> new NotFoundException("Sale line item", lineId));
    }

    private static void requireNormal(Sale sale) {
        if (sale.isPaymentRecord()) {
            throw new ValidationException("Sale #" + sale.getId() + " records a debt payment and has no line items");
        }
    }

    private Customer resolveCustomer(Long customerId) {
        if (customerId == null) {
            return null;
        }
        return customerRepository.findById(customerId)
                .orElseThrow(() -> new NotFoundException("Customer", customerId));
    }
}
