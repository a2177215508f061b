package com.stationery.tracker.service;

import com.stationery.tracker.dto.ItemRequest;
import com.stationery.tracker.dto.LowStockEntry;
import com.stationery.tracker.dto.ProductRequest;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.Category;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.Product;
import com.stationery.tracker.model.UnitType;
import com.stationery.tracker.repository.CategoryRepository;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.ItemRepository;
import com.stationery.tracker.repository.ProductRepository;
import com.stationery.tracker.repository.SaleLineItemRepository;
import com.stationery.tracker.repository.SupplierRepository;
import com.stationery.tracker.util.SkuGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class InventoryService {

    public static final String MISC_DEBT_SKU = "MISC-DEBT";

    private static final Logger logger = LoggerFactory.getLogger(InventoryService.class);

    private final ItemRepository itemRepository;
    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final SupplierRepository supplierRepository;
    private final DebtRepository debtRepository;
    private final SaleLineItemRepository lineItemRepository;
    private final StockService stockService;
    private final SkuGenerator skuGenerator;
    private final AuditService auditService;
    private final Clock clock;

    public InventoryService(ItemRepository itemRepository, ProductRepository productRepository,
            CategoryRepository categoryRepository, SupplierRepository supplierRepository,
            DebtRepository debtRepository, SaleLineItemRepository lineItemRepository, StockService stockService,
            SkuGenerator skuGenerator, AuditService auditService, Clock clock) {
        this.itemRepository = itemRepository;
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.supplierRepository = supplierRepository;
        this.debtRepository = debtRepository;
        this.lineItemRepository = lineItemRepository;
        this.stockService = stockService;
        this.skuGenerator = skuGenerator;
        this.auditService = auditService;
        this.clock = clock;
    }

    // --- Items ---

    @Transactional(readOnly = true)
    public List<Item> listItems(String search) {
        if (search != null && !search.isBlank()) {
            return itemRepository.findByNameContainingIgnoreCaseOrderByNameAsc(search.trim());
        }
        return itemRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Item getItem(Long id) {
        return itemRepository.findById(id).orElseThrow(() -> new NotFoundException("Item", id));
    }

    @Transactional
    public Item createItem(ItemRequest request, Actor actor) {
        Item item = new Item();
        applyItem(item, request);
        if (isBlank(request.sku())) {
            item.setSku(nextItemSku(item));
        } else {
            if (itemRepository.existsBySku(request.sku().trim())) {
                throw new ValidationException("sku", "SKU already exists: " + request.sku());
            }
            item.setSku(request.sku().trim());
        }
        item.setStockQuantity(request.stockQuantity());
        Item saved = itemRepository.save(item);
        auditService.log(actor, "CREATE_ITEM", "Item: " + saved.getName() + " (" + saved.getSku() + ")");
        return saved;
    }

    @Transactional
    public Item updateItem(Long id, ItemRequest request, Actor actor) {
        Item item = stockService.lockItem(id);
        if (!isBlank(request.sku()) && itemRepository.existsBySkuAndIdNot(request.sku().trim(), id)) {
            throw new ValidationException("sku", "SKU already exists: " + request.sku());
        }
        applyItem(item, request);
        if (isBlank(request.sku())) {
            if (isBlank(item.getSku())) {
                item.setSku(nextItemSku(item));
            }
        } else {
            item.setSku(request.sku().trim());
        }
        item.setStockQuantity(request.stockQuantity());
        auditService.log(actor, "UPDATE_ITEM", "Item: " + item.getName() + " (" + item.getSku() + ")");
        return item;
    }

    @Transactional
    public Item adjustItemStock(Long id, int delta, String reason, Actor actor) {
        Item item = stockService.lockItem(id);
        if (delta < 0) {
            stockService.take(item, -delta);
        } else {
            stockService.restore(item, delta);
        }
        auditService.log(actor, "ADJUST_STOCK",
                "Item " + item.getSku() + ": " + signed(delta) + " units" + reasonSuffix(reason));
        return item;
    }

    @Transactional
    public void deleteItem(Long id, Actor actor) {
        Item item = getItem(id);
        if (debtRepository.existsByItemId(id)) {
            throw new ValidationException("Cannot delete " + item.getName() + ": it is referenced by a debt");
        }
        if (lineItemRepository.existsByItemId(id)) {
            throw new ValidationException("Cannot delete " + item.getName() + ": it appears on recorded sales");
        }
        productRepository.findByLinkedItemId(id).ifPresent(product -> product.setLinkedItem(null));
        itemRepository.delete(item);
        auditService.log(actor, "DELETE_ITEM", "Item: " + item.getName() + " (" + item.getSku() + ")");
    }

    // --- Products ---

    @Transactional(readOnly = true)
    public List<Product> listProducts() {
        return productRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Product getProduct(Long id) {
        return productRepository.findById(id).orElseThrow(() -> new NotFoundException("Product", id));
    }

    @Transactional
    public Product createProduct(ProductRequest request, Actor actor) {
        Product product = new Product();
        applyProduct(product, request);
        if (isBlank(request.sku())) {
            product.setSku(nextProductSku(product));
        } else {
            if (productRepository.existsBySku(request.sku().trim())) {
                throw new ValidationException("sku", "SKU already exists: " + request.sku());
            }
            product.setSku(request.sku().trim());
        }
        product.setCartonsInStock(request.cartonsInStock());
        Product saved = productRepository.save(product);

        if (saved.getLinkedItem() == null) {
            saved.setLinkedItem(createLinkedItem(saved));
        }
        saved.syncLinkedItemStock();
        auditService.log(actor, "CREATE_PRODUCT", "Product: " + saved.getName() + " (" + saved.getSku() + ")");
        return saved;
    }

    @Transactional
    public Product updateProduct(Long id, ProductRequest request, Actor actor) {
        Product product = stockService.lockProduct(id);
        if (!isBlank(request.sku()) && productRepository.existsBySkuAndIdNot(request.sku().trim(), id)) {
            throw new ValidationException("sku", "SKU already exists: " + request.sku());
        }
        applyProduct(product, request);
        if (!isBlank(request.sku())) {
            product.setSku(request.sku().trim());
        }
        product.setCartonsInStock(request.cartonsInStock());
        product.syncLinkedItemStock();
        auditService.log(actor, "UPDATE_PRODUCT", "Product: " + product.getName() + " (" + product.getSku() + ")");
        return product;
    }

    @Transactional
    public Product adjustProductCartons(Long id, int delta, String reason, Actor actor) {
        Product product = stockService.lockProduct(id);
        if (delta < 0) {
            stockService.take(product, -delta);
        } else {
            stockService.restore(product, delta);
        }
        auditService.log(actor, "ADJUST_STOCK",
                "Product " + product.getSku() + ": " + signed(delta) + " cartons" + reasonSuffix(reason));
        return product;
    }

    @Transactional
    public void deleteProduct(Long id, Actor actor) {
        Product product = getProduct(id);
        if (lineItemRepository.existsByProductId(id)) {
            throw new ValidationException("Cannot delete " + product.getName() + ": it appears on recorded sales");
        }
        productRepository.delete(product);
        auditService.log(actor, "DELETE_PRODUCT", "Product: " + product.getName() + " (" + product.getSku() + ")");
    }

    // --- Derived views ---

    @Transactional(readOnly = true)
    public List<LowStockEntry> lowStock() {
        List<LowStockEntry> entries = new ArrayList<>();
        for (Product product : productRepository.findLowStock()) {
            entries.add(LowStockEntry.of(product));
        }
        Set<Long> mirrored = new HashSet<>(productRepository.findLinkedItemIds());
        for (Item item : itemRepository.findLowStock()) {
            if (!mirrored.contains(item.getId())) {
                entries.add(LowStockEntry.of(item));
            }
        }
        return entries;
    }

    // Inactive so it stays out of listings and low-stock alerts
    @Transactional
    public Item miscellaneousItem() {
        return itemRepository.findBySku(MISC_DEBT_SKU).orElseGet(() -> {
            Item misc = new Item();
            misc.setName("Miscellaneous Debt");
            misc.setSku(MISC_DEBT_SKU);
            misc.setCategory(categoryRepository.findAll().stream().findFirst().orElse(null));
            misc.setUnitPrice(new BigDecimal("0.01"));
            misc.setCostPrice(new BigDecimal("0.01"));
            misc.setStockQuantity(0);
            misc.setMinimumStock(0);
            misc.setActive(false);
            logger.info("Creating placeholder item {}", MISC_DEBT_SKU);
            return itemRepository.save(misc);
        });
    }

    // --- helpers ---

    private void applyItem(Item item, ItemRequest request) {
        item.setName(request.name().trim());
        item.setDescription(request.description());
        item.setCategory(resolveCategory(request.categoryId()));
        item.setUnitPrice(request.unitPrice());
        item.setCostPrice(request.costPrice());
        if (request.minimumStock() != null) {
            item.setMinimumStock(request.minimumStock());
        }
        item.setSupplierName(request.supplierName());
        if (request.active() != null) {
            item.setActive(request.active());
        }
    }

    private void applyProduct(Product product, ProductRequest request) {
        product.setName(request.name().trim());
        product.setDescription(request.description());
        product.setCategory(resolveCategory(request.categoryId()));
        product.setSupplier(request.supplierId() == null ? null
                : supplierRepository.findById(request.supplierId())
                        .orElseThrow(() -> new NotFoundException("Supplier", request.supplierId())));
        product.setSupplierPrice(request.supplierPrice());
        product.setSellingPrice(request.sellingPrice());
        product.setUnitsPerCarton(request.unitsPerCarton());
        product.setCartonWeight(request.cartonWeight());
        product.setUnitType(request.unitType() != null ? request.unitType() : UnitType.CARTON);
        if (request.minimumCartons() != null) {
            product.setMinimumCartons(request.minimumCartons());
        }
        product.setNotes(request.notes());
        if (request.active() != null) {
            product.setActive(request.active());
        }
    }

    private Item createLinkedItem(Product product) {
        Item item = new Item();
        item.setName(product.getName());
        item.setDescription(product.getDescription());
        item.setCategory(product.getCategory());
        item.setSku(itemRepository.existsBySku(product.getSku()) ? nextItemSku(item) : product.getSku());
        item.setUnitPrice(product.getSellingPrice());
        item.setCostPrice(product.getSupplierPrice());
        item.setStockQuantity(product.getTotalUnitsInStock());
        item.setMinimumStock(product.getMinimumCartons() * product.getUnitsPerCarton());
        item.setSupplierName(product.getSupplier() != null ? product.getSupplier().getName() : null);
        item.setActive(product.isActive());
        return itemRepository.save(item);
    }

    private Category resolveCategory(Long categoryId) {
        if (categoryId == null) {
            return null;
        }
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new NotFoundException("Category", categoryId));
    }

    private String nextItemSku(Item item) {
        LocalDate today = LocalDate.now(clock);
        long createdToday = itemRepository.countByCreatedAtBetween(today.atStartOfDay(),
                today.plusDays(1).atStartOfDay());
        return skuGenerator.generate(categoryName(item.getCategory()), item.getName(), today, createdToday,
                itemRepository::existsBySku);
    }

    private String nextProductSku(Product product) {
        LocalDate today = LocalDate.now(clock);
        long createdToday = productRepository.countByCreatedAtBetween(today.atStartOfDay(),
                today.plusDays(1).atStartOfDay());
        return skuGenerator.generate(categoryName(product.getCategory()), product.getName(), today, createdToday,
                productRepository::existsBySku);
    }

    private static String categoryName(Category category) {
        return category != null ? category.getName() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String signed(int delta) {
        return delta >= 0 ? "+" + delta : String.valueOf(delta);
    }

    private static String reasonSuffix(String reason) {
        return isBlank(reason) ? "" : " (" + reason + ")";
    }
}
