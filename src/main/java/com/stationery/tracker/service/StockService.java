package com.stationery.tracker.service;

import com.stationery.tracker.dto.RestoredStock;
import com.stationery.tracker.exception.InsufficientStockException;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.model.Product;
import com.stationery.tracker.model.RetailLineItem;
import com.stationery.tracker.model.SaleLineItem;
import com.stationery.tracker.model.Stocked;
import com.stationery.tracker.model.WholesaleLineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Row-locked stock movements. Every method must run inside the caller's transaction so the
 * lock is held until the caller's other writes commit.
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class StockService {

    private static final Logger logger = LoggerFactory.getLogger(StockService.class);

    private final EntityLocker entityLocker;

    public StockService(EntityLocker entityLocker) {
        this.entityLocker = entityLocker;
    }

    public Item lockItem(Long itemId) {
        return entityLocker.lock(Item.class, itemId)
                .orElseThrow(() -> new NotFoundException("Item", itemId));
    }

    public Product lockProduct(Long productId) {
        Product product = entityLocker.lock(Product.class, productId)
                .orElseThrow(() -> new NotFoundException("Product", productId));
        if (product.getLinkedItem() != null) {
            lockItem(product.getLinkedItem().getId());
        }
        return product;
    }

    public Stocked lockFor(SaleLineItem line) {
        if (line instanceof RetailLineItem) {
            return lockItem(((RetailLineItem) line).getItem().getId());
        }
        return lockProduct(((WholesaleLineItem) line).getProduct().getId());
    }

    public void take(Stocked stocked, int quantity) {
        int available = stocked.availableStock();
        if (quantity > available) {
            throw new InsufficientStockException(stocked.getName(), available, quantity);
        }
        stocked.decreaseStock(quantity);
        logger.debug("Took {} {} of {} ({} left)", quantity, stocked.stockUnit(), stocked.getSku(),
                stocked.availableStock());
    }

    public void restore(Stocked stocked, int quantity) {
        stocked.increaseStock(quantity);
        logger.debug("Restored {} {} of {} ({} now)", quantity, stocked.stockUnit(), stocked.getSku(),
                stocked.availableStock());
    }

    /**
     * Puts back the quantity of every given line. Stock rows are locked in a fixed order
     * (items by id, then products by id) so concurrent sweeps cannot deadlock.
     */
    public List<RestoredStock> restoreAll(Collection<? extends SaleLineItem> lines) {
        List<SaleLineItem> ordered = new ArrayList<>(lines);
        ordered.sort(Comparator.comparing((SaleLineItem l) -> l.getType().ordinal())
                .thenComparing(l -> l.getStocked().getId()));

        List<RestoredStock> restored = new ArrayList<>();
        for (SaleLineItem line : ordered) {
            Stocked stocked = lockFor(line);
            restore(stocked, line.getQuantity());
            restored.add(new RestoredStock(line.getType(), stocked.getId(), stocked.getName(),
                    line.getQuantity(), stocked.stockUnit()));
        }
        return restored;
    }
}
