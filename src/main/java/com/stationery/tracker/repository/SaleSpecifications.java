package com.stationery.tracker.repository;

import com.stationery.tracker.model.RetailLineItem;
import com.stationery.tracker.model.Sale;
import com.stationery.tracker.model.SaleKind;
import com.stationery.tracker.model.WholesaleLineItem;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

public final class SaleSpecifications {

    private SaleSpecifications() {
    }

    // Half-open [from, to); either bound may be null
    public static Specification<Sale> soldBetween(Instant from, Instant to) {
        return (root, query, cb) -> {
            if (from == null && to == null) {
                return null;
            }
            if (from == null) {
                return cb.lessThan(root.get("saleDate"), to);
            }
            if (to == null) {
                return cb.greaterThanOrEqualTo(root.get("saleDate"), from);
            }
            return cb.and(
                    cb.greaterThanOrEqualTo(root.get("saleDate"), from),
                    cb.lessThan(root.get("saleDate"), to));
        };
    }

    public static Specification<Sale> listable() {
        return (root, query, cb) -> cb.or(
                cb.equal(root.get("kind"), SaleKind.PAYMENT_RECORD),
                cb.isNotEmpty(root.get("items")));
    }

    public static Specification<Sale> hasLines() {
        return (root, query, cb) -> cb.isNotEmpty(root.get("items"));
    }

    public static Specification<Sale> paid(Boolean paid) {
        return (root, query, cb) -> paid == null ? null : cb.equal(root.get("paid"), paid);
    }

    public static Specification<Sale> containsProduct(String name) {
        return (root, query, cb) -> {
            if (name == null || name.isBlank()) {
                return null;
            }
            String pattern = "%" + name.trim().toLowerCase() + "%";

            Subquery<Long> retail = query.subquery(Long.class);
            Root<RetailLineItem> r = retail.from(RetailLineItem.class);
            retail.select(r.get("id")).where(
                    cb.equal(r.get("sale"), root),
                    cb.like(cb.lower(r.get("item").get("name")), pattern));

            Subquery<Long> wholesale = query.subquery(Long.class);
            Root<WholesaleLineItem> w = wholesale.from(WholesaleLineItem.class);
            wholesale.select(w.get("id")).where(
                    cb.equal(w.get("sale"), root),
                    cb.like(cb.lower(w.get("product").get("name")), pattern));

            return cb.or(cb.exists(retail), cb.exists(wholesale));
        };
    }
}
