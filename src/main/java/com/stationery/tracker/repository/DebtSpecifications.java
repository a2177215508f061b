package com.stationery.tracker.repository;

import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;
import jakarta.persistence.criteria.Join;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;

public final class DebtSpecifications {

    private DebtSpecifications() {
    }

    // OVERDUE is never stored: unpaid and due before today
    public static Specification<Debt> hasStatus(DebtStatus status, LocalDate today) {
        return (root, query, cb) -> {
            if (status == null) {
                return null;
            }
            if (status == DebtStatus.OVERDUE) {
                return cb.and(
                        cb.lessThan(root.get("dueDate"), today),
                        root.get("status").in(DebtStatus.PENDING, DebtStatus.PARTIAL));
            }
            return cb.equal(root.get("status"), status);
        };
    }

    public static Specification<Debt> forCustomer(Long customerId) {
        return (root, query, cb) -> customerId == null ? null
                : cb.equal(root.get("customer").get("id"), customerId);
    }

    public static Specification<Debt> matches(String search, boolean includeCustomerName) {
        return (root, query, cb) -> {
            if (search == null || search.isBlank()) {
                return null;
            }
            String pattern = "%" + search.trim().toLowerCase() + "%";
            if (!includeCustomerName) {
                return cb.like(cb.lower(root.get("description")), pattern);
            }
            Join<Object, Object> customer = root.join("customer");
            return cb.or(
                    cb.like(cb.lower(root.get("description")), pattern),
                    cb.like(cb.lower(customer.get("name")), pattern));
        };
    }
}
