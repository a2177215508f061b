package com.stationery.tracker.service;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Row locks that always hand back current state. A locking query alone returns an instance
 * already in the persistence context as it was first read, so anything loaded earlier in the
 * transaction (through a line item or a sale) is re-read once the lock is held.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class EntityLocker {

    private final EntityManager entityManager;

    public EntityLocker(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public <T> Optional<T> lock(Class<T> type, Object id) {
        T entity = entityManager.find(type, id);
        if (entity == null) {
            return Optional.empty();
        }
        if (entityManager.getLockMode(entity) != LockModeType.PESSIMISTIC_WRITE) {
            // Own pending writes must reach the row before it is re-read
            entityManager.flush();
            entityManager.refresh(entity, LockModeType.PESSIMISTIC_WRITE);
        }
        return Optional.of(entity);
    }
}
