package com.stationery.tracker.service;

import com.stationery.tracker.model.AuditLog;
import com.stationery.tracker.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    // Own transaction: a failed audit write must not roll back the business change
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void log(Actor actor, String action, String details) {
        try {
            AuditLog log = new AuditLog();
            log.setAction(action);
            log.setDetails(details);
            log.setUsername(actor != null ? actor.username() : Actor.SYSTEM.username());
            auditLogRepository.save(log);
        } catch (Exception e) {
            logger.error("Failed to write audit log {}: {}", action, e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> recent(int page, int size) {
        return auditLogRepository.findAllByOrderByTimestampDesc(PageRequest.of(page, size));
    }
}
