package com.stationery.tracker.service;

import com.stationery.tracker.config.TrackerProperties;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;
import com.stationery.tracker.notification.BulkReminderResult;
import com.stationery.tracker.notification.DeliveryResult;
import com.stationery.tracker.notification.NotificationChannel;
import com.stationery.tracker.notification.NotificationGateway;
import com.stationery.tracker.notification.ReminderMessageRenderer;
import com.stationery.tracker.notification.ReminderResult;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.util.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.thymeleaf.exceptions.TemplateEngineException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class DebtReminderService {

    private static final Logger logger = LoggerFactory.getLogger(DebtReminderService.class);

    static final String NO_PHONE = "Customer has no phone number";

    private final DebtRepository debtRepository;
    private final ReminderMessageRenderer renderer;
    private final Map<NotificationChannel, NotificationGateway> gateways = new EnumMap<>(NotificationChannel.class);
    private final AuditService auditService;
    private final TrackerProperties properties;
    private final Clock clock;

    public DebtReminderService(DebtRepository debtRepository, ReminderMessageRenderer renderer,
            List<NotificationGateway> gateways, AuditService auditService, TrackerProperties properties,
            Clock clock) {
        this.debtRepository = debtRepository;
        this.renderer = renderer;
        for (NotificationGateway gateway : gateways) {
            this.gateways.put(gateway.channel(), gateway);
        }
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Debt> reminderCandidates() {
        return debtRepository.findReminderCandidates(DebtStatus.PAID);
    }

    @Transactional(readOnly = true)
    public ReminderResult sendReminder(Long debtId, NotificationChannel channel, Actor actor) {
        Debt debt = debtRepository.findById(debtId).orElseThrow(() -> new NotFoundException("Debt", debtId));
        ReminderResult result = deliver(debt, channel, LocalDate.now(clock));
        audit(actor, result);
        return result;
    }

    @Transactional(readOnly = true)
    public BulkReminderResult sendBulkReminders(Collection<Long> debtIds, NotificationChannel channel, Actor actor) {
        if (debtIds == null || debtIds.isEmpty()) {
            throw new ValidationException("No debts selected. Please select at least one debt.");
        }
        LocalDate today = LocalDate.now(clock);
        List<ReminderResult> results = new ArrayList<>();
        int sent = 0;
        int failed = 0;
        int skipped = 0;

        for (Debt debt : debtRepository.findAllById(debtIds)) {
            if (!debt.getCustomer().hasPhone()) {
                skipped++;
                continue;
            }
            ReminderResult result;
            try {
                result = deliver(debt, channel, today);
            } catch (RuntimeException e) {
                logger.error("Reminder for debt #{} failed: {}", debt.getId(), e.getMessage(), e);
                result = new ReminderResult(debt.getId(), debt.getCustomer().getName(), channel,
                        DeliveryResult.failed(debt.getCustomer().getPhone(), e.getMessage()));
            }
            if (result.isSent()) {
                sent++;
            } else {
                failed++;
            }
            results.add(result);
        }

        logger.info("Bulk {} reminders: {} sent, {} failed, {} skipped", channel, sent, failed, skipped);
        auditService.log(actor, "SEND_BULK_REMINDERS", channel + ": " + sent + " sent, " + failed + " failed, "
                + skipped + " without phone");
        return new BulkReminderResult(sent, failed, skipped, results);
    }

    private ReminderResult deliver(Debt debt, NotificationChannel channel, LocalDate today) {
        String customerName = debt.getCustomer().getName();
        if (!debt.getCustomer().hasPhone()) {
            return new ReminderResult(debt.getId(), customerName, channel, DeliveryResult.failed(null, NO_PHONE));
        }
        NotificationGateway gateway = gateways.get(channel);
        if (gateway == null) {
            return new ReminderResult(debt.getId(), customerName, channel,
                    DeliveryResult.failed(debt.getCustomer().getPhone(), channel + " is not available"));
        }
        String phone = PhoneNumbers.toInternational(debt.getCustomer().getPhone(), properties.getDefaultCountryCode());
        String message;
        try {
            message = renderer.render(debt, channel, today);
        } catch (TemplateEngineException e) {
            logger.error("Reminder for debt #{} could not be rendered: {}", debt.getId(), e.getMessage(), e);
            return new ReminderResult(debt.getId(), customerName, channel,
                    DeliveryResult.failed(phone, "Message could not be rendered: " + e.getMessage()));
        }
        DeliveryResult delivery = gateway.send(phone, message);
        if (!delivery.success()) {
            logger.warn("Reminder for debt #{} to {} not delivered: {}", debt.getId(), phone, delivery.error());
        }
        return new ReminderResult(debt.getId(), customerName, channel, delivery);
    }

    private void audit(Actor actor, ReminderResult result) {
        auditService.log(actor, "SEND_REMINDER", result.channel() + " reminder for debt #" + result.debtId()
                + " to " + result.customerName() + (result.isSent() ? " sent" : " failed: " + result.delivery().error()));
    }
}
