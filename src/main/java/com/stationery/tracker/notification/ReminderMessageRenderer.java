package com.stationery.tracker.notification;

import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.DebtStatus;
import com.stationery.tracker.service.SettingsService;
import com.stationery.tracker.util.Amounts;
import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
public class ReminderMessageRenderer {

    private static final DateTimeFormatter DUE_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final SpringTemplateEngine templateEngine;
    private final SettingsService settingsService;

    public ReminderMessageRenderer(SettingsService settingsService) {
        this.settingsService = settingsService;

        // Kept apart from the auto-configured HTML engine; expressions evaluate through SpEL
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/reminders/");
        resolver.setSuffix(".txt");
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new SpringTemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    public String render(Debt debt, NotificationChannel channel, LocalDate today) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("customerName", debt.getCustomer().getName());
        context.setVariable("currency", settingsService.getCurrency());
        context.setVariable("amount", Amounts.format(debt.getAmount()));
        context.setVariable("remaining", Amounts.format(debt.getRemainingAmount()));
        context.setVariable("dueDate", debt.getDueDate() != null ? DUE_DATE.format(debt.getDueDate()) : "");

        return templateEngine.process(templateName(debt, channel, today), context);
    }

    static String templateName(Debt debt, NotificationChannel channel, LocalDate today) {
        DebtStatus status = debt.effectiveStatus(today);
        String branch;
        if (status == DebtStatus.PAID) {
            branch = "paid";
        } else if (status == DebtStatus.OVERDUE) {
            branch = "overdue";
        } else {
            branch = "pending";
        }
        return channel.name().toLowerCase(Locale.ROOT) + "/" + branch;
    }
}
