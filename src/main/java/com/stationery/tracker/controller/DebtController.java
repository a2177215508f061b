package com.stationery.tracker.controller;

import com.stationery.tracker.dto.DebtFilter;
import com.stationery.tracker.dto.DebtListing;
import com.stationery.tracker.dto.DebtRequest;
import com.stationery.tracker.dto.DebtResponse;
import com.stationery.tracker.dto.PaymentRequest;
import com.stationery.tracker.dto.PaymentResponse;
import com.stationery.tracker.model.DebtStatus;
import com.stationery.tracker.model.Payment;
import com.stationery.tracker.notification.BulkReminderResult;
import com.stationery.tracker.notification.NotificationChannel;
import com.stationery.tracker.notification.ReminderRequest;
import com.stationery.tracker.notification.ReminderResult;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.DebtReminderService;
import com.stationery.tracker.service.DebtService;
import com.stationery.tracker.service.PaymentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/debts")
public class DebtController {

    private final DebtService debtService;
    private final PaymentService paymentService;
    private final DebtReminderService reminderService;

    public DebtController(DebtService debtService, PaymentService paymentService,
            DebtReminderService reminderService) {
        this.debtService = debtService;
        this.paymentService = paymentService;
        this.reminderService = reminderService;
    }

    @GetMapping
    public DebtListing list(@RequestParam(required = false) DebtStatus status,
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page) {
        return debtService.listDebts(new DebtFilter(status, customerId, search, page));
    }

    @GetMapping("/{id}")
    public DebtResponse get(@PathVariable Long id) {
        return debtService.toResponse(debtService.getDebt(id));
    }

    @PostMapping
    public ResponseEntity<DebtResponse> create(@Valid @RequestBody DebtRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(debtService.toResponse(debtService.createDebt(request, actor)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Actor actor) {
        debtService.deleteDebt(id, actor);
        return ResponseEntity.noContent().build();
    }

    // --- payments ---

    @GetMapping("/{id}/payments")
    public List<PaymentResponse> payments(@PathVariable Long id) {
        return debtService.paymentsOf(id).stream().map(PaymentResponse::from).collect(Collectors.toList());
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> recordPayment(@PathVariable Long id,
            @Valid @RequestBody PaymentRequest request, Actor actor) {
        Payment payment = paymentService.recordPayment(id, request.amount(), request.paymentMethod(),
                request.notes(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    // --- reminders ---

    @GetMapping("/reminders/candidates")
    public List<DebtResponse> reminderCandidates() {
        return reminderService.reminderCandidates().stream()
                .map(debtService::toResponse)
                .collect(Collectors.toList());
    }

    @PostMapping("/{id}/reminders")
    public ReminderResult sendReminder(@PathVariable Long id,
            @RequestParam(defaultValue = "SMS") NotificationChannel channel, Actor actor) {
        return reminderService.sendReminder(id, channel, actor);
    }

    @PostMapping("/reminders")
    public BulkReminderResult sendBulkReminders(@Valid @RequestBody ReminderRequest request, Actor actor) {
        NotificationChannel channel = request.channel() != null ? request.channel() : NotificationChannel.SMS;
        return reminderService.sendBulkReminders(request.debtIds(), channel, actor);
    }
}
