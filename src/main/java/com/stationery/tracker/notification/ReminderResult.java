package com.stationery.tracker.notification;

public record ReminderResult(Long debtId, String customerName, NotificationChannel channel, DeliveryResult delivery) {

    public boolean isSent() {
        return delivery.success();
    }
}
