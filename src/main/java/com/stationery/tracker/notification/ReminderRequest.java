package com.stationery.tracker.notification;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ReminderRequest(@NotEmpty List<Long> debtIds, NotificationChannel channel) {
}
