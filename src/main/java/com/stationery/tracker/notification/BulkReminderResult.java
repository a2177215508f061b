package com.stationery.tracker.notification;

import java.util.List;

public record BulkReminderResult(int sent, int failed, int skipped, List<ReminderResult> results) {
}
