package com.stationery.tracker.notification;

public enum NotificationChannel {
    SMS,
    WHATSAPP
}
