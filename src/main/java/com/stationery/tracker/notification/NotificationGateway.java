package com.stationery.tracker.notification;

/**
 * Delivers a text message to a phone number. Implementations report failures through the
 * returned {@link DeliveryResult} and do not throw.
 */
public interface NotificationGateway {

    NotificationChannel channel();

    DeliveryResult send(String phone, String message);
}
