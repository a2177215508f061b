package com.stationery.tracker.notification;

public record DeliveryResult(boolean success, String recipient, String error, String providerResponse) {

    public static DeliveryResult sent(String recipient, String providerResponse) {
        return new DeliveryResult(true, recipient, null, providerResponse);
    }

    public static DeliveryResult failed(String recipient, String error) {
        return new DeliveryResult(false, recipient, error, null);
    }
}
