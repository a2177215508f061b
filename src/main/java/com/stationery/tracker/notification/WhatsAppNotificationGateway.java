package com.stationery.tracker.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WhatsAppNotificationGateway implements NotificationGateway {

    private static final Logger logger = LoggerFactory.getLogger(WhatsAppNotificationGateway.class);

    static final String UNAVAILABLE = "WhatsApp Business API is not configured. WhatsApp messages need a "
            + "separate WhatsApp Business API account.";

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WHATSAPP;
    }

    @Override
    public DeliveryResult send(String phone, String message) {
        logger.warn("WhatsApp send to {} attempted but the channel is unavailable", phone);
        return DeliveryResult.failed(phone, UNAVAILABLE);
    }
}
