package com.stationery.tracker.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.stationery.tracker.config.TrackerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

@Component
public class SmsNotificationGateway implements NotificationGateway {

    private static final Logger logger = LoggerFactory.getLogger(SmsNotificationGateway.class);

    private final RestTemplate restTemplate;
    private final TrackerProperties.Sms settings;

    public SmsNotificationGateway(@Qualifier("smsRestTemplate") RestTemplate restTemplate,
            TrackerProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getSms();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SMS;
    }

    @Override
    public DeliveryResult send(String phone, String message) {
        if (!settings.isEnabled() || settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            logger.warn("SMS to {} not sent: gateway is disabled or has no API key", phone);
            return DeliveryResult.failed(phone, "SMS service not configured properly");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("apiKey", settings.getApiKey());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", settings.getUsername());
        form.add("to", phone);
        form.add("message", message);
        if (settings.getSenderId() != null && !settings.getSenderId().isBlank()) {
            form.add("from", settings.getSenderId());
        }

        try {
            JsonNode response = restTemplate.postForObject(settings.getUrl(), new HttpEntity<>(form, headers),
                    JsonNode.class);
            return interpret(phone, response);
        } catch (RestClientException e) {
            logger.error("Failed to send SMS to {}: {}", phone, e.getMessage());
            return DeliveryResult.failed(phone, e.getMessage());
        }
    }

    // {"SMSMessageData":{"Message":"Sent to 1/1","Recipients":[{"number":"+255...","status":"Success",...}]}}
    private DeliveryResult interpret(String phone, JsonNode response) {
        if (response == null) {
            return DeliveryResult.failed(phone, "Empty response from SMS gateway");
        }
        JsonNode data = response.path("SMSMessageData");
        JsonNode recipients = data.path("Recipients");
        if (recipients.isArray() && recipients.size() > 0) {
            String status = recipients.get(0).path("status").asText();
            if ("Success".equalsIgnoreCase(status)) {
                logger.info("SMS sent to {}: {}", phone, data.path("Message").asText());
                return DeliveryResult.sent(phone, response.toString());
            }
            logger.warn("SMS to {} rejected: {}", phone, status);
            return DeliveryResult.failed(phone, status);
        }
        String reason = data.path("Message").asText("Unknown error");
        logger.warn("SMS to {} rejected: {}", phone, reason);
        return DeliveryResult.failed(phone, reason);
    }
}
