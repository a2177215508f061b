package com.stationery.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "tracker")
@Data
public class TrackerProperties {

    // Turns sale instants into business dates
    private ZoneId timeZone = ZoneId.of("Africa/Dar_es_Salaam");

    // Prefix for local numbers starting with 0
    private String defaultCountryCode = "+255";

    // Given to the admin user created on an empty database
    private String initialAdminPassword = "password";

    private final Debt debt = new Debt();

    private final Sms sms = new Sms();

    @Data
    public static class Debt {
        private int dueDays = 7;
    }

    @Data
    public static class Sms {
        private boolean enabled = false;
        private String url = "https://api.africastalking.com/version1/messaging";
        private String username = "sandbox";
        private String apiKey;
        private String senderId;
        private Duration timeout = Duration.ofSeconds(10);
    }
}
