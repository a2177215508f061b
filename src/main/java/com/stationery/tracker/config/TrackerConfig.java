package com.stationery.tracker.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public Clock clock(TrackerProperties properties) {
        return Clock.system(properties.getTimeZone());
    }

    @Bean
    public RestTemplate smsRestTemplate(RestTemplateBuilder builder, TrackerProperties properties) {
        return builder
                .setConnectTimeout(properties.getSms().getTimeout())
                .setReadTimeout(properties.getSms().getTimeout())
                .build();
    }
}
