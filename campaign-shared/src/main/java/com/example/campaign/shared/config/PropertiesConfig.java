package com.example.campaign.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:${HOSTNAME:campaign-worker-0}}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "campaign")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // Lease owner identity; campaign.delivery.worker-id overrides it when set.
        properties.getDelivery().setWorkerId(podName);
        return properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
