package com.example.campaign.admin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import reactor.core.publisher.Hooks;

/**
 * Campaign administration: segment and campaign API, scheduled-campaign promotion,
 * draft cleanup and the outbox relay to Kafka.
 */
@SpringBootApplication
@ComponentScan("com.example.campaign")
public class CampaignAdminApplication {

    static {
        // Carries the correlation id MDC entry across Reactor scheduler hops.
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(CampaignAdminApplication.class, args);
    }
}
