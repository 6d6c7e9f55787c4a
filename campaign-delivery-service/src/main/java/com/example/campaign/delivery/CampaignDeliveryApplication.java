package com.example.campaign.delivery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import reactor.core.publisher.Hooks;

/**
 * Delivery workers: claim queued campaigns, fan them out to their audience through the push
 * gateway and retry transient failures until every recipient has a final outcome.
 */
@SpringBootApplication
@ComponentScan("com.example.campaign")
public class CampaignDeliveryApplication {

    static {
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(CampaignDeliveryApplication.class, args);
    }
}
