package com.example.campaign.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduled sweeps run everywhere except in the 'no-scheduler' profile.
 */
@Configuration
@EnableScheduling
@Profile("!no-scheduler")
public class SchedulingConditionalConfig {
}
