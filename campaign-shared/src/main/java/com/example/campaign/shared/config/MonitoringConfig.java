package com.example.campaign.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for campaign scheduling and delivery.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    /**
     * Pre-registers the meters dashboards expect to exist before the first campaign runs.
     */
    @Bean
    public MeterBinder campaignMetrics() {
        return registry -> {
            registry.counter("campaign.transitions", "to", "QUEUED");
            registry.counter("campaign.transitions", "to", "SENDING");
            registry.counter("campaign.transitions", "to", "COMPLETED");
            registry.counter("campaign.transitions", "to", "FAILED");

            registry.counter("campaign.delivery.outcomes", "status", "SENT");
            registry.counter("campaign.delivery.outcomes", "status", "FAILED_TRANSIENT");
            registry.counter("campaign.delivery.outcomes", "status", "FAILED_PERMANENT");
            registry.counter("campaign.subscribers.deactivated");
        };
    }

    @Bean
    public CampaignMetricsCollector campaignMetricsCollector(MeterRegistry registry) {
        return new CampaignMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths do not hit the registry lookup each time.
     */
    public static class CampaignMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public CampaignMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }
    }
}
