package com.example.campaign.admin.metrics;

import com.example.campaign.shared.repository.OutboxRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Outbox backlog gauge. A growing value means the relay cannot reach Kafka.
 */
@Component
@RequiredArgsConstructor
public class OutboxMetrics implements MeterBinder {

    private final OutboxRepository outboxRepository;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("campaign.outbox.size", outboxRepository, repo -> (double) repo.count())
                .description("Outbox events waiting to be relayed")
                .register(registry);
    }
}
