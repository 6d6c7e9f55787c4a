package com.example.campaign.admin.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.dto.CampaignDispatchEvent;
import com.example.campaign.shared.model.OutboxEvent;
import com.example.campaign.shared.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Relays outbox rows to Kafka. Rows are deleted only after every send in the batch is acknowledged;
 * a failure rolls the batch back so it is retried on the next poll.
 */
@Service
@Slf4j
@Profile("!no-scheduler")
public class OutboxPollingService {

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final Counter relayedCounter;

    public OutboxPollingService(OutboxRepository outboxRepository,
                                KafkaTemplate<String, Object> kafkaTemplate,
                                ObjectMapper objectMapper,
                                AppProperties appProperties,
                                MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.relayedCounter = meterRegistry.counter("campaign.outbox.relayed.total");
    }

    @Scheduled(fixedDelay = 2000)
    @SchedulerLock(name = "relayOutboxEvents", lockAtMostFor = "PT1M")
    @Transactional
    public void pollAndPublishEvents() {
        List<OutboxEvent> events = outboxRepository.findAndLockUnprocessedEvents(appProperties.getOutbox().getBatchSize());
        if (events.isEmpty()) {
            return;
        }
        log.trace("Found {} outbox events to relay", events.size());

        for (OutboxEvent event : events) {
            try {
                CampaignDispatchEvent payload = objectMapper.readValue(event.getPayload(), CampaignDispatchEvent.class);
                kafkaTemplate.send(event.getTopic(), event.getAggregateId(), payload).get();
            } catch (JsonProcessingException e) {
                log.error("Unreadable payload in outbox event {}", event.getId(), e);
                throw new IllegalStateException("Failed to deserialize outbox payload " + event.getId(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while relaying outbox event " + event.getId(), e);
            } catch (ExecutionException e) {
                log.error("Kafka send failed for outbox event {}; batch will be retried", event.getId(), e);
                throw new IllegalStateException("Kafka send failed", e);
            }
        }

        List<UUID> processedIds = events.stream().map(OutboxEvent::getId).toList();
        outboxRepository.deleteByIds(processedIds);
        relayedCounter.increment(processedIds.size());
        log.debug("Relayed and deleted {} outbox events", processedIds.size());
    }
}
