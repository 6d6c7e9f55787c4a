package com.example.campaign.shared.service;

import com.example.campaign.shared.model.OutboxEvent;
import com.example.campaign.shared.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Writes events to the transactional outbox. Callers must already be in the transaction
 * that performs the state change the event announces.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(Object payload, String aggregateType, String aggregateId, String eventType, String topicName) {
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox payload. Event type {} for aggregate {} will not be published.", eventType, aggregateId, e);
            throw new IllegalStateException("Failed to serialize event payload for outbox.", e);
        }
        OutboxEvent outboxEvent = OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .topic(topicName)
                .payload(payloadJson)
                .createdAt(OffsetDateTime.now(clock))
                .build();
        outboxRepository.save(outboxEvent);
        log.debug("Outbox event {} written for {} {}", eventType, aggregateType, aggregateId);
    }
}
