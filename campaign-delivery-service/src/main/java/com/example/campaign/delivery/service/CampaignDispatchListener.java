package com.example.campaign.delivery.service;

import com.example.campaign.shared.config.CorrelationIdFilter;
import com.example.campaign.shared.dto.CampaignDispatchEvent;
import com.example.campaign.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
@Profile("!no-scheduler")
public class CampaignDispatchListener {

    private final DeliveryWorker deliveryWorker;

    @KafkaListener(
        topics = "${campaign.kafka.topic.name-dispatch:campaign-dispatch}",
        groupId = "${campaign.kafka.consumer.group-dispatch:campaign-dispatch-group}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void onDispatchEvent(@Payload CampaignDispatchEvent event,
                                Acknowledgment acknowledgment,
                                @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                                @Header(KafkaHeaders.OFFSET) long offset) {
        if (event.getCorrelationId() != null) {
            MDC.put(CorrelationIdFilter.CORRELATION_ID_KEY, event.getCorrelationId());
        }
        try {
            log.debug("Dispatch event received [Partition: {}, Offset: {}] {}", partition, offset, event);
            if (event.getCampaignId() == null
                    || !Constants.EventType.CAMPAIGN_QUEUED.name().equals(event.getEventType())) {
                log.warn("Ignoring unexpected dispatch event {}", event);
            } else if (deliveryWorker.submit(event.getCampaignId())) {
                log.info("Campaign {} handed to delivery", event.getCampaignId());
            }
            acknowledgment.acknowledge();
        } finally {
            MDC.remove(CorrelationIdFilter.CORRELATION_ID_KEY);
        }
    }
}
