package com.example.campaign.admin.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.config.CorrelationIdFilter;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.dto.CampaignDispatchEvent;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.service.OutboxEventPublisher;
import com.example.campaign.shared.util.Constants;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Moves a campaign to QUEUED and writes the dispatch event in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignQueueService {

    private final CampaignRepository campaignRepository;
    private final OutboxEventPublisher outboxEventPublisher;
    private final AppProperties appProperties;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * @return false if the campaign was no longer in {@code from}, in which case nothing is written
     */
    @Transactional
    public boolean queue(Long campaignId, CampaignStatus from) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!campaignRepository.markQueued(campaignId, from, now)) {
            return false;
        }
        CampaignDispatchEvent event = CampaignDispatchEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .campaignId(campaignId)
                .eventType(Constants.EventType.CAMPAIGN_QUEUED.name())
                .correlationId(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY))
                .timestampEpochMilli(now.toInstant().toEpochMilli())
                .build();
        outboxEventPublisher.publish(event, Constants.CAMPAIGN_AGGREGATE, String.valueOf(campaignId),
                event.getEventType(), appProperties.getKafka().getTopic().getNameDispatch());
        metricsCollector.incrementCounter("campaign.transitions", "to", CampaignStatus.QUEUED.name());
        log.info("Campaign {} queued (from {})", campaignId, from);
        return true;
    }
}
