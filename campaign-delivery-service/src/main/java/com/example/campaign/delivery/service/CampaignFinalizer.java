package com.example.campaign.delivery.service;

import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.DeliveryOutcomeRepository;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import com.example.campaign.shared.util.Constants.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Completes a SENDING campaign once its audience pass has finished and no recipient is still
 * PENDING, being pushed or waiting for a retry. A campaign where every recipient failed still
 * completes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignFinalizer {

    private final CampaignRepository campaignRepository;
    private final DeliveryOutcomeRepository deliveryOutcomeRepository;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * @return true if this call moved the campaign to COMPLETED
     */
    public boolean finalizeIfDone(Long campaignId) {
        Optional<Campaign> campaign = campaignRepository.findById(campaignId);
        if (campaign.isEmpty()
                || !CampaignStatus.SENDING.name().equals(campaign.get().getStatus())
                || !campaign.get().isAudienceResolved()) {
            return false;
        }
        Map<String, Long> counts = deliveryOutcomeRepository.countByStatus(campaignId);
        long open = counts.getOrDefault(DeliveryStatus.PENDING.name(), 0L)
                + counts.getOrDefault(DeliveryStatus.IN_FLIGHT.name(), 0L)
                + counts.getOrDefault(DeliveryStatus.FAILED_TRANSIENT.name(), 0L);
        if (open > 0) {
            log.debug("Campaign {} still has {} open deliveries", campaignId, open);
            return false;
        }
        int sent = counts.getOrDefault(DeliveryStatus.SENT.name(), 0L).intValue();
        int failed = counts.getOrDefault(DeliveryStatus.FAILED_PERMANENT.name(), 0L).intValue();
        if (!campaignRepository.markCompleted(campaignId, sent, failed, OffsetDateTime.now(clock))) {
            return false;
        }
        log.info("Campaign {} completed: {} sent, {} failed", campaignId, sent, failed);
        metricsCollector.incrementCounter("campaign.transitions", "to", CampaignStatus.COMPLETED.name());
        return true;
    }
}
