package com.example.campaign.delivery.service;

import com.example.campaign.delivery.transport.PushPayload;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.audience.Audience;
import com.example.campaign.shared.audience.AudienceCursor;
import com.example.campaign.shared.audience.AudienceResolver;
import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.exception.CampaignExecutionException;
import com.example.campaign.shared.exception.UnknownDimensionException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.DeliveryOutcome;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.DeliveryOutcomeRepository;
import com.example.campaign.shared.service.PushPayloadValidator;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import com.example.campaign.shared.util.Constants.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Runs the audience pass of one campaign: claim, validate, resolve, then deliver batch by batch
 * under a renewable lease. Re-running a pass is safe: recipients that already have a recorded
 * outcome are skipped, and each recipient is claimed before its push, so a worker that takes over
 * an expired lease never pushes to a recipient the previous holder is still sending to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignDeliveryService {

    private final CampaignRepository campaignRepository;
    private final DeliveryOutcomeRepository deliveryOutcomeRepository;
    private final AudienceResolver audienceResolver;
    private final PushPayloadValidator pushPayloadValidator;
    private final RecipientDispatcher recipientDispatcher;
    private final CampaignFinalizer campaignFinalizer;
    private final AppProperties appProperties;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * @return false if another worker holds the campaign or it is not deliverable
     */
    @Monitored("delivery")
    public boolean execute(Long campaignId) {
        String owner = appProperties.getDelivery().getWorkerId();
        OffsetDateTime now = now();
        if (!campaignRepository.claimForSending(campaignId, owner, now, leaseUntil(now))) {
            log.debug("Campaign {} not claimable by {}", campaignId, owner);
            return false;
        }
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new IllegalStateException("Claimed campaign " + campaignId + " disappeared"));
        log.info("Worker {} claimed campaign {}", owner, campaignId);
        metricsCollector.incrementCounter("campaign.transitions", "to", CampaignStatus.SENDING.name());

        try {
            if (!runAudiencePass(campaign, owner)) {
                return false;
            }
        } catch (CampaignExecutionException e) {
            log.error("Campaign {} failed: {}", campaignId, e.getMessage(), e);
            if (campaignRepository.markFailed(campaignId, e.getMessage(), now())) {
                metricsCollector.incrementCounter("campaign.transitions", "to", CampaignStatus.FAILED.name());
            }
            return false;
        }
        campaignFinalizer.finalizeIfDone(campaignId);
        return true;
    }

    private boolean runAudiencePass(Campaign campaign, String owner) {
        Long campaignId = campaign.getId();
        List<String> violations = pushPayloadValidator.violations(campaign);
        if (!violations.isEmpty()) {
            throw new CampaignExecutionException(campaignId, "Invalid payload: " + String.join("; ", violations));
        }
        Audience audience;
        try {
            audience = audienceResolver.resolve(campaign.getSegments());
        } catch (UnknownDimensionException e) {
            throw new CampaignExecutionException(campaignId, e.getMessage(), e);
        }

        PushPayload payload = PushPayload.from(campaign, appProperties.getPush().getTtlSeconds());
        int batches = 0;
        if (audience.isKnownEmpty()) {
            log.info("Campaign {} has a filter with no values; nobody to deliver to", campaignId);
        } else {
            AudienceCursor cursor = audience.members(appProperties.getDelivery().getBatchSize());
            List<Long> page;
            while (!(page = cursor.nextPage()).isEmpty()) {
                if (!campaignRepository.renewLease(campaignId, owner, leaseUntil(now()))) {
                    log.warn("Worker {} lost the lease on campaign {}; stopping audience pass", owner, campaignId);
                    return false;
                }
                deliverBatch(campaignId, payload, page, owner);
                batches++;
            }
        }

        int totalTargeted = deliveryOutcomeRepository.countByStatus(campaignId).values().stream()
                .mapToInt(Long::intValue).sum();
        if (!campaignRepository.markAudienceResolved(campaignId, owner, totalTargeted, now())) {
            log.warn("Worker {} lost the lease on campaign {} before recording its audience", owner, campaignId);
            return false;
        }
        log.info("Campaign {} audience pass finished: {} recipients in {} batches", campaignId, totalTargeted, batches);
        return true;
    }

    private void deliverBatch(Long campaignId, PushPayload payload, List<Long> subscriberIds, String owner) {
        deliveryOutcomeRepository.insertPendingIfAbsent(campaignId, subscriberIds, now());
        Map<Long, DeliveryOutcome> outcomes = deliveryOutcomeRepository.findByCampaignAndSubscribers(campaignId, subscriberIds);
        List<DeliveryOutcome> pending = outcomes.values().stream()
                .filter(outcome -> DeliveryStatus.PENDING.name().equals(outcome.getStatus()))
                .sorted(Comparator.comparing(DeliveryOutcome::getSubscriberId))
                .toList();
        if (pending.size() < subscriberIds.size()) {
            log.debug("Campaign {}: {} of {} recipients in batch already have an outcome",
                    campaignId, subscriberIds.size() - pending.size(), subscriberIds.size());
        }
        recipientDispatcher.claimAndDispatchAll(payload, pending, owner);
    }

    private OffsetDateTime leaseUntil(OffsetDateTime now) {
        return now.plus(appProperties.getDelivery().getLeaseDuration());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
