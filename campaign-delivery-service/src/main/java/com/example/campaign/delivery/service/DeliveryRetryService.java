package com.example.campaign.delivery.service;

import com.example.campaign.delivery.transport.PushPayload;
import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.DeliveryOutcome;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.DeliveryOutcomeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Re-dispatches transient failures whose backoff has elapsed. Every worker runs this sweep;
 * the per-row claim keeps two workers from retrying the same recipient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryRetryService {

    private final DeliveryOutcomeRepository deliveryOutcomeRepository;
    private final CampaignRepository campaignRepository;
    private final RecipientDispatcher recipientDispatcher;
    private final CampaignFinalizer campaignFinalizer;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${campaign.delivery.retry-poll-interval-ms:10000}")
    public void runSweep() {
        retryDueDeliveries();
    }

    /**
     * @return number of recipients re-dispatched
     */
    public int retryDueDeliveries() {
        AppProperties.Delivery delivery = appProperties.getDelivery();
        OffsetDateTime now = OffsetDateTime.now(clock);

        OffsetDateTime staleBefore = now.minus(delivery.getStalePendingAfter());
        int requeued = deliveryOutcomeRepository.requeueStalePending(staleBefore, now);
        if (requeued > 0) {
            log.warn("Re-queued {} deliveries left PENDING by an interrupted pass", requeued);
        }
        int expired = deliveryOutcomeRepository.requeueStaleInFlight(staleBefore, now);
        if (expired > 0) {
            log.warn("Re-queued {} deliveries whose claim expired mid-push", expired);
        }

        String owner = delivery.getWorkerId();
        List<DeliveryOutcome> claimed = deliveryOutcomeRepository.findDueRetries(now, delivery.getRetryBatchSize()).stream()
                .filter(outcome -> deliveryOutcomeRepository.claimRetry(outcome.getId(), owner, now))
                .toList();
        if (claimed.isEmpty()) {
            return 0;
        }

        Map<Long, List<DeliveryOutcome>> byCampaign = claimed.stream()
                .collect(Collectors.groupingBy(DeliveryOutcome::getCampaignId, LinkedHashMap::new, Collectors.toList()));
        for (Map.Entry<Long, List<DeliveryOutcome>> entry : byCampaign.entrySet()) {
            Optional<Campaign> campaign = campaignRepository.findById(entry.getKey());
            if (campaign.isEmpty()) {
                continue;
            }
            PushPayload payload = PushPayload.from(campaign.get(), appProperties.getPush().getTtlSeconds());
            recipientDispatcher.dispatchAll(payload, entry.getValue());
            campaignFinalizer.finalizeIfDone(entry.getKey());
        }
        log.info("Retried {} deliveries across {} campaigns", claimed.size(), byCampaign.size());
        return claimed.size();
    }
}
