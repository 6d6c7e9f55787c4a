package com.example.campaign.delivery.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands campaigns to the bounded campaign executor. Kafka dispatch events and the poll sweep
 * both land here; the sweep also covers lost events, expired leases and missed finalization.
 */
@Component
@Slf4j
public class DeliveryWorker {

    private final CampaignDeliveryService campaignDeliveryService;
    private final CampaignFinalizer campaignFinalizer;
    private final CampaignRepository campaignRepository;
    private final AppProperties appProperties;
    private final TaskExecutor campaignExecutor;
    private final Clock clock;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public DeliveryWorker(CampaignDeliveryService campaignDeliveryService,
                          CampaignFinalizer campaignFinalizer,
                          CampaignRepository campaignRepository,
                          AppProperties appProperties,
                          @Qualifier("campaignExecutor") TaskExecutor campaignExecutor,
                          Clock clock) {
        this.campaignDeliveryService = campaignDeliveryService;
        this.campaignFinalizer = campaignFinalizer;
        this.campaignRepository = campaignRepository;
        this.appProperties = appProperties;
        this.campaignExecutor = campaignExecutor;
        this.clock = clock;
    }

    /**
     * @return false if the campaign is already running here or the executor is saturated
     */
    public boolean submit(Long campaignId) {
        if (!inFlight.add(campaignId)) {
            return false;
        }
        try {
            campaignExecutor.execute(() -> run(campaignId));
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(campaignId);
            log.warn("Campaign executor saturated; campaign {} left for the next poll", campaignId);
            return false;
        }
    }

    @Scheduled(fixedDelayString = "${campaign.delivery.poll-interval-ms:5000}")
    public void poll() {
        int limit = appProperties.getDelivery().getPollLimit();
        for (Long campaignId : campaignRepository.findClaimable(OffsetDateTime.now(clock), limit)) {
            submit(campaignId);
        }
        for (Long campaignId : campaignRepository.findResolvedSending(limit)) {
            campaignFinalizer.finalizeIfDone(campaignId);
        }
    }

    private void run(Long campaignId) {
        try {
            campaignDeliveryService.execute(campaignId);
        } catch (RuntimeException e) {
            log.error("Delivery of campaign {} aborted; it will be reclaimed once its lease expires", campaignId, e);
        } finally {
            inFlight.remove(campaignId);
        }
    }
}
