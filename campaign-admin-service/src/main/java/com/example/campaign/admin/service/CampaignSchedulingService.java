package com.example.campaign.admin.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Promotes SCHEDULED campaigns whose send time has arrived. The lock keeps replicas from sweeping
 * at the same time, but correctness rests on the conditional transition in
 * {@link CampaignQueueService#queue}: a campaign is queued and announced at most once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignSchedulingService {

    private final CampaignRepository campaignRepository;
    private final CampaignQueueService campaignQueueService;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${campaign.scheduler.sweep-interval-ms:60000}")
    @SchedulerLock(name = "promoteDueCampaigns", lockAtLeastFor = "PT5S", lockAtMostFor = "PT55S")
    public void runSweep() {
        promoteDueCampaigns();
    }

    /**
     * @return number of campaigns this sweep moved to QUEUED
     */
    public int promoteDueCampaigns() {
        List<Campaign> due = campaignRepository.findDueScheduled(OffsetDateTime.now(clock),
                appProperties.getScheduler().getBatchLimit());
        if (due.isEmpty()) {
            return 0;
        }
        int promoted = 0;
        for (Campaign campaign : due) {
            if (campaignQueueService.queue(campaign.getId(), CampaignStatus.SCHEDULED)) {
                promoted++;
            } else {
                log.debug("Campaign {} was promoted or cancelled by someone else", campaign.getId());
            }
        }
        log.info("Scheduler sweep promoted {} of {} due campaigns", promoted, due.size());
        return promoted;
    }
}
