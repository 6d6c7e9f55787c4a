package com.example.campaign.admin.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class DraftCleanupService {

    private final CampaignRepository campaignRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(cron = "${campaign.drafts.cleanup-cron:0 0 2 * * *}")
    @SchedulerLock(name = "cleanupAbandonedDrafts", lockAtMostFor = "PT30M")
    public void runCleanup() {
        cleanupAbandonedDrafts();
    }

    /**
     * Deletes drafts not edited within the retention window.
     *
     * @return number of campaigns deleted
     */
    @Transactional
    public int cleanupAbandonedDrafts() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minusDays(appProperties.getDrafts().getRetentionDays());
        int deleted = campaignRepository.deleteAbandonedDrafts(cutoff);
        if (deleted > 0) {
            log.info("Deleted {} drafts last edited before {}", deleted, cutoff);
        } else {
            log.debug("No abandoned drafts older than {}", cutoff);
        }
        return deleted;
    }
}
