package com.example.campaign.admin.service;

import com.example.campaign.admin.support.AdminTestDatabase;
import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DraftCleanupServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 7, 1, 2, 0, 0, 0, ZoneOffset.UTC);

    private CampaignRepository campaignRepository;
    private DraftCleanupService cleanupService;

    @BeforeEach
    void setUp() {
        campaignRepository = new CampaignRepository(new JdbcTemplate(AdminTestDatabase.create()));
        cleanupService = new DraftCleanupService(campaignRepository, new AppProperties(),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void deletesOnlyDraftsOlderThanRetention() {
        Long stale = campaignRepository.save(AdminTestDatabase.campaign(CampaignStatus.DRAFT, null, NOW.minusDays(32))).getId();
        Long recent = campaignRepository.save(AdminTestDatabase.campaign(CampaignStatus.DRAFT, null, NOW.minusDays(30))).getId();
        Long oldCompleted = campaignRepository.save(AdminTestDatabase.campaign(CampaignStatus.COMPLETED, null, NOW.minusDays(90))).getId();
        Long oldCancelled = campaignRepository.save(AdminTestDatabase.campaign(CampaignStatus.CANCELLED, null, NOW.minusDays(90))).getId();

        int deleted = cleanupService.cleanupAbandonedDrafts();

        assertThat(deleted).isEqualTo(1);
        assertThat(campaignRepository.findById(stale)).isEmpty();
        assertThat(campaignRepository.findById(recent)).isPresent();
        assertThat(campaignRepository.findById(oldCompleted)).isPresent();
        assertThat(campaignRepository.findById(oldCancelled)).isPresent();
    }

    @Test
    void secondRunFindsNothing() {
        campaignRepository.save(AdminTestDatabase.campaign(CampaignStatus.DRAFT, null, NOW.minusDays(45)));

        assertThat(cleanupService.cleanupAbandonedDrafts()).isEqualTo(1);
        assertThat(cleanupService.cleanupAbandonedDrafts()).isZero();
    }
}
