package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.DeliveryOutcome;
import com.example.campaign.shared.support.H2TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryOutcomeRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private DeliveryOutcomeRepository repository;
    private CampaignRepository campaignRepository;
    private Long campaignId;

    @BeforeEach
    void setUp() {
        DataSource dataSource = H2TestDatabase.create();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        repository = new DeliveryOutcomeRepository(jdbcTemplate, new NamedParameterJdbcTemplate(dataSource));
        campaignRepository = new CampaignRepository(jdbcTemplate);
        campaignId = campaignRepository.save(Campaign.builder()
                .name("c").title("t").body("b").status("QUEUED").createdAt(NOW).updatedAt(NOW).build()).getId();
        campaignRepository.claimForSending(campaignId, "worker", NOW, NOW.plusMinutes(5));
    }

    @Test
    void insertPendingIsIdempotent() {
        repository.insertPendingIfAbsent(campaignId, List.of(1L, 2L, 3L), NOW);
        Long sentId = repository.findByCampaignAndSubscribers(campaignId, List.of(2L)).get(2L).getId();
        repository.claimPending(sentId, "worker", NOW);
        repository.markSent(sentId, NOW);

        repository.insertPendingIfAbsent(campaignId, List.of(2L, 3L, 4L), NOW.plusMinutes(1));

        Map<Long, DeliveryOutcome> outcomes = repository.findByCampaignAndSubscribers(campaignId, List.of(1L, 2L, 3L, 4L));
        assertThat(outcomes).hasSize(4);
        assertThat(outcomes.get(2L).getStatus()).isEqualTo("SENT");
        assertThat(outcomes.get(2L).getAttempts()).isEqualTo(1);
        assertThat(outcomes.get(4L).getStatus()).isEqualTo("PENDING");
    }

    @Test
    void terminalOutcomesCannotBeOverwritten() {
        repository.insertPendingIfAbsent(campaignId, List.of(7L), NOW);
        Long id = repository.findByCampaignAndSubscribers(campaignId, List.of(7L)).get(7L).getId();
        repository.claimPending(id, "worker", NOW);

        assertThat(repository.markFailedPermanent(id, "gone", true, NOW)).isTrue();
        assertThat(repository.markSent(id, NOW)).isFalse();
        assertThat(repository.markFailedTransient(id, "5xx", NOW, NOW.plusMinutes(1))).isFalse();
    }

    @Test
    void dueRetryIsClaimedByOneSweeperOnly() {
        repository.insertPendingIfAbsent(campaignId, List.of(9L), NOW);
        Long id = repository.findByCampaignAndSubscribers(campaignId, List.of(9L)).get(9L).getId();
        repository.claimPending(id, "worker", NOW);
        repository.markFailedTransient(id, "429", NOW, NOW.plusSeconds(30));

        assertThat(repository.findDueRetries(NOW, 10)).isEmpty();
        OffsetDateTime later = NOW.plusMinutes(1);
        assertThat(repository.findDueRetries(later, 10)).extracting(DeliveryOutcome::getId).containsExactly(id);

        assertThat(repository.claimRetry(id, "worker-a", later)).isTrue();
        assertThat(repository.claimRetry(id, "worker-b", later)).isFalse();
        assertThat(repository.findDueRetries(later, 10)).isEmpty();
        DeliveryOutcome claimed = repository.findByCampaignAndSubscribers(campaignId, List.of(9L)).get(9L);
        assertThat(claimed.getStatus()).isEqualTo("IN_FLIGHT");
        assertThat(claimed.getClaimedBy()).isEqualTo("worker-a");
    }

    @Test
    void pendingOutcomeIsClaimedByOneWorkerOnly() {
        repository.insertPendingIfAbsent(campaignId, List.of(5L), NOW);
        Long id = repository.findByCampaignAndSubscribers(campaignId, List.of(5L)).get(5L).getId();

        assertThat(repository.markSent(id, NOW)).isFalse();
        assertThat(repository.claimPending(id, "worker-a", NOW)).isTrue();
        assertThat(repository.claimPending(id, "worker-b", NOW)).isFalse();
        assertThat(repository.markSent(id, NOW)).isTrue();
        assertThat(repository.countByStatus(campaignId)).containsEntry("SENT", 1L);
    }

    @Test
    void expiredClaimsAreRequeued() {
        repository.insertPendingIfAbsent(campaignId, List.of(12L, 13L), NOW);
        Map<Long, DeliveryOutcome> outcomes = repository.findByCampaignAndSubscribers(campaignId, List.of(12L, 13L));
        repository.claimPending(outcomes.get(12L).getId(), "dead-worker", NOW);
        repository.claimPending(outcomes.get(13L).getId(), "live-worker", NOW.plusMinutes(18));

        assertThat(repository.requeueStaleInFlight(NOW.plusMinutes(5), NOW.plusMinutes(20))).isEqualTo(1);

        DeliveryOutcome requeued = repository.findByCampaignAndSubscribers(campaignId, List.of(12L)).get(12L);
        assertThat(requeued.getStatus()).isEqualTo("FAILED_TRANSIENT");
        assertThat(requeued.getNextAttemptAt()).isAtSameInstantAs(NOW.plusMinutes(20));
        assertThat(repository.countByStatus(campaignId)).containsEntry("IN_FLIGHT", 1L);
    }

    @Test
    void stalePendingIsRequeuedOnlyForResolvedCampaigns() {
        repository.insertPendingIfAbsent(campaignId, List.of(11L), NOW);

        assertThat(repository.requeueStalePending(NOW.plusMinutes(20), NOW.plusMinutes(20))).isZero();

        campaignRepository.markAudienceResolved(campaignId, "worker", 1, NOW);
        assertThat(repository.requeueStalePending(NOW.plusMinutes(20), NOW.plusMinutes(20))).isEqualTo(1);
        assertThat(repository.countByStatus(campaignId)).containsEntry("FAILED_TRANSIENT", 1L);
    }

    @Test
    void countsByStatus() {
        repository.insertPendingIfAbsent(campaignId, List.of(1L, 2L, 3L), NOW);
        Map<Long, DeliveryOutcome> outcomes = repository.findByCampaignAndSubscribers(campaignId, List.of(1L, 2L));
        repository.claimPending(outcomes.get(1L).getId(), "worker", NOW);
        repository.claimPending(outcomes.get(2L).getId(), "worker", NOW);
        repository.markSent(outcomes.get(1L).getId(), NOW);
        repository.markFailedPermanent(outcomes.get(2L).getId(), "rejected", true, NOW);

        assertThat(repository.countByStatus(campaignId))
                .containsEntry("SENT", 1L)
                .containsEntry("FAILED_PERMANENT", 1L)
                .containsEntry("PENDING", 1L);
    }
}
