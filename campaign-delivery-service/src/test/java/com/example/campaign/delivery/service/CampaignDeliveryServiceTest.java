package com.example.campaign.delivery.service;

import com.example.campaign.delivery.support.DeliveryTestFixture;
import com.example.campaign.delivery.transport.PushResult;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.DeliveryOutcome;
import com.example.campaign.shared.model.Subscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.example.campaign.delivery.support.DeliveryTestFixture.START;
import static com.example.campaign.delivery.support.DeliveryTestFixture.filter;
import static org.assertj.core.api.Assertions.assertThat;

class CampaignDeliveryServiceTest {

    private DeliveryTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new DeliveryTestFixture(5);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void deliversToMatchingAudienceAndCompletes() {
        Subscriber us1 = fixture.subscriber("US");
        Subscriber us2 = fixture.subscriber("US");
        Subscriber us3 = fixture.subscriber("US");
        fixture.subscriber("CA");
        Long campaignId = fixture.queuedCampaign("Flash sale", filter("country", "US"));

        boolean ran = fixture.deliveryService.execute(campaignId);

        assertThat(ran).isTrue();
        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("COMPLETED");
        assertThat(campaign.getTotalTargeted()).isEqualTo(3);
        assertThat(campaign.getSentCount()).isEqualTo(3);
        assertThat(campaign.getFailedCount()).isZero();
        assertThat(campaign.getLeaseOwner()).isNull();
        assertThat(fixture.transport.recipientsOf(campaignId))
                .containsExactlyInAnyOrder(us1.getId(), us2.getId(), us3.getId());
    }

    @Test
    void campaignHeldByAnotherWorkerIsSkipped() {
        fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign("Held", filter("country", "US"));
        fixture.campaignRepository.claimForSending(campaignId, "other-worker", START, START.plusMinutes(5));

        assertThat(fixture.deliveryService.execute(campaignId)).isFalse();
        assertThat(fixture.transport.totalSends()).isZero();
        assertThat(fixture.campaign(campaignId).getLeaseOwner()).isEqualTo("other-worker");
    }

    @Test
    void reclaimedPassNeverRedispatchesToSentSubscriber() {
        Subscriber alreadySent = fixture.subscriber("US");
        Subscriber stillPending = fixture.subscriber("US");
        Subscriber notReached = fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign("Crash recovery", filter("country", "US"));

        // A worker claimed the campaign, delivered to one subscriber and died.
        fixture.campaignRepository.claimForSending(campaignId, "dead-worker", START.minusMinutes(20), START.minusMinutes(15));
        fixture.deliveryOutcomeRepository.insertPendingIfAbsent(campaignId,
                List.of(alreadySent.getId(), stillPending.getId()), START.minusMinutes(20));
        Long sentOutcomeId = fixture.deliveryOutcomeRepository
                .findByCampaignAndSubscribers(campaignId, List.of(alreadySent.getId())).get(alreadySent.getId()).getId();
        fixture.deliveryOutcomeRepository.claimPending(sentOutcomeId, "dead-worker", START.minusMinutes(19));
        fixture.deliveryOutcomeRepository.markSent(sentOutcomeId, START.minusMinutes(19));

        assertThat(fixture.deliveryService.execute(campaignId)).isTrue();

        assertThat(fixture.transport.recipientsOf(campaignId))
                .containsExactlyInAnyOrder(stillPending.getId(), notReached.getId());
        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("COMPLETED");
        assertThat(campaign.getSentCount()).isEqualTo(3);
        assertThat(campaign.getTotalTargeted()).isEqualTo(3);
    }

    @Test
    void workerTakingOverAnExpiredLeaseNeverPushesTwice() {
        Subscriber first = fixture.subscriber("US");
        Subscriber second = fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign("Slow gateway", filter("country", "US"));
        CampaignDeliveryService otherWorker = fixture.worker("worker-test-2");
        AtomicBoolean otherWorkerRan = new AtomicBoolean();
        // The first push stalls past the lease, and another worker takes the campaign over meanwhile.
        fixture.transport.beforeNextSend(() -> {
            fixture.clock.advance(Duration.ofMinutes(6));
            otherWorkerRan.set(otherWorker.execute(campaignId));
        });

        boolean firstWorkerFinished = fixture.deliveryService.execute(campaignId);

        assertThat(otherWorkerRan).isTrue();
        assertThat(firstWorkerFinished).isFalse();
        assertThat(fixture.transport.recipientsOf(campaignId))
                .containsExactlyInAnyOrder(first.getId(), second.getId());

        assertThat(fixture.finalizer.finalizeIfDone(campaignId)).isTrue();
        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("COMPLETED");
        assertThat(campaign.getSentCount()).isEqualTo(2);
        assertThat(campaign.getTotalTargeted()).isEqualTo(2);
    }

    @Test
    void goneEndpointDeactivatesSubscriberForLaterCampaigns() {
        Subscriber healthy = fixture.subscriber("US");
        Subscriber gone = fixture.subscriber("US");
        fixture.transport.respond(gone, PushResult.gone("Subscription expired (HTTP 410)"));
        Long first = fixture.queuedCampaign("First", filter("country", "US"));
        Long second = fixture.queuedCampaign("Second", filter("country", "US"));

        fixture.deliveryService.execute(first);
        fixture.deliveryService.execute(second);

        assertThat(fixture.subscriberRepository.isActive(gone.getId())).isFalse();
        DeliveryOutcome goneOutcome = fixture.deliveryOutcomeRepository
                .findByCampaignAndSubscribers(first, List.of(gone.getId())).get(gone.getId());
        assertThat(goneOutcome.getStatus()).isEqualTo("FAILED_PERMANENT");
        assertThat(fixture.campaign(first).getFailedCount()).isEqualTo(1);

        assertThat(fixture.transport.recipientsOf(second)).containsExactly(healthy.getId());
        assertThat(fixture.campaign(second).getTotalTargeted()).isEqualTo(1);
        assertThat(fixture.campaign(second).getStatus()).isEqualTo("COMPLETED");
    }

    @Test
    void zeroAudienceCompletesImmediately() {
        fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign("Nobody", filter("country", "ZZ"));

        fixture.deliveryService.execute(campaignId);

        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("COMPLETED");
        assertThat(campaign.getSentCount()).isZero();
        assertThat(campaign.getFailedCount()).isZero();
        assertThat(campaign.getTotalTargeted()).isZero();
        assertThat(fixture.transport.totalSends()).isZero();
    }

    @Test
    void emptyValueSetTargetsNobody() {
        fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign("Empty filter", filter("country"));

        assertThat(fixture.deliveryService.execute(campaignId)).isTrue();

        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("COMPLETED");
        assertThat(campaign.isAudienceResolved()).isTrue();
        assertThat(campaign.getTotalTargeted()).isZero();
        assertThat(campaign.getSentCount()).isZero();
        assertThat(fixture.transport.totalSends()).isZero();
        assertThat(fixture.deliveryOutcomeRepository.countByStatus(campaignId)).isEmpty();
    }

    @Test
    void campaignWhereEveryRecipientIsRejectedStillCompletes() {
        fixture.subscriber("US");
        fixture.subscriber("US");
        fixture.subscriber("US");
        fixture.transport.respondToAll(PushResult.rejected("HTTP 400"));
        Long campaignId = fixture.queuedCampaign("Rejected", filter("country", "US"));

        fixture.deliveryService.execute(campaignId);

        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("COMPLETED");
        assertThat(campaign.getSentCount()).isZero();
        assertThat(campaign.getFailedCount()).isEqualTo(3);
    }

    @Test
    void invalidPayloadFailsCampaignWithoutDispatch() {
        fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign(null, filter("country", "US"));

        assertThat(fixture.deliveryService.execute(campaignId)).isFalse();

        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("FAILED");
        assertThat(campaign.getFailureReason()).contains("title is required");
        assertThat(fixture.transport.totalSends()).isZero();
    }

    @Test
    void unknownDimensionFailsCampaign() {
        fixture.subscriber("US");
        Long campaignId = fixture.queuedCampaign("Zodiac", filter("zodiac", "leo"));

        fixture.deliveryService.execute(campaignId);

        assertThat(fixture.campaign(campaignId).getStatus()).isEqualTo("FAILED");
        assertThat(fixture.campaign(campaignId).getFailureReason()).contains("zodiac");
    }

    @Test
    void transientFailureKeepsCampaignSendingWithScheduledRetry() {
        fixture.subscriber("US");
        Subscriber throttled = fixture.subscriber("US");
        fixture.transport.respond(throttled, PushResult.transientFailure("HTTP 429"));
        Long campaignId = fixture.queuedCampaign("Throttled", filter("country", "US"));

        fixture.deliveryService.execute(campaignId);

        Campaign campaign = fixture.campaign(campaignId);
        assertThat(campaign.getStatus()).isEqualTo("SENDING");
        assertThat(campaign.isAudienceResolved()).isTrue();
        DeliveryOutcome outcome = fixture.deliveryOutcomeRepository
                .findByCampaignAndSubscribers(campaignId, List.of(throttled.getId())).get(throttled.getId());
        assertThat(outcome.getStatus()).isEqualTo("FAILED_TRANSIENT");
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(outcome.getNextAttemptAt()).isAfter(START)
                .isBeforeOrEqualTo(START.plus(Duration.ofMinutes(1)));
    }
}
