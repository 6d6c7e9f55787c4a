package com.example.campaign.delivery.service;

import com.example.campaign.delivery.retry.RetryPolicy;
import com.example.campaign.delivery.transport.PushPayload;
import com.example.campaign.delivery.transport.PushResult;
import com.example.campaign.delivery.transport.PushTransport;
import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.model.DeliveryOutcome;
import com.example.campaign.shared.model.Subscriber;
import com.example.campaign.shared.repository.DeliveryOutcomeRepository;
import com.example.campaign.shared.repository.SubscriberRepository;
import com.example.campaign.shared.util.Constants.DeliveryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Pushes to individual recipients and records each result on its delivery outcome row.
 */
@Component
@Slf4j
public class RecipientDispatcher {

    private final PushTransport pushTransport;
    private final DeliveryOutcomeRepository deliveryOutcomeRepository;
    private final SubscriberRepository subscriberRepository;
    private final RetryPolicy retryPolicy;
    private final AppProperties appProperties;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Executor deliveryExecutor;
    private final Clock clock;

    public RecipientDispatcher(PushTransport pushTransport,
                               DeliveryOutcomeRepository deliveryOutcomeRepository,
                               SubscriberRepository subscriberRepository,
                               RetryPolicy retryPolicy,
                               AppProperties appProperties,
                               MonitoringConfig.CampaignMetricsCollector metricsCollector,
                               @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                               Clock clock) {
        this.pushTransport = pushTransport;
        this.deliveryOutcomeRepository = deliveryOutcomeRepository;
        this.subscriberRepository = subscriberRepository;
        this.retryPolicy = retryPolicy;
        this.appProperties = appProperties;
        this.metricsCollector = metricsCollector;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
    }

    /**
     * Dispatches outcomes the caller has already claimed, concurrently on the delivery pool, and
     * returns once all results are recorded.
     */
    public void dispatchAll(PushPayload payload, Collection<DeliveryOutcome> outcomes) {
        dispatchAll(payload, outcomes, outcome -> true);
    }

    /**
     * Claims each PENDING outcome for {@code owner} right before its push. Outcomes another worker
     * claimed first are skipped, so a recipient is pushed by one worker only.
     */
    public void claimAndDispatchAll(PushPayload payload, Collection<DeliveryOutcome> outcomes, String owner) {
        dispatchAll(payload, outcomes, outcome -> {
            if (deliveryOutcomeRepository.claimPending(outcome.getId(), owner, OffsetDateTime.now(clock))) {
                return true;
            }
            log.debug("Outcome {} already claimed by another worker", outcome.getId());
            return false;
        });
    }

    private void dispatchAll(PushPayload payload, Collection<DeliveryOutcome> outcomes, Predicate<DeliveryOutcome> claim) {
        if (outcomes.isEmpty()) {
            return;
        }
        List<Long> subscriberIds = outcomes.stream().map(DeliveryOutcome::getSubscriberId).toList();
        Map<Long, Subscriber> subscribers = subscriberRepository.findByIds(subscriberIds).stream()
                .collect(Collectors.toMap(Subscriber::getId, Function.identity()));

        CompletableFuture<?>[] futures = outcomes.stream()
                .map(outcome -> CompletableFuture.runAsync(() -> {
                    if (claim.test(outcome)) {
                        dispatch(payload, outcome, subscribers.get(outcome.getSubscriberId()));
                    }
                }, deliveryExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    /**
     * Pushes to a recipient whose outcome row is IN_FLIGHT and records the result.
     *
     * @return the status recorded for this recipient
     */
    public DeliveryStatus dispatch(PushPayload payload, DeliveryOutcome outcome, Subscriber subscriber) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (subscriber == null || !subscriber.isActive()) {
            deliveryOutcomeRepository.markFailedPermanent(outcome.getId(), "Subscriber inactive", false, now);
            return record(DeliveryStatus.FAILED_PERMANENT);
        }

        PushResult result;
        try {
            result = pushTransport.send(subscriber, payload);
        } catch (RuntimeException e) {
            log.warn("Push to subscriber {} failed unexpectedly: {}", subscriber.getId(), e.getMessage());
            result = PushResult.transientFailure(e.getMessage());
        }

        now = OffsetDateTime.now(clock);
        switch (result.getOutcome()) {
            case DELIVERED:
                deliveryOutcomeRepository.markSent(outcome.getId(), now);
                return record(DeliveryStatus.SENT);
            case GONE:
                subscriberRepository.deactivate(subscriber.getId(), now);
                deliveryOutcomeRepository.markFailedPermanent(outcome.getId(), result.getDetail(), true, now);
                log.info("Subscriber {} deactivated: {}", subscriber.getId(), result.getDetail());
                metricsCollector.incrementCounter("campaign.subscribers.deactivated");
                return record(DeliveryStatus.FAILED_PERMANENT);
            case REJECTED:
                deliveryOutcomeRepository.markFailedPermanent(outcome.getId(), result.getDetail(), true, now);
                return record(DeliveryStatus.FAILED_PERMANENT);
            case TRANSIENT:
            default:
                return recordTransient(outcome, result.getDetail(), now);
        }
    }

    private DeliveryStatus recordTransient(DeliveryOutcome outcome, String detail, OffsetDateTime now) {
        int attempts = outcome.getAttempts() + 1;
        int maxAttempts = appProperties.getDelivery().getMaxAttempts();
        if (attempts >= maxAttempts) {
            deliveryOutcomeRepository.markFailedPermanent(outcome.getId(),
                    "Gave up after " + attempts + " attempts: " + detail, true, now);
            log.debug("Outcome {} exhausted {} attempts", outcome.getId(), attempts);
            return record(DeliveryStatus.FAILED_PERMANENT);
        }
        OffsetDateTime nextAttemptAt = now.plus(Duration.ofMillis(retryPolicy.computeDelayMs(attempts)));
        deliveryOutcomeRepository.markFailedTransient(outcome.getId(), detail, now, nextAttemptAt);
        return record(DeliveryStatus.FAILED_TRANSIENT);
    }

    private DeliveryStatus record(DeliveryStatus status) {
        metricsCollector.incrementCounter("campaign.delivery.outcomes", "status", status.name());
        return status;
    }
}
