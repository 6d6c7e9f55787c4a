package com.example.campaign.delivery.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.repository.CampaignRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliveryWorkerTest {

    @Mock
    private CampaignDeliveryService deliveryService;

    @Mock
    private CampaignFinalizer finalizer;

    @Mock
    private CampaignRepository campaignRepository;

    private final Clock clock = Clock.fixed(Instant.parse("2026-06-01T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void sameCampaignIsNotSubmittedTwiceWhileInFlight() {
        List<Runnable> queued = new ArrayList<>();
        DeliveryWorker worker = worker(queued::add);

        assertThat(worker.submit(5L)).isTrue();
        assertThat(worker.submit(5L)).isFalse();

        queued.get(0).run();
        verify(deliveryService).execute(5L);
        assertThat(worker.submit(5L)).isTrue();
    }

    @Test
    void failedRunReleasesCampaign() {
        when(deliveryService.execute(6L)).thenThrow(new IllegalStateException("database unavailable"));
        DeliveryWorker worker = worker(Runnable::run);

        assertThat(worker.submit(6L)).isTrue();
        assertThat(worker.submit(6L)).isTrue();
    }

    @Test
    void saturatedExecutorLeavesCampaignForNextPoll() {
        TaskExecutor executor = mock(TaskExecutor.class);
        doThrow(new TaskRejectedException("full")).when(executor).execute(any(Runnable.class));
        DeliveryWorker worker = worker(executor);

        assertThat(worker.submit(7L)).isFalse();
    }

    @Test
    void pollSubmitsClaimableAndFinalizesResolved() {
        when(campaignRepository.findClaimable(any(), anyInt())).thenReturn(List.of(1L, 2L));
        when(campaignRepository.findResolvedSending(anyInt())).thenReturn(List.of(3L));
        DeliveryWorker worker = worker(Runnable::run);

        worker.poll();

        verify(deliveryService).execute(1L);
        verify(deliveryService).execute(2L);
        verify(finalizer).finalizeIfDone(3L);
    }

    private DeliveryWorker worker(TaskExecutor executor) {
        return new DeliveryWorker(deliveryService, finalizer, campaignRepository, new AppProperties(), executor, clock);
    }
}
