package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.CampaignRequest;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.SegmentFilterRequest;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.admin.support.AdminTestDatabase;
import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.exception.CampaignStateException;
import com.example.campaign.shared.exception.InvalidCampaignException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.exception.UnknownDimensionException;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.OutboxRepository;
import com.example.campaign.shared.repository.SubscriberRepository;
import com.example.campaign.shared.segment.SegmentCatalog;
import com.example.campaign.shared.service.OutboxEventPublisher;
import com.example.campaign.shared.service.PushPayloadValidator;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CampaignLifecycleServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 4, 10, 15, 0, 0, 0, ZoneOffset.UTC);

    private CampaignRepository campaignRepository;
    private OutboxRepository outboxRepository;
    private CampaignLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        DataSource dataSource = AdminTestDatabase.create();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        AppProperties appProperties = new AppProperties();
        campaignRepository = new CampaignRepository(jdbcTemplate);
        outboxRepository = new OutboxRepository(jdbcTemplate);
        SubscriberRepository subscriberRepository = new SubscriberRepository(jdbcTemplate, new NamedParameterJdbcTemplate(dataSource));
        SegmentCatalog catalog = new SegmentCatalog(subscriberRepository, Caffeine.newBuilder().build(), appProperties);
        CampaignQueueService queueService = new CampaignQueueService(campaignRepository,
                new OutboxEventPublisher(outboxRepository, new ObjectMapper(), clock), appProperties,
                new MonitoringConfig.CampaignMetricsCollector(new SimpleMeterRegistry()), clock);
        lifecycleService = new CampaignLifecycleService(campaignRepository, queueService,
                new SegmentFilterValidator(catalog), new PushPayloadValidator(),
                Mappers.getMapper(CampaignMapper.class), clock);
    }

    @Test
    void saveWithoutSendTimeQueuesImmediately() {
        CampaignResponse response = lifecycleService.createCampaign(request("save", null));

        assertThat(response.getStatus()).isEqualTo("QUEUED");
        assertThat(response.getQueuedAt()).isNotNull();
        assertThat(outboxRepository.count()).isEqualTo(1);
    }

    @Test
    void saveWithSendTimeSchedules() {
        CampaignResponse response = lifecycleService.createCampaign(request("save", NOW.plusHours(2)));

        assertThat(response.getStatus()).isEqualTo("SCHEDULED");
        assertThat(outboxRepository.count()).isZero();
    }

    @Test
    void draftActionKeepsIncompleteCampaign() {
        CampaignRequest request = request("DRAFT", null);
        request.setTitle(null);

        CampaignResponse response = lifecycleService.createCampaign(request);

        assertThat(response.getStatus()).isEqualTo("DRAFT");
        assertThat(response.getSegments()).hasSize(1);
    }

    @Test
    void publishingDraftWithMissingTitleIsRejected() {
        CampaignRequest request = request("draft", null);
        request.setTitle("  ");
        Long id = lifecycleService.createCampaign(request).getId();

        assertThatThrownBy(() -> lifecycleService.publishCampaign(id))
                .isInstanceOf(InvalidCampaignException.class)
                .hasMessageContaining("title is required");
        assertThat(campaignRepository.findById(id).orElseThrow().getStatus()).isEqualTo("DRAFT");
    }

    @Test
    void unknownActionIsRejected() {
        assertThatThrownBy(() -> lifecycleService.createCampaign(request("send-now", null)))
                .isInstanceOf(InvalidCampaignException.class);
    }

    @Test
    void unknownDimensionIsRejectedEvenForDrafts() {
        CampaignRequest request = request("draft", null);
        request.setSegments(List.of(SegmentFilterRequest.builder().type("zodiac").values(List.of("leo")).build()));

        assertThatThrownBy(() -> lifecycleService.createCampaign(request))
                .isInstanceOf(UnknownDimensionException.class);
    }

    @Test
    void updatingScheduledCampaignConflicts() {
        Long id = lifecycleService.createCampaign(request("save", NOW.plusDays(1))).getId();

        assertThatThrownBy(() -> lifecycleService.updateCampaign(id, request("draft", null)))
                .isInstanceOf(CampaignStateException.class);
    }

    @Test
    void cancelledCampaignCanBeEditedAndRepublished() {
        Long id = lifecycleService.createCampaign(request("save", NOW.plusDays(1))).getId();
        lifecycleService.cancelCampaign(id);

        CampaignRequest edit = request("save", null);
        edit.setTitle("Back by popular demand");
        CampaignResponse response = lifecycleService.updateCampaign(id, edit);

        assertThat(response.getStatus()).isEqualTo("QUEUED");
        assertThat(response.getTitle()).isEqualTo("Back by popular demand");
    }

    @Test
    void queuedCampaignCannotBeCancelled() {
        Long id = lifecycleService.createCampaign(request("save", null)).getId();

        assertThatThrownBy(() -> lifecycleService.cancelCampaign(id))
                .isInstanceOf(CampaignStateException.class)
                .hasMessageContaining("QUEUED");
        assertThat(campaignRepository.findById(id).orElseThrow().getStatus()).isEqualTo(CampaignStatus.QUEUED.name());
    }

    @Test
    void missingCampaignIsNotFound() {
        assertThatThrownBy(() -> lifecycleService.publishCampaign(999L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private static CampaignRequest request(String action, OffsetDateTime sendAt) {
        return CampaignRequest.builder()
                .name("Spring launch")
                .title("New collection is live")
                .body("Tap to see what just landed.")
                .url("https://shop.example.com/new")
                .segments(List.of(SegmentFilterRequest.builder().type("country").values(List.of("US", "CA")).build()))
                .sendAt(sendAt)
                .action(action)
                .build();
    }
}
