package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.CampaignRequest;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.exception.CampaignStateException;
import com.example.campaign.shared.exception.InvalidCampaignException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.service.PushPayloadValidator;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Create, edit, publish and cancel. Publishing with a send time schedules the campaign for the
 * next scheduler sweep (even when that time has passed); publishing without one queues it now.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("service")
public class CampaignLifecycleService {

    static final String ACTION_SAVE = "save";
    static final String ACTION_DRAFT = "draft";

    private final CampaignRepository campaignRepository;
    private final CampaignQueueService campaignQueueService;
    private final SegmentFilterValidator segmentFilterValidator;
    private final PushPayloadValidator pushPayloadValidator;
    private final CampaignMapper campaignMapper;
    private final Clock clock;

    @Transactional
    public CampaignResponse createCampaign(CampaignRequest request) {
        boolean publish = isPublish(request.getAction());
        Campaign campaign = toValidatedCampaign(request);
        OffsetDateTime now = OffsetDateTime.now(clock);
        campaign.setStatus(CampaignStatus.DRAFT.name());
        campaign.setCreatedAt(now);
        campaign.setUpdatedAt(now);
        campaign = campaignRepository.save(campaign);
        log.info("Campaign {} saved as draft", campaign.getId());

        if (publish) {
            publishInternal(campaign, CampaignStatus.DRAFT);
        }
        return campaignMapper.toCampaignResponse(load(campaign.getId()));
    }

    @Transactional
    public CampaignResponse updateCampaign(Long id, CampaignRequest request) {
        boolean publish = isPublish(request.getAction());
        Campaign existing = load(id);
        requireEditable(existing, "update");

        Campaign campaign = toValidatedCampaign(request);
        campaign.setId(id);
        if (!campaignRepository.updateDraft(campaign, OffsetDateTime.now(clock))) {
            throw new CampaignStateException(id, load(id).getStatus(), "update");
        }
        log.info("Campaign {} updated and returned to draft", id);

        if (publish) {
            publishInternal(load(id), CampaignStatus.DRAFT);
        }
        return campaignMapper.toCampaignResponse(load(id));
    }

    @Transactional
    public CampaignResponse publishCampaign(Long id) {
        Campaign campaign = load(id);
        requireEditable(campaign, "publish");
        publishInternal(campaign, CampaignStatus.valueOf(campaign.getStatus()));
        return campaignMapper.toCampaignResponse(load(id));
    }

    /**
     * Only DRAFT and SCHEDULED campaigns can be cancelled; once queued, delivery is under way.
     */
    @Transactional
    public CampaignResponse cancelCampaign(Long id) {
        Campaign campaign = load(id);
        CampaignStatus status = CampaignStatus.valueOf(campaign.getStatus());
        if (status != CampaignStatus.DRAFT && status != CampaignStatus.SCHEDULED) {
            throw new CampaignStateException(id, campaign.getStatus(), "cancel");
        }
        if (!campaignRepository.transition(id, status, CampaignStatus.CANCELLED, OffsetDateTime.now(clock))) {
            throw new CampaignStateException(id, load(id).getStatus(), "cancel");
        }
        log.info("Campaign {} cancelled (was {})", id, status);
        return campaignMapper.toCampaignResponse(load(id));
    }

    private void publishInternal(Campaign campaign, CampaignStatus from) {
        pushPayloadValidator.requireValid(campaign);
        segmentFilterValidator.validate(campaign.getSegments());

        if (campaign.getSendAt() != null) {
            if (!campaignRepository.transition(campaign.getId(), from, CampaignStatus.SCHEDULED, OffsetDateTime.now(clock))) {
                throw new CampaignStateException(campaign.getId(), load(campaign.getId()).getStatus(), "schedule");
            }
            log.info("Campaign {} scheduled for {}", campaign.getId(), campaign.getSendAt());
            return;
        }
        if (!campaignQueueService.queue(campaign.getId(), from)) {
            throw new CampaignStateException(campaign.getId(), load(campaign.getId()).getStatus(), "queue");
        }
    }

    private Campaign toValidatedCampaign(CampaignRequest request) {
        Campaign campaign = campaignMapper.toCampaign(request);
        if (campaign.getSegments() == null) {
            campaign.setSegments(new ArrayList<>());
        }
        segmentFilterValidator.validate(campaign.getSegments());
        return campaign;
    }

    private static void requireEditable(Campaign campaign, String operation) {
        CampaignStatus status = CampaignStatus.valueOf(campaign.getStatus());
        if (status != CampaignStatus.DRAFT && status != CampaignStatus.CANCELLED) {
            throw new CampaignStateException(campaign.getId(), campaign.getStatus(), operation);
        }
    }

    private Campaign load(Long id) {
        return campaignRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + id));
    }

    private static boolean isPublish(String action) {
        String normalized = action == null ? ACTION_SAVE : action.trim().toLowerCase(Locale.ROOT);
        if (ACTION_SAVE.equals(normalized)) {
            return true;
        }
        if (ACTION_DRAFT.equals(normalized)) {
            return false;
        }
        throw new InvalidCampaignException("Unknown action: " + action);
    }
}
