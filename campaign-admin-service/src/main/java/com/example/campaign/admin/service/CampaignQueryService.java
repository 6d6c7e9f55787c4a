package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.CampaignStatsResponse;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.exception.InvalidCampaignException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.DeliveryOutcomeRepository;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
@Monitored("service")
public class CampaignQueryService {

    private final CampaignRepository campaignRepository;
    private final DeliveryOutcomeRepository deliveryOutcomeRepository;
    private final CampaignMapper campaignMapper;

    public CampaignResponse getCampaign(Long id) {
        return campaignMapper.toCampaignResponse(load(id));
    }

    public List<CampaignResponse> listCampaigns(String status) {
        String filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = CampaignStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)).name();
            } catch (IllegalArgumentException e) {
                throw new InvalidCampaignException("Unknown campaign status: " + status);
            }
        }
        log.debug("Listing campaigns with status filter {}", filter);
        return campaignMapper.toCampaignResponses(campaignRepository.findAll(filter));
    }

    public CampaignStatsResponse getStats(Long id) {
        Campaign campaign = load(id);
        return campaignMapper.toStatsResponse(campaign, deliveryOutcomeRepository.countByStatus(id));
    }

    private Campaign load(Long id) {
        return campaignRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + id));
    }
}
