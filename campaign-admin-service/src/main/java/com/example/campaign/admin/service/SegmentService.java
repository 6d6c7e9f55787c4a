package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.SegmentFilterRequest;
import com.example.campaign.admin.dto.SegmentResponse;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.audience.AudienceResolver;
import com.example.campaign.shared.model.SegmentFilter;
import com.example.campaign.shared.segment.SegmentCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("service")
public class SegmentService {

    private final SegmentCatalog segmentCatalog;
    private final AudienceResolver audienceResolver;
    private final SegmentFilterValidator segmentFilterValidator;
    private final CampaignMapper campaignMapper;

    public List<SegmentResponse> listDimensions() {
        return segmentCatalog.listDimensions().stream()
                .map(campaignMapper::toSegmentResponse)
                .toList();
    }

    public Set<String> listValues(String dimensionId) {
        return segmentCatalog.listValues(dimensionId);
    }

    /**
     * Audience size for the given filters, using the resolver's count path so the form preview
     * and the eventual delivery agree.
     */
    public long countAudience(List<SegmentFilterRequest> requests) {
        List<SegmentFilter> filters = campaignMapper.toSegmentFilters(requests == null ? List.of() : requests);
        segmentFilterValidator.validate(filters);
        long count = audienceResolver.resolve(filters).count();
        log.debug("Audience preview for {} filters: {}", filters.size(), count);
        return count;
    }
}
