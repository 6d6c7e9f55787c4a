package com.example.campaign.admin.service;

import com.example.campaign.shared.exception.InvalidCampaignException;
import com.example.campaign.shared.model.SegmentFilter;
import com.example.campaign.shared.segment.SegmentCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects filters on unregistered dimensions and repeated dimensions. The resolver would AND
 * two filters of the same type, which the campaign form never means.
 */
@Component
@RequiredArgsConstructor
public class SegmentFilterValidator {

    private final SegmentCatalog segmentCatalog;

    public void validate(List<SegmentFilter> filters) {
        if (filters == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (SegmentFilter filter : filters) {
            if (filter.getType() == null || filter.getType().isBlank()) {
                throw new InvalidCampaignException("Segment type is required");
            }
            segmentCatalog.dimension(filter.getType());
            if (!seen.add(filter.getType())) {
                throw new InvalidCampaignException("Duplicate segment type: " + filter.getType());
            }
        }
    }
}
