package com.example.campaign.admin.mapper;

import com.example.campaign.admin.dto.CampaignRequest;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.CampaignStatsResponse;
import com.example.campaign.admin.dto.SegmentFilterRequest;
import com.example.campaign.admin.dto.SegmentResponse;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.SegmentFilter;
import com.example.campaign.shared.segment.SegmentDimension;
import com.example.campaign.shared.util.Constants.DeliveryStatus;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;
import java.util.Map;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface CampaignMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "status", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Campaign toCampaign(CampaignRequest request);

    SegmentFilter toSegmentFilter(SegmentFilterRequest request);

    List<SegmentFilter> toSegmentFilters(List<SegmentFilterRequest> requests);

    CampaignResponse toCampaignResponse(Campaign campaign);

    List<CampaignResponse> toCampaignResponses(List<Campaign> campaigns);

    default SegmentResponse toSegmentResponse(SegmentDimension dimension) {
        return SegmentResponse.builder()
                .id(dimension.id())
                .name(dimension.displayName())
                .description(dimension.description())
                .dataDerived(dimension.dataDerived())
                .build();
    }

    default CampaignStatsResponse toStatsResponse(Campaign campaign, Map<String, Long> counts) {
        long sent = counts.getOrDefault(DeliveryStatus.SENT.name(), 0L);
        int targeted = campaign.getTotalTargeted();
        return CampaignStatsResponse.builder()
                .campaignId(campaign.getId())
                .status(campaign.getStatus())
                .totalTargeted(targeted)
                .pending(counts.getOrDefault(DeliveryStatus.PENDING.name(), 0L))
                .inFlight(counts.getOrDefault(DeliveryStatus.IN_FLIGHT.name(), 0L))
                .sent(sent)
                .failedTransient(counts.getOrDefault(DeliveryStatus.FAILED_TRANSIENT.name(), 0L))
                .failedPermanent(counts.getOrDefault(DeliveryStatus.FAILED_PERMANENT.name(), 0L))
                .deliveryRate(targeted > 0 ? (double) sent / targeted : 0.0)
                .build();
    }
}
