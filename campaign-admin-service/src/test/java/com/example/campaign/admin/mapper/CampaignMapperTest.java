package com.example.campaign.admin.mapper;

import com.example.campaign.admin.dto.CampaignStatsResponse;
import com.example.campaign.admin.dto.SegmentResponse;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.segment.AttributeDimension;
import com.example.campaign.shared.segment.EngagementDimension;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CampaignMapperTest {

    private final CampaignMapper mapper = Mappers.getMapper(CampaignMapper.class);

    @Test
    void segmentResponseTellsDataDerivedFromFixedDimensions() {
        SegmentResponse country = mapper.toSegmentResponse(new AttributeDimension("country", "Country",
                "Country of the subscriber", "country", null, Caffeine.newBuilder().build()));
        SegmentResponse engagement = mapper.toSegmentResponse(new EngagementDimension(30));

        assertThat(country.getId()).isEqualTo("country");
        assertThat(country.isDataDerived()).isTrue();
        assertThat(engagement.getId()).isEqualTo("engagement");
        assertThat(engagement.isDataDerived()).isFalse();
    }

    @Test
    void statsCountRecipientsBeingPushed() {
        Campaign campaign = Campaign.builder().id(4L).status("SENDING").totalTargeted(10).build();

        CampaignStatsResponse stats = mapper.toStatsResponse(campaign,
                Map.of("SENT", 5L, "IN_FLIGHT", 3L, "PENDING", 2L));

        assertThat(stats.getSent()).isEqualTo(5);
        assertThat(stats.getInFlight()).isEqualTo(3);
        assertThat(stats.getPending()).isEqualTo(2);
        assertThat(stats.getDeliveryRate()).isEqualTo(0.5);
    }
}
