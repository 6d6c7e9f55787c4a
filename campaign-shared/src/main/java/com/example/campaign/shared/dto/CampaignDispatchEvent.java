package com.example.campaign.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Kafka message telling delivery workers that a campaign has been queued.
 * It is only a wake-up signal: workers re-read the campaign and claim it conditionally.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignDispatchEvent {
    private String eventId;
    private Long campaignId;
    private String eventType;
    private String correlationId;
    private long timestampEpochMilli;
}
