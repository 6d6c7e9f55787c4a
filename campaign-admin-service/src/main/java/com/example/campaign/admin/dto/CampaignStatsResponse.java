package com.example.campaign.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignStatsResponse {
    private Long campaignId;
    private String status;
    private int totalTargeted;
    private long pending;
    private long inFlight;
    private long sent;
    private long failedTransient;
    private long failedPermanent;
    private double deliveryRate;
}
