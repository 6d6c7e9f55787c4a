package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryOutcome {
    private Long id;
    private Long campaignId;
    private Long subscriberId;
    private String status;
    private int attempts;
    private OffsetDateTime lastAttemptAt;
    private OffsetDateTime nextAttemptAt;
    private String errorDetail;
    private OffsetDateTime createdAt;
    private String claimedBy;
    private OffsetDateTime claimedAt;
}
