package com.example.campaign.admin.dto;

import com.example.campaign.shared.model.SegmentFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignResponse {
    private Long id;
    private String name;
    private String title;
    private String body;
    private String url;
    private String image;
    private String icon;
    private String badge;
    private boolean requireInteraction;
    private boolean renotify;
    private boolean silent;
    private List<SegmentFilter> segments;
    private OffsetDateTime sendAt;
    private String status;
    private int totalTargeted;
    private int sentCount;
    private int failedCount;
    private String failureReason;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime queuedAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
}
