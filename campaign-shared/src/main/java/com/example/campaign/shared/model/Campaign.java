package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {
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

    @Builder.Default
    private List<SegmentFilter> segments = new ArrayList<>();
    private OffsetDateTime sendAt;
    private String status;

    private int totalTargeted;
    private int sentCount;
    private int failedCount;
    private boolean audienceResolved;
    private String leaseOwner;
    private OffsetDateTime leaseExpiresAt;
    private String failureReason;

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime queuedAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
}
