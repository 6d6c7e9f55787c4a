package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A push subscription with its attribute snapshot. Attributes are written by the
 * ingestion pipeline; this service only flips {@code active}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscriber {
    private Long id;
    private String endpoint;
    private String p256dh;
    private String authSecret;
    private String browser;
    private String os;
    private String deviceType;
    private String country;
    private String language;
    private OffsetDateTime subscribedAt;
    private OffsetDateTime lastSeenAt;
    private boolean active;
    private OffsetDateTime deactivatedAt;
}
