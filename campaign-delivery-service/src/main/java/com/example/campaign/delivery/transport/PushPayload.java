package com.example.campaign.delivery.transport;

import com.example.campaign.shared.model.Campaign;
import lombok.Builder;
import lombok.Value;

/**
 * Notification content as handed to the push gateway. Identical for every recipient of a campaign.
 */
@Value
@Builder
public class PushPayload {
    Long campaignId;
    String title;
    String body;
    String url;
    String image;
    String icon;
    String badge;
    boolean requireInteraction;
    boolean renotify;
    boolean silent;
    int ttlSeconds;

    public static PushPayload from(Campaign campaign, int ttlSeconds) {
        return PushPayload.builder()
                .campaignId(campaign.getId())
                .title(campaign.getTitle())
                .body(campaign.getBody())
                .url(campaign.getUrl())
                .image(campaign.getImage())
                .icon(campaign.getIcon())
                .badge(campaign.getBadge())
                .requireInteraction(campaign.isRequireInteraction())
                .renotify(campaign.isRenotify())
                .silent(campaign.isSilent())
                .ttlSeconds(ttlSeconds)
                .build();
    }
}
