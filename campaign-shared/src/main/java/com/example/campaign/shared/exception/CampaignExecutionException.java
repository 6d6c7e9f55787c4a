package com.example.campaign.shared.exception;

import lombok.Getter;

/**
 * A campaign cannot be executed at all, e.g. its payload is invalid or its segments
 * reference a dimension that no longer exists. The campaign is moved to FAILED.
 */
@Getter
public class CampaignExecutionException extends RuntimeException {

    private final Long campaignId;

    public CampaignExecutionException(Long campaignId, String message) {
        super(message);
        this.campaignId = campaignId;
    }

    public CampaignExecutionException(Long campaignId, String message, Throwable cause) {
        super(message, cause);
        this.campaignId = campaignId;
    }
}
