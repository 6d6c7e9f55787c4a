package com.example.campaign.shared.exception;

import lombok.Getter;

/**
 * The requested operation is not allowed in the campaign's current status.
 */
@Getter
public class CampaignStateException extends RuntimeException {

    private final Long campaignId;
    private final String currentStatus;

    public CampaignStateException(Long campaignId, String currentStatus, String operation) {
        super(String.format("Cannot %s campaign %d in status %s", operation, campaignId, currentStatus));
        this.campaignId = campaignId;
        this.currentStatus = currentStatus;
    }
}
