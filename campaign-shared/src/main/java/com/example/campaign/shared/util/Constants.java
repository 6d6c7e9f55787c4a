package com.example.campaign.shared.util;

public final class Constants {

    private Constants() {}

    public static final String DLT_SUFFIX = "-dlt";

    public static final String CAMPAIGN_AGGREGATE = "Campaign";

    public enum CampaignStatus {
        DRAFT,
        SCHEDULED,
        QUEUED,
        SENDING,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    public enum DeliveryStatus {
        PENDING,
        IN_FLIGHT,
        SENT,
        FAILED_TRANSIENT,
        FAILED_PERMANENT
    }

    public enum EventType {
        CAMPAIGN_QUEUED
    }
}
