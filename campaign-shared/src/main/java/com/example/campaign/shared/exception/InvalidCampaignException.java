package com.example.campaign.shared.exception;

public class InvalidCampaignException extends RuntimeException {
    public InvalidCampaignException(String message) {
        super(message);
    }
}
