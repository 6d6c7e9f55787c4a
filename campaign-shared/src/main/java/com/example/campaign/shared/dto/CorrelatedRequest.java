package com.example.campaign.shared.dto;

/**
 * Request payloads that carry a caller-supplied correlation id.
 */
public interface CorrelatedRequest {
    String getCorrelationId();
}
