package com.example.campaign.shared.service;

import com.example.campaign.shared.exception.InvalidCampaignException;
import com.example.campaign.shared.model.Campaign;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the parts of a campaign that end up in the push message. Used when publishing and
 * again by the delivery engine before the first dispatch.
 */
@Component
public class PushPayloadValidator {

    public static final int TITLE_MAX_LENGTH = 65;
    public static final int BODY_MAX_LENGTH = 180;

    public List<String> violations(Campaign campaign) {
        List<String> violations = new ArrayList<>();
        checkText(violations, "title", campaign.getTitle(), TITLE_MAX_LENGTH);
        checkText(violations, "body", campaign.getBody(), BODY_MAX_LENGTH);
        checkUrl(violations, "url", campaign.getUrl());
        checkUrl(violations, "image", campaign.getImage());
        checkUrl(violations, "icon", campaign.getIcon());
        checkUrl(violations, "badge", campaign.getBadge());
        return violations;
    }

    public void requireValid(Campaign campaign) {
        List<String> violations = violations(campaign);
        if (!violations.isEmpty()) {
            throw new InvalidCampaignException(String.join("; ", violations));
        }
    }

    private static void checkText(List<String> violations, String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            violations.add(field + " is required");
        } else if (value.length() > maxLength) {
            violations.add(field + " must be at most " + maxLength + " characters");
        }
    }

    private static void checkUrl(List<String> violations, String field, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                violations.add(field + " must be an absolute http or https URL");
            }
        } catch (URISyntaxException e) {
            violations.add(field + " is not a valid URL");
        }
    }
}
