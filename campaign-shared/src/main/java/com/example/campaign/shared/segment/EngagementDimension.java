package com.example.campaign.shared.segment;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * {@code active}: seen within the engagement window. {@code inactive}: never seen, or seen before it.
 */
public class EngagementDimension extends BucketDimension {

    public static final String ACTIVE = "active";
    public static final String INACTIVE = "inactive";

    private final int windowDays;

    public EngagementDimension(int windowDays) {
        super("engagement", "Engagement",
                "Whether the subscriber has been seen in the last " + windowDays + " days",
                List.of(ACTIVE, INACTIVE));
        this.windowDays = windowDays;
    }

    @Override
    protected String bucketCondition(String value, OffsetDateTime reference, String paramPrefix, Map<String, Object> params) {
        String cutoff = paramPrefix + "cutoff";
        params.put(cutoff, reference.minusDays(windowDays));
        if (ACTIVE.equals(value)) {
            return "last_seen_at >= :" + cutoff;
        }
        return "last_seen_at IS NULL OR last_seen_at < :" + cutoff;
    }
}
