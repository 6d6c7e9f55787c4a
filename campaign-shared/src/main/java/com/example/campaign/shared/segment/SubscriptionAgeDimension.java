package com.example.campaign.shared.segment;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Age of the subscription: {@code new} up to newDays, {@code recent} up to recentDays,
 * {@code established} beyond that.
 */
public class SubscriptionAgeDimension extends BucketDimension {

    public static final String NEW = "new";
    public static final String RECENT = "recent";
    public static final String ESTABLISHED = "established";

    private final int newDays;
    private final int recentDays;

    public SubscriptionAgeDimension(int newDays, int recentDays) {
        super("subscription_age", "Subscription age",
                "new: up to " + newDays + " days, recent: up to " + recentDays + " days, established: older",
                List.of(NEW, RECENT, ESTABLISHED));
        if (recentDays <= newDays) {
            throw new IllegalArgumentException("recentDays must be greater than newDays");
        }
        this.newDays = newDays;
        this.recentDays = recentDays;
    }

    @Override
    protected String bucketCondition(String value, OffsetDateTime reference, String paramPrefix, Map<String, Object> params) {
        String newCutoff = paramPrefix + "new_cutoff";
        String recentCutoff = paramPrefix + "recent_cutoff";
        switch (value) {
            case NEW:
                params.put(newCutoff, reference.minusDays(newDays));
                return "subscribed_at >= :" + newCutoff;
            case RECENT:
                params.put(newCutoff, reference.minusDays(newDays));
                params.put(recentCutoff, reference.minusDays(recentDays));
                return "subscribed_at < :" + newCutoff + " AND subscribed_at >= :" + recentCutoff;
            default:
                params.put(recentCutoff, reference.minusDays(recentDays));
                return "subscribed_at < :" + recentCutoff;
        }
    }
}
