package com.example.campaign.shared.audience;

import com.example.campaign.shared.repository.SubscriberRepository;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * The resolved audience of one set of segment filters. Nothing is read until
 * {@link #count()} or a cursor page is requested.
 */
public class Audience {

    private final SubscriberRepository subscriberRepository;
    private final String predicate;
    private final MapSqlParameterSource params;
    private final boolean empty;

    Audience(SubscriberRepository subscriberRepository, String predicate, MapSqlParameterSource params) {
        this.subscriberRepository = subscriberRepository;
        this.predicate = predicate;
        this.params = params;
        this.empty = false;
    }

    private Audience() {
        this.subscriberRepository = null;
        this.predicate = null;
        this.params = null;
        this.empty = true;
    }

    static Audience none() {
        return new Audience();
    }

    /**
     * Cardinality via COUNT(*), without materializing subscriber ids.
     */
    public long count() {
        if (empty) {
            return 0L;
        }
        return subscriberRepository.countActiveMatching(predicate, params);
    }

    public AudienceCursor members(int pageSize) {
        return membersAfter(0L, pageSize);
    }

    /**
     * A cursor that resumes after a previously seen subscriber id.
     */
    AudienceCursor membersAfter(long afterId, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        if (empty) {
            return AudienceCursor.exhausted();
        }
        return new AudienceCursor(
                (after, limit) -> subscriberRepository.findActiveMatchingIds(predicate, params, after, limit),
                afterId, pageSize);
    }

    /**
     * True when a filter had no values, so the audience is empty without a query.
     */
    public boolean isKnownEmpty() {
        return empty;
    }
}
