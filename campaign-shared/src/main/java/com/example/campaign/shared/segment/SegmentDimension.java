package com.example.campaign.shared.segment;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * One axis along which subscribers can be partitioned.
 */
public interface SegmentDimension {

    String id();

    String displayName();

    String description();

    /**
     * The raw values an operator may pick for this dimension.
     */
    Set<String> values();

    /**
     * Builds the predicate selecting subscribers whose attribute matches any of {@code values}.
     *
     * @param values      accepted values, never empty
     * @param reference   "now" for time-based dimensions, fixed for the whole resolution
     * @param paramPrefix prefix that keeps this predicate's parameter names unique in the query
     */
    SqlPredicate predicate(Set<String> values, OffsetDateTime reference, String paramPrefix);

    /**
     * Whether {@link #values()} is read from subscriber data rather than being a fixed set.
     */
    default boolean dataDerived() {
        return false;
    }
}
