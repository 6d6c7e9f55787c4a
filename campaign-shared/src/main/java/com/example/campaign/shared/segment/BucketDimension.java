package com.example.campaign.shared.segment;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A dimension with a fixed set of values, each mapped to its own SQL condition.
 * Values outside the set match nothing.
 */
public abstract class BucketDimension implements SegmentDimension {

    private final String id;
    private final String displayName;
    private final String description;
    private final Set<String> values;

    protected BucketDimension(String id, String displayName, String description, List<String> values) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Set<String> values() {
        return values;
    }

    @Override
    public SqlPredicate predicate(Set<String> selected, OffsetDateTime reference, String paramPrefix) {
        List<String> clauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        for (String value : values) {
            if (selected.contains(value)) {
                clauses.add("(" + bucketCondition(value, reference, paramPrefix + value + "_", params) + ")");
            }
        }
        if (clauses.isEmpty()) {
            return SqlPredicate.MATCH_NONE;
        }
        return new SqlPredicate(String.join(" OR ", clauses), params);
    }

    /**
     * SQL condition for one bucket. Parameter names must start with {@code paramPrefix}.
     */
    protected abstract String bucketCondition(String value, OffsetDateTime reference, String paramPrefix,
                                              Map<String, Object> params);
}
