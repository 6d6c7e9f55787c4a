package com.example.campaign.shared.segment;

import com.example.campaign.shared.repository.SubscriberRepository;
import com.github.benmanes.caffeine.cache.Cache;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A dimension backed directly by one subscriber attribute column. Its values are whatever
 * the active population currently holds, cached for a short time.
 */
public class AttributeDimension implements SegmentDimension {

    private final String id;
    private final String displayName;
    private final String description;
    private final String column;
    private final SubscriberRepository subscriberRepository;
    private final Cache<String, Set<String>> valuesCache;

    public AttributeDimension(String id, String displayName, String description, String column,
                              SubscriberRepository subscriberRepository, Cache<String, Set<String>> valuesCache) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.column = column;
        this.subscriberRepository = subscriberRepository;
        this.valuesCache = valuesCache;
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
        return valuesCache.get(id, key -> Collections.unmodifiableSet(
                new LinkedHashSet<>(subscriberRepository.findDistinctActiveValues(column))));
    }

    @Override
    public SqlPredicate predicate(Set<String> values, OffsetDateTime reference, String paramPrefix) {
        String param = paramPrefix + "values";
        return new SqlPredicate(column + " IN (:" + param + ")", Map.of(param, values));
    }

    @Override
    public boolean dataDerived() {
        return true;
    }
}
