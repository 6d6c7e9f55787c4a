package com.example.campaign.shared.segment;

import java.util.Map;

/**
 * A boolean SQL expression over the subscribers table plus the named parameters it binds.
 */
public record SqlPredicate(String sql, Map<String, Object> params) {

    public static final SqlPredicate MATCH_NONE = new SqlPredicate("1 = 0", Map.of());
}
