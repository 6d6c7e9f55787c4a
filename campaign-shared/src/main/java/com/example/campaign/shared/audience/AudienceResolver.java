package com.example.campaign.shared.audience;

import com.example.campaign.shared.model.SegmentFilter;
import com.example.campaign.shared.repository.SubscriberRepository;
import com.example.campaign.shared.segment.SegmentCatalog;
import com.example.campaign.shared.segment.SegmentDimension;
import com.example.campaign.shared.segment.SqlPredicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns segment filters into an {@link Audience}: OR within a filter's values, AND across filters,
 * always restricted to active subscribers. No filters means everyone active.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AudienceResolver {

    private final SegmentCatalog segmentCatalog;
    private final SubscriberRepository subscriberRepository;
    private final Clock clock;

    public Audience resolve(List<SegmentFilter> filters) {
        OffsetDateTime reference = OffsetDateTime.now(clock);
        List<SegmentFilter> safeFilters = filters != null ? filters : List.of();

        // Dimensions are checked up front so an unknown one fails even next to an empty filter.
        List<SegmentDimension> dimensions = new ArrayList<>(safeFilters.size());
        for (SegmentFilter filter : safeFilters) {
            dimensions.add(segmentCatalog.dimension(filter.getType()));
        }

        List<String> clauses = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource();
        for (int i = 0; i < safeFilters.size(); i++) {
            Set<String> values = toValueSet(safeFilters.get(i).getValues());
            if (values.isEmpty()) {
                log.debug("Filter on '{}' has no values; audience is empty", dimensions.get(i).id());
                return Audience.none();
            }
            SqlPredicate predicate = dimensions.get(i).predicate(values, reference, "f" + i + "_");
            clauses.add("(" + predicate.sql() + ")");
            params.addValues(predicate.params());
        }

        String where = clauses.isEmpty() ? "1 = 1" : String.join(" AND ", clauses);
        return new Audience(subscriberRepository, where, params);
    }

    private static Set<String> toValueSet(List<String> values) {
        Set<String> set = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null) {
                    set.add(value);
                }
            }
        }
        return set;
    }
}
