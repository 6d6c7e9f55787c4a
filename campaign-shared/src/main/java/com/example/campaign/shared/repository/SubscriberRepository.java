package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.Subscriber;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

@Repository
@RequiredArgsConstructor
public class SubscriberRepository {

    /** Columns a segment dimension may enumerate or filter on. */
    private static final Set<String> ATTRIBUTE_COLUMNS = Set.of("country", "browser", "os", "device_type", "language");

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

    private final RowMapper<Subscriber> subscriberRowMapper = (rs, rowNum) -> Subscriber.builder()
            .id(rs.getLong("id"))
            .endpoint(rs.getString("endpoint"))
            .p256dh(rs.getString("p256dh"))
            .authSecret(rs.getString("auth_secret"))
            .browser(rs.getString("browser"))
            .os(rs.getString("os"))
            .deviceType(rs.getString("device_type"))
            .country(rs.getString("country"))
            .language(rs.getString("language"))
            .subscribedAt(rs.getObject("subscribed_at", OffsetDateTime.class))
            .lastSeenAt(rs.getObject("last_seen_at", OffsetDateTime.class))
            .active(rs.getBoolean("active"))
            .deactivatedAt(rs.getObject("deactivated_at", OffsetDateTime.class))
            .build();

    /**
     * Subscribers normally arrive through the ingestion pipeline; this insert exists for
     * imports and fixtures.
     */
    public Subscriber save(Subscriber subscriber) {
        String sql = """
            INSERT INTO subscribers
            (endpoint, p256dh, auth_secret, browser, os, device_type, country, language,
             subscribed_at, last_seen_at, active)
            VALUES (:endpoint, :p256dh, :authSecret, :browser, :os, :deviceType, :country, :language,
                    :subscribedAt, :lastSeenAt, :active)
            """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("endpoint", subscriber.getEndpoint())
                .addValue("p256dh", subscriber.getP256dh())
                .addValue("authSecret", subscriber.getAuthSecret())
                .addValue("browser", subscriber.getBrowser())
                .addValue("os", subscriber.getOs())
                .addValue("deviceType", subscriber.getDeviceType())
                .addValue("country", subscriber.getCountry())
                .addValue("language", subscriber.getLanguage())
                .addValue("subscribedAt", subscriber.getSubscribedAt())
                .addValue("lastSeenAt", subscriber.getLastSeenAt())
                .addValue("active", subscriber.isActive());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        namedParameterJdbcTemplate.update(sql, params, keyHolder, new String[] {"id"});
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to retrieve generated key for subscriber.");
        }
        subscriber.setId(key.longValue());
        return subscriber;
    }

    public List<Subscriber> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return namedParameterJdbcTemplate.query("SELECT * FROM subscribers WHERE id IN (:ids)",
                new MapSqlParameterSource("ids", ids), subscriberRowMapper);
    }

    public boolean isActive(Long id) {
        List<Boolean> result = jdbcTemplate.queryForList("SELECT active FROM subscribers WHERE id = ?", Boolean.class, id);
        return !result.isEmpty() && Boolean.TRUE.equals(result.get(0));
    }

    /**
     * Marks a subscriber whose push endpoint is gone. Returns false if it was already inactive.
     */
    public boolean deactivate(Long id, OffsetDateTime now) {
        return jdbcTemplate.update("UPDATE subscribers SET active = FALSE, deactivated_at = ? WHERE id = ? AND active = TRUE",
                now, id) == 1;
    }

    /**
     * Distinct non-null values of one attribute column across active subscribers.
     */
    public List<String> findDistinctActiveValues(String column) {
        if (!ATTRIBUTE_COLUMNS.contains(column)) {
            throw new IllegalArgumentException("Not a subscriber attribute column: " + column);
        }
        String sql = "SELECT DISTINCT " + column + " FROM subscribers WHERE active = TRUE AND " + column
                + " IS NOT NULL ORDER BY " + column;
        return jdbcTemplate.queryForList(sql, String.class);
    }

    /**
     * Counts active subscribers matching a predicate built by the audience resolver.
     */
    public long countActiveMatching(String predicate, MapSqlParameterSource params) {
        String sql = "SELECT COUNT(*) FROM subscribers WHERE active = TRUE AND (" + predicate + ")";
        Long count = namedParameterJdbcTemplate.queryForObject(sql, params, Long.class);
        return count != null ? count : 0L;
    }

    /**
     * One keyset page of active subscriber ids matching a predicate, ascending, strictly after {@code afterId}.
     */
    public List<Long> findActiveMatchingIds(String predicate, MapSqlParameterSource params, long afterId, int limit) {
        String sql = "SELECT id FROM subscribers WHERE active = TRUE AND (" + predicate + ")"
                + " AND id > :afterId ORDER BY id LIMIT :pageLimit";
        MapSqlParameterSource pageParams = new MapSqlParameterSource(params.getValues())
                .addValue("afterId", afterId)
                .addValue("pageLimit", limit);
        return namedParameterJdbcTemplate.queryForList(sql, pageParams, Long.class);
    }
}
