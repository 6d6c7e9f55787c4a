package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.DeliveryOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-recipient outcome rows. A worker claims a PENDING or due FAILED_TRANSIENT row by moving it to
 * IN_FLIGHT before pushing, and records the result only from IN_FLIGHT. SENT and FAILED_PERMANENT
 * are terminal.
 */
@Repository
@RequiredArgsConstructor
public class DeliveryOutcomeRepository {

    private static final int BATCH_SIZE = 1000;
    private static final int ERROR_DETAIL_MAX = 1000;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

    private final RowMapper<DeliveryOutcome> outcomeRowMapper = (rs, rowNum) -> DeliveryOutcome.builder()
            .id(rs.getLong("id"))
            .campaignId(rs.getLong("campaign_id"))
            .subscriberId(rs.getLong("subscriber_id"))
            .status(rs.getString("status"))
            .attempts(rs.getInt("attempts"))
            .lastAttemptAt(rs.getObject("last_attempt_at", OffsetDateTime.class))
            .nextAttemptAt(rs.getObject("next_attempt_at", OffsetDateTime.class))
            .errorDetail(rs.getString("error_detail"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .claimedBy(rs.getString("claimed_by"))
            .claimedAt(rs.getObject("claimed_at", OffsetDateTime.class))
            .build();

    /**
     * Creates PENDING rows for the given recipients, leaving existing rows untouched.
     */
    public void insertPendingIfAbsent(Long campaignId, List<Long> subscriberIds, OffsetDateTime now) {
        if (subscriberIds == null || subscriberIds.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO campaign_deliveries (campaign_id, subscriber_id, status, attempts, created_at)
            VALUES (?, ?, 'PENDING', 0, ?)
            ON CONFLICT DO NOTHING
            """;
        jdbcTemplate.batchUpdate(sql, subscriberIds, BATCH_SIZE, (PreparedStatement ps, Long subscriberId) -> {
            ps.setLong(1, campaignId);
            ps.setLong(2, subscriberId);
            ps.setObject(3, now);
        });
    }

    public Map<Long, DeliveryOutcome> findByCampaignAndSubscribers(Long campaignId, Collection<Long> subscriberIds) {
        if (subscriberIds == null || subscriberIds.isEmpty()) {
            return Map.of();
        }
        String sql = "SELECT * FROM campaign_deliveries WHERE campaign_id = :campaignId AND subscriber_id IN (:ids)";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("campaignId", campaignId)
                .addValue("ids", subscriberIds);
        return namedParameterJdbcTemplate.query(sql, params, outcomeRowMapper).stream()
                .collect(Collectors.toMap(DeliveryOutcome::getSubscriberId, Function.identity()));
    }

    /**
     * Claims a PENDING row for a push. Of several workers holding the same row, only one wins.
     */
    public boolean claimPending(Long id, String owner, OffsetDateTime now) {
        String sql = """
            UPDATE campaign_deliveries SET status = 'IN_FLIGHT', claimed_by = ?, claimed_at = ?
            WHERE id = ? AND status = 'PENDING'
            """;
        return jdbcTemplate.update(sql, owner, now, id) == 1;
    }

    public boolean markSent(Long id, OffsetDateTime now) {
        String sql = """
            UPDATE campaign_deliveries SET
                status = 'SENT', attempts = attempts + 1, last_attempt_at = ?, next_attempt_at = NULL, error_detail = NULL
            WHERE id = ? AND status = 'IN_FLIGHT'
            """;
        return jdbcTemplate.update(sql, now, id) == 1;
    }

    /**
     * @param dispatched whether a push was attempted; recipients deactivated since resolution
     *                   are failed without an attempt
     */
    public boolean markFailedPermanent(Long id, String errorDetail, boolean dispatched, OffsetDateTime now) {
        String sql = """
            UPDATE campaign_deliveries SET
                status = 'FAILED_PERMANENT', attempts = attempts + ?, last_attempt_at = ?, next_attempt_at = NULL, error_detail = ?
            WHERE id = ? AND status = 'IN_FLIGHT'
            """;
        return jdbcTemplate.update(sql, dispatched ? 1 : 0, now, truncate(errorDetail), id) == 1;
    }

    public boolean markFailedTransient(Long id, String errorDetail, OffsetDateTime now, OffsetDateTime nextAttemptAt) {
        String sql = """
            UPDATE campaign_deliveries SET
                status = 'FAILED_TRANSIENT', attempts = attempts + 1, last_attempt_at = ?, next_attempt_at = ?, error_detail = ?
            WHERE id = ? AND status = 'IN_FLIGHT'
            """;
        return jdbcTemplate.update(sql, now, nextAttemptAt, truncate(errorDetail), id) == 1;
    }

    /**
     * Transient failures whose backoff has elapsed, restricted to campaigns still SENDING.
     */
    public List<DeliveryOutcome> findDueRetries(OffsetDateTime now, int limit) {
        String sql = """
            SELECT d.* FROM campaign_deliveries d
            JOIN campaigns c ON c.id = d.campaign_id
            WHERE d.status = 'FAILED_TRANSIENT' AND d.next_attempt_at <= ? AND c.status = 'SENDING'
            ORDER BY d.next_attempt_at, d.id
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, outcomeRowMapper, now, limit);
    }

    /**
     * Claims a due retry for a push. Only one sweeper can win, because the loser no longer
     * sees the row as FAILED_TRANSIENT.
     */
    public boolean claimRetry(Long id, String owner, OffsetDateTime now) {
        String sql = """
            UPDATE campaign_deliveries SET status = 'IN_FLIGHT', claimed_by = ?, claimed_at = ?
            WHERE id = ? AND status = 'FAILED_TRANSIENT' AND next_attempt_at <= ?
            """;
        return jdbcTemplate.update(sql, owner, now, id, now) == 1;
    }

    /**
     * Hands PENDING rows that were never recorded back to the retry sweep. Only touches campaigns
     * whose audience pass has finished; unfinished passes re-dispatch their own PENDING rows.
     */
    public int requeueStalePending(OffsetDateTime createdBefore, OffsetDateTime now) {
        String sql = """
            UPDATE campaign_deliveries SET status = 'FAILED_TRANSIENT', next_attempt_at = ?, error_detail = 'stale pending'
            WHERE status = 'PENDING' AND created_at < ?
              AND campaign_id IN (SELECT id FROM campaigns WHERE status = 'SENDING' AND audience_resolved = TRUE)
            """;
        return jdbcTemplate.update(sql, now, createdBefore);
    }

    /**
     * Hands rows whose claim outlived any push back to the retry sweep, so a worker that died
     * mid-push does not keep its campaign SENDING forever. The push may or may not have happened.
     */
    public int requeueStaleInFlight(OffsetDateTime claimedBefore, OffsetDateTime now) {
        String sql = """
            UPDATE campaign_deliveries SET status = 'FAILED_TRANSIENT', next_attempt_at = ?, error_detail = 'claim expired'
            WHERE status = 'IN_FLIGHT' AND claimed_at < ?
              AND campaign_id IN (SELECT id FROM campaigns WHERE status = 'SENDING')
            """;
        return jdbcTemplate.update(sql, now, claimedBefore);
    }

    public Map<String, Long> countByStatus(Long campaignId) {
        String sql = "SELECT status, COUNT(*) AS cnt FROM campaign_deliveries WHERE campaign_id = ? GROUP BY status";
        Map<String, Long> counts = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            counts.put(rs.getString("status"), rs.getLong("cnt"));
        }, campaignId);
        return counts;
    }

    private static String truncate(String value) {
        return value != null && value.length() > ERROR_DETAIL_MAX ? value.substring(0, ERROR_DETAIL_MAX) : value;
    }
}
