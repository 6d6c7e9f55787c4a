package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import com.example.campaign.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to the campaigns table.
 * <p>
 * Every status change is a conditional update keyed on the expected prior status, and
 * callers learn from the boolean result whether they won the transition.
 */
@Repository
@RequiredArgsConstructor
public class CampaignRepository {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Campaign> campaignRowMapper = (rs, rowNum) -> Campaign.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .title(rs.getString("title"))
            .body(rs.getString("body"))
            .url(rs.getString("url"))
            .image(rs.getString("image"))
            .icon(rs.getString("icon"))
            .badge(rs.getString("badge"))
            .requireInteraction(rs.getBoolean("require_interaction"))
            .renotify(rs.getBoolean("renotify"))
            .silent(rs.getBoolean("silent"))
            .segments(JsonUtils.parseSegments(rs.getString("segments")))
            .sendAt(rs.getObject("send_at", OffsetDateTime.class))
            .status(rs.getString("status"))
            .totalTargeted(rs.getInt("total_targeted"))
            .sentCount(rs.getInt("sent_count"))
            .failedCount(rs.getInt("failed_count"))
            .audienceResolved(rs.getBoolean("audience_resolved"))
            .leaseOwner(rs.getString("lease_owner"))
            .leaseExpiresAt(rs.getObject("lease_expires_at", OffsetDateTime.class))
            .failureReason(rs.getString("failure_reason"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .queuedAt(rs.getObject("queued_at", OffsetDateTime.class))
            .startedAt(rs.getObject("started_at", OffsetDateTime.class))
            .completedAt(rs.getObject("completed_at", OffsetDateTime.class))
            .build();

    public Campaign save(Campaign campaign) {
        String sql = """
            INSERT INTO campaigns
            (name, title, body, url, image, icon, badge, require_interaction, renotify, silent,
             segments, send_at, status, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, campaign.getName());
            ps.setString(2, campaign.getTitle());
            ps.setString(3, campaign.getBody());
            ps.setString(4, campaign.getUrl());
            ps.setString(5, campaign.getImage());
            ps.setString(6, campaign.getIcon());
            ps.setString(7, campaign.getBadge());
            ps.setBoolean(8, campaign.isRequireInteraction());
            ps.setBoolean(9, campaign.isRenotify());
            ps.setBoolean(10, campaign.isSilent());
            ps.setString(11, JsonUtils.toJson(campaign.getSegments()));
            if (campaign.getSendAt() != null) {
                ps.setObject(12, campaign.getSendAt());
            } else {
                ps.setNull(12, Types.TIMESTAMP_WITH_TIMEZONE);
            }
            ps.setString(13, campaign.getStatus());
            ps.setObject(14, campaign.getCreatedAt());
            ps.setObject(15, campaign.getUpdatedAt());
            return ps;
        }, keyHolder);

        // PostgreSQL reports the key as "id", H2 as "ID".
        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty()) {
            throw new IllegalStateException("Failed to retrieve generated key for campaign.");
        }
        Number id = (Number) keys.get(0).get("id");
        if (id == null) {
            id = (Number) keys.get(0).get("ID");
        }
        if (id == null) {
            throw new IllegalStateException("Generated key 'id' not found in the returned keys.");
        }
        campaign.setId(id.longValue());
        return campaign;
    }

    public Optional<Campaign> findById(Long id) {
        List<Campaign> results = jdbcTemplate.query("SELECT * FROM campaigns WHERE id = ?", campaignRowMapper, id);
        return results.stream().findFirst();
    }

    /**
     * Newest first, optionally restricted to one status.
     */
    public List<Campaign> findAll(String status) {
        if (status == null) {
            return jdbcTemplate.query("SELECT * FROM campaigns ORDER BY created_at DESC, id DESC", campaignRowMapper);
        }
        return jdbcTemplate.query("SELECT * FROM campaigns WHERE status = ? ORDER BY created_at DESC, id DESC",
                campaignRowMapper, status);
    }

    /**
     * Replaces the editable content of a DRAFT or CANCELLED campaign and puts it back to DRAFT.
     */
    public boolean updateDraft(Campaign campaign, OffsetDateTime now) {
        String sql = """
            UPDATE campaigns SET
                name = ?, title = ?, body = ?, url = ?, image = ?, icon = ?, badge = ?,
                require_interaction = ?, renotify = ?, silent = ?, segments = ?, send_at = ?,
                status = 'DRAFT', updated_at = ?
            WHERE id = ? AND status IN ('DRAFT', 'CANCELLED')
            """;
        return jdbcTemplate.update(sql,
                campaign.getName(), campaign.getTitle(), campaign.getBody(), campaign.getUrl(),
                campaign.getImage(), campaign.getIcon(), campaign.getBadge(),
                campaign.isRequireInteraction(), campaign.isRenotify(), campaign.isSilent(),
                JsonUtils.toJson(campaign.getSegments()), campaign.getSendAt(),
                now, campaign.getId()) == 1;
    }

    /**
     * Plain status change for transitions that carry no extra bookkeeping.
     */
    public boolean transition(Long id, CampaignStatus from, CampaignStatus to, OffsetDateTime now) {
        String sql = "UPDATE campaigns SET status = ?, updated_at = ? WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, to.name(), now, id, from.name()) == 1;
    }

    public boolean markQueued(Long id, CampaignStatus from, OffsetDateTime now) {
        String sql = "UPDATE campaigns SET status = 'QUEUED', queued_at = ?, updated_at = ? WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, now, now, id, from.name()) == 1;
    }

    public List<Campaign> findDueScheduled(OffsetDateTime now, int limit) {
        String sql = """
            SELECT * FROM campaigns
            WHERE status = 'SCHEDULED' AND send_at <= ?
            ORDER BY send_at, id
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, campaignRowMapper, now, limit);
    }

    /**
     * Campaigns a delivery worker may claim: QUEUED ones, plus SENDING ones whose audience pass
     * never finished and whose lease has run out.
     */
    public List<Long> findClaimable(OffsetDateTime now, int limit) {
        String sql = """
            SELECT id FROM campaigns
            WHERE status = 'QUEUED'
               OR (status = 'SENDING' AND audience_resolved = FALSE AND lease_expires_at < ?)
            ORDER BY queued_at, id
            LIMIT ?
            """;
        return jdbcTemplate.queryForList(sql, Long.class, now, limit);
    }

    public boolean claimForSending(Long id, String owner, OffsetDateTime now, OffsetDateTime leaseUntil) {
        String sql = """
            UPDATE campaigns SET
                status = 'SENDING', lease_owner = ?, lease_expires_at = ?,
                started_at = COALESCE(started_at, ?), updated_at = ?
            WHERE id = ?
              AND (status = 'QUEUED'
                   OR (status = 'SENDING' AND audience_resolved = FALSE AND lease_expires_at < ?))
            """;
        return jdbcTemplate.update(sql, owner, leaseUntil, now, now, id, now) == 1;
    }

    public boolean renewLease(Long id, String owner, OffsetDateTime leaseUntil) {
        String sql = "UPDATE campaigns SET lease_expires_at = ? WHERE id = ? AND status = 'SENDING' AND lease_owner = ?";
        return jdbcTemplate.update(sql, leaseUntil, id, owner) == 1;
    }

    public boolean markAudienceResolved(Long id, String owner, int totalTargeted, OffsetDateTime now) {
        String sql = """
            UPDATE campaigns SET
                audience_resolved = TRUE, total_targeted = ?, lease_owner = NULL, lease_expires_at = NULL, updated_at = ?
            WHERE id = ? AND status = 'SENDING' AND lease_owner = ?
            """;
        return jdbcTemplate.update(sql, totalTargeted, now, id, owner) == 1;
    }

    public boolean markFailed(Long id, String reason, OffsetDateTime now) {
        String sql = """
            UPDATE campaigns SET
                status = 'FAILED', failure_reason = ?, lease_owner = NULL, lease_expires_at = NULL,
                completed_at = ?, updated_at = ?
            WHERE id = ? AND status = 'SENDING'
            """;
        return jdbcTemplate.update(sql, truncate(reason, 1000), now, now, id) == 1;
    }

    public boolean markCompleted(Long id, int sentCount, int failedCount, OffsetDateTime now) {
        String sql = """
            UPDATE campaigns SET
                status = 'COMPLETED', sent_count = ?, failed_count = ?, completed_at = ?, updated_at = ?
            WHERE id = ? AND status = 'SENDING' AND audience_resolved = TRUE
            """;
        return jdbcTemplate.update(sql, sentCount, failedCount, now, now, id) == 1;
    }

    /**
     * SENDING campaigns whose audience pass has finished, i.e. candidates for finalization.
     */
    public List<Long> findResolvedSending(int limit) {
        String sql = "SELECT id FROM campaigns WHERE status = 'SENDING' AND audience_resolved = TRUE ORDER BY id LIMIT ?";
        return jdbcTemplate.queryForList(sql, Long.class, limit);
    }

    public int deleteAbandonedDrafts(OffsetDateTime cutoff) {
        return jdbcTemplate.update("DELETE FROM campaigns WHERE status = 'DRAFT' AND updated_at < ?", cutoff);
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
