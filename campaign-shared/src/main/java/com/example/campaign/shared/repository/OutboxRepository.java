package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.OutboxEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class OutboxRepository {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<OutboxEvent> rowMapper = (rs, rowNum) -> OutboxEvent.builder()
            .id(rs.getObject("id", UUID.class))
            .aggregateType(rs.getString("aggregate_type"))
            .aggregateId(rs.getString("aggregate_id"))
            .eventType(rs.getString("event_type"))
            .topic(rs.getString("topic"))
            .payload(rs.getString("payload"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    public void save(OutboxEvent event) {
        String sql = """
            INSERT INTO outbox_events (id, aggregate_type, aggregate_id, event_type, topic, payload, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql, event.getId(), event.getAggregateType(), event.getAggregateId(),
                event.getEventType(), event.getTopic(), event.getPayload(), event.getCreatedAt());
    }

    /**
     * Oldest events first, row-locked so concurrent relays skip each other's batches.
     * Must run inside a transaction.
     */
    public List<OutboxEvent> findAndLockUnprocessedEvents(int limit) {
        String sql = """
            SELECT * FROM outbox_events
            ORDER BY created_at
            LIMIT ?
            FOR UPDATE SKIP LOCKED
            """;
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    public List<OutboxEvent> findAll() {
        return jdbcTemplate.query("SELECT * FROM outbox_events ORDER BY created_at", rowMapper);
    }

    public void deleteByIds(List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        String sql = String.format("DELETE FROM outbox_events WHERE id IN (%s)",
                String.join(",", Collections.nCopies(ids.size(), "?")));
        jdbcTemplate.update(sql, ids.toArray());
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM outbox_events", Long.class);
        return count != null ? count : 0L;
    }
}
