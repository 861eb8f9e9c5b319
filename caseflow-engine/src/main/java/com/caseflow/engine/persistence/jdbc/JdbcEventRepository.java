package com.caseflow.engine.persistence.jdbc;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.core.repository.EventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of EventRepository.
 *
 * Rows are never updated or deleted. Both the idempotency key and the pair
 * (workflow_instance_id, sequence_number) are unique; a conflicting append inserts
 * nothing and reports false so the caller can detect a concurrent writer.
 */
@Repository
@ConditionalOnProperty(prefix = "caseflow.persistence", name = "type", havingValue = "jdbc")
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EventRowMapper rowMapper;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EventRowMapper();
    }

    @Override
    @Transactional
    public boolean append(Event event) {
        String sql = """
            INSERT INTO events (
                event_id, workflow_instance_id, sequence_number,
                event_type, event_timestamp, payload,
                idempotency_key, actor_type, actor_id
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            event.eventId(),
            event.workflowInstanceId(),
            event.sequenceNumber(),
            event.type().name(),
            Timestamp.from(event.timestamp()),
            serializePayload(event.payload()),
            event.idempotencyKey(),
            event.actorType(),
            event.actorId()
        );

        if (rows == 0) {
            log.debug("Event already exists for key {} (seq={})", event.idempotencyKey(), event.sequenceNumber());
            return false;
        }
        return true;
    }

    @Override
    public Optional<Event> findByIdempotencyKey(String idempotencyKey) {
        String sql = "SELECT * FROM events WHERE idempotency_key = ?";
        List<Event> results = jdbcTemplate.query(sql, rowMapper, idempotencyKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Event> findByWorkflowInstance(UUID workflowInstanceId) {
        String sql = """
            SELECT * FROM events
            WHERE workflow_instance_id = ?
            ORDER BY sequence_number ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, workflowInstanceId);
    }

    @Override
    public List<Event> findByWorkflowInstanceAfter(UUID workflowInstanceId, long afterSequence) {
        String sql = """
            SELECT * FROM events
            WHERE workflow_instance_id = ? AND sequence_number > ?
            ORDER BY sequence_number ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, workflowInstanceId, afterSequence);
    }

    @Override
    public List<Event> findByWorkflowInstanceAndTypes(UUID workflowInstanceId, List<EventType> types) {
        if (types == null || types.isEmpty()) {
            return findByWorkflowInstance(workflowInstanceId);
        }

        String placeholders = String.join(",", types.stream().map(t -> "?").toList());
        String sql = """
            SELECT * FROM events
            WHERE workflow_instance_id = ? AND event_type IN (%s)
            ORDER BY sequence_number ASC
            """.formatted(placeholders);

        Object[] params = new Object[types.size() + 1];
        params[0] = workflowInstanceId;
        for (int i = 0; i < types.size(); i++) {
            params[i + 1] = types.get(i).name();
        }
        return jdbcTemplate.query(sql, rowMapper, params);
    }

    @Override
    public long getLatestSequenceNumber(UUID workflowInstanceId) {
        String sql = "SELECT COALESCE(MAX(sequence_number), 0) FROM events WHERE workflow_instance_id = ?";
        Long seq = jdbcTemplate.queryForObject(sql, Long.class, workflowInstanceId);
        return seq != null ? seq : 0L;
    }

    @Override
    public Map<EventType, Long> countByType(UUID workflowInstanceId) {
        String sql = """
            SELECT event_type, COUNT(*) AS count
            FROM events
            WHERE workflow_instance_id = ?
            GROUP BY event_type
            """;

        Map<EventType, Long> result = new EnumMap<>(EventType.class);
        jdbcTemplate.query(sql, rs -> {
            String typeName = rs.getString("event_type");
            try {
                result.put(EventType.valueOf(typeName), rs.getLong("count"));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown event type in database: {}", typeName);
            }
        }, workflowInstanceId);
        return result;
    }

    private String serializePayload(JsonNode payload) {
        if (payload == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event payload", e);
        }
    }

    private class EventRowMapper implements RowMapper<Event> {
        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new Event(
                    UUID.fromString(rs.getString("event_id")),
                    UUID.fromString(rs.getString("workflow_instance_id")),
                    rs.getLong("sequence_number"),
                    EventType.valueOf(rs.getString("event_type")),
                    rs.getTimestamp("event_timestamp").toInstant(),
                    objectMapper.readTree(rs.getString("payload")),
                    rs.getString("idempotency_key"),
                    rs.getString("actor_type"),
                    rs.getString("actor_id")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to parse payload of event " + rs.getString("event_id"), e);
            }
        }
    }
}
