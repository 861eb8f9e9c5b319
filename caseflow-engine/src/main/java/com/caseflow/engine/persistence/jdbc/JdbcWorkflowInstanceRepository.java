package com.caseflow.engine.persistence.jdbc;

import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed snapshot store.
 *
 * The full state is kept as jsonb; the columns beside it exist for lookups.
 * An upsert only replaces a row whose last_sequence is not newer, so a stale
 * snapshot written late never hides a newer one.
 */
@Repository
@ConditionalOnProperty(prefix = "caseflow.persistence", name = "type", havingValue = "jdbc")
public class JdbcWorkflowInstanceRepository implements WorkflowInstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowInstanceRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<WorkflowInstance> rowMapper;

    public JdbcWorkflowInstanceRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            try {
                return objectMapper.readValue(rs.getString("state_json"), WorkflowInstance.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to parse snapshot " + rs.getString("instance_id"), e);
            }
        };
    }

    @Override
    @Transactional
    public void save(WorkflowInstance instance) {
        String sql = """
            INSERT INTO workflow_snapshots (
                instance_id, workflow_id, entity_id, entity_type, template_id,
                status, current_stage_id, last_sequence,
                started_at, completed_at, updated_at, state_json
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (instance_id) DO UPDATE SET
                status = EXCLUDED.status,
                current_stage_id = EXCLUDED.current_stage_id,
                last_sequence = EXCLUDED.last_sequence,
                completed_at = EXCLUDED.completed_at,
                updated_at = EXCLUDED.updated_at,
                state_json = EXCLUDED.state_json
            WHERE workflow_snapshots.last_sequence <= EXCLUDED.last_sequence
            """;

        int rows = jdbcTemplate.update(sql,
            instance.instanceId(),
            instance.workflowId(),
            instance.entityId(),
            instance.entityType() != null ? instance.entityType().name() : null,
            instance.templateId(),
            instance.status() != null ? instance.status().name() : null,
            instance.currentStageId(),
            instance.lastSequence(),
            toTimestamp(instance.startedAt()),
            toTimestamp(instance.completedAt()),
            Timestamp.from(Instant.now()),
            toJson(instance)
        );

        if (rows == 0) {
            log.debug("Skipped stale snapshot of {} at seq {}", instance.workflowId(), instance.lastSequence());
        }
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID instanceId) {
        String sql = "SELECT instance_id, state_json FROM workflow_snapshots WHERE instance_id = ?";
        List<WorkflowInstance> results = jdbcTemplate.query(sql, rowMapper, instanceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowInstance> findByWorkflowId(String workflowId) {
        String sql = "SELECT instance_id, state_json FROM workflow_snapshots WHERE workflow_id = ?";
        List<WorkflowInstance> results = jdbcTemplate.query(sql, rowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowInstance> findByEntityId(String entityId) {
        String sql = """
            SELECT instance_id, state_json FROM workflow_snapshots
            WHERE entity_id = ?
            ORDER BY started_at DESC
            """;
        return jdbcTemplate.query(sql, rowMapper, entityId);
    }

    @Override
    public List<WorkflowInstance> findByStatus(WorkflowStatus status, int limit) {
        String sql = """
            SELECT instance_id, state_json FROM workflow_snapshots
            WHERE status = ?
            ORDER BY started_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public List<WorkflowInstance> findAll(int limit) {
        String sql = "SELECT instance_id, state_json FROM workflow_snapshots ORDER BY started_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    @Override
    public List<WorkflowInstance> findActive() {
        String sql = """
            SELECT instance_id, state_json FROM workflow_snapshots
            WHERE status IS NULL OR status IN ('RUNNING', 'PAUSED')
            ORDER BY started_at
            """;
        return jdbcTemplate.query(sql, rowMapper);
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        String sql = """
            SELECT status, COUNT(*) AS count
            FROM workflow_snapshots
            WHERE status IS NOT NULL
            GROUP BY status
            """;

        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(WorkflowStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    // ========== Helper Methods ==========

    private String toJson(WorkflowInstance instance) {
        try {
            return objectMapper.writeValueAsString(instance);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot of " + instance.workflowId(), e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
