package com.caseflow.engine.persistence.jdbc;

import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.repository.WorkflowTemplateRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
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
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed template registry. Versions are immutable once written.
 */
@Repository
@ConditionalOnProperty(prefix = "caseflow.persistence", name = "type", havingValue = "jdbc")
public class JdbcWorkflowTemplateRepository implements WorkflowTemplateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowTemplateRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TemplateRowMapper rowMapper = new TemplateRowMapper();

    public JdbcWorkflowTemplateRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(WorkflowTemplate template) {
        String sql = """
            INSERT INTO workflow_templates (template_id, version, name, entity_type, template_json, created_at)
            VALUES (?, ?, ?, ?, ?::jsonb, now())
            ON CONFLICT (template_id, version) DO NOTHING
            """;
        int rows = jdbcTemplate.update(sql,
            template.templateId(),
            template.version(),
            template.name(),
            template.entityType() != null ? template.entityType().name() : null,
            toJson(template)
        );
        if (rows == 0) {
            log.debug("Template {} v{} already exists", template.templateId(), template.version());
        }
    }

    @Override
    public Optional<WorkflowTemplate> findLatest(String templateId) {
        String sql = """
            SELECT template_json FROM workflow_templates
            WHERE template_id = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<WorkflowTemplate> results = jdbcTemplate.query(sql, rowMapper, templateId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowTemplate> findByIdAndVersion(String templateId, int version) {
        String sql = "SELECT template_json FROM workflow_templates WHERE template_id = ? AND version = ?";
        List<WorkflowTemplate> results = jdbcTemplate.query(sql, rowMapper, templateId, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowTemplate> findAllLatest() {
        String sql = """
            SELECT DISTINCT ON (template_id) template_json FROM workflow_templates
            ORDER BY template_id, version DESC
            """;
        return jdbcTemplate.query(sql, rowMapper);
    }

    private String toJson(WorkflowTemplate template) {
        try {
            return objectMapper.writeValueAsString(template);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize template " + template.templateId(), e);
        }
    }

    private class TemplateRowMapper implements RowMapper<WorkflowTemplate> {
        @Override
        public WorkflowTemplate mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return objectMapper.readValue(rs.getString("template_json"), WorkflowTemplate.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to parse template row", e);
            }
        }
    }
}
