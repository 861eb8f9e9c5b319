package com.caseflow.engine.health;

import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.engine.runtime.WorkflowDispatcher;
import com.caseflow.scheduler.WakeupScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicator for the orchestrator.
 * Reports health status based on:
 * - Database connectivity, when persistence is JDBC
 * - Wakeup scheduler state
 * - Live runners and stored instances per status
 */
@Component
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final ObjectProvider<JdbcTemplate> jdbcTemplate;
    private final WorkflowInstanceRepository instanceRepository;
    private final WorkflowDispatcher dispatcher;
    private final WakeupScheduler scheduler;

    public OrchestratorHealthIndicator(
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            WorkflowInstanceRepository instanceRepository,
            WorkflowDispatcher dispatcher,
            WakeupScheduler scheduler) {
        this.jdbcTemplate = jdbcTemplate;
        this.instanceRepository = instanceRepository;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
        if (jdbc != null && !checkDatabase(jdbc, details)) {
            return Health.down().withDetails(details).build();
        }

        details.put("scheduler", scheduler.isRunning() ? "running" : "stopped");
        details.put("pendingWakeups", scheduler.pendingCount());
        details.put("liveRunners", dispatcher.activeCount());
        try {
            Map<WorkflowStatus, Long> counts = instanceRepository.countByStatus();
            details.put("workflows", counts);
        } catch (DataAccessException e) {
            details.put("workflowCountError", e.getMessage());
        }

        if (!scheduler.isRunning()) {
            return Health.outOfService().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    private boolean checkDatabase(JdbcTemplate jdbc, Map<String, Object> details) {
        try {
            Integer result = jdbc.queryForObject("SELECT 1", Integer.class);
            boolean ok = result != null && result == 1;
            details.put("database", ok ? "connected" : "unexpected response");
            return ok;
        } catch (DataAccessException e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }
}
