package com.caseflow.api.rest;

import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.query.CurrentStageView;
import com.caseflow.core.query.RequirementsView;
import com.caseflow.core.signal.SignalType;
import com.caseflow.engine.service.WorkflowService;
import com.caseflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.caseflow.engine.service.WorkflowService.WorkflowStatistics;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for lifecycle workflows.
 * Signals are accepted asynchronously and applied by the workflow's next iteration.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Start a new workflow instance.
     */
    @PostMapping
    public ResponseEntity<WorkflowInstance> startWorkflow(@RequestBody StartWorkflowRequestDto request) {
        WorkflowInstance instance = workflowService.startWorkflow(new StartWorkflowRequest(
            request.workflowId(),
            request.entityId(),
            request.entityType(),
            request.templateId(),
            request.input()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(instance);
    }

    @GetMapping
    public ResponseEntity<List<WorkflowInstance>> listWorkflows(
            @RequestParam(required = false) WorkflowStatus status,
            @RequestParam(required = false) String entityId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(workflowService.listWorkflows(
            new WorkflowService.WorkflowQuery(status, entityId, limit)));
    }

    @GetMapping("/statistics")
    public ResponseEntity<WorkflowStatistics> statistics() {
        return ResponseEntity.ok(workflowService.statistics());
    }

    @GetMapping("/instances/{instanceId}")
    public ResponseEntity<WorkflowInstance> getWorkflow(@PathVariable UUID instanceId) {
        return ResponseEntity.ok(workflowService.getWorkflow(instanceId));
    }

    // ========== Queries ==========

    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowInstance> getWorkflowState(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getWorkflowState(workflowId));
    }

    @GetMapping("/{workflowId}/stage")
    public ResponseEntity<CurrentStageView> getCurrentStage(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getCurrentStage(workflowId));
    }

    @GetMapping("/{workflowId}/requirements")
    public ResponseEntity<RequirementsView> getRequirements(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getRequirements(workflowId));
    }

    // ========== Signals ==========

    @PostMapping("/{workflowId}/requirements/{requirementId}/complete")
    public ResponseEntity<Map<String, Object>> completeRequirement(
            @PathVariable String workflowId,
            @PathVariable String requirementId,
            @RequestBody(required = false) NotesRequest request) {
        workflowService.completeRequirement(workflowId, requirementId, request != null ? request.notes() : null);
        return accepted(SignalType.COMPLETE_REQUIREMENT);
    }

    @PostMapping("/{workflowId}/transition")
    public ResponseEntity<Map<String, Object>> transitionStage(
            @PathVariable String workflowId,
            @RequestBody TransitionRequestDto request) {
        workflowService.transitionStage(workflowId, request.targetStageId(), request.notes());
        return accepted(SignalType.TRANSITION_STAGE);
    }

    @PostMapping("/{workflowId}/deadlines")
    public ResponseEntity<Map<String, Object>> addDeadline(
            @PathVariable String workflowId,
            @RequestBody DatedRequest request) {
        workflowService.addDeadline(workflowId, request.date(), request.description());
        return accepted(SignalType.ADD_DEADLINE);
    }

    @PostMapping("/{workflowId}/court-dates")
    public ResponseEntity<Map<String, Object>> addCourtDate(
            @PathVariable String workflowId,
            @RequestBody DatedRequest request) {
        workflowService.addCourtDate(workflowId, request.date(), request.description());
        return accepted(SignalType.ADD_COURT_DATE);
    }

    @PostMapping("/{workflowId}/override")
    public ResponseEntity<Map<String, Object>> manualOverride(
            @PathVariable String workflowId,
            @RequestBody OverrideRequestDto request) {
        workflowService.manualOverride(workflowId, request.reason(), request.approvedBy());
        return accepted(SignalType.MANUAL_OVERRIDE);
    }

    @PostMapping("/{workflowId}/escalate")
    public ResponseEntity<Map<String, Object>> escalate(
            @PathVariable String workflowId,
            @RequestBody EscalationRequest request) {
        workflowService.escalate(workflowId, request.reason(), request.escalatedTo());
        return accepted(SignalType.ESCALATE);
    }

    @PostMapping("/{workflowId}/pause")
    public ResponseEntity<Map<String, Object>> pauseWorkflow(@PathVariable String workflowId) {
        workflowService.pauseWorkflow(workflowId);
        return accepted(SignalType.PAUSE);
    }

    @PostMapping("/{workflowId}/resume")
    public ResponseEntity<Map<String, Object>> resumeWorkflow(@PathVariable String workflowId) {
        workflowService.resumeWorkflow(workflowId);
        return accepted(SignalType.RESUME);
    }

    /**
     * Cancel a workflow.
     */
    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<WorkflowInstance> cancelWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) CancelRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "Manual cancellation";
        workflowService.cancelWorkflow(workflowId, reason);
        return ResponseEntity.ok(workflowService.getWorkflowState(workflowId));
    }

    private static ResponseEntity<Map<String, Object>> accepted(SignalType signal) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "accepted", true,
            "signal", signal.name()
        ));
    }

    // ========== DTOs ==========

    public record StartWorkflowRequestDto(
        String workflowId,
        String entityId,
        EntityType entityType,
        String templateId,
        JsonNode input
    ) {}

    public record NotesRequest(String notes) {}

    public record TransitionRequestDto(String targetStageId, String notes) {}

    public record DatedRequest(Instant date, String description) {}

    public record CancelRequest(String reason) {}

    public record OverrideRequestDto(String reason, String approvedBy) {}

    public record EscalationRequest(String reason, String escalatedTo) {}
}
