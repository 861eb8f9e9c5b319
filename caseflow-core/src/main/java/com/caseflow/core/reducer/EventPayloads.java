package com.caseflow.core.reducer;

import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.ReminderWindow;
import com.caseflow.core.model.DeadlineNotice;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.TransitionEffect;
import com.caseflow.core.model.TransitionReason;
import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.signal.WorkflowSignal;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Builds the JSON payload of each event type.
 * {@link WorkflowStateReducer} reads the same field names back.
 * Instants and durations are written as ISO-8601 strings.
 */
public final class EventPayloads {

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public static final String WORKFLOW_ID = "workflowId";
    public static final String ENTITY_ID = "entityId";
    public static final String ENTITY_TYPE = "entityType";
    public static final String TEMPLATE_ID = "templateId";
    public static final String TEMPLATE_VERSION = "templateVersion";
    public static final String INPUT = "input";
    public static final String STAGES = "stages";
    public static final String SIGNAL = "signal";
    public static final String REQUIREMENT_ID = "requirementId";
    public static final String TARGET_STAGE_ID = "targetStageId";
    public static final String STAGE_ID = "stageId";
    public static final String FROM_STAGE_ID = "fromStageId";
    public static final String TO_STAGE_ID = "toStageId";
    public static final String DATE = "date";
    public static final String DESCRIPTION = "description";
    public static final String NOTES = "notes";
    public static final String REASON = "reason";
    public static final String SATISFIED = "satisfied";
    public static final String PENDING = "pending";
    public static final String EFFECT = "effect";
    public static final String INDEX = "index";
    public static final String DAYS_UNTIL = "daysUntil";
    public static final String HOURS_UNTIL = "hoursUntil";
    public static final String NOTICE = "notice";
    public static final String WINDOW = "window";
    public static final String ERROR = "error";
    public static final String ERROR_CODE = "errorCode";
    public static final String SEQUENCE = "sequence";
    public static final String ESCALATED_TO = "escalatedTo";
    public static final String APPROVED_BY = "approvedBy";
    public static final String TIMEOUT = "timeout";

    private EventPayloads() {
    }

    public static JsonNode workflowStarted(String workflowId, String entityId, EntityType entityType,
                                           String templateId, JsonNode input) {
        ObjectNode node = MAPPER.createObjectNode()
            .put(WORKFLOW_ID, workflowId)
            .put(ENTITY_ID, entityId)
            .put(ENTITY_TYPE, entityType.name())
            .put(TEMPLATE_ID, templateId);
        node.set(INPUT, input == null ? MAPPER.createObjectNode() : input);
        return node;
    }

    public static JsonNode templateLoaded(WorkflowTemplate template) {
        ObjectNode node = MAPPER.createObjectNode()
            .put(TEMPLATE_ID, template.templateId())
            .put(TEMPLATE_VERSION, template.version());
        node.set(STAGES, MAPPER.valueToTree(template.stages()));
        return node;
    }

    public static JsonNode signalReceived(WorkflowSignal signal) {
        ObjectNode node = MAPPER.createObjectNode().put(SIGNAL, signal.type().name());
        putIfPresent(node, REQUIREMENT_ID, signal.requirementId());
        putIfPresent(node, TARGET_STAGE_ID, signal.targetStageId());
        if (signal.date() != null) {
            node.put(DATE, signal.date().toString());
        }
        putIfPresent(node, DESCRIPTION, signal.description());
        putIfPresent(node, NOTES, signal.notes());
        putIfPresent(node, ESCALATED_TO, signal.escalatedTo());
        putIfPresent(node, APPROVED_BY, signal.approvedBy());
        return node;
    }

    public static JsonNode empty() {
        return MAPPER.createObjectNode();
    }

    public static JsonNode cancelled(String reason) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, REASON, reason);
        return node;
    }

    public static JsonNode dated(Instant date, String description) {
        ObjectNode node = MAPPER.createObjectNode().put(DATE, date.toString());
        putIfPresent(node, DESCRIPTION, description);
        return node;
    }

    public static JsonNode requirementCompleted(String requirementId, String stageId, String notes) {
        ObjectNode node = MAPPER.createObjectNode()
            .put(REQUIREMENT_ID, requirementId)
            .put(STAGE_ID, stageId);
        putIfPresent(node, NOTES, notes);
        return node;
    }

    public static JsonNode requirementsChecked(String stageId, boolean satisfied, Collection<String> pending) {
        ObjectNode node = MAPPER.createObjectNode()
            .put(STAGE_ID, stageId)
            .put(SATISFIED, satisfied);
        ArrayNode array = node.putArray(PENDING);
        pending.forEach(array::add);
        return node;
    }

    public static JsonNode transitionStarted(String fromStageId, String toStageId,
                                             TransitionReason reason, String notes) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, FROM_STAGE_ID, fromStageId);
        node.put(TO_STAGE_ID, toStageId).put(REASON, reason.name());
        putIfPresent(node, NOTES, notes);
        return node;
    }

    public static JsonNode transitionEffectCompleted(String toStageId, TransitionEffect effect) {
        return MAPPER.createObjectNode()
            .put(TO_STAGE_ID, toStageId)
            .put(EFFECT, effect.name());
    }

    public static JsonNode transitionRejected(String targetStageId, String reason) {
        return MAPPER.createObjectNode()
            .put(TARGET_STAGE_ID, targetStageId)
            .put(REASON, reason);
    }

    public static JsonNode stageEntered(Stage stage, String fromStageId) {
        ObjectNode node = MAPPER.createObjectNode().put(STAGE_ID, stage.stageId());
        putIfPresent(node, FROM_STAGE_ID, fromStageId);
        return node;
    }

    public static JsonNode deadlineReminder(int index, long daysUntil, DeadlineNotice notice) {
        return MAPPER.createObjectNode()
            .put(INDEX, index)
            .put(DAYS_UNTIL, daysUntil)
            .put(NOTICE, notice.name());
    }

    public static JsonNode courtDateReminder(int index, long hoursUntil, ReminderWindow window) {
        return MAPPER.createObjectNode()
            .put(INDEX, index)
            .put(HOURS_UNTIL, hoursUntil)
            .put(WINDOW, window.name());
    }

    public static JsonNode escalationRaised(String stageId, String reason, String escalatedTo) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, STAGE_ID, stageId);
        return node.put(REASON, reason).put(ESCALATED_TO, escalatedTo);
    }

    public static JsonNode stageTimeoutEscalated(String stageId, Duration timeout, String reason) {
        return MAPPER.createObjectNode()
            .put(STAGE_ID, stageId)
            .put(TIMEOUT, timeout.toString())
            .put(REASON, reason);
    }

    public static JsonNode manualOverrideApplied(String stageId, String reason, String approvedBy) {
        return MAPPER.createObjectNode()
            .put(STAGE_ID, stageId)
            .put(REASON, reason)
            .put(APPROVED_BY, approvedBy);
    }

    public static JsonNode workflowFailed(String errorCode, String error) {
        return MAPPER.createObjectNode()
            .put(ERROR_CODE, errorCode)
            .put(ERROR, error);
    }

    public static JsonNode snapshotCreated(long sequence) {
        return MAPPER.createObjectNode().put(SEQUENCE, sequence);
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
