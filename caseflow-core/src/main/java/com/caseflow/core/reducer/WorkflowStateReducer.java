package com.caseflow.core.reducer;

import com.caseflow.core.model.ActiveTransition;
import com.caseflow.core.model.CompletedRequirement;
import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.Escalation;
import com.caseflow.core.model.EscalationSource;
import com.caseflow.core.model.Event;
import com.caseflow.core.model.ManualOverride;
import com.caseflow.core.model.OverrideRequest;
import com.caseflow.core.model.PendingRequirement;
import com.caseflow.core.model.ReminderWindow;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.TransitionEffect;
import com.caseflow.core.model.TransitionReason;
import com.caseflow.core.model.TransitionRequest;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.signal.SignalType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static com.caseflow.core.reducer.EventPayloads.*;

/**
 * Pure state transition function: {@code apply(state, event) -> state}.
 *
 * Rules:
 * - No clock, no I/O: every instant comes from the event timestamp or payload
 * - Applying the same events to {@link WorkflowInstance#empty} always yields the same state
 * - Events that do not apply to the current state leave it unchanged apart from lastSequence
 */
public final class WorkflowStateReducer {

    private static final TypeReference<List<Stage>> STAGE_LIST = new TypeReference<>() {};

    private WorkflowStateReducer() {
    }

    /**
     * Fold a sequence of events onto a starting state.
     */
    public static WorkflowInstance replay(WorkflowInstance initial, List<Event> events) {
        WorkflowInstance state = initial;
        for (Event event : events) {
            state = apply(state, event);
        }
        return state;
    }

    public static WorkflowInstance apply(WorkflowInstance state, Event event) {
        JsonNode payload = event.payload();
        Instant at = event.timestamp();

        WorkflowInstance next = switch (event.type()) {
            case WORKFLOW_STARTED -> state.toBuilder()
                .workflowId(text(payload, WORKFLOW_ID))
                .entityId(text(payload, ENTITY_ID))
                .entityType(EntityType.valueOf(text(payload, ENTITY_TYPE)))
                .templateId(text(payload, TEMPLATE_ID))
                .input(payload.get(INPUT))
                .status(WorkflowStatus.RUNNING)
                .startedAt(at)
                .build();

            case TEMPLATE_LOADED -> templateLoaded(state, payload);
            case SIGNAL_RECEIVED -> signalReceived(state, payload);

            case WORKFLOW_PAUSED -> state.status() == WorkflowStatus.RUNNING
                ? state.toBuilder().status(WorkflowStatus.PAUSED).paused(true).pausedAt(at).build()
                : state;

            case WORKFLOW_RESUMED -> state.status() == WorkflowStatus.PAUSED
                ? state.toBuilder().status(WorkflowStatus.RUNNING).paused(false).pausedAt(null).build()
                : state;

            case DEADLINE_ADDED -> state.toBuilder()
                .deadlines(append(state.deadlines(), Deadline.of(instant(payload, DATE), text(payload, DESCRIPTION))))
                .pendingDeadlines(tail(state.pendingDeadlines()))
                .build();

            case COURT_DATE_ADDED -> state.toBuilder()
                .courtDates(append(state.courtDates(), CourtDate.of(instant(payload, DATE), text(payload, DESCRIPTION))))
                .pendingCourtDates(tail(state.pendingCourtDates()))
                .build();

            case REQUIREMENT_COMPLETED -> state.toBuilder()
                .completedRequirements(append(state.completedRequirements(),
                    new CompletedRequirement(text(payload, REQUIREMENT_ID), text(payload, STAGE_ID), at, text(payload, NOTES))))
                .pendingRequirements(tail(state.pendingRequirements()))
                .requirementCheckStageId(text(payload, STAGE_ID))
                .build();

            case REQUIREMENTS_CHECKED -> requirementsChecked(state, payload);
            case MANUAL_OVERRIDE_APPLIED -> manualOverrideApplied(state, payload, at);

            case TRANSITION_STARTED -> state.toBuilder()
                .activeTransition(new ActiveTransition(
                    event.sequenceNumber(),
                    text(payload, FROM_STAGE_ID),
                    text(payload, TO_STAGE_ID),
                    TransitionReason.valueOf(text(payload, REASON)),
                    text(payload, NOTES),
                    List.of()))
                .pendingTransition(null)
                .build();

            case TRANSITION_EFFECT_COMPLETED -> state.activeTransition() == null
                ? state
                : state.toBuilder()
                    .activeTransition(state.activeTransition()
                        .withEffectCompleted(TransitionEffect.valueOf(text(payload, EFFECT))))
                    .build();

            case TRANSITION_REJECTED -> state.toBuilder().pendingTransition(null).build();

            case STAGE_ENTERED -> state.toBuilder()
                .currentStageId(text(payload, STAGE_ID))
                .currentStageEnteredAt(at)
                .stageTimeoutEscalated(false)
                .activeTransition(null)
                .build();

            case DEADLINE_REMINDER_SENT -> state.toBuilder()
                .deadlines(replace(state.deadlines(), payload.get(INDEX).asInt(), Deadline::withReminded))
                .build();

            case DEADLINE_OVERDUE_NOTIFIED -> state.toBuilder()
                .deadlines(replace(state.deadlines(), payload.get(INDEX).asInt(), Deadline::withOverdueNotified))
                .build();

            case COURT_DATE_REMINDER_SENT -> {
                ReminderWindow window = ReminderWindow.valueOf(text(payload, WINDOW));
                yield state.toBuilder()
                    .courtDates(replace(state.courtDates(), payload.get(INDEX).asInt(), c -> c.withReminded(window)))
                    .build();
            }

            case ESCALATION_RAISED -> state.toBuilder()
                .escalations(append(state.escalations(), new Escalation(text(payload, STAGE_ID),
                    text(payload, REASON), text(payload, ESCALATED_TO), EscalationSource.SIGNAL, at)))
                .build();

            case STAGE_TIMEOUT_ESCALATED -> {
                String stageId = text(payload, STAGE_ID);
                yield state.toBuilder()
                    .escalations(append(state.escalations(), new Escalation(stageId,
                        text(payload, REASON), null, EscalationSource.STAGE_TIMEOUT, at)))
                    .stageTimeoutEscalated(state.stageTimeoutEscalated() || stageId.equals(state.currentStageId()))
                    .build();
            }

            case WORKFLOW_COMPLETED -> state.toBuilder()
                .status(WorkflowStatus.COMPLETED)
                .completedAt(state.completedAt() == null ? at : state.completedAt())
                .paused(false)
                .pausedAt(null)
                .build();

            case WORKFLOW_FAILED -> state.toBuilder()
                .status(WorkflowStatus.FAILED)
                .lastError(text(payload, ERROR))
                .paused(false)
                .pausedAt(null)
                .build();

            case WORKFLOW_CANCELLED -> state.toBuilder()
                .status(WorkflowStatus.CANCELLED)
                .lastError(text(payload, REASON))
                .paused(false)
                .pausedAt(null)
                .build();

            case SNAPSHOT_CREATED -> state;
        };

        return next.toBuilder().lastSequence(event.sequenceNumber()).build();
    }

    private static WorkflowInstance templateLoaded(WorkflowInstance state, JsonNode payload) {
        List<Stage> stages = MAPPER.convertValue(payload.get(STAGES), STAGE_LIST);
        WorkflowInstance loaded = state.toBuilder().stages(stages).build();

        Optional<Stage> initial = stages.stream()
            .sorted((a, b) -> Integer.compare(a.order(), b.order()))
            .filter(Stage::initial)
            .findFirst()
            .or(() -> stages.stream().min((a, b) -> Integer.compare(a.order(), b.order())));

        return initial
            .map(stage -> loaded.toBuilder()
                .pendingTransition(new TransitionRequest(stage.stageId(), TransitionReason.INITIAL, null))
                .build())
            .orElse(loaded);
    }

    private static WorkflowInstance signalReceived(WorkflowInstance state, JsonNode payload) {
        SignalType type = SignalType.valueOf(text(payload, SIGNAL));
        return switch (type) {
            case COMPLETE_REQUIREMENT -> state.toBuilder()
                .pendingRequirements(append(state.pendingRequirements(),
                    new PendingRequirement(text(payload, REQUIREMENT_ID), text(payload, NOTES))))
                .build();
            // Last write wins: a newer request replaces one the loop has not drained yet.
            case TRANSITION_STAGE -> state.toBuilder()
                .pendingTransition(new TransitionRequest(
                    text(payload, TARGET_STAGE_ID), TransitionReason.EXPLICIT, text(payload, NOTES)))
                .build();
            case ADD_DEADLINE -> state.toBuilder()
                .pendingDeadlines(append(state.pendingDeadlines(),
                    Deadline.of(instant(payload, DATE), text(payload, DESCRIPTION))))
                .build();
            case ADD_COURT_DATE -> state.toBuilder()
                .pendingCourtDates(append(state.pendingCourtDates(),
                    CourtDate.of(instant(payload, DATE), text(payload, DESCRIPTION))))
                .build();
            // A newer override replaces one the loop has not applied yet.
            case MANUAL_OVERRIDE -> state.toBuilder()
                .pendingOverride(new OverrideRequest(
                    state.currentStageId(), text(payload, NOTES), text(payload, APPROVED_BY)))
                .build();
            case ESCALATE, PAUSE, RESUME, CANCEL -> state;
        };
    }

    private static WorkflowInstance requirementsChecked(WorkflowInstance state, JsonNode payload) {
        WorkflowInstance checked = state.toBuilder().requirementCheckStageId(null).build();
        String stageId = text(payload, STAGE_ID);
        if (!payload.path(SATISFIED).asBoolean(false) || !stageId.equals(state.currentStageId())) {
            return checked;
        }
        Optional<Stage> current = state.currentStage();
        if (current.isEmpty() || !current.get().autoTransition()) {
            return checked;
        }
        return state.nextStage()
            .map(next -> checked.toBuilder()
                .pendingTransition(new TransitionRequest(next.stageId(), TransitionReason.AUTO, null))
                .build())
            .orElse(checked);
    }

    /**
     * An override completes the stage it was applied in by moving to the next stage,
     * unless a transition is already pending or there is no next stage.
     */
    private static WorkflowInstance manualOverrideApplied(WorkflowInstance state, JsonNode payload, Instant at) {
        String stageId = text(payload, STAGE_ID);
        WorkflowInstance applied = state.toBuilder()
            .manualOverrides(append(state.manualOverrides(),
                new ManualOverride(stageId, text(payload, REASON), text(payload, APPROVED_BY), at)))
            .pendingOverride(null)
            .build();
        boolean inStage = stageId.equals(state.currentStageId())
            && state.currentStage().map(stage -> !stage.terminal()).orElse(false);
        if (!inStage || state.pendingTransition() != null) {
            return applied;
        }
        return state.nextStage()
            .map(next -> applied.toBuilder()
                .pendingTransition(new TransitionRequest(next.stageId(), TransitionReason.OVERRIDE,
                    text(payload, REASON)))
                .build())
            .orElse(applied);
    }

    private static String text(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode payload, String field) {
        String value = text(payload, field);
        return value == null ? null : Instant.parse(value);
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list);
        copy.add(item);
        return copy;
    }

    private static <T> List<T> tail(List<T> list) {
        return list.isEmpty() ? list : list.subList(1, list.size());
    }

    private static <T> List<T> replace(List<T> list, int index, UnaryOperator<T> change) {
        if (index < 0 || index >= list.size()) {
            return list;
        }
        List<T> copy = new ArrayList<>(list);
        copy.set(index, change.apply(copy.get(index)));
        return copy;
    }
}
