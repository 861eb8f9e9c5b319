package com.caseflow.engine.history;

import com.caseflow.core.exception.NotFoundException;
import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.reducer.EventPayloads;
import com.caseflow.core.reducer.WorkflowStateReducer;
import com.caseflow.core.repository.EventRepository;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for workflow history and replay.
 *
 * Provides:
 * - Full event history retrieval
 * - Deterministic replay, compared with the live state
 * - Stage timeline with time spent per stage
 */
public class WorkflowHistoryService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowHistoryService.class);

    private final EventRepository eventRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final WorkflowService workflowService;

    public WorkflowHistoryService(EventRepository eventRepository,
                                  WorkflowInstanceRepository instanceRepository,
                                  WorkflowService workflowService) {
        this.eventRepository = eventRepository;
        this.instanceRepository = instanceRepository;
        this.workflowService = workflowService;
    }

    public List<Event> getEvents(String workflowId) {
        return eventRepository.findByWorkflowInstance(instanceId(workflowId));
    }

    public List<Event> getEvents(String workflowId, List<EventType> types) {
        return eventRepository.findByWorkflowInstanceAndTypes(instanceId(workflowId), types);
    }

    public Map<EventType, Long> countByType(String workflowId) {
        return eventRepository.countByType(instanceId(workflowId));
    }

    /**
     * Rebuild state from history.
     *
     * @param toSequence Last event to apply; null replays everything and compares
     *                   the result with the live state
     */
    @Transactional(readOnly = true)
    public ReplayResult replay(String workflowId, Long toSequence) {
        UUID instanceId = instanceId(workflowId);
        List<Event> events = eventRepository.findByWorkflowInstance(instanceId).stream()
            .filter(e -> toSequence == null || e.sequenceNumber() <= toSequence)
            .collect(Collectors.toList());
        WorkflowInstance replayed = WorkflowStateReducer.replay(WorkflowInstance.empty(instanceId), events);

        Boolean matches = null;
        if (toSequence == null) {
            WorkflowInstance live = workflowService.getWorkflowState(workflowId);
            matches = live.lastSequence() == replayed.lastSequence() ? live.equals(replayed) : null;
            if (Boolean.FALSE.equals(matches)) {
                log.warn("Replay of {} diverges from live state at seq {}", workflowId, replayed.lastSequence());
            }
        }
        return new ReplayResult(workflowId, replayed.lastSequence(), events.size(), replayed, matches);
    }

    /**
     * Stages visited, in order, with entry and exit times.
     */
    @Transactional(readOnly = true)
    public List<StageVisit> timeline(String workflowId) {
        WorkflowInstance state = workflowService.getWorkflowState(workflowId);
        List<Event> entries = eventRepository.findByWorkflowInstanceAndTypes(state.instanceId(),
            List.of(EventType.STAGE_ENTERED, EventType.WORKFLOW_COMPLETED,
                EventType.WORKFLOW_FAILED, EventType.WORKFLOW_CANCELLED));

        List<StageVisit> visits = new ArrayList<>();
        StageVisitBuilder open = null;
        for (Event event : entries) {
            if (open != null) {
                visits.add(open.close(event.timestamp()));
                open = null;
            }
            if (event.type() == EventType.STAGE_ENTERED) {
                String stageId = event.payload().path(EventPayloads.STAGE_ID).asText();
                String name = state.findStage(stageId).map(s -> s.name()).orElse(stageId);
                open = new StageVisitBuilder(stageId, name, event.timestamp());
            }
        }
        if (open != null) {
            visits.add(open.close(null));
        }
        return visits;
    }

    private UUID instanceId(String workflowId) {
        return instanceRepository.findByWorkflowId(workflowId)
            .map(WorkflowInstance::instanceId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    private record StageVisitBuilder(String stageId, String stageName, Instant enteredAt) {
        StageVisit close(Instant exitedAt) {
            Duration duration = exitedAt != null ? Duration.between(enteredAt, exitedAt) : null;
            return new StageVisit(stageId, stageName, enteredAt, exitedAt, duration);
        }
    }

    /**
     * @param matchesLiveState null when only part of the history was replayed
     *                         or the live state moved on during the replay
     */
    public record ReplayResult(
        String workflowId,
        long replayedToSequence,
        int eventsApplied,
        WorkflowInstance state,
        Boolean matchesLiveState
    ) {}

    /**
     * @param exitedAt null while the stage is current
     */
    public record StageVisit(
        String stageId,
        String stageName,
        Instant enteredAt,
        Instant exitedAt,
        Duration duration
    ) {}
}
