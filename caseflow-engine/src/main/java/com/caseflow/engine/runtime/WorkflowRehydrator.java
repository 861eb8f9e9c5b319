package com.caseflow.engine.runtime;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.reducer.WorkflowStateReducer;
import com.caseflow.core.repository.EventRepository;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rebuilds instance state from the latest snapshot plus the events recorded after it.
 */
public class WorkflowRehydrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRehydrator.class);

    private final EventRepository eventRepository;
    private final WorkflowInstanceRepository instanceRepository;

    public WorkflowRehydrator(EventRepository eventRepository, WorkflowInstanceRepository instanceRepository) {
        this.eventRepository = eventRepository;
        this.instanceRepository = instanceRepository;
    }

    /**
     * @return The current state, or empty if the instance has no history
     */
    public Optional<WorkflowInstance> load(UUID instanceId) {
        WorkflowInstance base = instanceRepository.findById(instanceId)
            .orElseGet(() -> WorkflowInstance.empty(instanceId));
        List<Event> tail = eventRepository.findByWorkflowInstanceAfter(instanceId, base.lastSequence());
        if (base.lastSequence() == 0 && tail.isEmpty()) {
            return Optional.empty();
        }
        WorkflowInstance state = WorkflowStateReducer.replay(base, tail);
        log.debug("Rehydrated {} from snapshot at seq {} plus {} events", instanceId, base.lastSequence(), tail.size());
        return Optional.of(state);
    }

    /**
     * Fold the full history, ignoring snapshots.
     */
    public Optional<WorkflowInstance> replayFromScratch(UUID instanceId) {
        List<Event> events = eventRepository.findByWorkflowInstance(instanceId);
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(WorkflowStateReducer.replay(WorkflowInstance.empty(instanceId), events));
    }
}
