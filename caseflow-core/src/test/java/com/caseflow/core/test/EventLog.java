package com.caseflow.core.test;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.reducer.WorkflowStateReducer;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds an ordered event history for reducer tests.
 * Each event gets the next sequence number and the log's current time.
 */
public class EventLog {

    private final UUID instanceId = UUID.randomUUID();
    private final List<Event> events = new ArrayList<>();
    private Instant now;

    public EventLog(Instant start) {
        this.now = start;
    }

    public EventLog add(EventType type, JsonNode payload) {
        long sequence = events.size() + 1;
        events.add(Event.create(instanceId, sequence, type, now, payload,
            instanceId + ":" + sequence, Event.ACTOR_SYSTEM, "test"));
        return this;
    }

    public EventLog advance(Duration duration) {
        now = now.plus(duration);
        return this;
    }

    public Instant now() {
        return now;
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public WorkflowInstance fold() {
        return WorkflowStateReducer.replay(WorkflowInstance.empty(instanceId), events);
    }
}
