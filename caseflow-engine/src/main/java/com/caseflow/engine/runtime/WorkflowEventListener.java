package com.caseflow.engine.runtime;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.WorkflowInstance;

/**
 * Observer of recorded events, called after the event is applied.
 */
@FunctionalInterface
public interface WorkflowEventListener {

    WorkflowEventListener NOOP = (state, event) -> { };

    void onEvent(WorkflowInstance state, Event event);
}
