package com.caseflow.engine.runtime;

import com.caseflow.core.model.ActivityOptions;
import com.caseflow.core.repository.EventRepository;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.worker.ActivityExecutor;
import com.caseflow.worker.LifecycleActivities;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators shared by every {@link WorkflowRunner}.
 *
 * @param pollInterval Upper bound between two iterations of an idle instance
 */
public record RunnerEnvironment(
    EventRepository eventRepository,
    WorkflowInstanceRepository instanceRepository,
    LifecycleActivities activities,
    ActivityExecutor activityExecutor,
    ActivityOptions activityOptions,
    Clock clock,
    Duration pollInterval,
    WorkflowEventListener listener
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofHours(1);

    public RunnerEnvironment {
        if (pollInterval == null) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (listener == null) {
            listener = WorkflowEventListener.NOOP;
        }
    }
}
