package com.caseflow.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStatuses() {
        assertTrue(WorkflowStatus.COMPLETED.isTerminal());
        assertTrue(WorkflowStatus.FAILED.isTerminal());
        assertTrue(WorkflowStatus.CANCELLED.isTerminal());

        assertFalse(WorkflowStatus.RUNNING.isTerminal());
        assertFalse(WorkflowStatus.PAUSED.isTerminal());
    }

    @Test
    void acceptsSignals_onlyWhileActive() {
        assertTrue(WorkflowStatus.RUNNING.acceptsSignals());
        assertTrue(WorkflowStatus.PAUSED.acceptsSignals());

        assertFalse(WorkflowStatus.COMPLETED.acceptsSignals());
        assertFalse(WorkflowStatus.CANCELLED.acceptsSignals());
    }

    @Test
    void canTransitionTo_fromRunning() {
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.PAUSED));
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.COMPLETED));
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.CANCELLED));

        assertFalse(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.RUNNING));
    }

    @Test
    void canTransitionTo_fromPaused_shouldNotComplete() {
        assertTrue(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.RUNNING));
        assertTrue(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.CANCELLED));

        assertFalse(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.COMPLETED));
    }

    @Test
    void terminalStatuses_shouldNotTransition() {
        for (WorkflowStatus terminal : new WorkflowStatus[]{
                WorkflowStatus.COMPLETED, WorkflowStatus.FAILED, WorkflowStatus.CANCELLED}) {
            for (WorkflowStatus target : WorkflowStatus.values()) {
                assertFalse(terminal.canTransitionTo(target),
                    terminal + " should not transition to " + target);
            }
        }
    }
}
