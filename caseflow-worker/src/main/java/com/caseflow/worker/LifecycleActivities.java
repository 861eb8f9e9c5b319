package com.caseflow.worker;

import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.DeadlineNotice;
import com.caseflow.core.model.ReminderWindow;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Every side effect the orchestration loop performs.
 * Implementations must be idempotent for a given {@link ActivityContext#getIdempotencyKey()}:
 * a call may be repeated after a crash or a timeout.
 */
public interface LifecycleActivities {

    /**
     * Load the template an instance was started with.
     *
     * @param context Call context
     * @param templateId Template id from the start request
     * @return The latest version of the template
     * @throws ActivityException non-retryable if the template does not exist
     */
    WorkflowTemplate getWorkflowTemplate(ActivityContext context, String templateId) throws ActivityException;

    /**
     * Persist that the entity entered a stage.
     */
    void enterStage(ActivityContext context, String entityId, Stage stage) throws ActivityException;

    /**
     * Persist that the entity left a stage.
     *
     * @param timeInStage Time between entering and leaving the stage
     */
    void exitStage(ActivityContext context, String entityId, Stage stage, Duration timeInStage) throws ActivityException;

    /**
     * Check whether all requirements of a stage are satisfied.
     *
     * @param completed Requirement ids completed while the stage was current
     */
    RequirementCheck checkStageRequirements(ActivityContext context, String entityId, Stage stage,
                                            Set<String> completed) throws ActivityException;

    void notifyStageTransition(ActivityContext context, String entityId, Stage stage,
                               TransitionDirection direction) throws ActivityException;

    void notifyAssignedTeam(ActivityContext context, String entityId, Stage stage) throws ActivityException;

    /**
     * Append an entry to the entity's activity log.
     *
     * @param eventName e.g. stage_entered, requirement_completed, workflow_completed
     */
    void logCaseActivity(ActivityContext context, String entityId, String eventName,
                         Map<String, Object> details) throws ActivityException;

    void sendDeadlineReminder(ActivityContext context, String entityId, Deadline deadline,
                              long daysUntil, DeadlineNotice notice) throws ActivityException;

    void createCourtDateReminder(ActivityContext context, String entityId, CourtDate courtDate,
                                 ReminderWindow window, long hoursUntil) throws ActivityException;

    void updateCaseStatus(ActivityContext context, String entityId, String status) throws ActivityException;

    /**
     * Raise an issue with the people responsible for the entity, e.g. a stage that ran past its timeout.
     *
     * @param stage Stage the issue concerns
     * @param issue Human-readable description
     */
    void escalateIssue(ActivityContext context, String entityId, Stage stage, String issue) throws ActivityException;
}
