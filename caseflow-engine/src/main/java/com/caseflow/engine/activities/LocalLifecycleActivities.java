package com.caseflow.engine.activities;

import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.DeadlineNotice;
import com.caseflow.core.model.ReminderWindow;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.repository.WorkflowTemplateRepository;
import com.caseflow.worker.ActivityContext;
import com.caseflow.worker.ActivityException;
import com.caseflow.worker.HttpLifecycleActivities;
import com.caseflow.worker.LifecycleActivities;
import com.caseflow.worker.RequirementCheck;
import com.caseflow.worker.TransitionDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Activities for running without the case management back end.
 * Templates come from the local registry; side effects are written to the log.
 */
public class LocalLifecycleActivities implements LifecycleActivities {

    private static final Logger log = LoggerFactory.getLogger(LocalLifecycleActivities.class);

    private final WorkflowTemplateRepository templateRepository;

    public LocalLifecycleActivities(WorkflowTemplateRepository templateRepository) {
        this.templateRepository = templateRepository;
    }

    @Override
    public WorkflowTemplate getWorkflowTemplate(ActivityContext context, String templateId) throws ActivityException {
        return templateRepository.findLatest(templateId)
            .orElseThrow(() -> ActivityException.permanent(HttpLifecycleActivities.TEMPLATE_NOT_FOUND,
                "Template not found: " + templateId));
    }

    @Override
    public void enterStage(ActivityContext context, String entityId, Stage stage) {
        log.info("[{}] {} {} entered stage {}", context.getIdempotencyKey(), context.getEntityType(), entityId,
            stage.stageId());
    }

    @Override
    public void exitStage(ActivityContext context, String entityId, Stage stage, Duration timeInStage) {
        log.info("[{}] {} {} exited stage {} after {}", context.getIdempotencyKey(), context.getEntityType(),
            entityId, stage.stageId(), timeInStage);
    }

    @Override
    public RequirementCheck checkStageRequirements(ActivityContext context, String entityId, Stage stage,
                                                   Set<String> completedRequirements) {
        return RequirementCheck.of(stage.requirements(), completedRequirements);
    }

    @Override
    public void notifyStageTransition(ActivityContext context, String entityId, Stage stage,
                                      TransitionDirection direction) {
        log.info("Notify: {} {} {} stage {}", context.getEntityType(), entityId, direction, stage.name());
    }

    @Override
    public void notifyAssignedTeam(ActivityContext context, String entityId, Stage stage) {
        log.info("Notify team of {} {}: now in {}", context.getEntityType(), entityId, stage.name());
    }

    @Override
    public void escalateIssue(ActivityContext context, String entityId, Stage stage, String issue) {
        log.warn("Escalation for {} {} in {}: {}", context.getEntityType(), entityId, stage.name(), issue);
    }

    @Override
    public void logCaseActivity(ActivityContext context, String entityId, String eventName,
                                Map<String, Object> details) {
        log.info("Activity log {} {}: {} {}", context.getEntityType(), entityId, eventName, details.keySet());
    }

    @Override
    public void sendDeadlineReminder(ActivityContext context, String entityId, Deadline deadline, long daysUntil,
                                     DeadlineNotice notice) {
        log.info("Deadline {} for {} {}: '{}' ({} days)", notice, context.getEntityType(), entityId,
            deadline.description(), daysUntil);
    }

    @Override
    public void createCourtDateReminder(ActivityContext context, String entityId, CourtDate courtDate,
                                        ReminderWindow window, long hoursUntil) {
        log.info("Court date reminder {} for {} {}: '{}' ({} hours)", window, context.getEntityType(), entityId,
            courtDate.description(), hoursUntil);
    }

    @Override
    public void updateCaseStatus(ActivityContext context, String entityId, String status) {
        log.info("{} {} status set to {}", context.getEntityType(), entityId, status);
    }
}
