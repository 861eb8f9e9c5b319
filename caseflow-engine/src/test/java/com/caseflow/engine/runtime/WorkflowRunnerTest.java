package com.caseflow.engine.runtime;

import com.caseflow.core.exception.InvalidStateTransitionException;
import com.caseflow.core.exception.OptimisticLockException;
import com.caseflow.core.exception.WorkflowExecutionException;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.Escalation;
import com.caseflow.core.model.EscalationSource;
import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.core.model.ManualOverride;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.TransitionReason;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.query.WorkflowResult;
import com.caseflow.core.reducer.EventPayloads;
import com.caseflow.core.signal.SignalType;
import com.caseflow.core.signal.WorkflowSignal;
import com.caseflow.engine.test.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.*;

class WorkflowRunnerTest {

    private final EngineHarness harness = new EngineHarness();

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private WorkflowRunner startedInIntake(String workflowId) {
        WorkflowRunner runner = harness.start(workflowId);
        harness.drive(runner);
        assertThat(runner.state().currentStageId()).isEqualTo("intake");
        harness.activities.clearFailures();
        return runner;
    }

    /**
     * Same stages as the test template, with timeouts on intake (48h) and review (24h).
     */
    private static WorkflowTemplate timedTemplate() {
        return WorkflowTemplate.builder()
            .templateId("timed-case")
            .name("Timed Case")
            .entityType(EntityType.CASE)
            .version(1)
            .stages(List.of(
                Stage.builder().stageId("intake").name("Intake").order(0).initial(true)
                    .requirements(List.of("doc-a", "doc-b")).autoTransition(true)
                    .timeout(Duration.ofHours(48)).build(),
                Stage.builder().stageId("review").name("Review").order(1)
                    .requirements(List.of("approval")).timeout(Duration.ofHours(24)).build(),
                Stage.builder().stageId("closed").name("Closed").order(2).terminal(true).build()))
            .build();
    }

    private List<Event> events(WorkflowRunner runner, EventType type) {
        return harness.events.findByWorkflowInstance(runner.instanceId()).stream()
            .filter(event -> event.type() == type)
            .toList();
    }

    @Nested
    class Startup {

        @Test
        @DisplayName("First iteration loads the template and enters the initial stage")
        void entersInitialStage() {
            WorkflowRunner runner = harness.start("wf-start");

            Optional<Instant> next = harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(state.status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(state.currentStageId()).isEqualTo("intake");
            assertThat(state.currentStageEnteredAt()).isEqualTo(EngineHarness.START);
            assertThat(state.stages()).hasSize(3);
            assertThat(state.activeTransition()).isNull();
            assertThat(harness.activities.activityNames()).containsExactly(
                "getWorkflowTemplate", "enterStage", "notifyStageTransition", "notifyAssignedTeam",
                "logCaseActivity");
            assertThat(next).contains(EngineHarness.START.plus(Duration.ofHours(1)));
        }

        @Test
        void startEventIsTheFirstInHistory() {
            WorkflowRunner runner = harness.start("wf-history");
            harness.drive(runner);

            assertThat(harness.eventTypes(runner.instanceId())).startsWith(
                EventType.WORKFLOW_STARTED, EventType.TEMPLATE_LOADED, EventType.TRANSITION_STARTED);
            assertThat(harness.snapshots.findByWorkflowId("wf-history"))
                .get()
                .extracting(WorkflowInstance::lastSequence)
                .isEqualTo(runner.state().lastSequence());
        }

        @Test
        @DisplayName("A missing template fails the instance without retrying")
        void missingTemplate_failsInstance() {
            WorkflowRunner runner = harness.start("wf-missing", "no-such-template");

            Optional<Instant> next = harness.drive(runner);

            assertThat(next).isEmpty();
            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(runner.state().lastError()).contains("TEMPLATE_NOT_FOUND");
            assertThat(harness.activities.calls("getWorkflowTemplate")).hasSize(1);
            assertThat(harness.activities.details("logCaseActivity")).containsExactly("workflow_failed");
            assertThat(runner.result()).isCompletedExceptionally();
        }
    }

    @Nested
    class Requirements {

        @Test
        void partialRequirements_stayInStage() {
            WorkflowRunner runner = startedInIntake("wf-partial");

            runner.signal(WorkflowSignal.completeRequirement("doc-a", "scanned"));
            harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(state.currentStageId()).isEqualTo("intake");
            assertThat(state.completedRequirementIds("intake")).containsExactly("doc-a");
            assertThat(state.completedRequirements().get(0).notes()).isEqualTo("scanned");
            assertThat(state.pendingRequirements()).isEmpty();
            assertThat(harness.count(runner.instanceId(), EventType.REQUIREMENTS_CHECKED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Completing every requirement of an auto-transition stage moves to the next stage")
        void allRequirements_autoTransition() {
            WorkflowRunner runner = startedInIntake("wf-auto");

            runner.signal(WorkflowSignal.completeRequirement("doc-a", null));
            runner.signal(WorkflowSignal.completeRequirement("doc-b", null));
            harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(state.currentStageId()).isEqualTo("review");
            assertThat(harness.activities.enteredStages()).containsExactly("intake", "review");
            assertThat(harness.activities.details("exitStage")).containsExactly("intake");
            assertThat(harness.activities.details("logCaseActivity"))
                .contains("requirement_completed", "stage_exited", "stage_entered");
        }

        @Test
        void manualStage_doesNotAdvanceWhenSatisfied() {
            WorkflowRunner runner = startedInIntake("wf-manual");
            runner.signal(WorkflowSignal.transitionStage("review", "skip intake"));
            harness.drive(runner);

            runner.signal(WorkflowSignal.completeRequirement("approval", null));
            harness.drive(runner);

            assertThat(runner.state().currentStageId()).isEqualTo("review");
            assertThat(runner.state().pendingTransition()).isNull();
        }

        @Test
        void unknownRequirement_isRecordedButDoesNotSatisfyStage() {
            WorkflowRunner runner = startedInIntake("wf-extra");

            runner.signal(WorkflowSignal.completeRequirement("not-listed", null));
            harness.drive(runner);

            assertThat(runner.state().completedRequirementIds("intake")).containsExactly("not-listed");
            assertThat(runner.state().currentStageId()).isEqualTo("intake");
        }
    }

    @Nested
    class Transitions {

        @Test
        @DisplayName("Explicit transition to a terminal stage completes the workflow")
        void transitionToTerminal_completes() throws Exception {
            WorkflowRunner runner = startedInIntake("wf-close");
            harness.time.advance(Duration.ofHours(5));

            runner.signal(WorkflowSignal.transitionStage("closed", "settled"));
            Optional<Instant> next = harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(next).isEmpty();
            assertThat(runner.isFinished()).isTrue();
            assertThat(state.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(state.completedAt()).isEqualTo(EngineHarness.START.plus(Duration.ofHours(5)));
            assertThat(harness.activities.details("updateCaseStatus")).containsExactly("completed");
            assertThat(harness.activities.details("logCaseActivity")).endsWith("workflow_completed");

            WorkflowResult result = runner.result().get();
            assertThat(result.success()).isTrue();
            assertThat(result.workflowState().status()).isEqualTo(WorkflowStatus.COMPLETED);
        }

        @Test
        void transitionRecordsReasonAndNotes() {
            WorkflowRunner runner = startedInIntake("wf-reason");

            runner.signal(WorkflowSignal.transitionStage("review", "expedited"));
            harness.drive(runner);

            assertThat(harness.events.findByWorkflowInstanceAndTypes(runner.instanceId(),
                    List.of(EventType.TRANSITION_STARTED)))
                .extracting(e -> e.payload().path("reason").asText())
                .containsExactly(TransitionReason.INITIAL.name(), TransitionReason.EXPLICIT.name());
        }

        @Test
        @DisplayName("A transition to an unknown stage is rejected and the instance keeps running")
        void unknownStage_isRejected() {
            WorkflowRunner runner = startedInIntake("wf-unknown");

            runner.signal(WorkflowSignal.transitionStage("appeal", null));
            harness.drive(runner);

            assertThat(runner.state().currentStageId()).isEqualTo("intake");
            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(runner.state().pendingTransition()).isNull();
            assertThat(harness.count(runner.instanceId(), EventType.TRANSITION_REJECTED)).isEqualTo(1);
        }

        @Test
        void latestTransitionRequestWins() {
            WorkflowRunner runner = startedInIntake("wf-lww");

            runner.signal(WorkflowSignal.transitionStage("closed", null));
            runner.signal(WorkflowSignal.transitionStage("review", null));
            harness.drive(runner);

            assertThat(runner.state().currentStageId()).isEqualTo("review");
            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.RUNNING);
        }

        @Test
        void exitNotificationOnlyForStagesThatAskForIt() {
            WorkflowRunner runner = startedInIntake("wf-notify");
            runner.signal(WorkflowSignal.transitionStage("review", null));
            harness.drive(runner);
            runner.signal(WorkflowSignal.transitionStage("closed", null));
            harness.drive(runner);

            assertThat(harness.activities.details("notifyStageTransition"))
                .containsExactly("ENTERED:intake", "EXITED:review");
        }
    }

    @Nested
    class PauseAndCancel {

        @Test
        @DisplayName("Signals received while paused are applied after resume")
        void pause_defersSignals() {
            WorkflowRunner runner = startedInIntake("wf-pause");

            runner.signal(WorkflowSignal.pause());
            runner.signal(WorkflowSignal.completeRequirement("doc-a", null));
            Optional<Instant> next = harness.drive(runner);

            assertThat(next).isEmpty();
            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.PAUSED);
            assertThat(runner.state().pausedAt()).isEqualTo(EngineHarness.START);
            assertThat(runner.state().pendingRequirements()).hasSize(1);

            runner.signal(WorkflowSignal.resume());
            harness.drive(runner);

            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(runner.state().pausedAt()).isNull();
            assertThat(runner.state().completedRequirementIds("intake")).containsExactly("doc-a");
        }

        @Test
        void pauseAndResume_areIdempotent() {
            WorkflowRunner runner = startedInIntake("wf-pause-twice");

            runner.signal(WorkflowSignal.pause());
            runner.signal(WorkflowSignal.pause());
            runner.signal(WorkflowSignal.resume());
            runner.signal(WorkflowSignal.resume());

            assertThat(harness.count(runner.instanceId(), EventType.WORKFLOW_PAUSED)).isEqualTo(1);
            assertThat(harness.count(runner.instanceId(), EventType.WORKFLOW_RESUMED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Cancel terminates immediately and rejects later signals")
        void cancel_terminates() {
            WorkflowRunner runner = startedInIntake("wf-cancel");

            runner.signal(WorkflowSignal.cancel("client withdrew"));
            Optional<Instant> next = harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(next).isEmpty();
            assertThat(state.status()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(state.lastError()).isEqualTo("client withdrew");
            assertThat(state.completedAt()).isNull();
            assertThat(harness.activities.calls("exitStage")).isEmpty();

            assertThatThrownBy(runner.result()::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkflowExecutionException.class);
            assertThatThrownBy(() -> runner.signal(WorkflowSignal.completeRequirement("doc-a", null)))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        void cancelWhilePaused_terminates() {
            WorkflowRunner runner = startedInIntake("wf-cancel-paused");

            runner.signal(WorkflowSignal.pause());
            runner.signal(WorkflowSignal.cancel(null));

            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.CANCELLED);
            assertThat(runner.state().paused()).isFalse();
        }
    }

    @Nested
    class Reminders {

        @Test
        @DisplayName("Deadline inside the seven-day window gets one upcoming reminder")
        void upcomingDeadline_remindedOnce() {
            WorkflowRunner runner = startedInIntake("wf-deadline");

            runner.signal(WorkflowSignal.addDeadline(EngineHarness.START.plus(Duration.ofDays(5)), "file brief"));
            harness.drive(runner);
            harness.time.advance(Duration.ofDays(1));
            harness.drive(runner);

            assertThat(runner.state().deadlines()).hasSize(1);
            assertThat(runner.state().deadlines().get(0).reminded()).isTrue();
            assertThat(harness.activities.details("sendDeadlineReminder")).containsExactly("UPCOMING:file brief:5");
        }

        @Test
        void distantDeadline_wakesAtWindowStart() {
            WorkflowRunner runner = startedInIntake("wf-far");
            Instant due = EngineHarness.START.plus(Duration.ofMinutes(7 * 24 * 60 + 30));

            runner.signal(WorkflowSignal.addDeadline(due, "appeal window"));
            Optional<Instant> next = harness.drive(runner);

            assertThat(harness.activities.calls("sendDeadlineReminder")).isEmpty();
            assertThat(next).contains(due.minus(Duration.ofDays(7)));

            harness.time.setTime(next.get());
            harness.drive(runner);
            assertThat(harness.activities.details("sendDeadlineReminder")).containsExactly("UPCOMING:appeal window:7");
        }

        @Test
        void passedDeadline_notifiedOverdueOnce() {
            WorkflowRunner runner = startedInIntake("wf-overdue");

            runner.signal(WorkflowSignal.addDeadline(EngineHarness.START.minus(Duration.ofDays(2)), "late filing"));
            harness.drive(runner);
            harness.drive(runner);

            assertThat(harness.count(runner.instanceId(), EventType.DEADLINE_OVERDUE_NOTIFIED)).isEqualTo(1);
            assertThat(runner.state().deadlines().get(0).overdueNotified()).isTrue();
        }

        @Test
        @DisplayName("Court dates get a 48h and a 24h reminder")
        void courtDate_twoWindows() {
            WorkflowRunner runner = startedInIntake("wf-court");
            Instant hearing = EngineHarness.START.plus(Duration.ofHours(40));

            runner.signal(WorkflowSignal.addCourtDate(hearing, "first hearing"));
            harness.drive(runner);
            harness.time.advance(Duration.ofHours(20));
            harness.drive(runner);
            harness.time.advance(Duration.ofHours(10));
            harness.drive(runner);

            assertThat(harness.activities.details("createCourtDateReminder"))
                .containsExactly("HOURS_48:first hearing:40", "HOURS_24:first hearing:20");
            assertThat(runner.state().courtDates().get(0).reminded48h()).isTrue();
            assertThat(runner.state().courtDates().get(0).reminded24h()).isTrue();
        }

        @Test
        void pausedInstance_sendsNoReminders() {
            WorkflowRunner runner = startedInIntake("wf-quiet");
            runner.signal(WorkflowSignal.addDeadline(EngineHarness.START.plus(Duration.ofDays(3)), "reply"));
            runner.signal(WorkflowSignal.pause());

            harness.drive(runner);

            assertThat(harness.activities.calls("sendDeadlineReminder")).isEmpty();
        }
    }

    @Nested
    class UnexpectedErrors {

        @Test
        @DisplayName("An unexpected exception inside an iteration fails the instance instead of retrying forever")
        void unexpectedException_failsInstance() {
            WorkflowRunner runner = startedInIntake("wf-overflow");
            // Bypasses the factory's date check, as a history written before it would.
            runner.signal(new WorkflowSignal(SignalType.ADD_DEADLINE, null, null,
                Instant.parse("+300000000-01-01T00:00:00Z"), "far future", null, null, null));
            runner.signal(WorkflowSignal.transitionStage("closed", "settled"));

            Optional<Instant> next = harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(next).isEmpty();
            assertThat(state.status()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(state.lastError()).contains("ArithmeticException");
            assertThat(runner.isFinished()).isTrue();
            assertThat(runner.result()).isCompletedExceptionally();
            assertThat(events(runner, EventType.WORKFLOW_FAILED)).singleElement()
                .satisfies(event -> assertThat(event.payload().path(EventPayloads.ERROR_CODE).asText())
                    .isEqualTo(WorkflowRunner.UNEXPECTED_ERROR));
            assertThat(harness.activities.details("logCaseActivity")).endsWith("workflow_failed");
            assertThat(harness.snapshots.findByWorkflowId("wf-overflow")).get()
                .extracting(WorkflowInstance::status).isEqualTo(WorkflowStatus.FAILED);
        }

        @Test
        @DisplayName("A conflicting append is left to the dispatcher and does not fail the instance")
        void appendConflict_propagates() {
            WorkflowRunner runner = startedInIntake("wf-conflict");
            runner.signal(WorkflowSignal.completeRequirement("doc-a", null));
            long taken = runner.state().lastSequence() + 1;
            harness.events.append(Event.create(runner.instanceId(), taken, EventType.WORKFLOW_PAUSED,
                EngineHarness.START, EventPayloads.empty(), "other-writer:" + taken, Event.ACTOR_SIGNAL, "PAUSE"));

            assertThatThrownBy(runner::runIteration).isInstanceOf(OptimisticLockException.class);

            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(events(runner, EventType.WORKFLOW_FAILED)).isEmpty();
            assertThat(runner.result()).isNotDone();
        }
    }

    @Nested
    class OverridesAndEscalations {

        @Test
        @DisplayName("A manual override completes the current stage with an audit entry")
        void manualOverride_movesToNextStage() {
            WorkflowRunner runner = startedInIntake("wf-override");

            runner.signal(WorkflowSignal.manualOverride("documents waived by court", "head-of-legal"));
            harness.drive(runner);

            WorkflowInstance state = runner.state();
            assertThat(state.currentStageId()).isEqualTo("review");
            assertThat(state.pendingOverride()).isNull();
            assertThat(state.completedRequirementIds("intake")).isEmpty();
            assertThat(state.manualOverrides()).singleElement().satisfies(override -> {
                assertThat(override.stageId()).isEqualTo("intake");
                assertThat(override.reason()).isEqualTo("documents waived by court");
                assertThat(override.approvedBy()).isEqualTo("head-of-legal");
                assertThat(override.appliedAt()).isEqualTo(EngineHarness.START);
            });
            assertThat(events(runner, EventType.TRANSITION_STARTED)).last()
                .satisfies(event -> assertThat(event.payload().path(EventPayloads.REASON).asText())
                    .isEqualTo(TransitionReason.OVERRIDE.name()));
            assertThat(harness.activities.details("logCaseActivity")).contains("manual_override");
        }

        @Test
        @DisplayName("An override of a stage that was already left is recorded but moves nothing")
        void manualOverride_ofLeftStage_onlyRecorded() {
            WorkflowRunner runner = startedInIntake("wf-late-override");

            runner.signal(WorkflowSignal.transitionStage("review", "expedited"));
            runner.signal(WorkflowSignal.manualOverride("skip intake", "partner"));
            harness.drive(runner);

            assertThat(runner.state().currentStageId()).isEqualTo("review");
            assertThat(runner.state().manualOverrides()).extracting(ManualOverride::stageId).containsExactly("intake");
            assertThat(harness.activities.enteredStages()).containsExactly("intake", "review");
        }

        @Test
        void manualOverride_requiresApprover() {
            assertThatThrownBy(() -> WorkflowSignal.manualOverride("no approver", " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("approvedBy");
        }

        @Test
        @DisplayName("An escalation is recorded on receipt and leaves the stage alone")
        void escalate_recordsReasonAndTarget() {
            WorkflowRunner runner = startedInIntake("wf-escalate");

            runner.signal(WorkflowSignal.escalate("client unresponsive", "partner-on-call"));

            assertThat(runner.state().escalations()).singleElement().satisfies(escalation -> {
                assertThat(escalation.stageId()).isEqualTo("intake");
                assertThat(escalation.reason()).isEqualTo("client unresponsive");
                assertThat(escalation.escalatedTo()).isEqualTo("partner-on-call");
                assertThat(escalation.source()).isEqualTo(EscalationSource.SIGNAL);
            });

            harness.drive(runner);
            assertThat(runner.state().currentStageId()).isEqualTo("intake");
            assertThat(harness.activities.calls("escalateIssue")).isEmpty();
        }

        @Test
        @DisplayName("A stage past its timeout escalates once per visit")
        void stageTimeout_escalatesOncePerVisit() {
            harness.activities.withTemplate(timedTemplate());
            WorkflowRunner runner = harness.start("wf-timeout", "timed-case");
            harness.drive(runner);

            harness.time.advance(Duration.ofHours(47));
            harness.drive(runner);
            assertThat(harness.activities.calls("escalateIssue")).isEmpty();

            harness.time.advance(Duration.ofHours(1));
            harness.drive(runner);
            harness.time.advance(Duration.ofHours(10));
            harness.drive(runner);

            assertThat(harness.activities.details("escalateIssue"))
                .containsExactly("intake:Intake not completed within 48 hours");
            assertThat(runner.state().stageTimeoutEscalated()).isTrue();
            assertThat(runner.state().escalations()).extracting(Escalation::source)
                .containsExactly(EscalationSource.STAGE_TIMEOUT);

            runner.signal(WorkflowSignal.completeRequirement("doc-a", null));
            runner.signal(WorkflowSignal.completeRequirement("doc-b", null));
            harness.drive(runner);
            assertThat(runner.state().currentStageId()).isEqualTo("review");
            assertThat(runner.state().stageTimeoutEscalated()).isFalse();

            harness.time.advance(Duration.ofHours(24));
            harness.drive(runner);

            assertThat(harness.activities.details("escalateIssue")).containsExactly(
                "intake:Intake not completed within 48 hours", "review:Review not completed within 24 hours");
            assertThat(harness.count(runner.instanceId(), EventType.STAGE_TIMEOUT_ESCALATED)).isEqualTo(2);
        }

        @Test
        void stageTimeout_setsNextWakeup() {
            harness.activities.withTemplate(timedTemplate());
            WorkflowRunner runner = harness.start("wf-timeout-wakeup", "timed-case");
            harness.drive(runner);

            harness.time.advance(Duration.ofMinutes(47 * 60 + 30));
            Optional<Instant> next = harness.drive(runner);

            assertThat(next).contains(EngineHarness.START.plus(Duration.ofHours(48)));
        }
    }
}
