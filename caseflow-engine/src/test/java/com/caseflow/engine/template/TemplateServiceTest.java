package com.caseflow.engine.template;

import com.caseflow.core.exception.NotFoundException;
import com.caseflow.core.exception.WorkflowValidationException;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.signal.WorkflowSignal;
import com.caseflow.engine.persistence.InMemoryWorkflowTemplateRepository;
import com.caseflow.engine.runtime.WorkflowRunner;
import com.caseflow.engine.test.EngineHarness;
import com.caseflow.engine.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TemplateServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-02T12:00:00Z");

    private InMemoryWorkflowTemplateRepository repository;
    private TemplateService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowTemplateRepository();
        service = new TemplateService(repository, TimeController.frozenAt(NOW));
    }

    private static WorkflowTemplate.Builder template(String templateId) {
        return WorkflowTemplate.builder()
            .templateId(templateId)
            .name("Onboarding")
            .entityType(EntityType.EMPLOYEE)
            .stages(List.of(
                Stage.builder().stageId("offer").name("Offer").order(0).initial(true).build(),
                Stage.builder().stageId("done").name("Done").order(1).terminal(true).build()));
    }

    @Test
    void register_assignsIncreasingVersions() {
        WorkflowTemplate first = service.register(template("onboarding").build());
        WorkflowTemplate second = service.register(template("onboarding").description("v2").build());

        assertThat(first.version()).isEqualTo(1);
        assertThat(second.version()).isEqualTo(2);
        assertThat(second.createdAt()).isEqualTo(NOW);
        assertThat(service.getLatest("onboarding").description()).isEqualTo("v2");
        assertThat(service.getVersion("onboarding", 1).description()).isNull();
    }

    @Test
    void register_invalidTemplate_rejected() {
        WorkflowTemplate noStages = template("broken").stages(List.of()).build();

        assertThatThrownBy(() -> service.register(noStages))
            .isInstanceOf(WorkflowValidationException.class);
        assertThat(repository.findLatest("broken")).isEmpty();
    }

    @Test
    void unknownTemplate_notFound() {
        assertThatThrownBy(() -> service.getLatest("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.importPreset("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void seedPresets_isIdempotent() {
        service.seedPresets();
        service.seedPresets();

        assertThat(service.list())
            .extracting(WorkflowTemplate::templateId)
            .containsExactlyInAnyOrder(TemplatePresets.LABOR_CASE, TemplatePresets.COMMERCIAL_CASE,
                TemplatePresets.EMPLOYEE_OFFBOARDING);
        assertThat(service.list()).allMatch(t -> t.version() == 1);
    }

    @ParameterizedTest
    @ValueSource(strings = {TemplatePresets.LABOR_CASE, TemplatePresets.COMMERCIAL_CASE,
        TemplatePresets.EMPLOYEE_OFFBOARDING})
    void presets_areValid(String presetId) {
        WorkflowTemplate preset = TemplatePresets.find(presetId).orElseThrow();

        assertThatCode(preset::validate).doesNotThrowAnyException();
        assertThat(preset.initialStage()).isPresent();
        assertThat(preset.orderedStages().get(preset.stages().size() - 1).terminal()).isTrue();
    }

    @Test
    @DisplayName("Employee offboarding runs end to end on requirement signals alone where stages auto-advance")
    void offboardingPreset_runsEndToEnd() {
        try (EngineHarness harness = new EngineHarness()) {
            harness.activities.withTemplate(TemplatePresets.employeeOffboarding());
            WorkflowRunner runner = harness.start("offboard-7", TemplatePresets.EMPLOYEE_OFFBOARDING);
            harness.drive(runner);

            runner.signal(WorkflowSignal.completeRequirement("manager-notified", null));
            runner.signal(WorkflowSignal.completeRequirement("hr-notified", null));
            harness.drive(runner);
            assertThat(runner.state().currentStageId()).isEqualTo("knowledge-transfer");

            runner.signal(WorkflowSignal.transitionStage("access-revocation", "handover done"));
            harness.drive(runner);
            runner.signal(WorkflowSignal.completeRequirement("accounts-disabled", null));
            runner.signal(WorkflowSignal.completeRequirement("badge-deactivated", null));
            runner.signal(WorkflowSignal.completeRequirement("laptop-returned", null));
            harness.drive(runner);
            assertThat(runner.state().currentStageId()).isEqualTo("exit-interview");

            runner.signal(WorkflowSignal.transitionStage("clearance", null));
            harness.drive(runner);
            runner.signal(WorkflowSignal.completeRequirement("final-settlement", null));
            harness.drive(runner);

            assertThat(runner.state().status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(harness.activities.enteredStages()).containsExactly(
                "notification", "knowledge-transfer", "access-revocation", "equipment-return",
                "exit-interview", "clearance", "offboarded");
        }
    }
}
