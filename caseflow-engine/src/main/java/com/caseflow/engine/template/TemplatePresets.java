package com.caseflow.engine.template;

import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Built-in templates that can be imported into the registry.
 */
public final class TemplatePresets {

    public static final String LABOR_CASE = "labor-case";
    public static final String COMMERCIAL_CASE = "commercial-case";
    public static final String EMPLOYEE_OFFBOARDING = "employee-offboarding";

    private static final Map<String, WorkflowTemplate> PRESETS = List.of(
            laborCase(), commercialCase(), employeeOffboarding())
        .stream()
        .collect(Collectors.toUnmodifiableMap(WorkflowTemplate::templateId, Function.identity()));

    private TemplatePresets() {
    }

    public static List<WorkflowTemplate> all() {
        return List.of(PRESETS.get(LABOR_CASE), PRESETS.get(COMMERCIAL_CASE), PRESETS.get(EMPLOYEE_OFFBOARDING));
    }

    public static Optional<WorkflowTemplate> find(String presetId) {
        return Optional.ofNullable(PRESETS.get(presetId));
    }

    static WorkflowTemplate laborCase() {
        return WorkflowTemplate.builder()
            .templateId(LABOR_CASE)
            .name("Labor Case Workflow")
            .entityType(EntityType.CASE)
            .category("labor")
            .description("Labor dispute from filing to judgment")
            .stages(stages(
                stage("case-filed", "Case Filed", List.of("power-of-attorney", "claim-statement")).initial(true),
                stage("document-review", "Document Review", List.of("contract-copy", "salary-records"))
                    .autoTransition(true),
                stage("initial-hearing", "Initial Hearing", List.of("hearing-attended")).notifyOnExit(true),
                stage("evidence-phase", "Evidence Phase", List.of("evidence-submitted")),
                stage("closing-arguments", "Closing Arguments", List.of("closing-memo")),
                stage("judgment", "Judgment", List.of()).terminal(true)))
            .build();
    }

    static WorkflowTemplate commercialCase() {
        return WorkflowTemplate.builder()
            .templateId(COMMERCIAL_CASE)
            .name("Commercial Case Workflow")
            .entityType(EntityType.CASE)
            .category("commercial")
            .description("Commercial dispute from registration to verdict")
            .stages(stages(
                stage("case-registration", "Case Registration", List.of("commercial-register", "claim-statement"))
                    .initial(true),
                stage("defendant-response", "Defendant Response", List.of("response-received")),
                stage("discovery", "Discovery", List.of("documents-exchanged")).autoTransition(true),
                stage("settlement-attempt", "Settlement Attempt", List.of("settlement-meeting")),
                stage("trial", "Trial", List.of("trial-attended")).notifyOnExit(true),
                stage("verdict", "Verdict", List.of()).terminal(true)))
            .build();
    }

    static WorkflowTemplate employeeOffboarding() {
        return WorkflowTemplate.builder()
            .templateId(EMPLOYEE_OFFBOARDING)
            .name("Employee Offboarding")
            .entityType(EntityType.EMPLOYEE)
            .category("hr")
            .description("Exit process with access revocation and clearance")
            .stages(stages(
                stage("notification", "Notification", List.of("manager-notified", "hr-notified")).initial(true)
                    .autoTransition(true).timeout(Duration.ofDays(2)),
                stage("knowledge-transfer", "Knowledge Transfer", List.of("handover-document"))
                    .timeout(Duration.ofDays(30)),
                stage("access-revocation", "Access Revocation", List.of("accounts-disabled", "badge-deactivated"))
                    .autoTransition(true),
                stage("equipment-return", "Equipment Return", List.of("laptop-returned")).autoTransition(true),
                stage("exit-interview", "Exit Interview", List.of("interview-held")),
                stage("clearance", "Clearance", List.of("final-settlement")).autoTransition(true),
                stage("offboarded", "Offboarded", List.of()).terminal(true)))
            .build();
    }

    private static Stage.Builder stage(String stageId, String name, List<String> requirements) {
        return Stage.builder()
            .stageId(stageId)
            .name(name)
            .requirements(requirements)
            .notifyOnEntry(true);
    }

    private static List<Stage> stages(Stage.Builder... builders) {
        List<Stage> stages = new ArrayList<>();
        for (int i = 0; i < builders.length; i++) {
            stages.add(builders[i].order(i).build());
        }
        return stages;
    }
}
