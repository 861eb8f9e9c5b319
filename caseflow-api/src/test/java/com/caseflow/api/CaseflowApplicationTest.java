package com.caseflow.api;

import com.caseflow.engine.history.WorkflowHistoryService;
import com.caseflow.engine.service.WorkflowService;
import com.caseflow.recovery.RecoveryEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application on the in-memory profile with local activities and seeded presets.
 */
@SpringBootTest(properties = "caseflow.engine.worker-threads=2")
@AutoConfigureMockMvc
class CaseflowApplicationTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WorkflowService workflowService;

    @Autowired
    private WorkflowHistoryService historyService;

    @Autowired
    private RecoveryEngine recoveryEngine;

    @Test
    void contextStartsRecovery() {
        assertThat(recoveryEngine.isRunning()).isTrue();
    }

    @Test
    void presetsAreSeeded() throws Exception {
        mockMvc.perform(get("/api/v1/templates/labor-case"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value(1))
            .andExpect(jsonPath("$.stages[0].stageId").value("case-filed"));
    }

    @Test
    void laborCase_movesThroughStagesOverHttp() throws Exception {
        mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflowId\":\"labor-2024-031\",\"entityId\":\"2024-031\","
                    + "\"entityType\":\"CASE\",\"templateId\":\"labor-case\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("RUNNING"));
        eventually(() -> "case-filed".equals(workflowService.getWorkflowState("labor-2024-031").currentStageId()));

        mockMvc.perform(post("/api/v1/workflows/labor-2024-031/requirements/power-of-attorney/complete"))
            .andExpect(status().isAccepted());
        eventually(() -> workflowService.getRequirements("labor-2024-031").completed()
            .contains("power-of-attorney"));

        mockMvc.perform(post("/api/v1/workflows/labor-2024-031/transition")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetStageId\":\"document-review\",\"notes\":\"filing accepted\"}"))
            .andExpect(status().isAccepted());
        eventually(() -> "document-review".equals(
            workflowService.getWorkflowState("labor-2024-031").currentStageId()));

        mockMvc.perform(get("/api/v1/workflows/labor-2024-031/stage"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stage.name").value("Document Review"));
        mockMvc.perform(get("/api/v1/history/labor-2024-031/timeline"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].stageId").value("case-filed"))
            .andExpect(jsonPath("$[1].stageId").value("document-review"));
        eventually(() -> Boolean.TRUE.equals(historyService.replay("labor-2024-031", null).matchesLiveState()));
        mockMvc.perform(get("/api/v1/history/labor-2024-031/replay"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matchesLiveState").value(true));
    }

    @Test
    void unknownTemplate_failsTheWorkflow() throws Exception {
        mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflowId\":\"wf-no-template\",\"entityId\":\"E-77\","
                    + "\"entityType\":\"EMPLOYEE\",\"templateId\":\"no-such-template\"}"))
            .andExpect(status().isCreated());

        eventually(() -> workflowService.getWorkflowState("wf-no-template").isTerminal());
        mockMvc.perform(get("/api/v1/workflows/wf-no-template"))
            .andExpect(jsonPath("$.status").value("FAILED"));
    }

    @Test
    void missingWorkflow_isNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/workflows/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").exists());
    }

    @Test
    void healthReportsScheduler() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.orchestrator.details.scheduler").value("running"));
    }

    private static void eventually(BooleanSupplier condition) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + WAIT);
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
    }
}
