package com.caseflow.api.rest;

import com.caseflow.core.exception.DuplicateInstanceException;
import com.caseflow.core.exception.InvalidStateTransitionException;
import com.caseflow.core.exception.NotFoundException;
import com.caseflow.core.exception.OrchestratorException;
import com.caseflow.core.exception.WorkflowValidationException;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.query.RequirementsView;
import com.caseflow.engine.service.WorkflowService;
import com.caseflow.engine.service.WorkflowService.StartWorkflowRequest;
import com.caseflow.engine.service.WorkflowService.WorkflowQuery;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkflowControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private WorkflowService workflowService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        workflowService = mock(WorkflowService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new WorkflowController(workflowService))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
    }

    private static WorkflowInstance instance(String workflowId, WorkflowStatus status) {
        return WorkflowInstance.builder()
            .instanceId(UUID.nameUUIDFromBytes(workflowId.getBytes()))
            .workflowId(workflowId)
            .entityId("2024-117")
            .entityType(EntityType.CASE)
            .templateId("labor-case")
            .status(status)
            .currentStageId("case-filed")
            .startedAt(Instant.parse("2024-04-01T10:00:00Z"))
            .build();
    }

    @Test
    void start_returnsCreated() throws Exception {
        when(workflowService.startWorkflow(any())).thenReturn(instance("wf-1", WorkflowStatus.RUNNING));

        mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entityId\":\"2024-117\",\"entityType\":\"CASE\",\"templateId\":\"labor-case\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.workflowId").value("wf-1"))
            .andExpect(jsonPath("$.status").value("RUNNING"));

        verify(workflowService).startWorkflow(
            new StartWorkflowRequest(null, "2024-117", EntityType.CASE, "labor-case", null));
    }

    @Test
    void start_duplicateEntity_conflict() throws Exception {
        when(workflowService.startWorkflow(any())).thenThrow(new DuplicateInstanceException("2024-117", "wf-1"));

        mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entityId\":\"2024-117\",\"entityType\":\"CASE\",\"templateId\":\"labor-case\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").exists());
    }

    @Test
    void start_invalidRequest_badRequest() throws Exception {
        when(workflowService.startWorkflow(any()))
            .thenThrow(new WorkflowValidationException("entityId", "cannot be empty"));

        mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entityType\":\"CASE\",\"templateId\":\"labor-case\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void completeRequirement_isAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/wf-1/requirements/power-of-attorney/complete")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\":\"signed copy on file\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.accepted").value(true))
            .andExpect(jsonPath("$.signal").value("COMPLETE_REQUIREMENT"));

        verify(workflowService).completeRequirement("wf-1", "power-of-attorney", "signed copy on file");
    }

    @Test
    void completeRequirement_withoutBody_hasNoNotes() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/wf-1/requirements/claim-statement/complete"))
            .andExpect(status().isAccepted());

        verify(workflowService).completeRequirement(eq("wf-1"), eq("claim-statement"), isNull());
    }

    @Test
    void transition_isAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/wf-1/transition")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetStageId\":\"judgment\",\"notes\":\"settled\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.signal").value("TRANSITION_STAGE"));

        verify(workflowService).transitionStage("wf-1", "judgment", "settled");
    }

    @Test
    void courtDate_parsesIsoInstant() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/wf-1/court-dates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\":\"2024-05-10T09:30:00Z\",\"description\":\"First hearing\"}"))
            .andExpect(status().isAccepted());

        verify(workflowService).addCourtDate("wf-1", Instant.parse("2024-05-10T09:30:00Z"), "First hearing");
    }

    @Test
    void deadlineOutOfRange_badRequest() throws Exception {
        doThrow(new IllegalArgumentException("date must be between 0001-01-01T00:00:00Z and 9999-12-31T23:59:59Z"))
            .when(workflowService).addDeadline(eq("wf-1"), any(), any());

        mockMvc.perform(post("/api/v1/workflows/wf-1/deadlines")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\":\"9999-12-31T23:59:59Z\",\"description\":\"Appeal\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void manualOverride_isAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/wf-1/override")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"documents waived\",\"approvedBy\":\"head-of-legal\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.signal").value("MANUAL_OVERRIDE"));

        verify(workflowService).manualOverride("wf-1", "documents waived", "head-of-legal");
    }

    @Test
    void escalate_isAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/wf-1/escalate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"client unresponsive\",\"escalatedTo\":\"partner-on-call\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.signal").value("ESCALATE"));

        verify(workflowService).escalate("wf-1", "client unresponsive", "partner-on-call");
    }

    @Test
    void signalToFinishedWorkflow_conflict() throws Exception {
        doThrow(new InvalidStateTransitionException("wf-1", WorkflowStatus.COMPLETED, "PAUSE"))
            .when(workflowService).pauseWorkflow("wf-1");

        mockMvc.perform(post("/api/v1/workflows/wf-1/pause"))
            .andExpect(status().isConflict());
    }

    @Test
    void cancel_defaultsReason_andReturnsState() throws Exception {
        when(workflowService.getWorkflowState("wf-1")).thenReturn(instance("wf-1", WorkflowStatus.CANCELLED));

        mockMvc.perform(post("/api/v1/workflows/wf-1/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        verify(workflowService).cancelWorkflow("wf-1", "Manual cancellation");
    }

    @Test
    void unknownWorkflow_notFound() throws Exception {
        when(workflowService.getWorkflowState("missing")).thenThrow(new NotFoundException("Workflow", "missing"));

        mockMvc.perform(get("/api/v1/workflows/missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void requirements_areListed() throws Exception {
        when(workflowService.getRequirements("wf-1")).thenReturn(
            new RequirementsView("case-filed", List.of("power-of-attorney"), List.of("claim-statement")));

        mockMvc.perform(get("/api/v1/workflows/wf-1/requirements"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stageId").value("case-filed"))
            .andExpect(jsonPath("$.pending[0]").value("claim-statement"));
    }

    @Test
    void list_passesFilters() throws Exception {
        when(workflowService.listWorkflows(any())).thenReturn(List.of(instance("wf-1", WorkflowStatus.PAUSED)));

        mockMvc.perform(get("/api/v1/workflows").param("status", "PAUSED").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].workflowId").value("wf-1"));

        verify(workflowService).listWorkflows(new WorkflowQuery(WorkflowStatus.PAUSED, null, 5));
    }

    @Test
    void unexpectedOrchestratorError_isServerError() throws Exception {
        when(workflowService.statistics()).thenThrow(new OrchestratorException("STORE_DOWN", "store unavailable"));

        mockMvc.perform(get("/api/v1/workflows/statistics"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.errorCode").value("STORE_DOWN"));
    }
}
