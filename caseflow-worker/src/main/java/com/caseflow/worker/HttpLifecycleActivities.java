package com.caseflow.worker;

import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.DeadlineNotice;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.ReminderWindow;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowTemplate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Activities implemented as calls to the case management back end.
 *
 * Status mapping:
 * - 2xx: success
 * - 404 on a template lookup, other 4xx: permanent failure
 * - 408, 429, 5xx and I/O errors: transient failure
 *
 * Every request carries the call's idempotency key in the {@code Idempotency-Key} header.
 */
public class HttpLifecycleActivities implements LifecycleActivities {

    private static final Logger log = LoggerFactory.getLogger(HttpLifecycleActivities.class);

    public static final String TEMPLATE_NOT_FOUND = "TEMPLATE_NOT_FOUND";
    public static final String CONNECTION_FAILED = "CONNECTION_FAILED";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpLifecycleActivities(String baseUrl, ObjectMapper objectMapper, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public WorkflowTemplate getWorkflowTemplate(ActivityContext context, String templateId) throws ActivityException {
        HttpResponse<String> response = send(context,
            request("/api/workflow-templates/" + encode(templateId)).GET(), Set.of(404));
        if (response.statusCode() == 404) {
            throw ActivityException.permanent(TEMPLATE_NOT_FOUND, "Workflow template not found: " + templateId);
        }
        try {
            return objectMapper.readValue(response.body(), WorkflowTemplate.class);
        } catch (JsonProcessingException e) {
            throw new ActivityException("INVALID_RESPONSE", "Cannot parse template " + templateId, e, false);
        }
    }

    @Override
    public void enterStage(ActivityContext context, String entityId, Stage stage) throws ActivityException {
        post(context, entityPath(context, entityId) + "/stages/enter", Map.of(
            "stageId", stage.stageId(),
            "stageName", stage.name()
        ));
    }

    @Override
    public void exitStage(ActivityContext context, String entityId, Stage stage, Duration timeInStage)
            throws ActivityException {
        post(context, entityPath(context, entityId) + "/stages/exit", Map.of(
            "stageId", stage.stageId(),
            "stageName", stage.name(),
            "durationHours", timeInStage.toHours()
        ));
    }

    @Override
    public RequirementCheck checkStageRequirements(ActivityContext context, String entityId, Stage stage,
                                                   Set<String> completed) throws ActivityException {
        HttpResponse<String> response = post(context, entityPath(context, entityId) + "/requirements/check", Map.of(
            "stageId", stage.stageId(),
            "requirements", stage.requirements(),
            "completed", completed
        ));
        try {
            JsonNode body = objectMapper.readTree(response.body());
            List<String> pending = new ArrayList<>();
            body.path("pending").forEach(node -> pending.add(node.asText()));
            return new RequirementCheck(body.path("satisfied").asBoolean(false), pending);
        } catch (JsonProcessingException e) {
            throw new ActivityException("INVALID_RESPONSE", "Cannot parse requirement check", e, false);
        }
    }

    @Override
    public void notifyStageTransition(ActivityContext context, String entityId, Stage stage,
                                      TransitionDirection direction) throws ActivityException {
        post(context, "/api/notifications/stage-transition", Map.of(
            "entityType", entityType(context),
            "entityId", entityId,
            "stageId", stage.stageId(),
            "stageName", stage.name(),
            "direction", direction.name()
        ));
    }

    @Override
    public void notifyAssignedTeam(ActivityContext context, String entityId, Stage stage) throws ActivityException {
        post(context, "/api/notifications/team", Map.of(
            "entityType", entityType(context),
            "entityId", entityId,
            "stageId", stage.stageId(),
            "stageName", stage.name()
        ));
    }

    @Override
    public void logCaseActivity(ActivityContext context, String entityId, String eventName,
                                Map<String, Object> details) throws ActivityException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", eventName);
        body.put("workflowId", context.getWorkflowId());
        body.put("details", details);
        post(context, entityPath(context, entityId) + "/activities", body);
    }

    @Override
    public void sendDeadlineReminder(ActivityContext context, String entityId, Deadline deadline,
                                     long daysUntil, DeadlineNotice notice) throws ActivityException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entityType", entityType(context));
        body.put("entityId", entityId);
        body.put("date", deadline.date().toString());
        body.put("description", deadline.description());
        body.put("daysUntil", daysUntil);
        body.put("notice", notice.name());
        post(context, "/api/notifications/deadline-reminder", body);
    }

    @Override
    public void createCourtDateReminder(ActivityContext context, String entityId, CourtDate courtDate,
                                        ReminderWindow window, long hoursUntil) throws ActivityException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entityType", entityType(context));
        body.put("entityId", entityId);
        body.put("date", courtDate.date().toString());
        body.put("description", courtDate.description());
        body.put("window", window.name());
        body.put("hoursUntil", hoursUntil);
        post(context, "/api/notifications/court-date-reminder", body);
    }

    @Override
    public void updateCaseStatus(ActivityContext context, String entityId, String status) throws ActivityException {
        String json = write(Map.of("status", status));
        send(context, request(entityPath(context, entityId) + "/status")
            .PUT(HttpRequest.BodyPublishers.ofString(json)), Set.of());
    }

    @Override
    public void escalateIssue(ActivityContext context, String entityId, Stage stage, String issue)
            throws ActivityException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entityType", entityType(context));
        body.put("entityId", entityId);
        body.put("workflowId", context.getWorkflowId());
        body.put("stageId", stage.stageId());
        body.put("issue", issue);
        if (stage.timeout() != null) {
            body.put("timeoutHours", stage.timeout().toHours());
        }
        post(context, "/api/escalations", body);
    }

    private HttpResponse<String> post(ActivityContext context, String path, Map<String, ?> body)
            throws ActivityException {
        return send(context, request(path).POST(HttpRequest.BodyPublishers.ofString(write(body))), Set.of());
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
    }

    private HttpResponse<String> send(ActivityContext context, HttpRequest.Builder builder, Set<Integer> accepted)
            throws ActivityException {
        HttpRequest request = builder
            .header("Idempotency-Key", context.getIdempotencyKey())
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ActivityException(CONNECTION_FAILED,
                request.method() + " " + request.uri() + " failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActivityInterruptedException(context.getActivityName(), e);
        }

        int status = response.statusCode();
        if (status / 100 == 2 || accepted.contains(status)) {
            return response;
        }
        log.warn("{} {} returned {}", request.method(), request.uri(), status);
        String errorCode = "HTTP_" + status;
        boolean retryable = status >= 500 || status == 408 || status == 429;
        throw new ActivityException(errorCode,
            request.method() + " " + request.uri().getPath() + " returned " + status, retryable);
    }

    private String entityPath(ActivityContext context, String entityId) {
        String collection = context.getEntityType() == EntityType.EMPLOYEE ? "employees" : "cases";
        return "/api/" + collection + "/" + encode(entityId);
    }

    private static String entityType(ActivityContext context) {
        return context.getEntityType() == null ? EntityType.CASE.name() : context.getEntityType().name();
    }

    private String write(Object body) throws ActivityException {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ActivityException("SERIALIZATION_FAILED", e.getMessage(), e, false);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
