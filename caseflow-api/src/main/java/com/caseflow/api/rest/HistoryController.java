package com.caseflow.api.rest;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.engine.history.WorkflowHistoryService;
import com.caseflow.engine.history.WorkflowHistoryService.ReplayResult;
import com.caseflow.engine.history.WorkflowHistoryService.StageVisit;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for workflow history and replay.
 */
@RestController
@RequestMapping("/api/v1/history/{workflowId}")
public class HistoryController {

    private final WorkflowHistoryService historyService;

    public HistoryController(WorkflowHistoryService historyService) {
        this.historyService = historyService;
    }

    /**
     * Get recorded events, optionally filtered by type.
     */
    @GetMapping("/events")
    public ResponseEntity<List<Event>> getEvents(
            @PathVariable String workflowId,
            @RequestParam(required = false) List<EventType> types) {
        List<Event> events = types == null || types.isEmpty()
            ? historyService.getEvents(workflowId)
            : historyService.getEvents(workflowId, types);
        return ResponseEntity.ok(events);
    }

    @GetMapping("/counts")
    public ResponseEntity<Map<EventType, Long>> countByType(@PathVariable String workflowId) {
        return ResponseEntity.ok(historyService.countByType(workflowId));
    }

    /**
     * Replay history up to a sequence number, or fully when none is given.
     */
    @GetMapping("/replay")
    public ResponseEntity<ReplayResult> replay(
            @PathVariable String workflowId,
            @RequestParam(required = false) Long toSequence) {
        return ResponseEntity.ok(historyService.replay(workflowId, toSequence));
    }

    @GetMapping("/timeline")
    public ResponseEntity<List<StageVisit>> timeline(@PathVariable String workflowId) {
        return ResponseEntity.ok(historyService.timeline(workflowId));
    }
}
