package com.caseflow.api.rest;

import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.engine.template.TemplateService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for lifecycle templates and built-in presets.
 */
@RestController
@RequestMapping("/api/v1/templates")
public class TemplateController {

    private final TemplateService templateService;

    public TemplateController(TemplateService templateService) {
        this.templateService = templateService;
    }

    @PostMapping
    public ResponseEntity<WorkflowTemplate> register(@RequestBody WorkflowTemplate template) {
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.register(template));
    }

    @GetMapping
    public ResponseEntity<List<WorkflowTemplate>> list() {
        return ResponseEntity.ok(templateService.list());
    }

    @GetMapping("/{templateId}")
    public ResponseEntity<WorkflowTemplate> get(
            @PathVariable String templateId,
            @RequestParam(required = false) Integer version) {
        WorkflowTemplate template = version != null
            ? templateService.getVersion(templateId, version)
            : templateService.getLatest(templateId);
        return ResponseEntity.ok(template);
    }

    @GetMapping("/presets")
    public ResponseEntity<List<WorkflowTemplate>> presets() {
        return ResponseEntity.ok(templateService.presets());
    }

    @PostMapping("/presets/{presetId}/import")
    public ResponseEntity<WorkflowTemplate> importPreset(@PathVariable String presetId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.importPreset(presetId));
    }
}
