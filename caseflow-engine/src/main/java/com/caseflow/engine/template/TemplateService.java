package com.caseflow.engine.template;

import com.caseflow.core.exception.NotFoundException;
import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.repository.WorkflowTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Registry of lifecycle templates. Every registration creates a new immutable version.
 */
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final WorkflowTemplateRepository repository;
    private final Clock clock;

    public TemplateService(WorkflowTemplateRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Validate a template and store it as the next version of its id.
     *
     * @return The stored template with its version assigned
     */
    public synchronized WorkflowTemplate register(WorkflowTemplate template) {
        template.validate();
        int nextVersion = repository.findLatest(template.templateId())
            .map(latest -> latest.version() + 1)
            .orElse(1);
        WorkflowTemplate versioned = template.withVersion(nextVersion, clock.instant());
        repository.save(versioned);
        log.info("Registered template {} v{} with {} stages",
            versioned.templateId(), versioned.version(), versioned.stages().size());
        return versioned;
    }

    public WorkflowTemplate getLatest(String templateId) {
        return repository.findLatest(templateId)
            .orElseThrow(() -> new NotFoundException("WorkflowTemplate", templateId));
    }

    public WorkflowTemplate getVersion(String templateId, int version) {
        return repository.findByIdAndVersion(templateId, version)
            .orElseThrow(() -> new NotFoundException("WorkflowTemplate", templateId + ":" + version));
    }

    public List<WorkflowTemplate> list() {
        return repository.findAllLatest();
    }

    public List<WorkflowTemplate> presets() {
        return TemplatePresets.all();
    }

    /**
     * Register a built-in preset under its own id.
     */
    public WorkflowTemplate importPreset(String presetId) {
        WorkflowTemplate preset = TemplatePresets.find(presetId)
            .orElseThrow(() -> new NotFoundException("Preset", presetId));
        return register(preset);
    }

    /**
     * Import every preset that is not registered yet.
     */
    public void seedPresets() {
        for (WorkflowTemplate preset : TemplatePresets.all()) {
            if (repository.findLatest(preset.templateId()).isEmpty()) {
                register(preset);
            }
        }
    }
}
