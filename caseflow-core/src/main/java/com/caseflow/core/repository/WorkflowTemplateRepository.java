package com.caseflow.core.repository;

import com.caseflow.core.model.WorkflowTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Repository for versioned workflow templates.
 */
public interface WorkflowTemplateRepository {

    /**
     * Save a template version. Existing versions are never overwritten.
     */
    void save(WorkflowTemplate template);

    Optional<WorkflowTemplate> findLatest(String templateId);

    Optional<WorkflowTemplate> findByIdAndVersion(String templateId, int version);

    /**
     * Latest version of every template.
     */
    List<WorkflowTemplate> findAllLatest();
}
