package com.caseflow.engine.persistence;

import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.repository.WorkflowTemplateRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * In-memory template registry keyed by template id and version.
 */
@Repository
@ConditionalOnProperty(prefix = "caseflow.persistence", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryWorkflowTemplateRepository implements WorkflowTemplateRepository {

    private final Map<String, NavigableMap<Integer, WorkflowTemplate>> templates = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowTemplate template) {
        templates.computeIfAbsent(template.templateId(), k -> new ConcurrentSkipListMap<>())
            .putIfAbsent(template.version(), template);
    }

    @Override
    public Optional<WorkflowTemplate> findLatest(String templateId) {
        NavigableMap<Integer, WorkflowTemplate> versions = templates.get(templateId);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.lastEntry().getValue());
    }

    @Override
    public Optional<WorkflowTemplate> findByIdAndVersion(String templateId, int version) {
        NavigableMap<Integer, WorkflowTemplate> versions = templates.get(templateId);
        return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(version));
    }

    @Override
    public List<WorkflowTemplate> findAllLatest() {
        return templates.values().stream()
            .filter(versions -> !versions.isEmpty())
            .map(versions -> versions.lastEntry().getValue())
            .sorted((a, b) -> a.templateId().compareTo(b.templateId()))
            .collect(Collectors.toList());
    }
}
