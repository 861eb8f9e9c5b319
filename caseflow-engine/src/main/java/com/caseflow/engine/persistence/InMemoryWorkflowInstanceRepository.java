package com.caseflow.engine.persistence;

import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory snapshot store.
 */
@Repository
@ConditionalOnProperty(prefix = "caseflow.persistence", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryWorkflowInstanceRepository implements WorkflowInstanceRepository {

    private static final Comparator<WorkflowInstance> NEWEST_FIRST = Comparator.comparing(
        WorkflowInstance::startedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Map<UUID, WorkflowInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, UUID> byWorkflowId = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowInstance instance) {
        instances.merge(instance.instanceId(), instance,
            (stored, candidate) -> candidate.lastSequence() >= stored.lastSequence() ? candidate : stored);
        if (instance.workflowId() != null) {
            byWorkflowId.putIfAbsent(instance.workflowId(), instance.instanceId());
        }
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public Optional<WorkflowInstance> findByWorkflowId(String workflowId) {
        return Optional.ofNullable(byWorkflowId.get(workflowId)).map(instances::get);
    }

    @Override
    public List<WorkflowInstance> findByEntityId(String entityId) {
        return instances.values().stream()
            .filter(i -> entityId.equals(i.entityId()))
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findByStatus(WorkflowStatus status, int limit) {
        return instances.values().stream()
            .filter(i -> i.status() == status)
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findAll(int limit) {
        return instances.values().stream()
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findActive() {
        return instances.values().stream()
            .filter(i -> !i.isTerminal())
            .collect(Collectors.toList());
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        return instances.values().stream()
            .filter(i -> i.status() != null)
            .collect(Collectors.groupingBy(WorkflowInstance::status,
                () -> new EnumMap<>(WorkflowStatus.class), Collectors.counting()));
    }
}
