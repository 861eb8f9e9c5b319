package com.caseflow.engine.persistence;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.core.repository.EventRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventRepository.
 * History is lost on restart; used for local runs and tests.
 */
@Repository
@ConditionalOnProperty(prefix = "caseflow.persistence", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEventRepository implements EventRepository {

    private final Map<String, Event> byIdempotencyKey = new ConcurrentHashMap<>();
    private final Map<UUID, NavigableMap<Long, Event>> byInstance = new ConcurrentHashMap<>();

    @Override
    public boolean append(Event event) {
        NavigableMap<Long, Event> history = byInstance
            .computeIfAbsent(event.workflowInstanceId(), k -> new ConcurrentSkipListMap<>());
        if (event.idempotencyKey() != null && byIdempotencyKey.putIfAbsent(event.idempotencyKey(), event) != null) {
            return false;
        }
        if (history.putIfAbsent(event.sequenceNumber(), event) != null) {
            if (event.idempotencyKey() != null) {
                byIdempotencyKey.remove(event.idempotencyKey(), event);
            }
            return false;
        }
        return true;
    }

    @Override
    public Optional<Event> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(byIdempotencyKey.get(idempotencyKey));
    }

    @Override
    public List<Event> findByWorkflowInstance(UUID workflowInstanceId) {
        return new ArrayList<>(history(workflowInstanceId).values());
    }

    @Override
    public List<Event> findByWorkflowInstanceAfter(UUID workflowInstanceId, long afterSequence) {
        return new ArrayList<>(history(workflowInstanceId).tailMap(afterSequence, false).values());
    }

    @Override
    public List<Event> findByWorkflowInstanceAndTypes(UUID workflowInstanceId, List<EventType> types) {
        Set<EventType> typeSet = new HashSet<>(types);
        return history(workflowInstanceId).values().stream()
            .filter(e -> typeSet.contains(e.type()))
            .collect(Collectors.toList());
    }

    @Override
    public long getLatestSequenceNumber(UUID workflowInstanceId) {
        NavigableMap<Long, Event> history = history(workflowInstanceId);
        return history.isEmpty() ? 0 : history.lastKey();
    }

    @Override
    public Map<EventType, Long> countByType(UUID workflowInstanceId) {
        return history(workflowInstanceId).values().stream()
            .collect(Collectors.groupingBy(Event::type, Collectors.counting()));
    }

    private NavigableMap<Long, Event> history(UUID workflowInstanceId) {
        return byInstance.getOrDefault(workflowInstanceId, new ConcurrentSkipListMap<>());
    }
}
