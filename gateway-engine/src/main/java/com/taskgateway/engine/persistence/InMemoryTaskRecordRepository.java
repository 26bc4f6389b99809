package com.taskgateway.engine.persistence;

import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.core.repository.TaskRecordRepository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRecordRepository.
 * For single-instance deployments and testing.
 */
public class InMemoryTaskRecordRepository implements TaskRecordRepository {
    
    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Map<String, String> bySubmissionKey = new ConcurrentHashMap<>();
    
    @Override
    public void insert(TaskRecord task) {
        if (task.submissionKey() != null
                && bySubmissionKey.putIfAbsent(task.submissionKey(), task.taskId()) != null) {
            throw new DuplicateSubmissionException(task.submissionKey());
        }
        tasks.put(task.taskId(), task);
    }
    
    @Override
    public boolean compareAndSet(TaskRecord expected, TaskRecord next) {
        boolean[] swapped = {false};
        tasks.computeIfPresent(expected.taskId(), (id, current) -> {
            if (current.status() == expected.status() && current.version() == expected.version()) {
                swapped[0] = true;
                return next;
            }
            return current;
        });
        return swapped[0];
    }
    
    @Override
    public Optional<TaskRecord> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }
    
    @Override
    public Optional<TaskRecord> findBySubmissionKey(String submissionKey) {
        return Optional.ofNullable(bySubmissionKey.get(submissionKey)).map(tasks::get);
    }
    
    @Override
    public List<TaskRecord> findByStatus(TaskStatus status, int limit) {
        return tasks.values().stream()
            .filter(t -> t.status() == status)
            .sorted(Comparator.comparing(TaskRecord::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<TaskRecord> findDispatchable(Instant now, int limit) {
        return tasks.values().stream()
            .filter(t -> t.isDispatchableAt(now))
            .sorted(Comparator.comparing(TaskRecord::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<TaskRecord> findExpiredLeases(Instant now, int limit) {
        return tasks.values().stream()
            .filter(t -> t.isLeaseExpired(now))
            .sorted(Comparator.comparing(TaskRecord::leaseExpiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        tasks.values().forEach(t -> counts.merge(t.status(), 1L, Long::sum));
        return counts;
    }
}
