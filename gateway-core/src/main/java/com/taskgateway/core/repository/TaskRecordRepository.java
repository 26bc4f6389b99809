package com.taskgateway.core.repository;

import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for task records.
 * All state changes go through {@link #compareAndSet}.
 */
public interface TaskRecordRepository {

    /**
     * Insert a new task.
     * 
     * @param task The task to insert
     * @throws com.taskgateway.core.exception.StoreUnavailableException if the store cannot be reached
     * @throws DuplicateSubmissionException if the submission key already exists
     */
    void insert(TaskRecord task);

    /**
     * Replace {@code expected} with {@code next} only if the stored row still has the
     * expected status and version.
     * 
     * @return true if this caller won the swap
     */
    boolean compareAndSet(TaskRecord expected, TaskRecord next);

    Optional<TaskRecord> findById(String taskId);

    Optional<TaskRecord> findBySubmissionKey(String submissionKey);

    /**
     * Find tasks in the given status, oldest first.
     */
    List<TaskRecord> findByStatus(TaskStatus status, int limit);

    /**
     * Find PENDING or RETRYING tasks whose next attempt is due.
     */
    List<TaskRecord> findDispatchable(Instant now, int limit);

    /**
     * Find IN_PROGRESS tasks whose lease expired before {@code now}.
     */
    List<TaskRecord> findExpiredLeases(Instant now, int limit);

    Map<TaskStatus, Long> countByStatus();

    /**
     * Raised when a submission key is already taken.
     */
    class DuplicateSubmissionException extends RuntimeException {
        public DuplicateSubmissionException(String submissionKey) {
            super("Duplicate submission key: " + submissionKey);
        }
    }
}
