package com.taskgateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.exception.InvalidStateTransitionException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of work accepted by the gateway.
 * 
 * Primary Key: taskId
 * Unique Constraint: submissionKey (when present)
 * 
 * Invariants:
 * - leaseHolder set iff status == IN_PROGRESS
 * - result set iff status == SUCCEEDED
 * - errorCode set when status is RETRYING or FAILED
 * - attemptCount never decreases; version increases on every change
 * - SUCCEEDED and FAILED are never left
 */
public record TaskRecord(
    // Primary key
    String taskId,
    
    // Idempotency
    String submissionKey,
    
    // Routing
    String topic,
    JsonNode payload,
    
    // State
    TaskStatus status,
    int attemptCount,
    
    // Outcome
    JsonNode result,
    String errorCode,
    String errorMessage,
    
    // Lease
    String leaseHolder,
    Instant leaseExpiresAt,
    Instant nextAttemptAt,
    
    // Timing
    Instant createdAt,
    Instant updatedAt,
    
    // Optimistic concurrency
    long version
) {
    /**
     * Create a new task in PENDING state.
     */
    public static TaskRecord create(String topic, JsonNode payload, String submissionKey, Instant now) {
        return new TaskRecord(
            UUID.randomUUID().toString(),
            submissionKey,
            topic,
            payload,
            TaskStatus.PENDING,
            0,
            null,
            null,
            null,
            null,
            null,
            null,
            now,
            now,
            0L
        );
    }

    /**
     * Create a task that failed validation at submission. It never consumes an attempt.
     */
    public static TaskRecord rejected(
            String topic,
            JsonNode payload,
            String submissionKey,
            String errorMessage,
            Instant now) {
        return new TaskRecord(
            UUID.randomUUID().toString(),
            submissionKey,
            topic,
            payload,
            TaskStatus.FAILED,
            0,
            null,
            ErrorClass.VALIDATION.code(),
            errorMessage,
            null,
            null,
            null,
            now,
            now,
            0L
        );
    }

    /**
     * Check if a dispatcher may claim this task at the given instant.
     */
    public boolean isDispatchableAt(Instant now) {
        return status.isDispatchable() && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    /**
     * Check if the in-progress lease has expired.
     */
    public boolean isLeaseExpired(Instant now) {
        return status == TaskStatus.IN_PROGRESS && leaseExpiresAt != null && leaseExpiresAt.isBefore(now);
    }

    public boolean isHeldBy(String holderId) {
        return status == TaskStatus.IN_PROGRESS && holderId != null && holderId.equals(leaseHolder);
    }

    public Optional<ErrorClass> errorClass() {
        return errorCode == null ? Optional.empty() : ErrorClass.fromCode(errorCode);
    }

    /**
     * Create a copy claimed by a dispatcher for the next attempt.
     */
    public TaskRecord withClaimed(String holderId, Instant expiresAt, Instant now) {
        checkTransition(TaskStatus.IN_PROGRESS);
        return new TaskRecord(
            taskId, submissionKey, topic, payload,
            TaskStatus.IN_PROGRESS, attemptCount + 1,
            null, errorCode, errorMessage,
            holderId, expiresAt, null,
            createdAt, now, version + 1
        );
    }

    /**
     * Create a copy with the task completed successfully.
     */
    public TaskRecord withSucceeded(JsonNode taskResult, Instant now) {
        checkTransition(TaskStatus.SUCCEEDED);
        return new TaskRecord(
            taskId, submissionKey, topic, payload,
            TaskStatus.SUCCEEDED, attemptCount,
            taskResult, null, null,
            null, null, null,
            createdAt, now, version + 1
        );
    }

    /**
     * Create a copy scheduled for another attempt after a retryable error.
     */
    public TaskRecord withRetrying(String code, String message, Instant retryAt, Instant now) {
        checkTransition(TaskStatus.RETRYING);
        return new TaskRecord(
            taskId, submissionKey, topic, payload,
            TaskStatus.RETRYING, attemptCount,
            null, code, message,
            null, null, retryAt,
            createdAt, now, version + 1
        );
    }

    /**
     * Create a copy with the task failed terminally.
     */
    public TaskRecord withFailed(String code, String message, Instant now) {
        checkTransition(TaskStatus.FAILED);
        return new TaskRecord(
            taskId, submissionKey, topic, payload,
            TaskStatus.FAILED, attemptCount,
            null, code, message,
            null, null, null,
            createdAt, now, version + 1
        );
    }

    /**
     * Create a copy returned to PENDING after its lease expired.
     */
    public TaskRecord withReclaimed(Instant now) {
        checkTransition(TaskStatus.PENDING);
        return new TaskRecord(
            taskId, submissionKey, topic, payload,
            TaskStatus.PENDING, attemptCount,
            null, errorCode, errorMessage,
            null, null, null,
            createdAt, now, version + 1
        );
    }

    private void checkTransition(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(taskId, status, target);
        }
    }
}
