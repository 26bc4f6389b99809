package com.taskgateway.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.model.TaskOutcome;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import java.util.List;
import java.util.Map;

/**
 * Service for task submission, dispatch and result reporting.
 */
public interface TaskService {

    /**
     * Accept a task for asynchronous processing. Never waits for the handler.
     * 
     * @param topic The topic selecting the handler
     * @param payload The task payload
     * @param submissionKey Optional idempotency key; resubmitting it returns the original task
     * @return The stored task: PENDING, or FAILED with VALIDATION_ERROR when the input is invalid
     * @throws com.taskgateway.core.exception.StoreUnavailableException if the task cannot be recorded
     */
    TaskRecord submit(String topic, JsonNode payload, String submissionKey);

    /**
     * Claim a dispatchable task and run one attempt.
     * 
     * @param taskId The task ID
     * @return true if this caller claimed the task, false if it was not dispatchable or another dispatcher won
     */
    boolean dispatch(String taskId);

    /**
     * Report the outcome of the attempt held by {@code holderId}.
     * 
     * @return The task after the transition
     * @throws com.taskgateway.core.exception.LeaseLostException if the caller no longer holds the task
     */
    TaskRecord markResult(String taskId, String holderId, TaskOutcome outcome);

    /**
     * Return an expired in-progress task to PENDING, or fail it when its attempts are used up.
     * 
     * @return true if this caller performed the transition
     */
    boolean reclaim(TaskRecord expired);

    /**
     * @throws com.taskgateway.core.exception.NotFoundException if no such task exists
     */
    TaskRecord getTask(String taskId);

    List<TaskRecord> findByStatus(TaskStatus status, int limit);

    Map<TaskStatus, Long> countByStatus();
}
