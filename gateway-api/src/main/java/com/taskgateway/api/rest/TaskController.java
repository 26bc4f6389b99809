package com.taskgateway.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.exception.TaskValidationException;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.engine.logging.LoggingContext;
import com.taskgateway.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for task submission and inspection.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);
    private static final int MAX_LIST_LIMIT = 500;

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    /**
     * Accept a task. Returns as soon as the task is stored; dispatch happens in the background.
     * A payload failing topic validation is stored as FAILED and reported with that status.
     */
    @PostMapping
    public ResponseEntity<SubmitResponse> submitTask(@RequestBody SubmitRequest request) {
        try (LoggingContext ignored = LoggingContext.forWorker(request.workerId())) {
            TaskRecord task = taskService.submit(request.topic(), request.payload(), request.submissionKey());
            log.debug("Submission for topic {} answered with task {} ({})",
                request.topic(), task.taskId(), task.status());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubmitResponse(task.taskId(), task.status()));
        }
    }

    /**
     * Get a task by ID.
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.getTask(taskId)));
    }

    /**
     * List tasks in a status, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks(
            @RequestParam TaskStatus status,
            @RequestParam(defaultValue = "50") int limit) {

        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new TaskValidationException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        List<TaskResponse> responses = taskService.findByStatus(status, limit).stream()
            .map(TaskResponse::from)
            .toList();

        return ResponseEntity.ok(responses);
    }

    /**
     * Task counts by status.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<TaskStatus, Long>> countByStatus() {
        return ResponseEntity.ok(taskService.countByStatus());
    }

    // ========== DTOs ==========

    public record SubmitRequest(
        String topic,
        JsonNode payload,
        String submissionKey,
        String workerId
    ) {}

    public record SubmitResponse(String taskId, TaskStatus status) {}

    public record TaskResponse(
        String taskId,
        String topic,
        TaskStatus status,
        int attemptCount,
        JsonNode result,
        String errorCode,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskResponse from(TaskRecord task) {
            return new TaskResponse(
                task.taskId(),
                task.topic(),
                task.status(),
                task.attemptCount(),
                task.result(),
                task.errorCode(),
                task.errorMessage(),
                task.createdAt(),
                task.updatedAt()
            );
        }
    }
}
