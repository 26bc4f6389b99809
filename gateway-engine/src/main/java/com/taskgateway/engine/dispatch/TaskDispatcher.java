package com.taskgateway.engine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.exception.LeaseLostException;
import com.taskgateway.core.exception.NotFoundException;
import com.taskgateway.core.exception.TaskValidationException;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.core.model.RetryPolicy;
import com.taskgateway.core.model.TaskOutcome;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.core.repository.TaskRecordRepository;
import com.taskgateway.engine.handler.TopicHandler;
import com.taskgateway.engine.handler.TopicHandlerException;
import com.taskgateway.engine.handler.TopicHandlerRegistry;
import com.taskgateway.engine.logging.LoggingContext;
import com.taskgateway.engine.metrics.GatewayMetrics;
import com.taskgateway.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Drives tasks through PENDING, IN_PROGRESS, RETRYING, SUCCEEDED and FAILED.
 * 
 * Every transition is a compare-and-set on (status, version), so two dispatchers
 * racing for the same task cannot both claim it, and a result from an attempt whose
 * lease was reclaimed is discarded.
 */
public class TaskDispatcher implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    public static final String LEASE_EXPIRED = "LEASE_EXPIRED";
    private static final int MAX_CAS_ATTEMPTS = 5;

    private final TaskRecordRepository taskRepository;
    private final TopicHandlerRegistry handlers;
    private final RetryPolicy retryPolicy;
    private final Duration maxProcessingTime;
    private final String dispatcherId;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private final List<Consumer<TaskRecord>> submissionListeners = new CopyOnWriteArrayList<>();

    public TaskDispatcher(
            TaskRecordRepository taskRepository,
            TopicHandlerRegistry handlers,
            RetryPolicy retryPolicy,
            Duration maxProcessingTime,
            String dispatcherId,
            Clock clock,
            GatewayMetrics metrics) {
        this.taskRepository = taskRepository;
        this.handlers = handlers;
        this.retryPolicy = retryPolicy;
        this.maxProcessingTime = maxProcessingTime;
        this.dispatcherId = dispatcherId;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Be told about every accepted PENDING task right after it is stored.
     */
    public void addSubmissionListener(Consumer<TaskRecord> listener) {
        submissionListeners.add(listener);
    }

    @Override
    public TaskRecord submit(String topic, JsonNode payload, String submissionKey) {
        if (topic == null || topic.isBlank()) {
            throw new TaskValidationException("topic is required");
        }
        if (submissionKey != null) {
            Optional<TaskRecord> existing = taskRepository.findBySubmissionKey(submissionKey);
            if (existing.isPresent()) {
                log.info("Submission key {} already maps to task {}", submissionKey, existing.get().taskId());
                return existing.get();
            }
        }

        Instant now = clock.instant();
        List<String> violations = handlers.validate(topic, payload);
        TaskRecord task = violations.isEmpty()
            ? TaskRecord.create(topic, payload, submissionKey, now)
            : TaskRecord.rejected(topic, payload, submissionKey, String.join("; ", violations), now);

        try {
            taskRepository.insert(task);
        } catch (TaskRecordRepository.DuplicateSubmissionException e) {
            return taskRepository.findBySubmissionKey(submissionKey)
                .orElseThrow(() -> e);
        }
        metrics.taskSubmitted(topic, violations.isEmpty());

        try (LoggingContext ctx = LoggingContext.forTask(task.taskId(), topic, 0)) {
            if (!violations.isEmpty()) {
                log.warn("Rejected task at submission: {}", task.errorMessage());
                return task;
            }
            log.info("Accepted task");
        }
        notifySubmitted(task);
        return task;
    }

    @Override
    public boolean dispatch(String taskId) {
        TaskRecord task = taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));

        Instant now = clock.instant();
        if (!task.isDispatchableAt(now)) {
            log.debug("Task {} not dispatchable: status={}, nextAttemptAt={}",
                taskId, task.status(), task.nextAttemptAt());
            return false;
        }

        TaskRecord claimed = task.withClaimed(dispatcherId, now.plus(maxProcessingTime), now);
        if (!taskRepository.compareAndSet(task, claimed)) {
            log.debug("Task {} claimed by another dispatcher", taskId);
            return false;
        }

        try (LoggingContext ctx = LoggingContext.forTask(taskId, claimed.topic(), claimed.attemptCount())) {
            log.info("Dispatching task, attempt {}", claimed.attemptCount());
            TaskOutcome outcome = execute(claimed);
            try {
                complete(claimed, outcome);
            } catch (LeaseLostException e) {
                log.warn("Discarding result of attempt {}: {}", claimed.attemptCount(), e.getMessage());
            }
        }
        return true;
    }

    @Override
    public TaskRecord markResult(String taskId, String holderId, TaskOutcome outcome) {
        for (int i = 0; i < MAX_CAS_ATTEMPTS; i++) {
            TaskRecord current = taskRepository.findById(taskId)
                .orElseThrow(() -> new NotFoundException("Task", taskId));
            if (!current.isHeldBy(holderId)) {
                throw new LeaseLostException(taskId, holderId);
            }
            TaskRecord next = decide(current, outcome);
            if (taskRepository.compareAndSet(current, next)) {
                recordOutcome(current, next);
                return next;
            }
        }
        throw new LeaseLostException(taskId, holderId);
    }

    @Override
    public boolean reclaim(TaskRecord expired) {
        Instant now = clock.instant();
        if (!expired.isLeaseExpired(now)) {
            return false;
        }

        boolean exhausted = !retryPolicy.hasMoreAttempts(expired.attemptCount());
        TaskRecord next = exhausted
            ? expired.withFailed(LEASE_EXPIRED, String.format(
                "Lease held by %s expired at %s after attempt %d of %d",
                expired.leaseHolder(), expired.leaseExpiresAt(),
                expired.attemptCount(), retryPolicy.maxAttempts()), now)
            : expired.withReclaimed(now);

        if (!taskRepository.compareAndSet(expired, next)) {
            return false;
        }

        metrics.leaseReclaimed(expired.topic(), exhausted);
        try (LoggingContext ctx = LoggingContext.forTask(expired.taskId(), expired.topic(), expired.attemptCount())) {
            if (exhausted) {
                log.error("Lease of {} expired with no attempts left, task failed", expired.leaseHolder());
            } else {
                log.warn("Lease of {} expired, task returned to PENDING", expired.leaseHolder());
            }
        }
        if (!exhausted) {
            notifySubmitted(next);
        }
        return true;
    }

    @Override
    public TaskRecord getTask(String taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    @Override
    public List<TaskRecord> findByStatus(TaskStatus status, int limit) {
        return taskRepository.findByStatus(status, limit);
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        return taskRepository.countByStatus();
    }

    // ========== Helper Methods ==========

    private TaskOutcome execute(TaskRecord task) {
        Optional<TopicHandler> handler = handlers.find(task.topic());
        if (handler.isEmpty()) {
            return TaskOutcome.failure(ErrorClass.VALIDATION, "No handler for topic " + task.topic());
        }
        try {
            return TaskOutcome.success(handler.get().handle(task.payload()));
        } catch (TopicHandlerException e) {
            return TaskOutcome.failure(e.getErrorClass(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler for topic {} threw unexpectedly", task.topic(), e);
            return TaskOutcome.failure(ErrorClass.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Apply the outcome to the exact claimed version. Any change since the claim means the lease was lost.
     */
    private void complete(TaskRecord claimed, TaskOutcome outcome) {
        TaskRecord next = decide(claimed, outcome);
        if (!taskRepository.compareAndSet(claimed, next)) {
            throw new LeaseLostException(claimed.taskId(), dispatcherId);
        }
        recordOutcome(claimed, next);
    }

    private TaskRecord decide(TaskRecord current, TaskOutcome outcome) {
        Instant now = clock.instant();
        if (outcome.isSuccess()) {
            return current.withSucceeded(outcome.result(), now);
        }

        ErrorClass errorClass = outcome.errorClass();
        if (retryPolicy.shouldRetry(errorClass, current.attemptCount())) {
            Duration backoff = retryPolicy.computeBackoff(current.attemptCount());
            return current.withRetrying(errorClass.code(), outcome.errorMessage(), now.plus(backoff), now);
        }

        String message = errorClass.isRetryable()
            ? String.format("%s (retry budget exhausted after %d attempts)",
                outcome.errorMessage(), current.attemptCount())
            : outcome.errorMessage();
        return current.withFailed(errorClass.code(), message, now);
    }

    private void recordOutcome(TaskRecord before, TaskRecord after) {
        Duration elapsed = Duration.between(before.updatedAt(), after.updatedAt());
        switch (after.status()) {
            case SUCCEEDED -> {
                metrics.taskSucceeded(after.topic(), elapsed);
                log.info("Task succeeded after {} attempt(s)", after.attemptCount());
            }
            case RETRYING -> {
                metrics.taskRetried(after.topic(), after.errorCode(), after.attemptCount(), elapsed);
                log.warn("Attempt {} failed with {}: {}. Next attempt at {}",
                    after.attemptCount(), after.errorCode(), after.errorMessage(), after.nextAttemptAt());
            }
            case FAILED -> {
                metrics.taskFailed(after.topic(), after.errorCode(), elapsed);
                if (after.errorClass().map(ErrorClass::isRetryable).orElse(true)) {
                    log.error("Task failed with {}: {}", after.errorCode(), after.errorMessage());
                } else {
                    log.warn("Task failed with {}: {}", after.errorCode(), after.errorMessage());
                }
            }
            default -> log.debug("Task moved to {}", after.status());
        }
    }

    private void notifySubmitted(TaskRecord task) {
        for (Consumer<TaskRecord> listener : submissionListeners) {
            try {
                listener.accept(task);
            } catch (RuntimeException e) {
                log.warn("Submission listener failed for task {}; the poll loop will pick it up", task.taskId(), e);
            }
        }
    }
}
