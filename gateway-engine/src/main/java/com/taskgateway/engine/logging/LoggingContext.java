package com.taskgateway.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the identifiers needed to follow a task or callback.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, topic, attempt)) {
 *     log.info("Dispatching task"); // Automatically includes taskId, topic, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [dispatch-1] INFO  c.t.e.d.TaskDispatcher - Task succeeded
 *   taskId=3f2a... topic=dw-law-search attempt=2 traceId=9c1d22ab
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String TOPIC = "topic";
    public static final String ATTEMPT = "attempt";
    public static final String CORRELATION_KEY = "correlationKey";
    public static final String CALLBACK_ID = "callbackId";
    public static final String API_NAME = "apiName";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private final boolean ownsTraceId;

    private LoggingContext(boolean ownsTraceId) {
        this.ownsTraceId = ownsTraceId;
    }

    /**
     * Create a logging context for one task attempt.
     */
    public static LoggingContext forTask(String taskId, String topic, int attempt) {
        putIfPresent(TASK_ID, taskId);
        putIfPresent(TOPIC, topic);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return new LoggingContext(ensureTraceId());
    }

    /**
     * Create a logging context for callback handling.
     */
    public static LoggingContext forCallback(String callbackId, String correlationKey) {
        putIfPresent(CALLBACK_ID, callbackId);
        putIfPresent(CORRELATION_KEY, correlationKey);
        return new LoggingContext(ensureTraceId());
    }

    /**
     * Create a logging context for worker operations.
     */
    public static LoggingContext forWorker(String workerId) {
        putIfPresent(WORKER_ID, workerId);
        return new LoggingContext(ensureTraceId());
    }

    public static void setApiName(String apiName) {
        putIfPresent(API_NAME, apiName);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * @return true if a trace ID was started here
     */
    private static boolean ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            return true;
        }
        return false;
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(TOPIC);
        MDC.remove(ATTEMPT);
        MDC.remove(CORRELATION_KEY);
        MDC.remove(CALLBACK_ID);
        MDC.remove(API_NAME);
        MDC.remove(WORKER_ID);
        // An enclosing scope keeps its trace ID
        if (ownsTraceId) {
            MDC.remove(TRACE_ID);
        }
    }
}
