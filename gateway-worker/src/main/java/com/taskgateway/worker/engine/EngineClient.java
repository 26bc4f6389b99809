package com.taskgateway.worker.engine;

import com.taskgateway.core.model.TypedVariable;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The workflow engine's external-task protocol.
 * Every method throws {@link EngineClientException} when the engine is unreachable or refuses the call.
 */
public interface EngineClient {

    List<ExternalTask> fetchAndLock(String workerId, int maxTasks, List<TopicLock> topics);

    void complete(String taskId, String workerId, Map<String, TypedVariable> variables);

    /**
     * Report a technical failure. The engine re-offers the task after {@code retryTimeout}
     * while {@code retries} is positive and raises an incident when it reaches zero.
     */
    void failure(String taskId, String workerId, String errorMessage, String errorDetails,
                 int retries, Duration retryTimeout);

    /**
     * Report a business error the process model can catch.
     */
    void bpmnError(String taskId, String workerId, String errorCode, String errorMessage);

    void extendLock(String taskId, String workerId, Duration newDuration);

    /**
     * Topic and lock duration of one fetch-and-lock subscription.
     */
    record TopicLock(String topicName, Duration lockDuration) {}
}
