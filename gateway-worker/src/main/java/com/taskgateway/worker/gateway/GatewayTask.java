package com.taskgateway.worker.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.model.TaskStatus;

/**
 * The adapter's view of a gateway task.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayTask(
    String taskId,
    String topic,
    TaskStatus status,
    int attemptCount,
    JsonNode result,
    String errorCode,
    String errorMessage
) {
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
