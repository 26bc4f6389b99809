package com.taskgateway.api.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.exception.NotFoundException;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.engine.service.CorrelationService;
import com.taskgateway.engine.service.TaskService;
import com.taskgateway.worker.gateway.GatewayClient;
import com.taskgateway.worker.gateway.GatewayClientException;
import com.taskgateway.worker.gateway.GatewayTask;

/**
 * Gateway client for the adapter running embedded in the API application.
 * Calls the services directly and reports failures the way the HTTP client does.
 */
public class LocalGatewayClient implements GatewayClient {

    private final TaskService taskService;
    private final CorrelationService correlationService;

    public LocalGatewayClient(TaskService taskService, CorrelationService correlationService) {
        this.taskService = taskService;
        this.correlationService = correlationService;
    }

    @Override
    public GatewayTask submit(String topic, JsonNode payload, String submissionKey) {
        try {
            return toGatewayTask(taskService.submit(topic, payload, submissionKey));
        } catch (StoreUnavailableException e) {
            throw new GatewayClientException("Task submission failed: " + e.getMessage(), e);
        }
    }

    @Override
    public GatewayTask getTask(String taskId) {
        try {
            return toGatewayTask(taskService.getTask(taskId));
        } catch (NotFoundException | StoreUnavailableException e) {
            throw new GatewayClientException("Task lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void registerCorrelation(String correlationKey, String workflowInstanceReference,
                                    String businessKey, String messageName) {
        try {
            correlationService.register(correlationKey, workflowInstanceReference, businessKey, messageName, null);
        } catch (StoreUnavailableException e) {
            throw new GatewayClientException("Correlation registration failed: " + e.getMessage(), e);
        }
    }

    private static GatewayTask toGatewayTask(TaskRecord task) {
        return new GatewayTask(
            task.taskId(),
            task.topic(),
            task.status(),
            task.attemptCount(),
            task.result(),
            task.errorCode(),
            task.errorMessage()
        );
    }
}
