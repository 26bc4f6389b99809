package com.taskgateway.worker.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the external-task adapter needs from the gateway: submit work, watch it, and
 * register the workflow instance waiting on a callback.
 * Implementations throw {@link GatewayClientException} when the gateway cannot be reached.
 */
public interface GatewayClient {

    /**
     * Submit a task. A repeated submission key returns the task created by the first submission.
     */
    GatewayTask submit(String topic, JsonNode payload, String submissionKey);

    GatewayTask getTask(String taskId);

    void registerCorrelation(String correlationKey, String workflowInstanceReference,
                             String businessKey, String messageName);
}
