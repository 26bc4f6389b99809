package com.taskgateway.worker;

import java.util.List;

/**
 * An engine topic the adapter serves.
 *
 * @param topicName engine topic to fetch and lock
 * @param gatewayTopic gateway topic the work is submitted to; defaults to the engine topic
 * @param requiredVariables process variables that must be present and non-blank before submission
 * @param awaitCallback result field (name or JSON pointer) holding the correlation key to register
 *                      for the process instance after success; null when no callback is awaited
 * @param messageName message the resume signal is sent as; null for the callback source's default
 */
public record TopicSubscription(
    String topicName,
    String gatewayTopic,
    List<String> requiredVariables,
    String awaitCallback,
    String messageName
) {
    public TopicSubscription {
        if (topicName == null || topicName.isBlank()) {
            throw new IllegalArgumentException("topicName is required");
        }
        gatewayTopic = gatewayTopic == null || gatewayTopic.isBlank() ? topicName : gatewayTopic;
        requiredVariables = requiredVariables == null ? List.of() : List.copyOf(requiredVariables);
    }

    public static TopicSubscription of(String topicName, String... requiredVariables) {
        return new TopicSubscription(topicName, null, List.of(requiredVariables), null, null);
    }

    public TopicSubscription awaitingCallback(String resultField, String message) {
        return new TopicSubscription(topicName, gatewayTopic, requiredVariables, resultField, message);
    }

    public boolean awaitsCallback() {
        return awaitCallback != null && !awaitCallback.isBlank();
    }
}
