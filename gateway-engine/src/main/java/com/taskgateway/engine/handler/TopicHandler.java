package com.taskgateway.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Business logic bound to a task topic.
 * Handlers are invoked by the dispatcher and must classify every failure.
 */
@FunctionalInterface
public interface TopicHandler {

    /**
     * Execute the work for one task attempt.
     *
     * @param payload The task payload as submitted
     * @return The result document persisted on success
     * @throws TopicHandlerException classified failure
     */
    JsonNode handle(JsonNode payload) throws TopicHandlerException;

    /**
     * Payload fields that must be present and non-null before a task is accepted.
     */
    default List<String> requiredFields() {
        return List.of();
    }
}
