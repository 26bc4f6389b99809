package com.taskgateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of one dispatch attempt: either a result document or a classified error.
 */
public record TaskOutcome(
    JsonNode result,
    ErrorClass errorClass,
    String errorMessage
) {
    public static TaskOutcome success(JsonNode result) {
        return new TaskOutcome(result, null, null);
    }

    public static TaskOutcome failure(ErrorClass errorClass, String errorMessage) {
        return new TaskOutcome(null, errorClass, errorMessage);
    }

    public boolean isSuccess() {
        return errorClass == null;
    }
}
