package com.taskgateway.engine.handler;

import com.taskgateway.client.ExternalApiException;
import com.taskgateway.core.model.ErrorClass;

/**
 * Exception thrown by topic handlers on failure.
 */
public class TopicHandlerException extends Exception {

    private final ErrorClass errorClass;

    public TopicHandlerException(ErrorClass errorClass, String message) {
        super(message);
        this.errorClass = errorClass;
    }

    public TopicHandlerException(ErrorClass errorClass, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }

    public boolean isRetryable() {
        return errorClass.isRetryable();
    }

    /**
     * Carry the classification of a failed external call.
     */
    public static TopicHandlerException from(ExternalApiException e) {
        return new TopicHandlerException(e.getErrorClass(), e.getMessage(), e);
    }

    public static TopicHandlerException validation(String message) {
        return new TopicHandlerException(ErrorClass.VALIDATION, message);
    }

    public static TopicHandlerException rejected(String message) {
        return new TopicHandlerException(ErrorClass.BUSINESS_REJECTED, message);
    }
}
