package com.taskgateway.client;

import com.taskgateway.core.model.ErrorClass;

/**
 * Classified failure of a call against an external API or its authentication endpoint.
 */
public class ExternalApiException extends Exception {
    
    private final ErrorClass errorClass;
    private final int statusCode;
    
    public ExternalApiException(ErrorClass errorClass, String message) {
        this(errorClass, 0, message, null);
    }
    
    public ExternalApiException(ErrorClass errorClass, int statusCode, String message) {
        this(errorClass, statusCode, message, null);
    }
    
    public ExternalApiException(ErrorClass errorClass, String message, Throwable cause) {
        this(errorClass, 0, message, cause);
    }
    
    public ExternalApiException(ErrorClass errorClass, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
        this.statusCode = statusCode;
    }
    
    public ErrorClass getErrorClass() {
        return errorClass;
    }
    
    public String getErrorCode() {
        return errorClass.code();
    }
    
    /**
     * HTTP status of the rejecting response, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
    
    public boolean isRetryable() {
        return errorClass.isRetryable();
    }
}
