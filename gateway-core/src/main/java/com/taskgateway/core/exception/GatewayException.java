package com.taskgateway.core.exception;

/**
 * Base exception for all gateway errors.
 */
public class GatewayException extends RuntimeException {
    
    private final String errorCode;
    
    public GatewayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public GatewayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
