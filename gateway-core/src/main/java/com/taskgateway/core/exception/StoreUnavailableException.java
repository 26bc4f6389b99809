package com.taskgateway.core.exception;

/**
 * Thrown when a durable store cannot be reached and degrading is not safe,
 * e.g. a submission that cannot be recorded.
 */
public class StoreUnavailableException extends GatewayException {
    
    public static final String ERROR_CODE = "INFRASTRUCTURE_DEGRADED";
    
    public StoreUnavailableException(String storeName, Throwable cause) {
        super(ERROR_CODE, storeName + " is unavailable: " + cause.getMessage(), cause);
    }
}
