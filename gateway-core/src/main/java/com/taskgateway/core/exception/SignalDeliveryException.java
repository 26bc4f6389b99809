package com.taskgateway.core.exception;

/**
 * Thrown when a resume signal could not be delivered to the workflow engine.
 */
public class SignalDeliveryException extends GatewayException {
    
    public static final String ERROR_CODE = "SIGNAL_DELIVERY_FAILED";
    
    public SignalDeliveryException(String message) {
        super(ERROR_CODE, message);
    }
    
    public SignalDeliveryException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
