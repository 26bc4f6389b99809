package com.taskgateway.core.exception;

/**
 * Thrown when a dispatcher reports a result for a task it no longer holds.
 */
public class LeaseLostException extends GatewayException {
    
    public static final String ERROR_CODE = "LEASE_LOST";
    
    public LeaseLostException(String taskId, String holderId) {
        super(ERROR_CODE, String.format(
            "Dispatcher %s no longer holds task %s",
            holderId, taskId
        ));
    }
}
