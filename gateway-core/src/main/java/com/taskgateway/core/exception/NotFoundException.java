package com.taskgateway.core.exception;

/**
 * Thrown when a task, callback or correlation is not found.
 */
public class NotFoundException extends GatewayException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
