package com.taskgateway.core.exception;

import com.taskgateway.core.model.TaskStatus;

/**
 * Thrown when a task status change would violate the task lifecycle.
 */
public class InvalidStateTransitionException extends GatewayException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String taskId, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, currentStatus, targetStatus
        ));
    }
}
