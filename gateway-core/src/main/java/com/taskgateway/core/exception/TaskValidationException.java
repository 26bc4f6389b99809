package com.taskgateway.core.exception;

import java.util.List;

/**
 * Thrown when a submission or callback is malformed or misses required fields.
 */
public class TaskValidationException extends GatewayException {
    
    public static final String ERROR_CODE = "VALIDATION_ERROR";
    
    private final List<String> violations;
    
    public TaskValidationException(String message) {
        this(message, List.of());
    }
    
    public TaskValidationException(String message, List<String> violations) {
        super(ERROR_CODE, message);
        this.violations = List.copyOf(violations);
    }
    
    public static TaskValidationException missingFields(String context, List<String> missing) {
        return new TaskValidationException(
            String.format("%s is missing required fields: %s", context, String.join(", ", missing)),
            missing
        );
    }
    
    public List<String> getViolations() {
        return violations;
    }
}
