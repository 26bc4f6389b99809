package com.taskgateway.engine.correlation;

import com.taskgateway.core.model.TypedVariable;
import java.util.Map;

/**
 * Message that resumes a workflow instance waiting for a callback.
 */
public record ResumeSignal(
    String messageName,
    String businessKey,
    String processInstanceId,
    Map<String, TypedVariable> variables
) {
    public ResumeSignal {
        variables = variables != null ? Map.copyOf(variables) : Map.of();
    }
}
