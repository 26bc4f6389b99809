package com.taskgateway.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a task accepted by the gateway.
 */
public enum TaskStatus {
    /**
     * Accepted and waiting for a dispatcher.
     * Transitions: -> IN_PROGRESS
     */
    PENDING,

    /**
     * Held by exactly one dispatcher.
     * Transitions: -> SUCCEEDED, RETRYING, FAILED, PENDING (lease reclaimed)
     */
    IN_PROGRESS,

    /**
     * Last attempt failed with a retryable error; eligible again after its backoff.
     * Transitions: -> IN_PROGRESS
     */
    RETRYING,

    /**
     * Completed successfully. Terminal state.
     */
    SUCCEEDED,

    /**
     * Failed terminally, either immediately or after the retry budget. Terminal state.
     */
    FAILED;

    /**
     * Check if this status is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Check if a dispatcher may claim a task in this status.
     */
    public boolean isDispatchable() {
        return this == PENDING || this == RETRYING;
    }

    /**
     * Check if the transition to the given status is allowed.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case PENDING, RETRYING -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(SUCCEEDED, RETRYING, FAILED, PENDING);
            case SUCCEEDED, FAILED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
