package com.taskgateway.core.model;

import java.time.Instant;

/**
 * A workflow instance waiting for a callback carrying {@code correlationKey}.
 * Lives until consumed by a matching callback, cancelled, or expired.
 */
public record PendingCorrelation(
    String correlationKey,
    String workflowInstanceReference,
    String businessKey,
    String messageName,
    Instant registeredAt,
    Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
