package com.taskgateway.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.model.CallbackRecord;
import com.taskgateway.core.model.PendingCorrelation;
import java.time.Duration;

/**
 * Service for callback intake and correlation with waiting workflow instances.
 */
public interface CorrelationService {

    /**
     * Durably store a callback and acknowledge it. Correlation happens afterwards.
     * 
     * @param source Configured callback source name
     * @param rawPayload The payload as pushed by the external system
     * @return The receipt; {@code duplicate} is set when the same payload was already stored
     */
    Receipt receive(String source, JsonNode rawPayload);

    /**
     * Try to deliver the resume signal for a stored callback.
     * A callback whose signal was already sent is left untouched.
     * 
     * @return The callback after processing
     */
    CallbackRecord process(String callbackId);

    /**
     * Register a workflow instance waiting for a callback and correlate any callback already received.
     * 
     * @param ttl How long the registration stays valid, or null for the configured default
     */
    PendingCorrelation register(String correlationKey, String workflowInstanceReference,
                                String businessKey, String messageName, Duration ttl);

    /**
     * @return true if a pending correlation was removed
     */
    boolean cancel(String correlationKey);

    CallbackRecord getCallback(String callbackId);

    /**
     * Receipt returned to the callback sender.
     */
    record Receipt(String callbackId, boolean duplicate) {}
}
