package com.taskgateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * An asynchronous notification received from an external system.
 * Kept forever as an audit trail.
 * 
 * Unique Constraint: (correlationKey, payloadHash)
 * 
 * Invariants:
 * - signalSent implies processed
 * - signalSent and expired are mutually exclusive, and both are final
 */
public record CallbackRecord(
    String callbackId,
    String source,
    String correlationKey,
    JsonNode rawPayload,
    String payloadHash,
    Instant receivedAt,
    boolean processed,
    boolean signalSent,
    boolean expired,
    int deliveryCount,
    Instant processedAt,
    String lastError
) {
    public static CallbackRecord create(
            String source,
            String correlationKey,
            JsonNode rawPayload,
            String payloadHash,
            Instant now) {
        return new CallbackRecord(
            UUID.randomUUID().toString(),
            source,
            correlationKey,
            rawPayload,
            payloadHash,
            now,
            false,
            false,
            false,
            1,
            null,
            null
        );
    }

    /**
     * Still waiting for a resume signal to be delivered.
     */
    public boolean isAwaitingSignal() {
        return !signalSent && !expired;
    }

    public boolean isTerminal() {
        return signalSent || expired;
    }

    public CallbackRecord withUnmatched(Instant now, String error) {
        return new CallbackRecord(
            callbackId, source, correlationKey, rawPayload, payloadHash, receivedAt,
            true, false, false, deliveryCount, now, error
        );
    }

    public CallbackRecord withSignalSent(Instant now) {
        return new CallbackRecord(
            callbackId, source, correlationKey, rawPayload, payloadHash, receivedAt,
            true, true, false, deliveryCount, now, null
        );
    }

    public CallbackRecord withExpired(Instant now) {
        return new CallbackRecord(
            callbackId, source, correlationKey, rawPayload, payloadHash, receivedAt,
            true, false, true, deliveryCount, now, lastError
        );
    }

    public CallbackRecord withRedelivered() {
        return new CallbackRecord(
            callbackId, source, correlationKey, rawPayload, payloadHash, receivedAt,
            processed, signalSent, expired, deliveryCount + 1, processedAt, lastError
        );
    }
}
