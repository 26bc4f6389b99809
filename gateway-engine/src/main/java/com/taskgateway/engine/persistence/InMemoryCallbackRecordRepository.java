package com.taskgateway.engine.persistence;

import com.taskgateway.core.model.CallbackRecord;
import com.taskgateway.core.repository.CallbackRecordRepository;
import com.taskgateway.core.repository.PendingCorrelationRepository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of CallbackRecordRepository.
 * For single-instance deployments and testing.
 */
public class InMemoryCallbackRecordRepository implements CallbackRecordRepository {
    
    private final Map<String, CallbackRecord> callbacks = new ConcurrentHashMap<>();
    private final Map<String, String> byFingerprint = new ConcurrentHashMap<>();
    private final PendingCorrelationRepository pendingCorrelations;

    public InMemoryCallbackRecordRepository(PendingCorrelationRepository pendingCorrelations) {
        this.pendingCorrelations = pendingCorrelations;
    }
    
    @Override
    public InsertResult insertIfAbsent(CallbackRecord callback) {
        String fingerprint = callback.correlationKey() + "|" + callback.payloadHash();
        String existingId = byFingerprint.putIfAbsent(fingerprint, callback.callbackId());
        if (existingId != null) {
            return new InsertResult(callbacks.get(existingId), true);
        }
        callbacks.put(callback.callbackId(), callback);
        return new InsertResult(callback, false);
    }
    
    @Override
    public boolean update(CallbackRecord callback) {
        boolean[] updated = {false};
        callbacks.computeIfPresent(callback.callbackId(), (id, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            updated[0] = true;
            // Delivery count is owned by incrementDeliveryCount
            return new CallbackRecord(
                current.callbackId(), current.source(), current.correlationKey(),
                current.rawPayload(), current.payloadHash(), current.receivedAt(),
                callback.processed(), callback.signalSent(), callback.expired(),
                current.deliveryCount(), callback.processedAt(), callback.lastError()
            );
        });
        return updated[0];
    }
    
    @Override
    public void incrementDeliveryCount(String callbackId) {
        callbacks.computeIfPresent(callbackId, (id, current) -> current.withRedelivered());
    }
    
    @Override
    public Optional<CallbackRecord> findById(String callbackId) {
        return Optional.ofNullable(callbacks.get(callbackId));
    }
    
    @Override
    public List<CallbackRecord> findByCorrelationKey(String correlationKey) {
        return callbacks.values().stream()
            .filter(c -> c.correlationKey().equals(correlationKey))
            .sorted(Comparator.comparing(CallbackRecord::receivedAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<CallbackRecord> findCorrelatable(Instant now, int limit) {
        return callbacks.values().stream()
            .filter(CallbackRecord::isAwaitingSignal)
            .filter(c -> !c.processed() || hasLivePending(c.correlationKey(), now))
            .sorted(Comparator.comparing(CallbackRecord::receivedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<CallbackRecord> findAwaitingSignalReceivedBefore(Instant cutoff, int limit) {
        return callbacks.values().stream()
            .filter(CallbackRecord::isAwaitingSignal)
            .filter(c -> !c.receivedAt().isAfter(cutoff))
            .sorted(Comparator.comparing(CallbackRecord::receivedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public long countAwaitingSignal() {
        return callbacks.values().stream()
            .filter(CallbackRecord::isAwaitingSignal)
            .count();
    }
    
    private boolean hasLivePending(String correlationKey, Instant now) {
        return pendingCorrelations.find(correlationKey)
            .filter(pending -> !pending.isExpired(now))
            .isPresent();
    }
}
