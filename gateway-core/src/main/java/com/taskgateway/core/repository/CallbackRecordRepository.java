package com.taskgateway.core.repository;

import com.taskgateway.core.model.CallbackRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for received callbacks. Records are never deleted.
 */
public interface CallbackRecordRepository {

    /**
     * Insert a callback unless one with the same correlation key and payload hash exists.
     * 
     * @return the stored record: the new one, or the existing duplicate
     */
    InsertResult insertIfAbsent(CallbackRecord callback);

    /**
     * Persist the processing flags of a callback. A record whose signal was already sent
     * or that has expired is never overwritten.
     * 
     * @return true if the row was updated
     */
    boolean update(CallbackRecord callback);

    /**
     * Count one more delivery of an already stored callback.
     */
    void incrementDeliveryCount(String callbackId);

    Optional<CallbackRecord> findById(String callbackId);

    List<CallbackRecord> findByCorrelationKey(String correlationKey);

    /**
     * Find callbacks awaiting a signal that were never processed or whose correlation key now has
     * a pending correlation not expired at {@code now}, oldest first. Unmatched callbacks without
     * a registration are left out so they cannot crowd out correlatable ones.
     */
    List<CallbackRecord> findCorrelatable(Instant now, int limit);

    /**
     * Find callbacks awaiting a signal that were received at or before the cutoff, oldest first.
     */
    List<CallbackRecord> findAwaitingSignalReceivedBefore(Instant cutoff, int limit);

    long countAwaitingSignal();

    /**
     * Outcome of {@link #insertIfAbsent}.
     */
    record InsertResult(CallbackRecord record, boolean duplicate) {}
}
