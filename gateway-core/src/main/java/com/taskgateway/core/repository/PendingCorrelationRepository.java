package com.taskgateway.core.repository;

import com.taskgateway.core.model.PendingCorrelation;
import java.time.Instant;
import java.util.Optional;

/**
 * Store for workflow instances waiting on a callback, keyed by correlation key.
 */
public interface PendingCorrelationRepository {

    /**
     * Register or replace the pending correlation for its key.
     */
    void register(PendingCorrelation correlation);

    Optional<PendingCorrelation> find(String correlationKey);

    /**
     * Atomically remove and return the correlation. Exactly one concurrent caller wins.
     */
    Optional<PendingCorrelation> consume(String correlationKey);

    /**
     * @return true if a correlation was removed
     */
    boolean remove(String correlationKey);

    /**
     * @return number of correlations removed
     */
    int deleteExpired(Instant now);
}
