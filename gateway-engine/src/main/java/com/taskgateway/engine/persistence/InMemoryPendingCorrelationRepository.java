package com.taskgateway.engine.persistence;

import com.taskgateway.core.model.PendingCorrelation;
import com.taskgateway.core.repository.PendingCorrelationRepository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PendingCorrelationRepository.
 * For single-instance deployments and testing.
 */
public class InMemoryPendingCorrelationRepository implements PendingCorrelationRepository {
    
    private final Map<String, PendingCorrelation> correlations = new ConcurrentHashMap<>();
    
    @Override
    public void register(PendingCorrelation correlation) {
        correlations.put(correlation.correlationKey(), correlation);
    }
    
    @Override
    public Optional<PendingCorrelation> find(String correlationKey) {
        return Optional.ofNullable(correlations.get(correlationKey));
    }
    
    @Override
    public Optional<PendingCorrelation> consume(String correlationKey) {
        return Optional.ofNullable(correlations.remove(correlationKey));
    }
    
    @Override
    public boolean remove(String correlationKey) {
        return correlations.remove(correlationKey) != null;
    }
    
    @Override
    public int deleteExpired(Instant now) {
        int before = correlations.size();
        correlations.values().removeIf(c -> c.isExpired(now));
        return before - correlations.size();
    }
}
