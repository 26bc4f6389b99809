package com.taskgateway.client.credential;

import com.taskgateway.core.model.CredentialRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SharedTokenStore} for single-instance deployments and tests.
 */
public class InMemorySharedTokenStore implements SharedTokenStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySharedTokenStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CredentialRecord> get(String cacheKey) {
        Entry entry = entries.get(cacheKey);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.evictAt().isAfter(clock.instant())) {
            entries.remove(cacheKey, entry);
            return Optional.empty();
        }
        return Optional.of(entry.credential());
    }

    @Override
    public void put(String cacheKey, CredentialRecord credential, Duration ttl) {
        entries.put(cacheKey, new Entry(credential, clock.instant().plus(ttl)));
    }

    @Override
    public void remove(String cacheKey) {
        entries.remove(cacheKey);
    }

    @Override
    public void removeIfMatches(String cacheKey, String token) {
        entries.computeIfPresent(cacheKey,
            (key, entry) -> entry.credential().token().equals(token) ? null : entry);
    }

    @Override
    public int removeByPrefix(String keyPrefix) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(keyPrefix));
        return before - entries.size();
    }

    private record Entry(CredentialRecord credential, Instant evictAt) {}
}
