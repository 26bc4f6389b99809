package com.taskgateway.client.credential;

import com.taskgateway.core.model.CredentialRecord;
import java.time.Duration;
import java.util.Optional;

/**
 * Credential tier shared by all gateway instances.
 * Every method may throw {@link SharedStoreUnavailableException}.
 */
public interface SharedTokenStore {

    Optional<CredentialRecord> get(String cacheKey);

    /**
     * Store a credential that disappears after {@code ttl}.
     */
    void put(String cacheKey, CredentialRecord credential, Duration ttl);

    void remove(String cacheKey);

    /**
     * Remove the entry only if it still holds {@code token}.
     */
    void removeIfMatches(String cacheKey, String token);

    /**
     * @return number of entries removed
     */
    int removeByPrefix(String keyPrefix);
}
