package com.taskgateway.client.credential;

import com.taskgateway.client.ExternalApiException;
import com.taskgateway.core.model.CredentialRecord;
import com.taskgateway.core.model.ErrorClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache of short-lived bearer credentials keyed by (api, account).
 * 
 * Lookup order:
 * 1. Process-local slot (no I/O)
 * 2. Shared store, visible to every gateway instance
 * 3. Authentication call, single-flight per key
 * 
 * A credential is never returned once {@code now >= expiresAt - safetyMargin}.
 * While the shared store is unreachable the cache is degraded: every acquire
 * re-authenticates, and callers never fail because of the shared store.
 */
public class CredentialCache {

    private static final Logger log = LoggerFactory.getLogger(CredentialCache.class);

    private final CredentialIssuer issuer;
    private final SharedTokenStore sharedStore;
    private final Duration safetyMargin;
    private final Clock clock;

    private final Map<String, CredentialRecord> localSlots = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<CredentialRecord>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final AtomicLong authentications = new AtomicLong();
    private final AtomicLong degradations = new AtomicLong();

    public CredentialCache(
            CredentialIssuer issuer,
            SharedTokenStore sharedStore,
            Duration safetyMargin,
            Clock clock) {
        this.issuer = issuer;
        this.sharedStore = sharedStore;
        this.safetyMargin = safetyMargin;
        this.clock = clock;
    }

    /**
     * Get a usable credential for the given API account.
     * 
     * @throws ExternalApiException if authentication is needed and fails
     */
    public CredentialRecord acquire(String apiName, String accountId) throws ExternalApiException {
        String key = CredentialRecord.cacheKey(apiName, accountId);

        if (!degraded.get()) {
            Optional<CredentialRecord> local = usableLocal(key);
            if (local.isPresent()) {
                return local.get();
            }
        }

        Optional<CredentialRecord> shared = usableShared(key);
        if (shared.isPresent()) {
            localSlots.put(key, shared.get());
            return shared.get();
        }

        return authenticateOnce(key, apiName, accountId);
    }

    /**
     * Drop the credential from both tiers.
     */
    public void invalidate(String apiName, String accountId) {
        String key = CredentialRecord.cacheKey(apiName, accountId);
        localSlots.remove(key);
        try {
            sharedStore.remove(key);
            markHealthy();
        } catch (SharedStoreUnavailableException e) {
            markDegraded(e);
        }
        log.info("Invalidated credential {}", key);
    }

    /**
     * Drop the credential only where it still holds {@code rejectedToken}, so a
     * credential already renewed by a concurrent caller survives.
     */
    public void invalidate(String apiName, String accountId, String rejectedToken) {
        String key = CredentialRecord.cacheKey(apiName, accountId);
        localSlots.computeIfPresent(key,
            (k, current) -> current.token().equals(rejectedToken) ? null : current);
        try {
            sharedStore.removeIfMatches(key, rejectedToken);
            markHealthy();
        } catch (SharedStoreUnavailableException e) {
            markDegraded(e);
        }
        log.info("Invalidated rejected credential {}", key);
    }

    /**
     * Drop every credential of an API, across all accounts.
     * 
     * @return number of shared entries removed
     */
    public int invalidateAll(String apiName) {
        String prefix = CredentialRecord.KEY_PREFIX + apiName + ":";
        localSlots.keySet().removeIf(key -> key.startsWith(prefix));
        try {
            int removed = sharedStore.removeByPrefix(prefix);
            markHealthy();
            log.info("Invalidated {} shared credentials for {}", removed, apiName);
            return removed;
        } catch (SharedStoreUnavailableException e) {
            markDegraded(e);
            return 0;
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * Total authentication calls issued by this instance.
     */
    public long getAuthenticationCount() {
        return authentications.get();
    }

    public long getDegradationCount() {
        return degradations.get();
    }

    // ========== Internal Methods ==========

    private CredentialRecord authenticateOnce(String key, String apiName, String accountId)
            throws ExternalApiException {
        CompletableFuture<CredentialRecord> flight = new CompletableFuture<>();
        CompletableFuture<CredentialRecord> leader = inFlight.putIfAbsent(key, flight);
        if (leader != null) {
            log.debug("Waiting for in-flight authentication of {}", key);
            return await(key, leader);
        }

        try {
            // Another caller may have finished a flight between our miss and putIfAbsent
            Optional<CredentialRecord> cached = degraded.get() ? Optional.empty() : usableLocal(key);
            if (cached.isEmpty()) {
                cached = usableShared(key);
            }
            CredentialRecord credential = cached.isPresent() ? cached.get() : authenticate(key, apiName, accountId);
            flight.complete(credential);
            return credential;
        } catch (ExternalApiException | RuntimeException e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, flight);
        }
    }

    private CredentialRecord authenticate(String key, String apiName, String accountId)
            throws ExternalApiException {
        authentications.incrementAndGet();
        CredentialRecord issued = issuer.issue(apiName, accountId);
        Instant now = clock.instant();

        if (!issued.isUsable(now, safetyMargin)) {
            throw new ExternalApiException(ErrorClass.AUTHENTICATION_EXPIRED, String.format(
                "Credential issued for %s expires at %s, within the safety margin of %s",
                key, issued.expiresAt(), safetyMargin));
        }

        if (!degraded.get()) {
            localSlots.put(key, issued);
        }
        try {
            sharedStore.put(key, issued, issued.remainingServeTime(now, safetyMargin));
            markHealthy();
        } catch (SharedStoreUnavailableException e) {
            markDegraded(e);
        }
        log.info("Authenticated {} (expires at {})", key, issued.expiresAt());
        return issued;
    }

    private CredentialRecord await(String key, CompletableFuture<CredentialRecord> leader)
            throws ExternalApiException {
        try {
            return leader.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT,
                "Interrupted while waiting for credential " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalApiException apiException) {
                throw apiException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ExternalApiException(ErrorClass.INTERNAL,
                "Authentication of " + key + " failed", cause);
        }
    }

    private Optional<CredentialRecord> usableLocal(String key) {
        CredentialRecord local = localSlots.get(key);
        if (local == null) {
            return Optional.empty();
        }
        if (local.isUsable(clock.instant(), safetyMargin)) {
            return Optional.of(local);
        }
        localSlots.remove(key, local);
        return Optional.empty();
    }

    private Optional<CredentialRecord> usableShared(String key) {
        try {
            Optional<CredentialRecord> shared = sharedStore.get(key);
            markHealthy();
            return shared.filter(c -> c.isUsable(clock.instant(), safetyMargin));
        } catch (SharedStoreUnavailableException e) {
            markDegraded(e);
            return Optional.empty();
        }
    }

    private void markDegraded(SharedStoreUnavailableException e) {
        if (degraded.compareAndSet(false, true)) {
            degradations.incrementAndGet();
            localSlots.clear();
            log.warn("Shared credential store unavailable, re-authenticating on every acquire: {}",
                e.getMessage());
        } else {
            log.debug("Shared credential store still unavailable: {}", e.getMessage());
        }
    }

    private void markHealthy() {
        if (degraded.compareAndSet(true, false)) {
            log.info("Shared credential store reachable again, caching resumed");
        }
    }
}
