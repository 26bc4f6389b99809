package com.taskgateway.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A bearer credential issued for an (api, account) pair.
 * Superseded on renewal, never mutated.
 */
public record CredentialRecord(
    String apiName,
    String accountId,
    String token,
    Instant issuedAt,
    Instant expiresAt
) {
    public static final String KEY_PREFIX = "token:";

    public static String cacheKey(String apiName, String accountId) {
        return KEY_PREFIX + apiName + ":" + accountId;
    }

    public String cacheKey() {
        return cacheKey(apiName, accountId);
    }

    /**
     * A credential is usable strictly before {@code expiresAt - safetyMargin}.
     */
    public boolean isUsable(Instant now, Duration safetyMargin) {
        return now.isBefore(expiresAt.minus(safetyMargin));
    }

    /**
     * Time the credential may still be served, or zero if already inside the margin.
     */
    public Duration remainingServeTime(Instant now, Duration safetyMargin) {
        Duration remaining = Duration.between(now, expiresAt.minus(safetyMargin));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
