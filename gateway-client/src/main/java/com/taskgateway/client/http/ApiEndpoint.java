package com.taskgateway.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Connection settings for one external API.
 *
 * @param tokenLifetime lifetime assumed for issued tokens when the auth response carries no expiry
 */
public record ApiEndpoint(
    String apiName,
    String baseUrl,
    String authPath,
    Duration authTimeout,
    Duration tokenLifetime,
    Map<String, ApiAccount> accounts,
    Map<String, CallClass> callClasses
) {
    public ApiEndpoint {
        accounts = Map.copyOf(accounts);
        callClasses = Map.copyOf(callClasses);
    }

    public Optional<ApiAccount> account(String accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    /**
     * Resolve a call class by name, falling back to the endpoint's default class.
     */
    public CallClass callClass(String name) {
        CallClass named = name != null ? callClasses.get(name) : null;
        if (named != null) {
            return named;
        }
        return callClasses.getOrDefault(CallClass.DEFAULT, CallClass.defaults());
    }

    public String resolve(String path) {
        if (baseUrl.endsWith("/") && path.startsWith("/")) {
            return baseUrl + path.substring(1);
        }
        if (!baseUrl.endsWith("/") && !path.startsWith("/")) {
            return baseUrl + "/" + path;
        }
        return baseUrl + path;
    }
}
