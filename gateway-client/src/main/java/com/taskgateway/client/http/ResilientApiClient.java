package com.taskgateway.client.http;

import com.taskgateway.client.ExternalApiException;
import com.taskgateway.client.credential.CredentialCache;
import com.taskgateway.core.model.CredentialRecord;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Executes one logical call against a flaky external API.
 * 
 * - Transient failures (timeouts, connection errors, 408/429/5xx) are retried with
 *   exponential backoff and jitter, bounded by the call class's attempt and elapsed budgets.
 * - An authentication rejection invalidates the credential and re-authenticates at most
 *   once per call; the retry consumes an attempt from the same budget.
 * - Business rejections propagate immediately.
 */
public class ResilientApiClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientApiClient.class);

    private final Map<String, ApiEndpoint> endpoints;
    private final CredentialCache credentialCache;
    private final ApiTransport transport;
    private final Clock clock;
    private final Sleeper sleeper;

    public ResilientApiClient(
            Map<String, ApiEndpoint> endpoints,
            CredentialCache credentialCache,
            ApiTransport transport,
            Clock clock,
            Sleeper sleeper) {
        this.endpoints = Map.copyOf(endpoints);
        this.credentialCache = credentialCache;
        this.transport = transport;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Call an API on behalf of an account.
     * 
     * @return the successful (2xx) response
     * @throws ExternalApiException classified failure once retries are exhausted or not allowed
     */
    public ApiResponse call(String apiName, String accountId, ApiRequest request) throws ExternalApiException {
        ApiEndpoint endpoint = endpoints.get(apiName);
        if (endpoint == null) {
            throw new ExternalApiException(ErrorClass.VALIDATION, "Unknown API: " + apiName);
        }
        CallClass callClass = endpoint.callClass(request.callClass());
        RetryPolicy policy = callClass.retryPolicy();

        Instant start = clock.instant();
        boolean reauthenticated = false;
        int attempt = 0;

        while (true) {
            attempt++;
            String token = null;
            ExternalApiException failure;

            try {
                CredentialRecord credential = credentialCache.acquire(apiName, accountId);
                token = credential.token();
                ApiResponse response = transport.send(endpoint, request, token, callClass.timeout());
                ErrorClass errorClass = ResponseClassifier.classify(response.statusCode());
                if (errorClass == null) {
                    log.info("{} {} {} attempt={} elapsedMs={} outcome=SUCCESS status={}",
                        apiName, request.method(), request.path(), attempt,
                        elapsedSince(start).toMillis(), response.statusCode());
                    return response;
                }
                failure = new ExternalApiException(errorClass, response.statusCode(), String.format(
                    "%s %s returned HTTP %d: %s",
                    request.method(), request.path(), response.statusCode(), abbreviate(response.body())));
            } catch (ExternalApiException e) {
                failure = e;
            } catch (HttpTimeoutException e) {
                failure = new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT, String.format(
                    "%s %s timed out after %s", request.method(), request.path(), callClass.timeout()), e);
            } catch (IOException e) {
                failure = new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT, String.format(
                    "%s %s failed: %s", request.method(), request.path(), e.getMessage()), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT,
                    "Interrupted while calling " + apiName, e);
            }

            Duration elapsed = elapsedSince(start);
            log.warn("{} {} {} attempt={} elapsedMs={} outcome={} reason={}",
                apiName, request.method(), request.path(), attempt,
                elapsed.toMillis(), failure.getErrorClass(), failure.getMessage());

            // token == null means authentication itself failed; no second re-auth then
            boolean rejectedCredential = failure.getErrorClass() == ErrorClass.AUTHENTICATION_EXPIRED && token != null;
            if (rejectedCredential) {
                // a rejected token never stays cached, whatever the remaining budget
                credentialCache.invalidate(apiName, accountId, token);
                if (!reauthenticated && policy.hasMoreAttempts(attempt)) {
                    reauthenticated = true;
                    continue;
                }
                throw failure;
            }

            if (failure.getErrorClass() != ErrorClass.TRANSIENT_TRANSPORT) {
                throw failure;
            }
            if (!policy.hasMoreAttempts(attempt)) {
                throw exhausted(failure, attempt, elapsed);
            }
            Duration backoff = policy.computeBackoff(attempt);
            if (!policy.withinElapsedBudget(elapsed, backoff)) {
                throw exhausted(failure, attempt, elapsed);
            }
            pause(apiName, backoff);
        }
    }

    // ========== Helper Methods ==========

    private void pause(String apiName, Duration backoff) throws ExternalApiException {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT,
                "Interrupted while backing off from " + apiName, e);
        }
    }

    private ExternalApiException exhausted(ExternalApiException last, int attempts, Duration elapsed) {
        return new ExternalApiException(last.getErrorClass(), last.getStatusCode(), String.format(
            "Gave up after %d attempts in %d ms: %s", attempts, elapsed.toMillis(), last.getMessage()),
            last);
    }

    private Duration elapsedSince(Instant start) {
        return Duration.between(start, clock.instant());
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
