package com.taskgateway.client.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.client.ExternalApiException;
import com.taskgateway.client.http.ApiAccount;
import com.taskgateway.client.http.ApiEndpoint;
import com.taskgateway.client.http.ApiRequest;
import com.taskgateway.client.http.ApiResponse;
import com.taskgateway.client.http.ApiTransport;
import com.taskgateway.client.http.ResponseClassifier;
import com.taskgateway.core.model.CredentialRecord;
import com.taskgateway.core.model.ErrorClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Issues credentials by posting {@code {login, password}} to the API's auth path.
 * 
 * Accepted responses carry {@code token} (or {@code access_token}) and either
 * {@code expires_at} (ISO-8601) or {@code expires_in} (seconds). Without either,
 * the endpoint's configured token lifetime applies.
 */
public class HttpCredentialIssuer implements CredentialIssuer {

    private static final Logger log = LoggerFactory.getLogger(HttpCredentialIssuer.class);

    private final Map<String, ApiEndpoint> endpoints;
    private final ApiTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpCredentialIssuer(
            Map<String, ApiEndpoint> endpoints,
            ApiTransport transport,
            ObjectMapper objectMapper,
            Clock clock) {
        this.endpoints = endpoints;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public CredentialRecord issue(String apiName, String accountId) throws ExternalApiException {
        ApiEndpoint endpoint = endpoints.get(apiName);
        if (endpoint == null) {
            throw new ExternalApiException(ErrorClass.VALIDATION, "Unknown API: " + apiName);
        }
        ApiAccount account = endpoint.account(accountId)
            .orElseThrow(() -> new ExternalApiException(ErrorClass.VALIDATION,
                "Unknown account " + accountId + " for API " + apiName));

        ApiResponse response = send(endpoint, account);
        ErrorClass errorClass = ResponseClassifier.classify(response.statusCode());
        if (errorClass != null) {
            log.warn("Authentication against {} for {} rejected with HTTP {}",
                apiName, accountId, response.statusCode());
            throw new ExternalApiException(errorClass, response.statusCode(),
                "Authentication rejected by " + apiName + " with HTTP " + response.statusCode());
        }

        Instant now = clock.instant();
        JsonNode body = parse(apiName, response.body());
        String token = body.hasNonNull("token") ? body.get("token").asText() : body.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw new ExternalApiException(ErrorClass.AUTHENTICATION_EXPIRED,
                "Authentication response from " + apiName + " carries no token");
        }
        return new CredentialRecord(apiName, accountId, token, now, expiresAt(endpoint, body, now));
    }

    // ========== Helper Methods ==========

    private ApiResponse send(ApiEndpoint endpoint, ApiAccount account) throws ExternalApiException {
        try {
            String body = objectMapper.writeValueAsString(Map.of(
                "login", account.login(),
                "password", account.secret()
            ));
            ApiRequest request = ApiRequest.json("POST", endpoint.authPath(), body, null);
            return transport.send(endpoint, request, null, endpoint.authTimeout());
        } catch (IOException e) {
            throw new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT,
                "Authentication call to " + endpoint.apiName() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalApiException(ErrorClass.TRANSIENT_TRANSPORT,
                "Interrupted while authenticating against " + endpoint.apiName(), e);
        }
    }

    private JsonNode parse(String apiName, String body) throws ExternalApiException {
        try {
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ExternalApiException(ErrorClass.AUTHENTICATION_EXPIRED,
                "Unreadable authentication response from " + apiName, e);
        }
    }

    private Instant expiresAt(ApiEndpoint endpoint, JsonNode body, Instant now) {
        if (body.hasNonNull("expires_in") && body.get("expires_in").canConvertToLong()) {
            return now.plusSeconds(body.get("expires_in").asLong());
        }
        if (body.hasNonNull("expires_at")) {
            Instant parsed = parseInstant(body.get("expires_at").asText());
            if (parsed != null) {
                return parsed;
            }
            log.warn("Ignoring unparseable expires_at '{}' from {}", body.get("expires_at").asText(), endpoint.apiName());
        }
        return now.plus(endpoint.tokenLifetime());
    }

    private Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }
}
