package com.taskgateway.client.credential;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.client.ExternalApiException;
import com.taskgateway.client.http.ApiAccount;
import com.taskgateway.client.http.ApiEndpoint;
import com.taskgateway.client.http.ApiRequest;
import com.taskgateway.client.http.ApiResponse;
import com.taskgateway.client.http.ApiTransport;
import com.taskgateway.core.model.CredentialRecord;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.testsupport.TimeController;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class HttpCredentialIssuerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TimeController time = TimeController.frozenAt(NOW);
    private final AtomicReference<ApiRequest> lastRequest = new AtomicReference<>();

    private final ApiEndpoint endpoint = new ApiEndpoint("cpj", "https://cpj.example.test", "/api/login",
        Duration.ofSeconds(30), Duration.ofMinutes(30),
        Map.of("tenant-a", new ApiAccount("tenant-a", "robot", "s3cret")), Map.of());

    private HttpCredentialIssuer issuerReturning(int status, String body) {
        ApiTransport transport = (ep, request, token, timeout) -> {
            lastRequest.set(request);
            assertThat(token).isNull();
            assertThat(timeout).isEqualTo(Duration.ofSeconds(30));
            return new ApiResponse(status, body, "application/json");
        };
        return new HttpCredentialIssuer(Map.of("cpj", endpoint), transport, objectMapper, time);
    }

    @Test
    void issue_shouldPostLoginAndReadExpiresIn() throws Exception {
        CredentialRecord credential = issuerReturning(200, "{\"token\":\"abc\",\"expires_in\":600}")
            .issue("cpj", "tenant-a");

        assertThat(credential.token()).isEqualTo("abc");
        assertThat(credential.issuedAt()).isEqualTo(NOW);
        assertThat(credential.expiresAt()).isEqualTo(NOW.plusSeconds(600));
        assertThat(objectMapper.readTree(lastRequest.get().body()).get("login").asText()).isEqualTo("robot");
        assertThat(lastRequest.get().path()).isEqualTo("/api/login");
    }

    @Test
    void issue_shouldReadExpiresAt() throws Exception {
        CredentialRecord credential = issuerReturning(200,
            "{\"access_token\":\"abc\",\"expires_at\":\"2024-01-15T12:00:00Z\"}").issue("cpj", "tenant-a");

        assertThat(credential.token()).isEqualTo("abc");
        assertThat(credential.expiresAt()).isEqualTo(Instant.parse("2024-01-15T12:00:00Z"));
    }

    @Test
    void issue_shouldFallBackToConfiguredLifetime() throws Exception {
        CredentialRecord credential = issuerReturning(200, "{\"token\":\"abc\"}").issue("cpj", "tenant-a");

        assertThat(credential.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
    }

    @Test
    void issue_shouldClassifyRejectedLogin() {
        assertThatThrownBy(() -> issuerReturning(401, "{}").issue("cpj", "tenant-a"))
            .isInstanceOf(ExternalApiException.class)
            .satisfies(e -> assertThat(((ExternalApiException) e).getErrorClass())
                .isEqualTo(ErrorClass.AUTHENTICATION_EXPIRED));
    }

    @Test
    void issue_shouldTreatConnectionFailureAsTransient() {
        HttpCredentialIssuer issuer = new HttpCredentialIssuer(Map.of("cpj", endpoint),
            (ep, request, token, timeout) -> {
                throw new ConnectException("refused");
            }, objectMapper, time);

        assertThatThrownBy(() -> issuer.issue("cpj", "tenant-a"))
            .isInstanceOf(ExternalApiException.class)
            .satisfies(e -> assertThat(((ExternalApiException) e).getErrorClass())
                .isEqualTo(ErrorClass.TRANSIENT_TRANSPORT));
    }

    @Test
    void issue_shouldRejectUnknownAccount() {
        assertThatThrownBy(() -> issuerReturning(200, "{}").issue("cpj", "tenant-z"))
            .isInstanceOf(ExternalApiException.class)
            .hasMessageContaining("tenant-z");
    }
}
