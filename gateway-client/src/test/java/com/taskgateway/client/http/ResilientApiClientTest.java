package com.taskgateway.client.http;

import com.taskgateway.client.ExternalApiException;
import com.taskgateway.client.credential.CredentialCache;
import com.taskgateway.client.credential.InMemorySharedTokenStore;
import com.taskgateway.core.model.CredentialRecord;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.core.model.RetryPolicy;
import com.taskgateway.testsupport.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResilientApiClientTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    private TimeController time;
    private ScriptedTransport transport;
    private AtomicInteger issued;
    private CredentialCache credentialCache;
    private List<Duration> sleeps;
    private ResilientApiClient client;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(START);
        transport = new ScriptedTransport();
        issued = new AtomicInteger();
        credentialCache = new CredentialCache(
            (api, account) -> new CredentialRecord(api, account, "token-" + issued.incrementAndGet(),
                time.instant(), time.instant().plus(Duration.ofMinutes(30))),
            new InMemorySharedTokenStore(time),
            Duration.ofSeconds(60),
            time);
        sleeps = new ArrayList<>();
        client = new ResilientApiClient(Map.of("dw-law", endpoint()), credentialCache, transport, time, sleeps::add);
    }

    private ApiEndpoint endpoint() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .jitterFactor(0.0)
            .maxElapsed(Duration.ofSeconds(120))
            .build();
        return new ApiEndpoint("dw-law", "https://api.example.test", "/login",
            Duration.ofSeconds(30), Duration.ofMinutes(120),
            Map.of("tenant-a", new ApiAccount("tenant-a", "user", "secret")),
            Map.of(
                CallClass.DEFAULT, new CallClass(CallClass.DEFAULT, Duration.ofSeconds(60), policy),
                "slow-query", new CallClass("slow-query", Duration.ofSeconds(120), policy),
                "single-shot", new CallClass("single-shot", Duration.ofSeconds(60), RetryPolicy.noRetry())));
    }

    private ApiRequest request() {
        return ApiRequest.json("POST", "/processos", "{\"numero\":\"1\"}", null);
    }

    @Test
    @DisplayName("Unauthorized once: invalidate, re-authenticate exactly once, retry and succeed")
    void unauthorizedOnce_shouldReauthenticateOnceAndSucceed() throws Exception {
        transport.respond(401, "{\"error\":\"expired\"}").respond(200, "{\"ok\":true}");

        ApiResponse response = client.call("dw-law", "tenant-a", request());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(issued.get()).isEqualTo(2);
        assertThat(transport.tokens).containsExactly("token-1", "token-2");
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("A second rejection after re-authentication surfaces as authentication error")
    void unauthorizedTwice_shouldNotLoop() {
        transport.respond(401, "").respond(403, "");

        assertThatThrownBy(() -> client.call("dw-law", "tenant-a", request()))
            .isInstanceOf(ExternalApiException.class)
            .satisfies(e -> assertThat(((ExternalApiException) e).getErrorClass())
                .isEqualTo(ErrorClass.AUTHENTICATION_EXPIRED));
        assertThat(issued.get()).isEqualTo(2);
        assertThat(transport.callCount()).isEqualTo(2);
    }

    @Test
    void unauthorizedWithoutAttemptsLeft_shouldStillDropRejectedToken() {
        transport.respond(401, "").respond(401, "").respond(200, "{}");
        ApiRequest singleShot = ApiRequest.json("POST", "/processos", "{}", "single-shot");

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> client.call("dw-law", "tenant-a", singleShot))
                .isInstanceOf(ExternalApiException.class)
                .satisfies(e -> assertThat(((ExternalApiException) e).getErrorClass())
                    .isEqualTo(ErrorClass.AUTHENTICATION_EXPIRED));
        }

        assertThat(transport.callCount()).isEqualTo(2);
        assertThat(transport.tokens).containsExactly("token-1", "token-2");
        assertThat(issued.get()).isEqualTo(2);
    }

    @Test
    void unauthorizedTwice_shouldLeaveNoRejectedTokenCached() throws Exception {
        transport.respond(401, "").respond(401, "").respond(200, "{}");

        assertThatThrownBy(() -> client.call("dw-law", "tenant-a", request()))
            .isInstanceOf(ExternalApiException.class);
        client.call("dw-law", "tenant-a", request());

        assertThat(transport.tokens).containsExactly("token-1", "token-2", "token-3");
    }

    @Test
    void transientFailures_shouldBeRetriedWithBackoff() throws Exception {
        transport.fail(new HttpTimeoutException("timeout"))
            .fail(new ConnectException("reset"))
            .respond(200, "{}");

        ApiResponse response = client.call("dw-law", "tenant-a", request());

        assertThat(response.isSuccessful()).isTrue();
        assertThat(transport.callCount()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(issued.get()).isEqualTo(1);
    }

    @Test
    void transientStatus_shouldBeExhaustedAfterBudget() {
        transport.respond(503, "").respond(502, "").respond(504, "");

        assertThatThrownBy(() -> client.call("dw-law", "tenant-a", request()))
            .isInstanceOf(ExternalApiException.class)
            .hasMessageContaining("Gave up after 3 attempts")
            .satisfies(e -> assertThat(((ExternalApiException) e).isRetryable()).isTrue());
        assertThat(transport.callCount()).isEqualTo(3);
    }

    @Test
    void businessRejection_shouldNotBeRetried() {
        transport.respond(422, "{\"message\":\"processo inexistente\"}");

        assertThatThrownBy(() -> client.call("dw-law", "tenant-a", request()))
            .isInstanceOf(ExternalApiException.class)
            .hasMessageContaining("processo inexistente")
            .satisfies(e -> {
                ExternalApiException apiException = (ExternalApiException) e;
                assertThat(apiException.getErrorClass()).isEqualTo(ErrorClass.BUSINESS_REJECTED);
                assertThat(apiException.getStatusCode()).isEqualTo(422);
            });
        assertThat(transport.callCount()).isEqualTo(1);
    }

    @Test
    void elapsedBudget_shouldStopRetriesBeforeAttemptBudget() {
        ResilientApiClient slowClient = new ResilientApiClient(Map.of("dw-law", endpoint()), credentialCache,
            (endpoint, request, token, timeout) -> {
                time.advance(Duration.ofSeconds(70));
                throw new HttpTimeoutException("slow upstream");
            }, time, sleeps::add);

        assertThatThrownBy(() -> slowClient.call("dw-law", "tenant-a", request()))
            .isInstanceOf(ExternalApiException.class)
            .hasMessageContaining("Gave up after 2 attempts");
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void callClass_shouldSelectTimeout() throws Exception {
        transport.respond(200, "{}").respond(200, "{}");

        client.call("dw-law", "tenant-a", ApiRequest.json("GET", "/consulta", null, "slow-query"));
        client.call("dw-law", "tenant-a", ApiRequest.json("GET", "/consulta", null, "unknown-class"));

        assertThat(transport.timeouts).containsExactly(Duration.ofSeconds(120), Duration.ofSeconds(60));
    }

    @Test
    void unknownApi_shouldFailValidation() {
        assertThatThrownBy(() -> client.call("nope", "tenant-a", request()))
            .isInstanceOf(ExternalApiException.class)
            .satisfies(e -> assertThat(((ExternalApiException) e).getErrorClass()).isEqualTo(ErrorClass.VALIDATION));
        assertThat(transport.callCount()).isZero();
    }
}
