package com.taskgateway.engine.health;

import com.taskgateway.client.credential.CredentialCache;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.engine.correlation.CallbackCorrelator;
import com.taskgateway.engine.lifecycle.GracefulShutdownHandler;
import com.taskgateway.engine.service.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class GatewayHealthIndicatorTest {

    private TaskService taskService;
    private CredentialCache credentialCache;
    private CallbackCorrelator correlator;
    private GracefulShutdownHandler shutdownHandler;
    private GatewayHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        taskService = mock(TaskService.class);
        credentialCache = mock(CredentialCache.class);
        correlator = mock(CallbackCorrelator.class);
        shutdownHandler = new GracefulShutdownHandler("node-1");
        indicator = new GatewayHealthIndicator(taskService, credentialCache, correlator, shutdownHandler);
        when(taskService.countByStatus()).thenReturn(Map.of(TaskStatus.PENDING, 3L));
    }

    @Test
    void health_shouldBeUpWithDetails() {
        when(credentialCache.getAuthenticationCount()).thenReturn(7L);
        when(correlator.countAwaitingSignal()).thenReturn(2L);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("credentialCache", "OK")
            .containsEntry("authentications", 7L)
            .containsEntry("unmatchedCallbacks", 2L)
            .doesNotContainKey("callbackWarning");
    }

    @Test
    void health_withDegradedCacheAndBacklog_shouldStayUpWithWarnings() {
        when(credentialCache.isDegraded()).thenReturn(true);
        when(correlator.countAwaitingSignal()).thenReturn(GatewayHealthIndicator.UNMATCHED_CALLBACK_WARNING + 1);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("credentialCache", "DEGRADED")
            .containsKey("callbackWarning");
    }

    @Test
    void health_withUnreachableStore_shouldBeDown() {
        when(taskService.countByStatus()).thenThrow(new StoreUnavailableException("task_records", new RuntimeException("refused")));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void health_duringShutdown_shouldBeOutOfService() {
        shutdownHandler.shutdown();

        assertThat(indicator.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    }
}
