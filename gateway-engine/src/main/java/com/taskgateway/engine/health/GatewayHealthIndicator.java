package com.taskgateway.engine.health;

import com.taskgateway.client.credential.CredentialCache;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.engine.correlation.CallbackCorrelator;
import com.taskgateway.engine.lifecycle.GracefulShutdownHandler;
import com.taskgateway.engine.service.TaskService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicator for the gateway.
 * Reports health status based on:
 * - Task store reachability and task counts by status
 * - Credential cache degradation
 * - Callbacks waiting for a resume signal
 */
public class GatewayHealthIndicator implements HealthIndicator {

    static final long UNMATCHED_CALLBACK_WARNING = 100;

    private final TaskService taskService;
    private final CredentialCache credentialCache;
    private final CallbackCorrelator correlator;
    private final GracefulShutdownHandler shutdownHandler;

    public GatewayHealthIndicator(
            TaskService taskService,
            CredentialCache credentialCache,
            CallbackCorrelator correlator,
            GracefulShutdownHandler shutdownHandler) {
        this.taskService = taskService;
        this.credentialCache = credentialCache;
        this.correlator = correlator;
        this.shutdownHandler = shutdownHandler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        if (shutdownHandler.isShuttingDown()) {
            return Health.outOfService()
                .withDetail("shutdown", "in progress")
                .build();
        }

        try {
            Map<String, Long> tasks = new LinkedHashMap<>();
            for (Map.Entry<TaskStatus, Long> entry : taskService.countByStatus().entrySet()) {
                tasks.put(entry.getKey().name(), entry.getValue());
            }
            details.put("tasks", tasks);
        } catch (Exception e) {
            details.put("taskStore", "unavailable");
            return Health.down(e)
                .withDetails(details)
                .build();
        }

        details.put("credentialCache", credentialCache.isDegraded() ? "DEGRADED" : "OK");
        details.put("authentications", credentialCache.getAuthenticationCount());

        try {
            long unmatched = correlator.countAwaitingSignal();
            details.put("unmatchedCallbacks", unmatched);
            if (unmatched > UNMATCHED_CALLBACK_WARNING) {
                details.put("callbackWarning", "High number of unmatched callbacks - check pending correlations");
            }
        } catch (Exception e) {
            details.put("callbackStoreError", e.getMessage());
        }

        // A degraded credential cache still serves callers, so it does not take the gateway down
        return Health.up()
            .withDetails(details)
            .build();
    }
}
