package com.taskgateway.engine.metrics;

import com.taskgateway.client.credential.CredentialCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for the task gateway.
 *
 * Metrics exposed:
 * - Task submissions and outcomes per topic
 * - Dispatch latency
 * - Lease reclamations
 * - Callback receipts, duplicates and resume signals
 * - Credential authentications and degraded cache events
 */
public class GatewayMetrics {

    // Metric names
    public static final String TASKS_SUBMITTED = "gateway.tasks.submitted";
    public static final String TASKS_SUCCEEDED = "gateway.tasks.succeeded";
    public static final String TASKS_FAILED = "gateway.tasks.failed";
    public static final String TASKS_RETRIED = "gateway.tasks.retried";
    public static final String DISPATCH_DURATION = "gateway.dispatch.duration";
    public static final String LEASES_RECLAIMED = "gateway.leases.reclaimed";

    public static final String CALLBACKS_RECEIVED = "gateway.callbacks.received";
    public static final String CALLBACKS_DUPLICATE = "gateway.callbacks.duplicate";
    public static final String CALLBACKS_EXPIRED = "gateway.callbacks.expired";
    public static final String SIGNALS_SENT = "gateway.signals.sent";
    public static final String SIGNALS_FAILED = "gateway.signals.failed";

    public static final String CREDENTIAL_AUTHENTICATIONS = "gateway.credentials.authentications";
    public static final String CREDENTIAL_DEGRADED = "gateway.credentials.degraded";

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Task Metrics ==========

    public void taskSubmitted(String topic, boolean accepted) {
        Counter.builder(TASKS_SUBMITTED)
            .tag("topic", topic != null ? topic : "none")
            .tag("accepted", String.valueOf(accepted))
            .description("Total tasks submitted")
            .register(registry)
            .increment();
    }

    public void taskSucceeded(String topic, Duration duration) {
        Counter.builder(TASKS_SUCCEEDED)
            .tag("topic", topic)
            .description("Total tasks completed successfully")
            .register(registry)
            .increment();
        recordDispatch(topic, "success", duration);
    }

    public void taskFailed(String topic, String errorCode, Duration duration) {
        Counter.builder(TASKS_FAILED)
            .tag("topic", topic)
            .tag("error_code", errorCode)
            .description("Total tasks failed terminally")
            .register(registry)
            .increment();
        recordDispatch(topic, "failed", duration);
    }

    public void taskRetried(String topic, String errorCode, int attempt, Duration duration) {
        Counter.builder(TASKS_RETRIED)
            .tag("topic", topic)
            .tag("error_code", errorCode)
            .tag("attempt", String.valueOf(attempt))
            .description("Total task attempts scheduled for retry")
            .register(registry)
            .increment();
        recordDispatch(topic, "retry", duration);
    }

    public void leaseReclaimed(String topic, boolean exhausted) {
        Counter.builder(LEASES_RECLAIMED)
            .tag("topic", topic)
            .tag("exhausted", String.valueOf(exhausted))
            .description("Expired in-progress leases reclaimed")
            .register(registry)
            .increment();
    }

    // ========== Callback Metrics ==========

    public void callbackReceived(String source, boolean duplicate) {
        Counter.builder(CALLBACKS_RECEIVED)
            .tag("source", source)
            .description("Total callbacks received")
            .register(registry)
            .increment();
        if (duplicate) {
            Counter.builder(CALLBACKS_DUPLICATE)
                .tag("source", source)
                .description("Callbacks matching an already stored payload")
                .register(registry)
                .increment();
        }
    }

    public void callbackExpired(String source) {
        Counter.builder(CALLBACKS_EXPIRED)
            .tag("source", source)
            .description("Callbacks left unmatched past the retention window")
            .register(registry)
            .increment();
    }

    public void signalSent(String messageName) {
        Counter.builder(SIGNALS_SENT)
            .tag("message", messageName)
            .description("Resume signals delivered to the workflow engine")
            .register(registry)
            .increment();
    }

    public void signalFailed(String messageName) {
        Counter.builder(SIGNALS_FAILED)
            .tag("message", messageName)
            .description("Resume signals the workflow engine did not accept")
            .register(registry)
            .increment();
    }

    // ========== Credential Metrics ==========

    /**
     * Publish the credential cache counters as function counters.
     */
    public void bindCredentialCache(CredentialCache cache) {
        FunctionCounter.builder(CREDENTIAL_AUTHENTICATIONS, cache, CredentialCache::getAuthenticationCount)
            .description("Credential-issuing calls made")
            .register(registry);
        FunctionCounter.builder(CREDENTIAL_DEGRADED, cache, CredentialCache::getDegradationCount)
            .description("Times the shared credential store became unreachable")
            .register(registry);
        Gauge.builder("gateway.credentials.degraded.active", cache, c -> c.isDegraded() ? 1 : 0)
            .description("1 while the credential cache bypasses the shared store")
            .register(registry);
    }

    // ========== Helper Methods ==========

    private void recordDispatch(String topic, String outcome, Duration duration) {
        Timer.builder(DISPATCH_DURATION)
            .tag("topic", topic)
            .tag("outcome", outcome)
            .description("Time spent in one task attempt")
            .register(registry)
            .record(duration);
    }
}
