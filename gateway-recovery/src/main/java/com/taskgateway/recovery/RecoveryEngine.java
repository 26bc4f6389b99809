package com.taskgateway.recovery;

import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.repository.TaskRecordRepository;
import com.taskgateway.engine.correlation.CallbackCorrelator;
import com.taskgateway.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for detecting and recovering from failures.
 * 
 * Responsibilities:
 * - Reclaim tasks whose dispatcher lease lapsed (crashed or partitioned instance)
 * - Re-attempt correlation of callbacks still waiting for a resume signal
 * - Expire callbacks past retention and pending correlations past their TTL
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final TaskRecordRepository taskRepository;
    private final TaskService taskService;
    private final CallbackCorrelator correlator;
    private final Clock clock;
    private final Settings settings;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            TaskRecordRepository taskRepository,
            TaskService taskService,
            CallbackCorrelator correlator,
            Clock clock,
            Settings settings) {
        this.taskRepository = taskRepository;
        this.taskService = taskService;
        this.correlator = correlator;
        this.clock = clock;
        this.settings = settings;
        this.scheduler = Executors.newScheduledThreadPool(3, runnable -> {
            Thread thread = new Thread(runnable, "gateway-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the recovery engine.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine (lease check every {}, reconcile every {})",
            settings.leaseCheckInterval(), settings.reconcileInterval());

        schedule(this::runLeaseSweep, settings.leaseCheckInterval());
        schedule(this::runReconcileSweep, settings.reconcileInterval());
        schedule(this::runExpirySweep, settings.expiryInterval());

        log.info("Recovery engine started");
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Hand tasks whose lease lapsed back to the dispatcher, or fail them when no attempt is left.
     *
     * @return number of tasks reclaimed by this instance
     */
    public int recoverExpiredLeases() {
        List<TaskRecord> expired = taskRepository.findExpiredLeases(clock.instant(), settings.batchSize());
        if (expired.isEmpty()) {
            return 0;
        }

        log.info("Found {} tasks with expired leases", expired.size());
        int reclaimed = 0;
        for (TaskRecord task : expired) {
            try {
                log.info("Reclaiming task {} (held by {}, lease expired {})",
                    task.taskId(), task.leaseHolder(), task.leaseExpiresAt());
                if (taskService.reclaim(task)) {
                    reclaimed++;
                }
            } catch (Exception e) {
                log.error("Failed to reclaim task: {}", task.taskId(), e);
            }
        }
        return reclaimed;
    }

    /**
     * Re-attempt correlation for unmatched callbacks and expire those past retention.
     */
    public CallbackCorrelator.ReconcileResult reconcileCallbacks() {
        CallbackCorrelator.ReconcileResult result = correlator.reconcile(settings.batchSize());
        if (result.signalled() > 0 || result.expired() > 0 || result.failed() > 0) {
            log.info("Callback reconciliation: examined={}, signalled={}, expired={}, failed={}",
                result.examined(), result.signalled(), result.expired(), result.failed());
        }
        return result;
    }

    public int expirePendingCorrelations() {
        return correlator.expirePendingCorrelations();
    }

    // ========== Helper Methods ==========

    private void schedule(Runnable sweep, Duration interval) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(sweep, millis, millis, TimeUnit.MILLISECONDS);
    }

    private void runLeaseSweep() {
        if (!running) return;

        try {
            recoverExpiredLeases();
        } catch (Exception e) {
            log.error("Error in lease recovery", e);
        }
    }

    private void runReconcileSweep() {
        if (!running) return;

        try {
            reconcileCallbacks();
        } catch (Exception e) {
            log.error("Error in callback reconciliation", e);
        }
    }

    private void runExpirySweep() {
        if (!running) return;

        try {
            expirePendingCorrelations();
        } catch (Exception e) {
            log.error("Error in pending correlation expiry", e);
        }
    }

    /**
     * Sweep intervals and batch size.
     */
    public record Settings(
        Duration leaseCheckInterval,
        Duration reconcileInterval,
        Duration expiryInterval,
        int batchSize
    ) {
        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofMinutes(1), 100);
        }
    }
}
