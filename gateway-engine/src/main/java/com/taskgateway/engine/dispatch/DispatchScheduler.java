package com.taskgateway.engine.dispatch;

import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Feeds dispatchable tasks to a bounded worker pool.
 * 
 * Tasks enter the pool two ways: immediately after submission, and through a
 * periodic poll that picks up retries whose backoff elapsed, reclaimed tasks,
 * and anything submitted by other gateway instances.
 */
public class DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final TaskDispatcher dispatcher;
    private final TaskRecordRepository taskRepository;
    private final Clock clock;
    private final int poolSize;
    private final Duration pollInterval;
    private final int batchSize;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService poller;
    private final ExecutorService workers;
    private volatile boolean running = false;

    public DispatchScheduler(
            TaskDispatcher dispatcher,
            TaskRecordRepository taskRepository,
            Clock clock,
            int poolSize,
            Duration pollInterval,
            int batchSize) {
        this.dispatcher = dispatcher;
        this.taskRepository = taskRepository;
        this.clock = clock;
        this.poolSize = poolSize;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.poller = Executors.newSingleThreadScheduledExecutor(namedThreads("dispatch-poller"));
        this.workers = Executors.newFixedThreadPool(poolSize, namedThreads("dispatch"));
        dispatcher.addSubmissionListener(this::onSubmitted);
    }

    /**
     * Start polling for dispatchable tasks.
     */
    public void start() {
        if (running) {
            log.warn("Dispatch scheduler already running");
            return;
        }

        running = true;
        poller.scheduleWithFixedDelay(
            this::pollOnce,
            0,
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Dispatch scheduler started with {} workers, polling every {}", poolSize, pollInterval);
    }

    /**
     * Stop polling and wait for in-flight attempts to finish.
     * Attempts still running after the grace period are abandoned to lease reclamation.
     */
    public void stop() {
        running = false;
        poller.shutdown();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("{} task attempts still running at shutdown", inFlight.size());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dispatch scheduler stopped");
    }

    /**
     * Enqueue every task that is due now.
     * 
     * @return number of tasks handed to the pool
     */
    public int pollOnce() {
        if (!running) return 0;

        try {
            int capacity = poolSize * 2 - inFlight.size();
            if (capacity <= 0) {
                return 0;
            }
            List<TaskRecord> due = taskRepository.findDispatchable(clock.instant(), Math.min(capacity, batchSize));
            int enqueued = 0;
            for (TaskRecord task : due) {
                if (enqueue(task.taskId())) {
                    enqueued++;
                }
            }
            if (enqueued > 0) {
                log.debug("Enqueued {} dispatchable tasks", enqueued);
            }
            return enqueued;
        } catch (Exception e) {
            log.error("Error polling for dispatchable tasks", e);
            return 0;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    // ========== Helper Methods ==========

    private void onSubmitted(TaskRecord task) {
        enqueue(task.taskId());
    }

    private boolean enqueue(String taskId) {
        if (!running || !inFlight.add(taskId)) {
            return false;
        }
        try {
            workers.execute(() -> runDispatch(taskId));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(taskId);
            log.warn("Worker pool rejected task {}; it stays PENDING", taskId);
            return false;
        }
    }

    private void runDispatch(String taskId) {
        try {
            dispatcher.dispatch(taskId);
        } catch (Exception e) {
            log.error("Dispatch of task {} failed", taskId, e);
        } finally {
            inFlight.remove(taskId);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
