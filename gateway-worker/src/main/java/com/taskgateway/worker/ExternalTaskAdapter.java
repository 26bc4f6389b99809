package com.taskgateway.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.client.http.Sleeper;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.core.model.TypedVariable;
import com.taskgateway.worker.engine.EngineClient;
import com.taskgateway.worker.engine.EngineClient.TopicLock;
import com.taskgateway.worker.engine.EngineClientException;
import com.taskgateway.worker.engine.ExternalTask;
import com.taskgateway.worker.gateway.GatewayClient;
import com.taskgateway.worker.gateway.GatewayClientException;
import com.taskgateway.worker.gateway.GatewayTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bridges the workflow engine's external-task protocol and the gateway.
 * 
 * Each locked engine task is validated, submitted to the gateway keyed by engine task id and
 * remaining retries, and watched until the gateway task is terminal. Meanwhile the engine lock is
 * extended every half lock duration. The terminal state is then reported back:
 * <ul>
 *   <li>SUCCEEDED: complete with the result as typed variables</li>
 *   <li>FAILED, non-retryable: BPMN error carrying the gateway error code</li>
 *   <li>FAILED, retryable: failure with one engine retry fewer</li>
 * </ul>
 * When the engine lock is lost the task is abandoned. The engine offers it again with the same
 * retries and the resubmission returns the same gateway task. An engine-level retry gets a fresh one.
 * When the gateway cannot be reached for longer than the configured timeout while watching, the
 * engine task is failed with one retry fewer so the lock is not held indefinitely.
 * 
 * Usage:
 * <pre>
 * ExternalTaskAdapter adapter = new ExternalTaskAdapter(engineClient, gatewayClient,
 *     List.of(TopicSubscription.of("consultar-processo", "numero_processo")), settings);
 * adapter.start();
 * </pre>
 */
public class ExternalTaskAdapter {

    private static final Logger log = LoggerFactory.getLogger(ExternalTaskAdapter.class);

    public static final String GATEWAY_TASK_ID_VARIABLE = "gatewayTaskId";

    private final EngineClient engineClient;
    private final GatewayClient gatewayClient;
    private final Map<String, TopicSubscription> subscriptions;
    private final Settings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ScheduledExecutorService poller;
    private final ExecutorService handlerPool;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();

    public ExternalTaskAdapter(
            EngineClient engineClient,
            GatewayClient gatewayClient,
            List<TopicSubscription> subscriptions,
            Settings settings) {
        this(engineClient, gatewayClient, subscriptions, settings, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public ExternalTaskAdapter(
            EngineClient engineClient,
            GatewayClient gatewayClient,
            List<TopicSubscription> subscriptions,
            Settings settings,
            Clock clock,
            Sleeper sleeper) {
        this.engineClient = engineClient;
        this.gatewayClient = gatewayClient;
        this.subscriptions = subscriptions.stream()
            .collect(Collectors.toUnmodifiableMap(TopicSubscription::topicName, Function.identity()));
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "external-task-poller-" + settings.workerId());
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger threadCount = new AtomicInteger();
        this.handlerPool = Executors.newFixedThreadPool(settings.maxTasks(), runnable -> {
            Thread thread = new Thread(runnable, "external-task-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Engine protocol ==========

    public List<ExternalTask> fetch(String topic, int maxBatch, Duration lockDuration) {
        return engineClient.fetchAndLock(settings.workerId(), maxBatch, List.of(new TopicLock(topic, lockDuration)));
    }

    public void complete(String taskId, Map<String, TypedVariable> variables) {
        engineClient.complete(taskId, settings.workerId(), variables);
    }

    public void fail(String taskId, String error, int retriesRemaining) {
        engineClient.failure(taskId, settings.workerId(), error, null, retriesRemaining, settings.retryTimeout());
    }

    public void registerPendingCorrelation(String correlationKey, String workflowInstanceReference) {
        gatewayClient.registerCorrelation(correlationKey, workflowInstanceReference, null, null);
    }

    // ========== Polling loop ==========

    /**
     * Start polling the engine for all subscribed topics.
     */
    public void start() {
        if (subscriptions.isEmpty()) {
            log.warn("External-task adapter {} has no subscriptions, not starting", settings.workerId());
            return;
        }
        if (running.compareAndSet(false, true)) {
            log.info("Starting external-task adapter {} for topics {}", settings.workerId(), subscriptions.keySet());
            poller.scheduleWithFixedDelay(this::pollSafely, 0, settings.pollInterval().toMillis(),
                TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stop the adapter gracefully. Tasks still being watched keep their engine lock until it lapses.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping external-task adapter {}", settings.workerId());
        }
        poller.shutdown();
        handlerPool.shutdown();
        try {
            if (!handlerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                handlerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    /**
     * Fetch as many tasks as there is free capacity for and hand them to the handler pool.
     *
     * @return number of tasks fetched
     */
    public int pollOnce() {
        int capacity = settings.maxTasks() - inFlight.get();
        if (capacity <= 0) {
            return 0;
        }

        List<TopicLock> topics = subscriptions.keySet().stream()
            .sorted()
            .map(topic -> new TopicLock(topic, settings.lockDuration()))
            .toList();
        List<ExternalTask> tasks = engineClient.fetchAndLock(settings.workerId(), capacity, topics);

        for (ExternalTask task : tasks) {
            inFlight.incrementAndGet();
            try {
                handlerPool.execute(() -> {
                    try {
                        handle(task);
                    } catch (Exception e) {
                        log.error("Unexpected error handling external task {}", task.id(), e);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                log.warn("Adapter shutting down, external task {} left to its lock timeout", task.id());
            }
        }
        return tasks.size();
    }

    private void pollSafely() {
        if (!running.get()) return;

        try {
            int fetched = pollOnce();
            if (fetched > 0) {
                log.debug("Fetched {} external tasks", fetched);
            }
        } catch (EngineClientException e) {
            log.warn("Fetch and lock failed: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error in external-task poll loop", e);
        }
    }

    // ========== Task handling ==========

    /**
     * Carry one locked engine task through the gateway and report its outcome to the engine.
     */
    public Outcome handle(ExternalTask task) {
        TopicSubscription subscription = subscriptions.get(task.topicName());
        if (subscription == null) {
            log.error("No subscription for topic {} of external task {}", task.topicName(), task.id());
            return reportFailure(task, "No subscription for topic " + task.topicName());
        }

        List<String> missing = subscription.requiredVariables().stream()
            .filter(name -> !task.hasVariable(name))
            .toList();
        if (!missing.isEmpty()) {
            String message = "Missing required variables: " + String.join(", ", missing);
            log.warn("External task {} rejected: {}", task.id(), message);
            return reportBpmnError(task, ErrorClass.VALIDATION.code(), message);
        }

        GatewayTask gatewayTask;
        try {
            gatewayTask = gatewayClient.submit(subscription.gatewayTopic(), task.variablesAsDocument(), submissionKey(task));
        } catch (GatewayClientException e) {
            log.warn("Submit of external task {} failed: {}", task.id(), e.getMessage());
            return reportFailure(task, "Gateway unavailable: " + e.getMessage());
        }
        log.info("External task {} submitted as gateway task {} ({})",
            task.id(), gatewayTask.taskId(), gatewayTask.status());

        try {
            gatewayTask = awaitTerminal(task, gatewayTask);
        } catch (EngineClientException e) {
            log.warn("Lock on external task {} lost, leaving it to the engine: {}", task.id(), e.getMessage());
            return Outcome.ABANDONED;
        } catch (GatewayClientException e) {
            log.error("Gave up watching gateway task {}: {}", gatewayTask.taskId(), e.getMessage());
            return reportFailure(task, "Gateway unavailable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while watching gateway task {}", gatewayTask.taskId());
            return Outcome.ABANDONED;
        }

        return report(task, subscription, gatewayTask);
    }

    private GatewayTask awaitTerminal(ExternalTask task, GatewayTask submitted) throws InterruptedException {
        Duration extendEvery = settings.lockDuration().dividedBy(2);
        Instant nextExtension = clock.instant().plus(extendEvery);
        Instant lastSeen = clock.instant();
        GatewayTask current = submitted;

        while (!current.isTerminal()) {
            sleeper.sleep(settings.statusPollInterval());

            Instant now = clock.instant();
            if (!now.isBefore(nextExtension)) {
                engineClient.extendLock(task.id(), settings.workerId(), settings.lockDuration());
                nextExtension = now.plus(extendEvery);
                log.debug("Extended lock on external task {} (gateway task {} is {})",
                    task.id(), current.taskId(), current.status());
            }

            try {
                current = gatewayClient.getTask(current.taskId());
                lastSeen = clock.instant();
            } catch (GatewayClientException e) {
                Duration unavailableFor = Duration.between(lastSeen, clock.instant());
                if (unavailableFor.compareTo(settings.gatewayUnavailableTimeout()) >= 0) {
                    throw new GatewayClientException("Status of gateway task " + current.taskId()
                        + " unavailable for " + unavailableFor + ": " + e.getMessage(), e);
                }
                log.warn("Status of gateway task {} unavailable: {}", current.taskId(), e.getMessage());
            }
        }
        return current;
    }

    private Outcome report(ExternalTask task, TopicSubscription subscription, GatewayTask gatewayTask) {
        if (gatewayTask.status() == TaskStatus.SUCCEEDED) {
            return reportSuccess(task, subscription, gatewayTask);
        }

        boolean retryable = ErrorClass.fromCode(gatewayTask.errorCode())
            .map(ErrorClass::isRetryable)
            .orElse(true);
        String message = gatewayTask.errorMessage() != null ? gatewayTask.errorMessage() : gatewayTask.errorCode();
        if (!retryable) {
            return reportBpmnError(task, gatewayTask.errorCode(), message);
        }
        return reportFailure(task, gatewayTask.errorCode() + ": " + message);
    }

    private Outcome reportSuccess(ExternalTask task, TopicSubscription subscription, GatewayTask gatewayTask) {
        JsonNode result = gatewayTask.result();

        if (subscription.awaitsCallback()) {
            String field = subscription.awaitCallback();
            JsonNode keyNode = result == null ? null : field.startsWith("/") ? result.at(field) : result.path(field);
            if (keyNode == null || keyNode.isMissingNode() || keyNode.isNull() || keyNode.asText().isBlank()) {
                return reportBpmnError(task, ErrorClass.BUSINESS_REJECTED.code(),
                    "Result carries no callback key in " + field);
            }
            try {
                gatewayClient.registerCorrelation(keyNode.asText(), task.processInstanceId(),
                    task.businessKey(), subscription.messageName());
            } catch (GatewayClientException e) {
                log.warn("Could not register callback key for external task {}: {}", task.id(), e.getMessage());
                return reportFailure(task, "Gateway unavailable: " + e.getMessage());
            }
            log.info("Registered callback key {} for process instance {}", keyNode.asText(), task.processInstanceId());
        }

        Map<String, TypedVariable> variables = toVariables(result);
        variables.put(GATEWAY_TASK_ID_VARIABLE, TypedVariable.string(gatewayTask.taskId()));
        try {
            complete(task.id(), variables);
        } catch (EngineClientException e) {
            log.error("Could not complete external task {}: {}", task.id(), e.getMessage());
            return Outcome.ABANDONED;
        }
        log.info("External task {} completed (gateway task {}, {} attempts)",
            task.id(), gatewayTask.taskId(), gatewayTask.attemptCount());
        return Outcome.COMPLETED;
    }

    private Outcome reportBpmnError(ExternalTask task, String errorCode, String message) {
        try {
            engineClient.bpmnError(task.id(), settings.workerId(), errorCode, message);
        } catch (EngineClientException e) {
            log.error("Could not report BPMN error for external task {}: {}", task.id(), e.getMessage());
            return Outcome.ABANDONED;
        }
        log.info("External task {} ended with BPMN error {}", task.id(), errorCode);
        return Outcome.BPMN_ERROR;
    }

    private Outcome reportFailure(ExternalTask task, String message) {
        int retries = remainingRetries(task);
        try {
            fail(task.id(), message, retries);
        } catch (EngineClientException e) {
            log.error("Could not report failure for external task {}: {}", task.id(), e.getMessage());
            return Outcome.ABANDONED;
        }
        log.warn("External task {} failed, {} engine retries left: {}", task.id(), retries, message);
        return Outcome.FAILED;
    }

    private String submissionKey(ExternalTask task) {
        int retries = task.retries() != null ? task.retries() : settings.engineRetries();
        return task.id() + ":" + retries;
    }

    private int remainingRetries(ExternalTask task) {
        int current = task.retries() != null ? task.retries() : settings.engineRetries();
        return Math.max(current - 1, 0);
    }

    private static Map<String, TypedVariable> toVariables(JsonNode result) {
        Map<String, TypedVariable> variables = new LinkedHashMap<>();
        if (result == null || result.isNull() || result.isMissingNode()) {
            return variables;
        }
        if (!result.isObject()) {
            variables.put("result", TypedVariable.fromJson(result));
            return variables;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            variables.put(field.getKey(), TypedVariable.fromJson(field.getValue()));
        }
        return variables;
    }

    /**
     * What the adapter told the engine about a task.
     */
    public enum Outcome {
        COMPLETED,
        BPMN_ERROR,
        FAILED,
        /** Nothing reported; the engine re-offers the task once its lock lapses. */
        ABANDONED
    }

    /**
     * Adapter tunables.
     *
     * @param workerId id the adapter locks engine tasks under
     * @param maxTasks most engine tasks held at once
     * @param lockDuration engine lock taken on fetch and on every extension
     * @param pollInterval pause between fetch-and-lock calls
     * @param statusPollInterval pause between gateway status checks of a submitted task
     * @param engineRetries engine retries assumed for a task offered for the first time
     * @param retryTimeout delay before the engine offers a failed task again
     */
    public record Settings(
        String workerId,
        int maxTasks,
        Duration lockDuration,
        Duration pollInterval,
        Duration statusPollInterval,
        int engineRetries,
        Duration retryTimeout,
        Duration gatewayUnavailableTimeout
    ) {
        public Settings {
            if (maxTasks < 1) {
                throw new IllegalArgumentException("maxTasks must be positive");
            }
            if (gatewayUnavailableTimeout == null || gatewayUnavailableTimeout.isNegative()
                    || gatewayUnavailableTimeout.isZero()) {
                throw new IllegalArgumentException("gatewayUnavailableTimeout must be positive");
            }
        }
    }
}
