package com.taskgateway.engine.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.core.model.ErrorClass;
import com.taskgateway.core.model.RetryPolicy;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.engine.handler.TopicHandlerException;
import com.taskgateway.engine.handler.TopicHandlerRegistry;
import com.taskgateway.engine.metrics.GatewayMetrics;
import com.taskgateway.engine.persistence.InMemoryTaskRecordRepository;
import com.taskgateway.testsupport.FailureInjector;
import com.taskgateway.testsupport.TimeController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class DispatchSchedulerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TimeController time;
    private InMemoryTaskRecordRepository repository;
    private TopicHandlerRegistry handlers;
    private TaskDispatcher dispatcher;
    private DispatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-01-15T10:00:00Z"));
        repository = new InMemoryTaskRecordRepository();
        handlers = new TopicHandlerRegistry();
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ofSeconds(30))
            .jitterFactor(0.0)
            .build();
        dispatcher = new TaskDispatcher(repository, handlers, policy, Duration.ofSeconds(300),
            "dispatcher-1", time, new GatewayMetrics(new SimpleMeterRegistry()));
        scheduler = new DispatchScheduler(dispatcher, repository, time, 4, Duration.ofMillis(20), 50);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void submittedTask_shouldBeDispatchedWithoutWaitingForPoll() throws Exception {
        handlers.register("search", p -> objectMapper.createObjectNode().put("found", true));
        scheduler.start();

        TaskRecord task = dispatcher.submit("search", objectMapper.createObjectNode(), null);

        TaskRecord done = awaitStatus(task.taskId(), TaskStatus.SUCCEEDED);
        assertThat(done.result().get("found").asBoolean()).isTrue();
    }

    @Test
    void retryingTask_shouldBePickedUpByPollOnceBackoffElapses() throws Exception {
        FailureInjector failures = FailureInjector.failFirst(1);
        handlers.register("search", p -> {
            failures.maybeThrow(() -> new TopicHandlerException(ErrorClass.TRANSIENT_TRANSPORT, "timeout"));
            return objectMapper.createObjectNode();
        });
        scheduler.start();

        TaskRecord task = dispatcher.submit("search", objectMapper.createObjectNode(), null);
        awaitStatus(task.taskId(), TaskStatus.RETRYING);

        time.advanceSeconds(31);
        TaskRecord done = awaitStatus(task.taskId(), TaskStatus.SUCCEEDED);
        assertThat(done.attemptCount()).isEqualTo(2);
    }

    @Test
    void stoppedScheduler_shouldNotEnqueue() throws Exception {
        handlers.register("search", p -> objectMapper.createObjectNode());

        TaskRecord task = dispatcher.submit("search", objectMapper.createObjectNode(), null);

        assertThat(scheduler.pollOnce()).isZero();
        assertThat(dispatcher.getTask(task.taskId()).status()).isEqualTo(TaskStatus.PENDING);
    }

    private TaskRecord awaitStatus(String taskId, TaskStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        TaskRecord task = dispatcher.getTask(taskId);
        while (task.status() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            task = dispatcher.getTask(taskId);
        }
        assertThat(task.status()).isEqualTo(expected);
        return task;
    }
}
