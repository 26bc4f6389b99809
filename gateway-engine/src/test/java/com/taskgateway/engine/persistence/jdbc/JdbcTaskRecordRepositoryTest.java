package com.taskgateway.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.core.repository.TaskRecordRepository.DuplicateSubmissionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JdbcTaskRecordRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JdbcTemplate jdbcTemplate;
    private JdbcTaskRecordRepository repository;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabases.h2();
        jdbcTemplate = new JdbcTemplate(dataSource);
        repository = new JdbcTaskRecordRepository(jdbcTemplate, objectMapper);
    }

    private TaskRecord newTask(String submissionKey) throws Exception {
        return TaskRecord.create("cpj.consulta", objectMapper.readTree("{\"processo\":\"123\",\"n\":1}"),
            submissionKey, NOW);
    }

    @Test
    void insert_shouldRoundTripAllColumns() throws Exception {
        TaskRecord task = newTask("order-1");
        repository.insert(task);

        TaskRecord stored = repository.findById(task.taskId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.payload().get("processo").asText()).isEqualTo("123");
        assertThat(stored.createdAt()).isEqualTo(NOW);
        assertThat(stored.version()).isEqualTo(task.version());
        assertThat(repository.findBySubmissionKey("order-1")).contains(stored);
    }

    @Test
    void insert_withTakenSubmissionKey_shouldThrowDuplicate() throws Exception {
        repository.insert(newTask("order-1"));

        assertThatThrownBy(() -> repository.insert(newTask("order-1")))
            .isInstanceOf(DuplicateSubmissionException.class);
    }

    @Test
    void insert_withoutSubmissionKey_shouldAllowMany() throws Exception {
        repository.insert(newTask(null));
        repository.insert(newTask(null));

        assertThat(repository.countByStatus()).containsEntry(TaskStatus.PENDING, 2L);
    }

    @Test
    void compareAndSet_shouldLetOnlyOneWriterWinPerVersion() throws Exception {
        TaskRecord task = newTask(null);
        repository.insert(task);

        TaskRecord claimedByA = task.withClaimed("node-a", NOW.plusSeconds(60), NOW);
        TaskRecord claimedByB = task.withClaimed("node-b", NOW.plusSeconds(60), NOW);

        assertThat(repository.compareAndSet(task, claimedByA)).isTrue();
        assertThat(repository.compareAndSet(task, claimedByB)).isFalse();

        TaskRecord stored = repository.findById(task.taskId()).orElseThrow();
        assertThat(stored.leaseHolder()).isEqualTo("node-a");
        assertThat(stored.attemptCount()).isEqualTo(1);
    }

    @Test
    void findDispatchable_shouldReturnDueTasksOldestFirst() throws Exception {
        TaskRecord first = newTask(null);
        repository.insert(first);
        TaskRecord claimed = first.withClaimed("node-a", NOW.plusSeconds(60), NOW);
        repository.compareAndSet(first, claimed);
        TaskRecord retrying = claimed.withRetrying("TRANSIENT_ERROR", "timeout", NOW.plusSeconds(30), NOW);
        repository.compareAndSet(claimed, retrying);

        TaskRecord second = newTask(null);
        repository.insert(second);

        assertThat(repository.findDispatchable(NOW, 10)).extracting(TaskRecord::taskId)
            .containsExactly(second.taskId());
        assertThat(repository.findDispatchable(NOW.plusSeconds(31), 10)).extracting(TaskRecord::taskId)
            .containsExactlyInAnyOrder(first.taskId(), second.taskId());
    }

    @Test
    void findExpiredLeases_shouldReturnOnlyLapsedInProgressTasks() throws Exception {
        TaskRecord task = newTask(null);
        repository.insert(task);
        repository.compareAndSet(task, task.withClaimed("node-a", NOW.plus(Duration.ofMinutes(5)), NOW));

        assertThat(repository.findExpiredLeases(NOW.plus(Duration.ofMinutes(4)), 10)).isEmpty();
        List<TaskRecord> expired = repository.findExpiredLeases(NOW.plus(Duration.ofMinutes(6)), 10);
        assertThat(expired).extracting(TaskRecord::taskId).containsExactly(task.taskId());
    }

    @Test
    void countByStatus_shouldGroupByStatus() throws Exception {
        TaskRecord task = newTask(null);
        repository.insert(task);
        repository.insert(newTask(null));
        TaskRecord claimed = task.withClaimed("node-a", NOW.plusSeconds(60), NOW);
        repository.compareAndSet(task, claimed);
        repository.compareAndSet(claimed, claimed.withSucceeded(objectMapper.createObjectNode(), NOW));

        Map<TaskStatus, Long> counts = repository.countByStatus();
        assertThat(counts).containsEntry(TaskStatus.PENDING, 1L).containsEntry(TaskStatus.SUCCEEDED, 1L);
        assertThat(repository.findByStatus(TaskStatus.SUCCEEDED, 10).get(0).result()).isNotNull();
    }

    @Test
    void droppedTable_shouldSurfaceAsStoreUnavailable() {
        jdbcTemplate.execute("DROP TABLE task_records");

        assertThatThrownBy(() -> repository.findById("any"))
            .isInstanceOf(StoreUnavailableException.class);
    }
}
