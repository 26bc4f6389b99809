package com.taskgateway.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.TaskRecord;
import com.taskgateway.core.model.TaskStatus;
import com.taskgateway.core.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JDBC-backed implementation of TaskRecordRepository.
 * Every transition is a conditional UPDATE on (task_id, status, version), so concurrent
 * dispatchers never both win the same claim.
 */
public class JdbcTaskRecordRepository implements TaskRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRecordRepository.class);
    private static final String STORE_NAME = "task store";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRecordRowMapper rowMapper;

    public JdbcTaskRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRecordRowMapper();
    }

    @Override
    public void insert(TaskRecord task) {
        String sql = """
            INSERT INTO task_records (
                task_id, submission_key, topic, payload_json,
                status, attempt_count, result_json, error_code, error_message,
                lease_holder, lease_expires_at, next_attempt_at,
                created_at, updated_at, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                task.taskId(),
                task.submissionKey(),
                task.topic(),
                toJson(task.payload()),
                task.status().name(),
                task.attemptCount(),
                toJson(task.result()),
                task.errorCode(),
                task.errorMessage(),
                task.leaseHolder(),
                toTimestamp(task.leaseExpiresAt()),
                toTimestamp(task.nextAttemptAt()),
                toTimestamp(task.createdAt()),
                toTimestamp(task.updatedAt()),
                task.version()
            );
        } catch (DuplicateKeyException e) {
            log.debug("Submission key already taken: {}", task.submissionKey());
            throw new DuplicateSubmissionException(task.submissionKey());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    public boolean compareAndSet(TaskRecord expected, TaskRecord next) {
        String sql = """
            UPDATE task_records SET
                status = ?,
                attempt_count = ?,
                result_json = ?,
                error_code = ?,
                error_message = ?,
                lease_holder = ?,
                lease_expires_at = ?,
                next_attempt_at = ?,
                updated_at = ?,
                version = ?
            WHERE task_id = ? AND status = ? AND version = ?
            """;

        int rows = guarded(() -> jdbcTemplate.update(sql,
            next.status().name(),
            next.attemptCount(),
            toJson(next.result()),
            next.errorCode(),
            next.errorMessage(),
            next.leaseHolder(),
            toTimestamp(next.leaseExpiresAt()),
            toTimestamp(next.nextAttemptAt()),
            toTimestamp(next.updatedAt()),
            next.version(),
            expected.taskId(),
            expected.status().name(),
            expected.version()
        ));

        if (rows == 0) {
            log.debug("Lost compare-and-set on task {} at version {}", expected.taskId(), expected.version());
        }
        return rows > 0;
    }

    @Override
    public Optional<TaskRecord> findById(String taskId) {
        String sql = "SELECT * FROM task_records WHERE task_id = ?";
        List<TaskRecord> results = guarded(() -> jdbcTemplate.query(sql, rowMapper, taskId));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<TaskRecord> findBySubmissionKey(String submissionKey) {
        String sql = "SELECT * FROM task_records WHERE submission_key = ?";
        List<TaskRecord> results = guarded(() -> jdbcTemplate.query(sql, rowMapper, submissionKey));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<TaskRecord> findByStatus(TaskStatus status, int limit) {
        String sql = "SELECT * FROM task_records WHERE status = ? ORDER BY created_at LIMIT ?";
        return guarded(() -> jdbcTemplate.query(sql, rowMapper, status.name(), limit));
    }

    @Override
    public List<TaskRecord> findDispatchable(Instant now, int limit) {
        String sql = """
            SELECT * FROM task_records
            WHERE status IN ('PENDING', 'RETRYING')
              AND (next_attempt_at IS NULL OR next_attempt_at <= ?)
            ORDER BY created_at
            LIMIT ?
            """;
        return guarded(() -> jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit));
    }

    @Override
    public List<TaskRecord> findExpiredLeases(Instant now, int limit) {
        String sql = """
            SELECT * FROM task_records
            WHERE status = 'IN_PROGRESS'
              AND lease_expires_at < ?
            ORDER BY lease_expires_at
            LIMIT ?
            """;
        return guarded(() -> jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit));
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM task_records GROUP BY status";
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        guarded(() -> {
            jdbcTemplate.query(sql, rs -> {
                counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
            });
            return null;
        });
        return counts;
    }

    // ========== Helper Methods ==========

    private <T> T guarded(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, e);
        }
    }

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class TaskRecordRowMapper implements RowMapper<TaskRecord> {
        @Override
        public TaskRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new TaskRecord(
                    rs.getString("task_id"),
                    rs.getString("submission_key"),
                    rs.getString("topic"),
                    parseJsonNode(rs.getString("payload_json")),
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempt_count"),
                    parseJsonNode(rs.getString("result_json")),
                    rs.getString("error_code"),
                    rs.getString("error_message"),
                    rs.getString("lease_holder"),
                    toInstant(rs.getTimestamp("lease_expires_at")),
                    toInstant(rs.getTimestamp("next_attempt_at")),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task record row", e);
            }
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
