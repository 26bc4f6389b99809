package com.taskgateway.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.CallbackRecord;
import com.taskgateway.core.repository.CallbackRecordRepository;
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
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JDBC-backed implementation of CallbackRecordRepository.
 * Deduplication relies on the unique (correlation_key, payload_hash) constraint.
 */
public class JdbcCallbackRecordRepository implements CallbackRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCallbackRecordRepository.class);
    private static final String STORE_NAME = "callback store";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final CallbackRecordRowMapper rowMapper;

    public JdbcCallbackRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new CallbackRecordRowMapper();
    }

    @Override
    public InsertResult insertIfAbsent(CallbackRecord callback) {
        String sql = """
            INSERT INTO callback_records (
                callback_id, source, correlation_key, raw_payload, payload_hash,
                received_at, processed, signal_sent, expired, delivery_count,
                processed_at, last_error
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                callback.callbackId(),
                callback.source(),
                callback.correlationKey(),
                toJson(callback),
                callback.payloadHash(),
                toTimestamp(callback.receivedAt()),
                callback.processed(),
                callback.signalSent(),
                callback.expired(),
                callback.deliveryCount(),
                toTimestamp(callback.processedAt()),
                callback.lastError()
            );
            return new InsertResult(callback, false);
        } catch (DuplicateKeyException e) {
            log.debug("Callback already stored for key {} and hash {}",
                callback.correlationKey(), callback.payloadHash());
            return findByFingerprint(callback.correlationKey(), callback.payloadHash())
                .map(existing -> new InsertResult(existing, true))
                .orElseThrow(() -> new StoreUnavailableException(STORE_NAME, e));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    public boolean update(CallbackRecord callback) {
        String sql = """
            UPDATE callback_records SET
                processed = ?,
                signal_sent = ?,
                expired = ?,
                processed_at = ?,
                last_error = ?
            WHERE callback_id = ? AND signal_sent = FALSE AND expired = FALSE
            """;

        int rows = guarded(() -> jdbcTemplate.update(sql,
            callback.processed(),
            callback.signalSent(),
            callback.expired(),
            toTimestamp(callback.processedAt()),
            callback.lastError(),
            callback.callbackId()
        ));
        return rows > 0;
    }

    @Override
    public void incrementDeliveryCount(String callbackId) {
        String sql = "UPDATE callback_records SET delivery_count = delivery_count + 1 WHERE callback_id = ?";
        guarded(() -> jdbcTemplate.update(sql, callbackId));
    }

    @Override
    public Optional<CallbackRecord> findById(String callbackId) {
        String sql = "SELECT * FROM callback_records WHERE callback_id = ?";
        List<CallbackRecord> results = guarded(() -> jdbcTemplate.query(sql, rowMapper, callbackId));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CallbackRecord> findByCorrelationKey(String correlationKey) {
        String sql = "SELECT * FROM callback_records WHERE correlation_key = ? ORDER BY received_at";
        return guarded(() -> jdbcTemplate.query(sql, rowMapper, correlationKey));
    }

    @Override
    public List<CallbackRecord> findCorrelatable(Instant now, int limit) {
        String sql = """
            SELECT c.* FROM callback_records c
            WHERE c.signal_sent = FALSE AND c.expired = FALSE
              AND (c.processed = FALSE OR EXISTS (
                  SELECT 1 FROM pending_correlations p
                  WHERE p.correlation_key = c.correlation_key
                    AND (p.expires_at IS NULL OR p.expires_at > ?)))
            ORDER BY c.received_at
            LIMIT ?
            """;
        return guarded(() -> jdbcTemplate.query(sql, rowMapper, toTimestamp(now), limit));
    }

    @Override
    public List<CallbackRecord> findAwaitingSignalReceivedBefore(Instant cutoff, int limit) {
        String sql = """
            SELECT * FROM callback_records
            WHERE signal_sent = FALSE AND expired = FALSE AND received_at <= ?
            ORDER BY received_at
            LIMIT ?
            """;
        return guarded(() -> jdbcTemplate.query(sql, rowMapper, toTimestamp(cutoff), limit));
    }

    @Override
    public long countAwaitingSignal() {
        String sql = "SELECT COUNT(*) FROM callback_records WHERE signal_sent = FALSE AND expired = FALSE";
        Long count = guarded(() -> jdbcTemplate.queryForObject(sql, Long.class));
        return count != null ? count : 0L;
    }

    // ========== Helper Methods ==========

    private Optional<CallbackRecord> findByFingerprint(String correlationKey, String payloadHash) {
        String sql = "SELECT * FROM callback_records WHERE correlation_key = ? AND payload_hash = ?";
        List<CallbackRecord> results = guarded(
            () -> jdbcTemplate.query(sql, rowMapper, correlationKey, payloadHash));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private <T> T guarded(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, e);
        }
    }

    private String toJson(CallbackRecord callback) {
        try {
            return objectMapper.writeValueAsString(callback.rawPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize callback payload", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class CallbackRecordRowMapper implements RowMapper<CallbackRecord> {
        @Override
        public CallbackRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new CallbackRecord(
                    rs.getString("callback_id"),
                    rs.getString("source"),
                    rs.getString("correlation_key"),
                    objectMapper.readTree(rs.getString("raw_payload")),
                    rs.getString("payload_hash"),
                    toInstant(rs.getTimestamp("received_at")),
                    rs.getBoolean("processed"),
                    rs.getBoolean("signal_sent"),
                    rs.getBoolean("expired"),
                    rs.getInt("delivery_count"),
                    toInstant(rs.getTimestamp("processed_at")),
                    rs.getString("last_error")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map callback record row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
