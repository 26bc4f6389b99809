package com.taskgateway.engine.persistence.jdbc;

import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.model.PendingCorrelation;
import com.taskgateway.core.repository.PendingCorrelationRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JDBC-backed implementation of PendingCorrelationRepository.
 */
public class JdbcPendingCorrelationRepository implements PendingCorrelationRepository {

    private static final String STORE_NAME = "correlation store";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RowMapper<PendingCorrelation> rowMapper = new PendingCorrelationRowMapper();

    public JdbcPendingCorrelationRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void register(PendingCorrelation correlation) {
        String updateSql = """
            UPDATE pending_correlations SET
                workflow_instance_reference = ?,
                business_key = ?,
                message_name = ?,
                registered_at = ?,
                expires_at = ?
            WHERE correlation_key = ?
            """;
        String insertSql = """
            INSERT INTO pending_correlations (
                correlation_key, workflow_instance_reference, business_key,
                message_name, registered_at, expires_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

        guarded(() -> transactionTemplate.execute(status -> {
            int rows = jdbcTemplate.update(updateSql,
                correlation.workflowInstanceReference(),
                correlation.businessKey(),
                correlation.messageName(),
                toTimestamp(correlation.registeredAt()),
                toTimestamp(correlation.expiresAt()),
                correlation.correlationKey()
            );
            if (rows == 0) {
                jdbcTemplate.update(insertSql,
                    correlation.correlationKey(),
                    correlation.workflowInstanceReference(),
                    correlation.businessKey(),
                    correlation.messageName(),
                    toTimestamp(correlation.registeredAt()),
                    toTimestamp(correlation.expiresAt())
                );
            }
            return null;
        }));
    }

    @Override
    public Optional<PendingCorrelation> find(String correlationKey) {
        String sql = "SELECT * FROM pending_correlations WHERE correlation_key = ?";
        List<PendingCorrelation> results = guarded(() -> jdbcTemplate.query(sql, rowMapper, correlationKey));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * The DELETE is conditioned on the row read, so of two concurrent consumers only
     * the one whose DELETE affects the row gets the correlation.
     */
    @Override
    public Optional<PendingCorrelation> consume(String correlationKey) {
        String sql = """
            DELETE FROM pending_correlations
            WHERE correlation_key = ? AND workflow_instance_reference = ?
            """;

        Optional<PendingCorrelation> found = find(correlationKey);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        PendingCorrelation correlation = found.get();
        int rows = guarded(() -> jdbcTemplate.update(sql,
            correlationKey, correlation.workflowInstanceReference()));
        return rows > 0 ? found : Optional.empty();
    }

    @Override
    public boolean remove(String correlationKey) {
        String sql = "DELETE FROM pending_correlations WHERE correlation_key = ?";
        return guarded(() -> jdbcTemplate.update(sql, correlationKey)) > 0;
    }

    @Override
    public int deleteExpired(Instant now) {
        String sql = "DELETE FROM pending_correlations WHERE expires_at IS NOT NULL AND expires_at <= ?";
        return guarded(() -> jdbcTemplate.update(sql, Timestamp.from(now)));
    }

    // ========== Helper Methods ==========

    private <T> T guarded(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(STORE_NAME, e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class PendingCorrelationRowMapper implements RowMapper<PendingCorrelation> {
        @Override
        public PendingCorrelation mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new PendingCorrelation(
                rs.getString("correlation_key"),
                rs.getString("workflow_instance_reference"),
                rs.getString("business_key"),
                rs.getString("message_name"),
                toInstant(rs.getTimestamp("registered_at")),
                toInstant(rs.getTimestamp("expires_at"))
            );
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
