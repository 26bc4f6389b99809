package com.taskgateway.engine.persistence.jdbc;

import com.taskgateway.client.credential.SharedStoreUnavailableException;
import com.taskgateway.client.credential.SharedTokenStore;
import com.taskgateway.core.model.CredentialRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared credential tier kept in the gateway database so every instance sees the same tokens.
 * Entries past {@code evict_at} read as absent and are deleted lazily.
 */
public class JdbcSharedTokenStore implements SharedTokenStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcSharedTokenStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<CredentialRecord> get(String cacheKey) {
        String sql = """
            SELECT api_name, account_id, token, issued_at, expires_at, evict_at
            FROM shared_credentials
            WHERE cache_key = ?
            """;

        Instant now = clock.instant();
        List<Entry> entries = guarded(() -> jdbcTemplate.query(sql, (rs, rowNum) -> new Entry(
            new CredentialRecord(
                rs.getString("api_name"),
                rs.getString("account_id"),
                rs.getString("token"),
                rs.getTimestamp("issued_at").toInstant(),
                rs.getTimestamp("expires_at").toInstant()
            ),
            rs.getTimestamp("evict_at").toInstant()
        ), cacheKey));

        if (entries.isEmpty()) {
            return Optional.empty();
        }
        Entry entry = entries.get(0);
        if (!entry.evictAt().isAfter(now)) {
            guarded(() -> jdbcTemplate.update(
                "DELETE FROM shared_credentials WHERE cache_key = ? AND evict_at <= ?",
                cacheKey, Timestamp.from(now)));
            return Optional.empty();
        }
        return Optional.of(entry.credential());
    }

    @Override
    public void put(String cacheKey, CredentialRecord credential, Duration ttl) {
        String updateSql = """
            UPDATE shared_credentials SET
                api_name = ?, account_id = ?, token = ?,
                issued_at = ?, expires_at = ?, evict_at = ?
            WHERE cache_key = ?
            """;
        String insertSql = """
            INSERT INTO shared_credentials (
                cache_key, api_name, account_id, token, issued_at, expires_at, evict_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        Timestamp evictAt = Timestamp.from(clock.instant().plus(ttl));
        guarded(() -> transactionTemplate.execute(status -> {
            int rows = jdbcTemplate.update(updateSql,
                credential.apiName(),
                credential.accountId(),
                credential.token(),
                Timestamp.from(credential.issuedAt()),
                Timestamp.from(credential.expiresAt()),
                evictAt,
                cacheKey
            );
            if (rows == 0) {
                jdbcTemplate.update(insertSql,
                    cacheKey,
                    credential.apiName(),
                    credential.accountId(),
                    credential.token(),
                    Timestamp.from(credential.issuedAt()),
                    Timestamp.from(credential.expiresAt()),
                    evictAt
                );
            }
            return null;
        }));
    }

    @Override
    public void remove(String cacheKey) {
        guarded(() -> jdbcTemplate.update("DELETE FROM shared_credentials WHERE cache_key = ?", cacheKey));
    }

    @Override
    public void removeIfMatches(String cacheKey, String token) {
        guarded(() -> jdbcTemplate.update(
            "DELETE FROM shared_credentials WHERE cache_key = ? AND token = ?", cacheKey, token));
    }

    @Override
    public int removeByPrefix(String keyPrefix) {
        return guarded(() -> jdbcTemplate.update(
            "DELETE FROM shared_credentials WHERE cache_key LIKE ?", escapeLike(keyPrefix) + "%"));
    }

    // ========== Helper Methods ==========

    private <T> T guarded(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new SharedStoreUnavailableException("Shared credential store unavailable", e);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private record Entry(CredentialRecord credential, Instant evictAt) {}
}
