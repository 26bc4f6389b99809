package com.taskgateway.engine.persistence.jdbc;

import com.taskgateway.client.credential.SharedStoreUnavailableException;
import com.taskgateway.core.model.CredentialRecord;
import com.taskgateway.testsupport.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JdbcSharedTokenStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final TimeController time = TimeController.frozenAt(NOW);
    private JdbcTemplate jdbcTemplate;
    private JdbcSharedTokenStore store;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabases.h2();
        jdbcTemplate = new JdbcTemplate(dataSource);
        store = new JdbcSharedTokenStore(jdbcTemplate, TestDatabases.transactions(dataSource), time);
    }

    private CredentialRecord credential(String api, String account, String token) {
        return new CredentialRecord(api, account, token, NOW, NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void put_shouldBeVisibleUntilTtlElapses() {
        CredentialRecord credential = credential("cpj", "tenant-a", "t1");
        store.put(credential.cacheKey(), credential, Duration.ofMinutes(55));

        assertThat(store.get(credential.cacheKey())).contains(credential);

        time.advanceMinutes(55);
        assertThat(store.get(credential.cacheKey())).isEmpty();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM shared_credentials", Long.class)).isZero();
    }

    @Test
    void put_shouldOverwriteExistingEntry() {
        String key = CredentialRecord.cacheKey("cpj", "tenant-a");
        store.put(key, credential("cpj", "tenant-a", "t1"), Duration.ofMinutes(10));
        store.put(key, credential("cpj", "tenant-a", "t2"), Duration.ofMinutes(10));

        assertThat(store.get(key)).map(CredentialRecord::token).contains("t2");
    }

    @Test
    void removeIfMatches_shouldLeaveNewerTokenAlone() {
        String key = CredentialRecord.cacheKey("cpj", "tenant-a");
        store.put(key, credential("cpj", "tenant-a", "t2"), Duration.ofMinutes(10));

        store.removeIfMatches(key, "t1");
        assertThat(store.get(key)).isPresent();

        store.removeIfMatches(key, "t2");
        assertThat(store.get(key)).isEmpty();
    }

    @Test
    void removeByPrefix_shouldTreatWildcardsLiterally() {
        store.put(CredentialRecord.cacheKey("cpj", "a"), credential("cpj", "a", "t1"), Duration.ofMinutes(10));
        store.put(CredentialRecord.cacheKey("cpj", "b"), credential("cpj", "b", "t2"), Duration.ofMinutes(10));
        store.put(CredentialRecord.cacheKey("cpjx", "a"), credential("cpjx", "a", "t3"), Duration.ofMinutes(10));
        store.put(CredentialRecord.cacheKey("dw_law", "a"), credential("dw_law", "a", "t4"), Duration.ofMinutes(10));

        assertThat(store.removeByPrefix(CredentialRecord.KEY_PREFIX + "cpj:")).isEqualTo(2);
        assertThat(store.removeByPrefix(CredentialRecord.KEY_PREFIX + "dw%")).isZero();
        assertThat(store.get(CredentialRecord.cacheKey("cpjx", "a"))).isPresent();
        assertThat(store.get(CredentialRecord.cacheKey("dw_law", "a"))).isPresent();
    }

    @Test
    void missingTable_shouldSurfaceAsSharedStoreUnavailable() {
        jdbcTemplate.execute("DROP TABLE shared_credentials");

        assertThatThrownBy(() -> store.get(CredentialRecord.cacheKey("cpj", "a")))
            .isInstanceOf(SharedStoreUnavailableException.class);
    }
}
