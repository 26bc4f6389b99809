package com.taskgateway.engine.persistence.jdbc;

import com.taskgateway.core.model.PendingCorrelation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JdbcPendingCorrelationRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private JdbcPendingCorrelationRepository repository;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabases.h2();
        repository = new JdbcPendingCorrelationRepository(
            new JdbcTemplate(dataSource), TestDatabases.transactions(dataSource));
    }

    private PendingCorrelation pending(String key, String reference, Instant expiresAt) {
        return new PendingCorrelation(key, reference, "BK-" + key, null, NOW, expiresAt);
    }

    @Test
    void register_shouldReplaceExistingRegistration() {
        repository.register(pending("K1", "proc-1", null));
        repository.register(pending("K1", "proc-2", NOW.plusSeconds(60)));

        PendingCorrelation stored = repository.find("K1").orElseThrow();
        assertThat(stored.workflowInstanceReference()).isEqualTo("proc-2");
        assertThat(stored.expiresAt()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void consume_shouldReturnRegistrationOnlyOnce() {
        repository.register(pending("K1", "proc-1", null));

        assertThat(repository.consume("K1")).map(PendingCorrelation::workflowInstanceReference).contains("proc-1");
        assertThat(repository.consume("K1")).isEmpty();
        assertThat(repository.find("K1")).isEmpty();
    }

    @Test
    void consume_concurrently_shouldHaveSingleWinner() throws Exception {
        repository.register(pending("K1", "proc-1", null));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Optional<PendingCorrelation>>> attempts = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                attempts.add(() -> repository.consume("K1"));
            }
            long winners = 0;
            for (Future<Optional<PendingCorrelation>> result : pool.invokeAll(attempts)) {
                if (result.get().isPresent()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deleteExpired_shouldKeepOpenEndedAndFutureRegistrations() {
        repository.register(pending("K1", "proc-1", NOW.minusSeconds(1)));
        repository.register(pending("K2", "proc-2", NOW.plusSeconds(60)));
        repository.register(pending("K3", "proc-3", null));

        assertThat(repository.deleteExpired(NOW)).isEqualTo(1);
        assertThat(repository.find("K1")).isEmpty();
        assertThat(repository.find("K2")).isPresent();
        assertThat(repository.find("K3")).isPresent();
    }

    @Test
    void remove_shouldReportWhetherSomethingWasRemoved() {
        repository.register(pending("K1", "proc-1", null));

        assertThat(repository.remove("K1")).isTrue();
        assertThat(repository.remove("K1")).isFalse();
    }
}
