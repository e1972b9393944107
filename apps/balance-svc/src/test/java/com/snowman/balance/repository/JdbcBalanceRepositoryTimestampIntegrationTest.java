package com.snowman.balance.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.snowman.balance.model.CurrencyBalances;
import com.snowman.balance.model.PastBalanceRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionOperations;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Repository against the TIMESTAMPTZ schema variant.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JdbcBalanceRepositoryTimestampIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("snowman_ts")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("balance.db.bootstrap-enabled", () -> "true");
        registry.add("balance.store.timestamp-format", () -> "TIMESTAMP");
    }

    @Autowired
    private JdbcBalanceRepository repository;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private TransactionOperations transactions;

    @BeforeEach
    void setUp() {
        jdbc.execute("TRUNCATE current_balance, past_balance RESTART IDENTITY");
    }

    @Test
    void changedColumnIsATimestamp() {
        String type = jdbc.queryForObject(
                "SELECT data_type FROM information_schema.columns WHERE table_name = 'past_balance' AND column_name = 'changed'",
                String.class);

        assertThat(type).isEqualTo("timestamp with time zone");
    }

    @Test
    void insertEmptyReportsExistingRow() {
        assertThat(repository.insertEmpty(3)).isTrue();
        assertThat(repository.insertEmpty(3)).isFalse();
        assertThat(repository.findBalances(3)).contains(CurrencyBalances.empty());
    }

    @Test
    void historyRoundTripsInstantsAndFiltersByWindow() {
        CurrencyBalances balances = CurrencyBalances.of(Map.of("gold", new BigDecimal("12.5")));
        transactions.executeWithoutResult(status -> {
            repository.insertEmpty(4);
            repository.updateBalances(4, balances);
            for (int i = 0; i < 3; i++) {
                repository.appendHistory(4, balances, T0.plusSeconds(i));
            }
        });

        List<PastBalanceRecord> all = repository.findHistory(4, null, null, 0, 10);
        assertThat(all).extracting(PastBalanceRecord::changed)
                .containsExactly(T0, T0.plusSeconds(1), T0.plusSeconds(2));
        assertThat(all.get(0).balances()).isEqualTo(balances);
        assertThat(repository.findLatestChange(4)).contains(T0.plusSeconds(2));
        assertThat(repository.findHistory(4, T0.plusSeconds(1), T0.plusSeconds(1), 0, 10)).hasSize(1);
        assertThat(repository.findHistory(4, null, null, all.get(1).id(), 10)).hasSize(1);
        assertThat(repository.findLatestChange(5)).isEmpty();
    }
}
