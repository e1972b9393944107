package com.snowman.balance.repository;

import com.snowman.balance.config.BalanceProperties;
import com.snowman.balance.model.CurrencyBalances;
import com.snowman.balance.model.PastBalanceRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcBalanceRepository implements BalanceRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final BalancesJsonCodec codec;
    private final TimestampFormat timestampFormat;

    public JdbcBalanceRepository(NamedParameterJdbcTemplate jdbcTemplate,
                                 BalancesJsonCodec codec,
                                 BalanceProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.timestampFormat = properties.store().timestampFormat();
    }

    @Override
    public Optional<CurrencyBalances> findBalances(long userId) {
        return selectBalances(userId, "SELECT balances FROM current_balance WHERE user_id = :userId");
    }

    @Override
    public Optional<CurrencyBalances> lockBalances(long userId) {
        return selectBalances(userId, "SELECT balances FROM current_balance WHERE user_id = :userId FOR UPDATE");
    }

    private Optional<CurrencyBalances> selectBalances(long userId, String sql) {
        List<String> rows = jdbcTemplate.query(sql,
                new MapSqlParameterSource("userId", userId),
                (rs, rowNum) -> rs.getString("balances"));
        return rows.stream().findFirst().map(json -> codec.read(userId, json));
    }

    @Override
    public boolean insertEmpty(long userId) {
        // Waits on a concurrent uncommitted insert of the same key instead of failing the transaction.
        int inserted = jdbcTemplate.update("""
                INSERT INTO current_balance (user_id)
                VALUES (:userId)
                ON CONFLICT (user_id) DO NOTHING
                """, new MapSqlParameterSource("userId", userId));
        return inserted == 1;
    }

    @Override
    public void updateBalances(long userId, CurrencyBalances balances) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("balances", codec.write(balances));
        int updated = jdbcTemplate.update(
                "UPDATE current_balance SET balances = CAST(:balances AS jsonb) WHERE user_id = :userId",
                params);
        if (updated != 1) {
            throw new IllegalStateException("Expected to update exactly one balance row for user " + userId + " but updated " + updated);
        }
    }

    @Override
    public Optional<Instant> findLatestChange(long userId) {
        List<Instant> latest = jdbcTemplate.query(
                "SELECT max(changed) AS changed FROM past_balance WHERE user_id = :userId",
                new MapSqlParameterSource("userId", userId),
                (rs, rowNum) -> timestampFormat.fromColumn(rs, "changed"));
        return latest.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public PastBalanceRecord appendHistory(long userId, CurrencyBalances balances, Instant changed) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("balances", codec.write(balances))
                .addValue("changed", timestampFormat.toColumn(changed));
        Long id = jdbcTemplate.queryForObject("""
                INSERT INTO past_balance (user_id, balances, changed)
                VALUES (:userId, CAST(:balances AS jsonb), :changed)
                RETURNING id
                """, params, Long.class);
        if (id == null) {
            throw new IllegalStateException("No id returned for history record of user " + userId);
        }
        return new PastBalanceRecord(id, userId, balances, changed);
    }

    @Override
    public List<PastBalanceRecord> findHistory(long userId, Instant since, Instant until, long afterId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("afterId", afterId)
                .addValue("limit", limit);
        StringBuilder sql = new StringBuilder("""
                SELECT id, user_id, balances, changed
                FROM past_balance
                WHERE user_id = :userId
                  AND id > :afterId
                """);
        if (since != null) {
            sql.append("  AND changed >= :since\n");
            params.addValue("since", timestampFormat.toColumn(since));
        }
        if (until != null) {
            sql.append("  AND changed <= :until\n");
            params.addValue("until", timestampFormat.toColumn(until));
        }
        sql.append("ORDER BY id ASC\n");
        sql.append("LIMIT :limit\n");
        return jdbcTemplate.query(sql.toString(), params, this::mapRecord);
    }

    private PastBalanceRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        long userId = rs.getLong("user_id");
        return new PastBalanceRecord(
                rs.getLong("id"),
                userId,
                codec.read(userId, rs.getString("balances")),
                timestampFormat.fromColumn(rs, "changed"));
    }
}
