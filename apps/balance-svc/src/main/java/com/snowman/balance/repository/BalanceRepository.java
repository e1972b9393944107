package com.snowman.balance.repository;

import com.snowman.balance.model.CurrencyBalances;
import com.snowman.balance.model.PastBalanceRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Row-level access to {@code current_balance} and {@code past_balance}.
 * Methods that lock or write expect to run inside the caller's transaction.
 */
public interface BalanceRepository {

    Optional<CurrencyBalances> findBalances(long userId);

    /**
     * Reads the user's row and holds a write lock on it until the surrounding transaction ends.
     */
    Optional<CurrencyBalances> lockBalances(long userId);

    /**
     * Inserts an empty balances row.
     *
     * @return {@code false} when a row for the user already exists
     */
    boolean insertEmpty(long userId);

    void updateBalances(long userId, CurrencyBalances balances);

    Optional<Instant> findLatestChange(long userId);

    PastBalanceRecord appendHistory(long userId, CurrencyBalances balances, Instant changed);

    /**
     * History rows with {@code id > afterId}, optionally bounded (inclusive) on {@code changed},
     * ascending by id.
     */
    List<PastBalanceRecord> findHistory(long userId, Instant since, Instant until, long afterId, int limit);
}
