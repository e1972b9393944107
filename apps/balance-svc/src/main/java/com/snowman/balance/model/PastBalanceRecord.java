package com.snowman.balance.model;

import java.time.Instant;

/**
 * One immutable row of the balance history.
 */
public record PastBalanceRecord(
        long id,
        long userId,
        CurrencyBalances balances,
        Instant changed
) {
}
