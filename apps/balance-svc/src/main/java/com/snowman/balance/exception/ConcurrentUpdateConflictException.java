package com.snowman.balance.exception;

/**
 * Another transaction won a race on the same user row. Retried by the store
 * before it ever reaches a caller.
 */
public class ConcurrentUpdateConflictException extends BalanceStoreException {

    public ConcurrentUpdateConflictException(long userId, String currency) {
        super("CONCURRENT_UPDATE_CONFLICT",
                String.format("Balance row of user %d changed concurrently", userId),
                userId, currency, null);
    }
}
