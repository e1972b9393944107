package com.snowman.balance.exception;

/**
 * The database could not be reached, timed out, or kept failing transiently after
 * the configured retries. Safe to retry later.
 */
public class StorageUnavailableException extends BalanceStoreException {

    private final String operation;

    public StorageUnavailableException(String operation, long userId, String currency, Throwable cause) {
        super("STORAGE_UNAVAILABLE",
                String.format("Balance storage unavailable during %s for user %d", operation, userId),
                userId, currency, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
