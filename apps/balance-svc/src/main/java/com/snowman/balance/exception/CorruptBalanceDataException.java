package com.snowman.balance.exception;

/**
 * A stored balances document is not a JSON object of numeric amounts.
 * The row is reported, never repaired.
 */
public class CorruptBalanceDataException extends BalanceStoreException {

    public CorruptBalanceDataException(long userId, String currency, String detail, Throwable cause) {
        super("CORRUPT_BALANCE_DATA",
                String.format("Stored balances of user %d are corrupt: %s", userId, detail),
                userId, currency, cause);
    }

    public CorruptBalanceDataException(long userId, String currency, String detail) {
        this(userId, currency, detail, null);
    }
}
