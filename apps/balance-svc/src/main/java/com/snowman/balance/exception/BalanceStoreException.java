package com.snowman.balance.exception;

/**
 * Base type of every failure surfaced by the balance store. Carries the user and,
 * where one was involved, the currency the failing operation was working on.
 */
public abstract class BalanceStoreException extends RuntimeException {

    private final String errorCode;
    private final long userId;
    private final String currency;

    protected BalanceStoreException(String errorCode, String message, long userId, String currency, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.userId = userId;
        this.currency = currency;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public long getUserId() {
        return userId;
    }

    /**
     * @return the currency involved, or {@code null} for whole-account operations
     */
    public String getCurrency() {
        return currency;
    }
}
