package com.snowman.balance.exception;

public class UnknownUserException extends BalanceStoreException {

    public UnknownUserException(long userId, String currency) {
        super("UNKNOWN_USER", String.format("User %d has no balance account", userId), userId, currency, null);
    }
}
