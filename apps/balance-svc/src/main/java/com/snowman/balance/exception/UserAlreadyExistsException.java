package com.snowman.balance.exception;

public class UserAlreadyExistsException extends BalanceStoreException {

    public UserAlreadyExistsException(long userId) {
        super("USER_ALREADY_EXISTS", String.format("User %d is already registered", userId), userId, null, null);
    }
}
