package com.snowman.balance.service;

/**
 * What {@code adjustBalance} does for a user that has no balance row yet.
 */
public enum UnknownUserPolicy {
    /** Open a zero-balance account and apply the adjustment to it. */
    CREATE,
    /** Fail with {@link com.snowman.balance.exception.UnknownUserException}. */
    REJECT
}
