package com.snowman.balance.service;

import com.snowman.balance.exception.ConcurrentUpdateConflictException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Classifies failures coming out of the JDBC and transaction layers.
 */
public final class StorageFailures {

    private StorageFailures() {
    }

    /**
     * Failures worth another attempt: lost connections, lock and query timeouts,
     * deadlock victims and lost creation races.
     */
    public static boolean isRetryable(Throwable failure) {
        return failure instanceof TransientDataAccessException
                || failure instanceof RecoverableDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof CannotCreateTransactionException
                || failure instanceof ConcurrentUpdateConflictException;
    }

    /**
     * Failures that mean the engine is unreachable or too slow, reported as storage unavailability.
     */
    public static boolean isUnavailable(Throwable failure) {
        return failure instanceof TransientDataAccessException
                || failure instanceof RecoverableDataAccessException
                || failure instanceof DataAccessResourceFailureException
                || failure instanceof CannotCreateTransactionException
                || failure instanceof TransactionTimedOutException;
    }
}
