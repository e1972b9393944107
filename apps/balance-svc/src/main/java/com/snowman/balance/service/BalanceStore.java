package com.snowman.balance.service;

import com.snowman.balance.config.BalanceProperties;
import com.snowman.balance.exception.ConcurrentUpdateConflictException;
import com.snowman.balance.exception.InsufficientFundsException;
import com.snowman.balance.exception.StorageUnavailableException;
import com.snowman.balance.exception.UnknownUserException;
import com.snowman.balance.exception.UserAlreadyExistsException;
import com.snowman.balance.model.CurrencyBalances;
import com.snowman.balance.model.HistoryPage;
import com.snowman.balance.model.PastBalanceRecord;
import com.snowman.balance.repository.BalanceRepository;
import io.github.resilience4j.retry.Retry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Reads and mutates per-user currency balances. Every mutation and the history record
 * describing its outcome commit in one transaction, serialized per user by the row lock
 * on {@code current_balance}.
 */
@Service
public class BalanceStore {

    private static final Logger log = LoggerFactory.getLogger(BalanceStore.class);

    static final long MAX_USER_ID = 4_294_967_295L;
    static final int MAX_CURRENCY_LENGTH = 32;

    private final BalanceRepository repository;
    private final TransactionOperations transactions;
    private final Retry retry;
    private final Clock clock;
    private final BalanceProperties.Store settings;

    public BalanceStore(
            BalanceRepository repository,
            TransactionOperations transactions,
            Retry retry,
            Clock clock,
            BalanceProperties properties
    ) {
        this.repository = repository;
        this.transactions = transactions;
        this.retry = retry;
        this.clock = clock;
        this.settings = properties.store();
    }

    /**
     * Current balances of the user; an unknown user reads as an empty mapping.
     */
    public CurrencyBalances getCurrentBalance(long userId) {
        requireUserId(userId);
        return withRetry("getCurrentBalance", userId, null,
                () -> repository.findBalances(userId).orElse(CurrencyBalances.empty()));
    }

    /**
     * Opens an empty account for the user.
     *
     * @throws UserAlreadyExistsException if the user already has a balance row
     */
    public CurrencyBalances registerUser(long userId) {
        requireUserId(userId);
        inTransaction("registerUser", userId, null, status -> {
            if (!repository.insertEmpty(userId)) {
                throw new UserAlreadyExistsException(userId);
            }
            return null;
        });
        log.info("Registered balance account for user {}", userId);
        return CurrencyBalances.empty();
    }

    /**
     * Sets one currency to {@code amount}, creating the account if needed. Other currencies
     * are left untouched.
     *
     * @return the history record written for this change
     */
    public PastBalanceRecord setBalance(long userId, String currency, BigDecimal amount) {
        requireUserId(userId);
        String code = requireCurrency(currency);
        requireAmount("amount", amount);
        if (!settings.negativeAllowed() && amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount.toPlainString());
        }
        PastBalanceRecord record = inTransaction("setBalance", userId, code, status -> {
            CurrencyBalances current = lockOrCreate(userId, code);
            return commit(userId, current.with(code, amount));
        });
        log.debug("Set {} of user {} to {} (history id {})", code, userId, amount, record.id());
        return record;
    }

    /**
     * Adds {@code delta} to one currency; a currency the user never held counts as zero.
     *
     * @return the history record written for this change
     * @throws InsufficientFundsException if negative balances are disallowed and the result would be negative
     * @throws UnknownUserException if the user has no account and unknown users are rejected
     */
    public PastBalanceRecord adjustBalance(long userId, String currency, BigDecimal delta) {
        requireUserId(userId);
        String code = requireCurrency(currency);
        requireAmount("delta", delta);
        PastBalanceRecord record = inTransaction("adjustBalance", userId, code, status -> {
            CurrencyBalances current = settings.unknownUserPolicy() == UnknownUserPolicy.CREATE
                    ? lockOrCreate(userId, code)
                    : repository.lockBalances(userId).orElseThrow(() -> new UnknownUserException(userId, code));
            BigDecimal available = current.amountOf(code);
            BigDecimal result = available.add(delta);
            requireAmount("resulting balance", result);
            if (!settings.negativeAllowed() && result.signum() < 0) {
                log.info("Rejected adjustment of {} {} for user {}: only {} available", delta, code, userId, available);
                throw new InsufficientFundsException(userId, code, available, delta);
            }
            return commit(userId, current.with(code, result));
        });
        log.debug("Adjusted {} of user {} by {} (history id {})", code, userId, delta, record.id());
        return record;
    }

    /**
     * Appends a history record holding the user's present balances.
     *
     * @throws UnknownUserException if the user has no account
     */
    public PastBalanceRecord recordSnapshot(long userId) {
        requireUserId(userId);
        return inTransaction("recordSnapshot", userId, null, status -> {
            CurrencyBalances current = repository.lockBalances(userId)
                    .orElseThrow(() -> new UnknownUserException(userId, null));
            return appendSnapshot(userId, current);
        });
    }

    /**
     * History of the user, oldest first, optionally restricted to records whose
     * {@code changed} lies within {@code [since, until]}. Either bound may be {@code null}.
     */
    public BalanceHistory getHistory(long userId, Instant since, Instant until) {
        requireUserId(userId);
        requireWindow(since, until);
        return new BalanceHistory(
                (afterId, limit) -> withRetry("getHistory", userId, null,
                        () -> repository.findHistory(userId, since, until, afterId, limit)),
                settings.historyPageSize());
    }

    public HistoryPage getHistoryPage(long userId, Instant since, Instant until, long afterId, int limit) {
        requireUserId(userId);
        requireWindow(since, until);
        if (afterId < 0) {
            throw new IllegalArgumentException("afterId must not be negative");
        }
        if (limit <= 0 || limit > settings.maxHistoryPageSize()) {
            throw new IllegalArgumentException("limit must be between 1 and " + settings.maxHistoryPageSize());
        }
        return HistoryPage.of(
                withRetry("getHistory", userId, null,
                        () -> repository.findHistory(userId, since, until, afterId, limit)),
                limit);
    }

    private CurrencyBalances lockOrCreate(long userId, String currency) {
        var locked = repository.lockBalances(userId);
        if (locked.isPresent()) {
            return locked.get();
        }
        if (repository.insertEmpty(userId)) {
            log.debug("Opened balance account for user {}", userId);
        }
        return repository.lockBalances(userId)
                .orElseThrow(() -> new ConcurrentUpdateConflictException(userId, currency));
    }

    private PastBalanceRecord commit(long userId, CurrencyBalances updated) {
        repository.updateBalances(userId, updated);
        return appendSnapshot(userId, updated);
    }

    private PastBalanceRecord appendSnapshot(long userId, CurrencyBalances balances) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        // never earlier than the user's previous record, whatever the clock says
        Instant changed = repository.findLatestChange(userId)
                .filter(latest -> latest.isAfter(now))
                .orElse(now);
        return repository.appendHistory(userId, balances, changed);
    }

    private <T> T inTransaction(String operation, long userId, String currency, TransactionCallback<T> work) {
        return withRetry(operation, userId, currency, () -> transactions.execute(work));
    }

    private <T> T withRetry(String operation, long userId, String currency, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (RuntimeException ex) {
            if (StorageFailures.isUnavailable(ex)) {
                log.warn("Balance storage unavailable during {} for user {}: {}", operation, userId, ex.getMessage());
                throw new StorageUnavailableException(operation, userId, currency, ex);
            }
            throw ex;
        }
    }

    private static void requireUserId(long userId) {
        if (userId < 0 || userId > MAX_USER_ID) {
            throw new IllegalArgumentException("userId must be an unsigned 32-bit integer: " + userId);
        }
    }

    private static String requireCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("currency must be provided");
        }
        String code = currency.trim();
        if (code.length() > MAX_CURRENCY_LENGTH) {
            throw new IllegalArgumentException("currency must be at most " + MAX_CURRENCY_LENGTH + " characters");
        }
        return code;
    }

    private static void requireAmount(String name, BigDecimal value) {
        Objects.requireNonNull(value, name);
        if (!CurrencyBalances.inRange(value)) {
            throw new IllegalArgumentException(name + " must have at most " + CurrencyBalances.MAX_INTEGER_DIGITS
                    + " integer and " + CurrencyBalances.MAX_FRACTION_DIGITS + " fraction digits");
        }
    }

    private static void requireWindow(Instant since, Instant until) {
        if (since != null && until != null && since.isAfter(until)) {
            throw new IllegalArgumentException("since must not be after until");
        }
    }
}
