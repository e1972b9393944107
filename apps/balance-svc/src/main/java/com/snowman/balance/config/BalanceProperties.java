package com.snowman.balance.config;

import com.snowman.balance.repository.TimestampFormat;
import com.snowman.balance.service.UnknownUserPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "balance")
public record BalanceProperties(
        Store store,
        Retry retry
) {

    @ConstructorBinding
    public BalanceProperties {
        if (store == null) {
            store = new Store(null, null, null, null, null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null);
        }
    }

    public record Store(
            TimestampFormat timestampFormat,
            Boolean allowNegative,
            UnknownUserPolicy unknownUserPolicy,
            Duration transactionTimeout,
            Integer historyPageSize,
            Integer maxHistoryPageSize
    ) {
        public Store {
            if (timestampFormat == null) timestampFormat = TimestampFormat.EPOCH_MILLIS;
            if (allowNegative == null) allowNegative = false;
            if (unknownUserPolicy == null) unknownUserPolicy = UnknownUserPolicy.CREATE;
            if (transactionTimeout == null) transactionTimeout = Duration.ofSeconds(5);
            if (historyPageSize == null) historyPageSize = 100;
            if (maxHistoryPageSize == null) maxHistoryPageSize = 1000;
            if (transactionTimeout.isNegative() || transactionTimeout.isZero()) {
                throw new IllegalArgumentException("transactionTimeout must be positive");
            }
            if (historyPageSize <= 0) {
                throw new IllegalArgumentException("historyPageSize must be positive");
            }
            if (maxHistoryPageSize < historyPageSize) {
                throw new IllegalArgumentException("maxHistoryPageSize must be >= historyPageSize");
            }
        }

        public boolean negativeAllowed() {
            return allowNegative;
        }

        /**
         * Transaction timeout in whole seconds, the granularity Spring transactions accept.
         */
        public int transactionTimeoutSeconds() {
            return (int) Math.max(1, transactionTimeout.toSeconds());
        }
    }

    public record Retry(Integer maxAttempts, Duration initialBackoff, Double multiplier) {
        public Retry {
            if (maxAttempts == null) maxAttempts = 3;
            if (initialBackoff == null) initialBackoff = Duration.ofMillis(50);
            if (multiplier == null) multiplier = 2.0;
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
            if (initialBackoff.isNegative() || initialBackoff.isZero()) {
                throw new IllegalArgumentException("initialBackoff must be positive");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
        }
    }
}
