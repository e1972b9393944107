package com.snowman.balance.config;

import com.snowman.balance.service.StorageFailures;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    public static final String RETRY_NAME = "balance-store";

    @Bean
    public TransactionOperations balanceTransactions(PlatformTransactionManager transactionManager,
                                                     BalanceProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setName("balance-store");
        template.setTimeout(properties.store().transactionTimeoutSeconds());
        return template;
    }

    @Bean
    public Retry balanceStoreRetry(BalanceProperties properties) {
        return buildRetry(properties.retry());
    }

    @Bean
    public Clock balanceClock() {
        return Clock.systemUTC();
    }

    public static Retry buildRetry(BalanceProperties.Retry settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.initialBackoff(), settings.multiplier()))
                .retryOnException(StorageFailures::isRetryable)
                .build();
        Retry retry = Retry.of(RETRY_NAME, config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying balance store call (attempt {}) after {}: {}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
