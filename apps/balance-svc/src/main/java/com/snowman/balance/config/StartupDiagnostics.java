package com.snowman.balance.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final BalanceProperties props;

    public StartupDiagnostics(BalanceProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var store = props.store();
        log.info("Balance store: timestampFormat={}, allowNegative={}, unknownUserPolicy={}, transactionTimeout={}, historyPageSize={}",
                store.timestampFormat(), store.negativeAllowed(), store.unknownUserPolicy(),
                store.transactionTimeout(), store.historyPageSize());
        var retry = props.retry();
        log.info("Balance store retry: maxAttempts={}, initialBackoff={}, multiplier={}",
                retry.maxAttempts(), retry.initialBackoff(), retry.multiplier());
    }
}
