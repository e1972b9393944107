package com.snowman.balance.exception;

import java.math.BigDecimal;

public class InsufficientFundsException extends BalanceStoreException {

    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(long userId, String currency, BigDecimal available, BigDecimal requested) {
        super("INSUFFICIENT_FUNDS",
                String.format("User %d holds %s %s, cannot apply %s", userId, available.toPlainString(), currency, requested.toPlainString()),
                userId, currency, null);
        this.available = available;
        this.requested = requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
