package com.snowman.balance.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable currency code to amount mapping of one user at one point in time.
 * Amounts are kept without trailing zeros so that {@code 100} and {@code 100.00} compare equal,
 * and are limited to {@value #MAX_INTEGER_DIGITS} integer and {@value #MAX_FRACTION_DIGITS} fraction digits.
 */
public final class CurrencyBalances {

    public static final int MAX_INTEGER_DIGITS = 64;
    public static final int MAX_FRACTION_DIGITS = 32;

    private static final CurrencyBalances EMPTY = new CurrencyBalances(new TreeMap<>());

    private final SortedMap<String, BigDecimal> amounts;

    private CurrencyBalances(SortedMap<String, BigDecimal> amounts) {
        this.amounts = amounts;
    }

    public static CurrencyBalances empty() {
        return EMPTY;
    }

    public static CurrencyBalances of(Map<String, BigDecimal> amounts) {
        Objects.requireNonNull(amounts, "amounts");
        if (amounts.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, BigDecimal> copy = new TreeMap<>();
        amounts.forEach((currency, amount) -> {
            Objects.requireNonNull(currency, "currency");
            Objects.requireNonNull(amount, () -> "amount for " + currency);
            copy.put(currency, normalize(amount));
        });
        return new CurrencyBalances(copy);
    }

    /**
     * Amount held in {@code currency}; a currency that was never written reads as zero.
     */
    public BigDecimal amountOf(String currency) {
        return amounts.getOrDefault(currency, BigDecimal.ZERO);
    }

    public CurrencyBalances with(String currency, BigDecimal amount) {
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(amount, "amount");
        TreeMap<String, BigDecimal> copy = new TreeMap<>(amounts);
        copy.put(currency, normalize(amount));
        return new CurrencyBalances(copy);
    }

    public Map<String, BigDecimal> asMap() {
        return Collections.unmodifiableSortedMap(amounts);
    }

    public boolean isEmpty() {
        return amounts.isEmpty();
    }

    public int size() {
        return amounts.size();
    }

    /**
     * Whether {@code amount} fits the supported digit limits. Only looks at precision and scale,
     * so a value like {@code 1e999999999} is refused without being expanded.
     */
    public static boolean inRange(BigDecimal amount) {
        if (amount.signum() == 0) {
            return true;
        }
        long integerDigits = (long) amount.precision() - amount.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            return false;
        }
        return amount.stripTrailingZeros().scale() <= MAX_FRACTION_DIGITS;
    }

    static BigDecimal normalize(BigDecimal amount) {
        if (amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (!inRange(amount)) {
            throw new IllegalArgumentException("amount out of range: at most " + MAX_INTEGER_DIGITS
                    + " integer and " + MAX_FRACTION_DIGITS + " fraction digits are supported");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CurrencyBalances other)) return false;
        return amounts.equals(other.amounts);
    }

    @Override
    public int hashCode() {
        return amounts.hashCode();
    }

    @Override
    public String toString() {
        return amounts.toString();
    }
}
