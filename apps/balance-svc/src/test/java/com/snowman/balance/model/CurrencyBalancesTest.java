package com.snowman.balance.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CurrencyBalancesTest {

    @Test
    void missingCurrencyReadsAsZero() {
        assertThat(CurrencyBalances.empty().amountOf("gold")).isEqualByComparingTo("0");
        assertThat(CurrencyBalances.empty().asMap()).doesNotContainKey("gold");
    }

    @Test
    void withReturnsUpdatedCopy() {
        CurrencyBalances original = CurrencyBalances.of(Map.of("gold", BigDecimal.TEN));

        CurrencyBalances updated = original.with("gems", BigDecimal.ONE);

        assertThat(original.size()).isEqualTo(1);
        assertThat(updated.asMap()).containsOnlyKeys("gems", "gold");
    }

    @Test
    void equalityIgnoresScale() {
        assertThat(CurrencyBalances.of(Map.of("gold", new BigDecimal("100.00"))))
                .isEqualTo(CurrencyBalances.of(Map.of("gold", new BigDecimal("100"))))
                .hasSameHashCodeAs(CurrencyBalances.of(Map.of("gold", new BigDecimal("1E+2"))));
    }

    @Test
    void viewIsReadOnly() {
        CurrencyBalances balances = CurrencyBalances.of(Map.of("gold", BigDecimal.TEN));

        assertThatThrownBy(() -> balances.asMap().put("gems", BigDecimal.ONE))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void hugeExponentsAreRefusedWithoutExpansion() {
        assertThatThrownBy(() -> CurrencyBalances.of(Map.of("gold", new BigDecimal("1e99999999"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CurrencyBalances.empty().with("gold", new BigDecimal("1e-33")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rangeCountsSignificantDigitsOnly() {
        assertThat(CurrencyBalances.inRange(new BigDecimal("9".repeat(64)))).isTrue();
        assertThat(CurrencyBalances.inRange(new BigDecimal("1" + "0".repeat(64)))).isFalse();
        assertThat(CurrencyBalances.inRange(new BigDecimal("0.5000000000000000000000000000000000000000"))).isTrue();
        assertThat(CurrencyBalances.inRange(new BigDecimal("0E+999999999"))).isTrue();
        assertThat(CurrencyBalances.of(Map.of("gold", new BigDecimal("0E+999999999"))).amountOf("gold"))
                .isEqualByComparingTo("0");
    }
}
