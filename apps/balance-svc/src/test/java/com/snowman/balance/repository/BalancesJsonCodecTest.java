package com.snowman.balance.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snowman.balance.exception.CorruptBalanceDataException;
import com.snowman.balance.model.CurrencyBalances;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BalancesJsonCodecTest {

    private final BalancesJsonCodec codec = new BalancesJsonCodec(new ObjectMapper());

    @Test
    void readsCurrencyObject() {
        CurrencyBalances balances = codec.read(1, "{\"gold\": 120, \"gems\": 3}");

        assertThat(balances.asMap()).containsOnlyKeys("gold", "gems");
        assertThat(balances.amountOf("gold")).isEqualByComparingTo("120");
        assertThat(balances.amountOf("gems")).isEqualByComparingTo("3");
    }

    @Test
    void emptyObjectIsEmptyMapping() {
        assertThat(codec.read(1, "{}").isEmpty()).isTrue();
    }

    @Test
    void keepsDecimalPrecision() {
        CurrencyBalances balances = codec.read(1, "{\"btc\": 0.123456789012345678901}");

        assertThat(balances.amountOf("btc")).isEqualByComparingTo(new BigDecimal("0.123456789012345678901"));
    }

    @Test
    void writesPlainSortedNumbers() {
        String json = codec.write(CurrencyBalances.of(Map.of(
                "gold", new BigDecimal("1E+3"),
                "dust", new BigDecimal("0.00000001"))));

        assertThat(json).isEqualTo("{\"dust\":0.00000001,\"gold\":1000}");
    }

    @Test
    void nonNumericAmountIsCorrupt() {
        assertThatThrownBy(() -> codec.read(5, "{\"gold\": \"lots\"}"))
                .isInstanceOfSatisfying(CorruptBalanceDataException.class, ex -> {
                    assertThat(ex.getUserId()).isEqualTo(5);
                    assertThat(ex.getCurrency()).isEqualTo("gold");
                });
    }

    @Test
    void amountBeyondSupportedDigitsIsCorrupt() {
        assertThatThrownBy(() -> codec.read(6, "{\"gems\": 1, \"gold\": 1e999999999}"))
                .isInstanceOfSatisfying(CorruptBalanceDataException.class, ex -> {
                    assertThat(ex.getUserId()).isEqualTo(6);
                    assertThat(ex.getCurrency()).isEqualTo("gold");
                });
        assertThatThrownBy(() -> codec.read(6, "{\"dust\": 1e-40}"))
                .isInstanceOf(CorruptBalanceDataException.class);
    }

    @Test
    void nonObjectDocumentsAreCorrupt() {
        assertThatThrownBy(() -> codec.read(5, "[1, 2]")).isInstanceOf(CorruptBalanceDataException.class);
        assertThatThrownBy(() -> codec.read(5, "{\"gold\": ")).isInstanceOf(CorruptBalanceDataException.class);
        assertThatThrownBy(() -> codec.read(5, "")).isInstanceOf(CorruptBalanceDataException.class);
        assertThatThrownBy(() -> codec.read(5, "{\"gold\": null}")).isInstanceOf(CorruptBalanceDataException.class);
    }
}
