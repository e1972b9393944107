package com.snowman.balance.config;

import static org.junit.jupiter.api.Assertions.*;

import com.snowman.balance.repository.TimestampFormat;
import com.snowman.balance.service.UnknownUserPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BalancePropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        BalanceProperties props = new BalanceProperties(null, null);

        assertEquals(TimestampFormat.EPOCH_MILLIS, props.store().timestampFormat());
        assertFalse(props.store().negativeAllowed());
        assertEquals(UnknownUserPolicy.CREATE, props.store().unknownUserPolicy());
        assertEquals(5, props.store().transactionTimeoutSeconds());
        assertEquals(3, props.retry().maxAttempts());
    }

    @Test
    void subSecondTimeoutRoundsUpToOneSecond() {
        BalanceProperties.Store store = new BalanceProperties.Store(null, null, null, Duration.ofMillis(300), null, null);

        assertEquals(1, store.transactionTimeoutSeconds());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new BalanceProperties.Store(null, null, null, Duration.ZERO, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new BalanceProperties.Store(null, null, null, null, 50, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new BalanceProperties.Retry(0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new BalanceProperties.Retry(null, null, 0.5));
    }
}
