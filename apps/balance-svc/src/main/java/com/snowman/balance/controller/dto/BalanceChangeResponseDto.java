package com.snowman.balance.controller.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record BalanceChangeResponseDto(
        long userId,
        Map<String, BigDecimal> balances,
        long historyId,
        Instant changed,
        String traceId
) {
}
