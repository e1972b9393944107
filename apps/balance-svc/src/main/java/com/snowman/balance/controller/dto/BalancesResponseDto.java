package com.snowman.balance.controller.dto;

import java.math.BigDecimal;
import java.util.Map;

public record BalancesResponseDto(long userId, Map<String, BigDecimal> balances, String traceId) {
}
