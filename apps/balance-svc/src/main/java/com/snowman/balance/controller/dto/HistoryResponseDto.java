package com.snowman.balance.controller.dto;

import java.util.List;

public record HistoryResponseDto(
        long userId,
        List<PastBalanceRecordDto> records,
        Long nextAfterId,
        String traceId
) {
}
