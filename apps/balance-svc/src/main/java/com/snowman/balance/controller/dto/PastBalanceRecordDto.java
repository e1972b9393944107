package com.snowman.balance.controller.dto;

import com.snowman.balance.model.PastBalanceRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record PastBalanceRecordDto(long id, long userId, Map<String, BigDecimal> balances, Instant changed) {

    public static PastBalanceRecordDto from(PastBalanceRecord record) {
        return new PastBalanceRecordDto(record.id(), record.userId(), record.balances().asMap(), record.changed());
    }
}
