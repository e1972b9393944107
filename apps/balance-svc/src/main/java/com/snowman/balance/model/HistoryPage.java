package com.snowman.balance.model;

import java.util.List;
import java.util.Optional;

public record HistoryPage(List<PastBalanceRecord> records, Optional<Long> nextAfterId) {

    public static HistoryPage of(List<PastBalanceRecord> records, int limit) {
        if (records.size() < limit || records.isEmpty()) {
            return new HistoryPage(List.copyOf(records), Optional.empty());
        }
        return new HistoryPage(List.copyOf(records), Optional.of(records.get(records.size() - 1).id()));
    }
}
