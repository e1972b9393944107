package com.snowman.balance.controller;

import com.snowman.balance.config.BalanceProperties;
import com.snowman.balance.controller.dto.HistoryResponseDto;
import com.snowman.balance.controller.dto.PastBalanceRecordDto;
import com.snowman.balance.model.HistoryPage;
import com.snowman.balance.service.BalanceStore;
import com.snowman.balance.web.RequestContextHolder;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/users/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
public class HistoryController {

    private final BalanceStore balanceStore;
    private final BalanceProperties properties;

    public HistoryController(BalanceStore balanceStore, BalanceProperties properties) {
        this.balanceStore = balanceStore;
        this.properties = properties;
    }

    @PostMapping("/snapshots")
    public ResponseEntity<PastBalanceRecordDto> recordSnapshot(@PathVariable long userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PastBalanceRecordDto.from(balanceStore.recordSnapshot(userId)));
    }

    @GetMapping("/history")
    public HistoryResponseDto history(
            @PathVariable long userId,
            @RequestParam(value = "since", required = false) String since,
            @RequestParam(value = "until", required = false) String until,
            @RequestParam(value = "afterId", required = false, defaultValue = "0") long afterId,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        int pageSize = limit == null ? properties.store().historyPageSize() : limit;
        HistoryPage page = balanceStore.getHistoryPage(userId, parseInstant("since", since), parseInstant("until", until),
                afterId, pageSize);
        return new HistoryResponseDto(
                userId,
                page.records().stream().map(PastBalanceRecordDto::from).toList(),
                page.nextAfterId().orElse(null),
                RequestContextHolder.currentTraceId());
    }

    private Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant, e.g. 2024-01-31T00:00:00Z");
        }
    }
}
