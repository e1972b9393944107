package com.snowman.balance.controller;

import com.snowman.balance.controller.dto.AdjustBalanceRequestDto;
import com.snowman.balance.controller.dto.BalanceChangeResponseDto;
import com.snowman.balance.controller.dto.BalancesResponseDto;
import com.snowman.balance.controller.dto.SetBalanceRequestDto;
import com.snowman.balance.model.PastBalanceRecord;
import com.snowman.balance.service.BalanceStore;
import com.snowman.balance.web.RequestContextHolder;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/users/{userId}/balances", produces = MediaType.APPLICATION_JSON_VALUE)
public class BalancesController {

    private final BalanceStore balanceStore;

    public BalancesController(BalanceStore balanceStore) {
        this.balanceStore = balanceStore;
    }

    @GetMapping
    public BalancesResponseDto getBalances(@PathVariable long userId) {
        return new BalancesResponseDto(
                userId,
                balanceStore.getCurrentBalance(userId).asMap(),
                RequestContextHolder.currentTraceId());
    }

    @PutMapping("/{currency}")
    public BalanceChangeResponseDto setBalance(
            @PathVariable long userId,
            @PathVariable String currency,
            @Valid @RequestBody SetBalanceRequestDto request
    ) {
        return toResponse(balanceStore.setBalance(userId, currency, request.amount()));
    }

    @PostMapping("/{currency}/adjustments")
    public BalanceChangeResponseDto adjustBalance(
            @PathVariable long userId,
            @PathVariable String currency,
            @Valid @RequestBody AdjustBalanceRequestDto request
    ) {
        return toResponse(balanceStore.adjustBalance(userId, currency, request.delta()));
    }

    private BalanceChangeResponseDto toResponse(PastBalanceRecord record) {
        return new BalanceChangeResponseDto(
                record.userId(),
                record.balances().asMap(),
                record.id(),
                record.changed(),
                RequestContextHolder.currentTraceId());
    }
}
