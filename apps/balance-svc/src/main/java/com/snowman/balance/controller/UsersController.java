package com.snowman.balance.controller;

import com.snowman.balance.controller.dto.BalancesResponseDto;
import com.snowman.balance.model.CurrencyBalances;
import com.snowman.balance.service.BalanceStore;
import com.snowman.balance.web.RequestContextHolder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UsersController {

    private final BalanceStore balanceStore;

    public UsersController(BalanceStore balanceStore) {
        this.balanceStore = balanceStore;
    }

    @PutMapping(path = "/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BalancesResponseDto> register(@PathVariable long userId) {
        CurrencyBalances balances = balanceStore.registerUser(userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new BalancesResponseDto(userId, balances.asMap(), RequestContextHolder.currentTraceId()));
    }
}
