package com.snowman.balance.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record SetBalanceRequestDto(@NotNull BigDecimal amount) {
}
