package com.snowman.balance.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record AdjustBalanceRequestDto(@NotNull BigDecimal delta) {
}
