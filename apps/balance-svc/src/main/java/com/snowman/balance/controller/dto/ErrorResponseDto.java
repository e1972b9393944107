package com.snowman.balance.controller.dto;

import com.snowman.balance.exception.BalanceStoreException;
import com.snowman.balance.exception.InsufficientFundsException;
import com.snowman.balance.exception.StorageUnavailableException;
import com.snowman.balance.web.RequestContextHolder;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body; {@code details} always names the user for store failures, plus the currency
 * and amounts where the failure has them.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public static ErrorResponseDto of(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(code, message, details, RequestContextHolder.currentTraceId());
    }

    public static ErrorResponseDto of(BalanceStoreException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", ex.getUserId());
        if (ex.getCurrency() != null) {
            details.put("currency", ex.getCurrency());
        }
        if (ex instanceof InsufficientFundsException insufficient) {
            details.put("available", insufficient.getAvailable());
            details.put("requested", insufficient.getRequested());
        }
        if (ex instanceof StorageUnavailableException unavailable) {
            details.put("operation", unavailable.getOperation());
            details.put("retryable", true);
        }
        return of(ex.getErrorCode(), ex.getMessage(), details);
    }
}
