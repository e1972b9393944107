package com.snowman.balance.controller;

import com.snowman.balance.controller.dto.ErrorResponseDto;
import com.snowman.balance.exception.BalanceStoreException;
import com.snowman.balance.exception.ConcurrentUpdateConflictException;
import com.snowman.balance.exception.InsufficientFundsException;
import com.snowman.balance.exception.StorageUnavailableException;
import com.snowman.balance.exception.UnknownUserException;
import com.snowman.balance.exception.UserAlreadyExistsException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request", Map.of("reason", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(BalanceStoreException.class)
    public ResponseEntity<ErrorResponseDto> handleBalanceStore(BalanceStoreException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Balance store failure for user {}", ex.getUserId(), ex);
        }
        return ResponseEntity.status(status).body(ErrorResponseDto.of(ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private HttpStatus statusOf(BalanceStoreException ex) {
        if (ex instanceof StorageUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (ex instanceof UnknownUserException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof InsufficientFundsException
                || ex instanceof UserAlreadyExistsException
                || ex instanceof ConcurrentUpdateConflictException) {
            return HttpStatus.CONFLICT;
        }
        // corrupt rows and anything unforeseen
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(ErrorResponseDto.of(code, message, details));
    }
}
