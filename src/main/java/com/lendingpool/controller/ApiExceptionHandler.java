package com.lendingpool.controller;

import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Error body: {status, reason, message, ts}. {@code reason} is the lower-case
 * LendingError code so clients can branch on it.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(LendingException.class)
    public ResponseEntity<Map<String, Object>> lending(LendingException ex) {
        HttpStatus status = statusOf(ex.getError());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getError(), ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.getError(), ex.getMessage());
        }
        return body(status, ex.getError().reason(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request",
                ex.getMessage() == null ? "invalid_request" : ex.getMessage());
    }

    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<Map<String, Object>> missingHeader(ServletRequestBindingException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> lockTimeout(PessimisticLockingFailureException ex) {
        log.warn("Lock wait timed out: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "lock_timeout", "Resource busy, retry the request");
    }

    static HttpStatus statusOf(LendingError error) {
        return switch (error) {
            case ZERO_AMOUNT, INVALID_PARAMETER, LOAN_BELOW_MINIMUM, REPAYMENT_EXCEEDS_DEBT -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case ASSET_NOT_SUPPORTED, LOAN_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ASSET_ALREADY_SUPPORTED, LOAN_NOT_ACTIVE, DUPLICATE_REQUEST -> HttpStatus.CONFLICT;
            case STALE_PRICE_DATA, LOW_CONFIDENCE_PRICE, PRICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message == null ? "" : message,
                "ts", Instant.now().toString()
        ));
    }
}
