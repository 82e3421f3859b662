package com.fintech.accountreconciliation.controller;

import com.fintech.accountreconciliation.dto.ErrorResponse;
import com.fintech.accountreconciliation.exception.LedgerParseException;
import com.fintech.accountreconciliation.exception.ReconciliationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.LocalDateTime;

/**
 * Maps reconciliation errors to JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(LedgerParseException.class)
    public ResponseEntity<ErrorResponse> handleLedgerParse(LedgerParseException ex) {
        log.warn("Rejected ledger input: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .code("LEDGER_PARSE_ERROR")
                .message(ex.getMessage())
                .source(ex.getSource())
                .line(ex.getLineNumber() > 0 ? ex.getLineNumber() : null)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleValidation(Exception ex) {
        log.warn("Rejected reconciliation request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException ex) {
        log.error("Reconciliation failed", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .occurredAt(LocalDateTime.now())
                .build());
    }
}
