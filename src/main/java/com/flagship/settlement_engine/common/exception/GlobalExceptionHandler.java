package com.flagship.settlement_engine.common.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders every failure as {@code {error, code, message, details, timestamp}}
 * where {@code error} is always an {@link ErrorCode} name.
 *
 * Client mistakes log at INFO or WARN; only the catch-all logs a stack trace.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ErrorResponse> handleSettlementException(SettlementException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.warn("Settlement operation failed: code={}, message={}", code, e.getMessage());
        } else {
            log.info("Settlement request rejected: code={}, message={}", code, e.getMessage());
        }
        return respond(code, e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(ErrorCode.INVALID_REQUEST, "Required header '" + e.getHeaderName() + "' is missing",
            Map.of("header", e.getHeaderName()));
    }

    /**
     * Details are keyed by the offending field, first message wins.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fields = new TreeMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> fields.putIfAbsent(error.getField(),
            error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));
        log.warn("Validation failed on {}", fields.keySet());
        return respond(ErrorCode.INVALID_REQUEST, "Request validation failed", fields);
    }

    /**
     * A path variable or header that does not parse, typically a malformed UUID.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Unparseable parameter {}: {}", e.getName(), e.getValue());
        return respond(ErrorCode.INVALID_REQUEST, "Parameter '" + e.getName() + "' has an invalid value",
            Map.of(e.getName(), String.valueOf(e.getValue())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.INVALID_REQUEST, "Request body is missing or malformed", Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(ErrorCode.INVALID_REQUEST, e.getMessage(), Map.of());
    }

    /**
     * An illegal state-machine transition that no service translated.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Illegal transition: {}", e.getMessage());
        return respond(ErrorCode.CONCURRENT_CHANGE, e.getMessage(), Map.of());
    }

    /**
     * A unique index rejected a concurrent duplicate, e.g. a second open withdrawal.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.CONCURRENT_CHANGE, ErrorCode.CONCURRENT_CHANGE.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage(), Map.of());
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String message, Map<String, String> details) {
        return ResponseEntity.status(code.getStatus()).body(ErrorResponse.builder()
            .error(code.name())
            .code(code.getCode())
            .message(message)
            .details(details == null || details.isEmpty() ? null : details)
            .timestamp(clock.instant())
            .build());
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
