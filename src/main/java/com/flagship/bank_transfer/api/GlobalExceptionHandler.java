package com.flagship.bank_transfer.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_transfer.exception.BankingException;
import com.flagship.bank_transfer.exception.ErrorCode;
import com.flagship.bank_transfer.observability.CorrelationContext;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns banking failures into HTTP responses.
 *
 * <pre>
 * UNAUTHORIZED, INVALID_CREDENTIALS                         401
 * FORBIDDEN                                                 403
 * NOT_FOUND                                                 404
 * UNKNOWN_RECIPIENT, SELF_TRANSFER_NOT_ALLOWED, INVALID_AMOUNT  400
 * INVALID_IDEMPOTENCY_KEY                                   400
 * STORE_UNAVAILABLE                                         503
 * </pre>
 *
 * Every error body carries the request's correlation id so a customer report
 * can be matched to the service logs.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(BankingException.class)
    public ResponseEntity<ErrorResponse> handleBanking(BankingException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("{}: {}", e.getCode(), e.getMessage(), e.getCause());
        } else {
            log.warn("{}: {}", e.getCode(), e.getMessage());
        }
        return respond(status, e.getCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> fields.putIfAbsent(error.getField(),
                error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));
        log.warn("Request body rejected: {}", fields);
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be parsed", null);
    }

    /**
     * Store failures that escaped the facade's translation.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Ledger store failure outside the facade", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.STORE_UNAVAILABLE.name(),
                "Ledger store unavailable", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case UNAUTHORIZED, INVALID_CREDENTIALS -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNKNOWN_RECIPIENT, SELF_TRANSFER_NOT_ALLOWED, INVALID_AMOUNT, INVALID_IDEMPOTENCY_KEY ->
                    HttpStatus.BAD_REQUEST;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details)
                .correlationId(CorrelationContext.getCorrelationId())
                .timestamp(clock.instant())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        @JsonProperty("correlation_id")
        String correlationId;
        Instant timestamp;
    }
}
