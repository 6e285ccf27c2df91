package com.example.presence.shared.exception;

import com.example.presence.shared.config.CorrelationIdFilter;
import com.example.presence.shared.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LeaderboardAggregationException.class)
    public ResponseEntity<ErrorResponse> handleAggregationException(LeaderboardAggregationException ex, ServerWebExchange exchange) {
        log.error("Leaderboard aggregation failed for reference date {}: {}", ex.getReferenceDate(), ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), exchange);
    }

    @ExceptionHandler(DurationStoreException.class)
    public ResponseEntity<ErrorResponse> handleDurationStoreException(DurationStoreException ex, ServerWebExchange exchange) {
        log.error("DurationStoreException on path {}: {}", exchange.getRequest().getPath(), ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Rejected request on path {}: {}", exchange.getRequest().getPath(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = body(ex.getStatusCode().value(), ex.getStatusCode().toString(), ex.getReason(), exchange);

        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }

        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return new ResponseEntity<>(body(status.value(), error, message, exchange), status);
    }

    private static ErrorResponse body(int status, String error, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(status)
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .correlationId(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.HEADER))
                .build();
    }
}
