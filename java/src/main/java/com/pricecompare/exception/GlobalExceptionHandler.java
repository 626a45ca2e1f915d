package com.pricecompare.exception;

import com.pricecompare.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 * Every failure is returned as {@code {success:false, error, traceId}}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Invalid request. " + errors);
    }

    @ExceptionHandler(SearchTimeoutException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSearchTimeout(SearchTimeoutException ex) {
        log.error("Search aborted: {}", ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request rejected: {}", ex.getMessage());
        return respond(ex.getStatusCode(), ex.getReason() != null ? ex.getReason() : ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error: " + ex.getMessage());
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatusCode status, String message) {
        ErrorResponse error = ErrorResponse.builder()
                .error(message)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
