package com.sporewriter.exception;

import com.sporewriter.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 * Rule and mapping problems are client errors; nothing is returned but the reason.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MatchException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMatch(MatchException ex) {
        log.warn("Match rejected ({}): {}", ex.getError(), ex.getMessage());
        return badRequest("match", ex.getError().name(), ex.getMessage());
    }

    @ExceptionHandler(RewriteException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRewrite(RewriteException ex) {
        log.warn("Rewrite rejected ({}): {}", ex.getError(), ex.getMessage());
        String stage = ex.getError() == RewriteError.NODE_IDS_EXHAUSTED ? "rewrite" : "gluing";
        return badRequest(stage, ex.getError().name(), ex.getMessage());
    }

    @ExceptionHandler(InvalidGraphException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidGraph(InvalidGraphException ex) {
        log.warn("Invalid graph: {}", ex.getMessage());
        return badRequest("request", "INVALID_GRAPH", ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return badRequest("request", "VALIDATION_FAILED", "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnreadableBody(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return badRequest("request", "MALFORMED_REQUEST", ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        ErrorResponse error = ErrorResponse.builder()
                .detail("Internal server error: " + ex.getMessage())
                .error("INTERNAL")
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error));
    }

    private Mono<ResponseEntity<ErrorResponse>> badRequest(String stage, String code, String detail) {
        ErrorResponse error = ErrorResponse.builder()
                .detail(detail)
                .error(code)
                .stage(stage)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }
}
