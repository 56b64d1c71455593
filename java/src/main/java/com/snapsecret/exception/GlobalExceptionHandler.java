package com.snapsecret.exception;

import com.snapsecret.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SecretLifecycleException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSecretLifecycle(SecretLifecycleException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Secret operation failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Secret request rejected: {}", ex.getErrorCode().getCode());
        }
        return Mono.just(ResponseEntity.status(status).body(error(ex.getErrorCode().getCode(), ex.getMessage())));
    }

    @ExceptionHandler(IngestionRejectedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIngestionRejected(IngestionRejectedException ex) {
        log.warn("Ingestion rejected: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error("ingestion_rejected", ex.getMessage())));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(SecretErrorCode.VALIDATION_FAILED.getCode(), "Validation failed: " + errors)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMalformedInput(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(SecretErrorCode.VALIDATION_FAILED.getCode(), "Malformed request: " + ex.getReason())));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        log.debug("Request rejected with status {}", ex.getStatusCode());
        String code = ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                ? SecretErrorCode.NOT_FOUND.getCode()
                : "request_rejected";
        return Mono.just(ResponseEntity.status(ex.getStatusCode())
                .body(error(code, ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("internal_error", "Internal server error")));
    }

    static HttpStatus statusOf(SecretErrorCode code) {
        switch (code) {
            case VALIDATION_FAILED:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CHALLENGE_FAILED:
                return HttpStatus.FORBIDDEN;
            case STORAGE_FAILURE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ErrorResponse error(String code, String detail) {
        return ErrorResponse.builder()
                .error(code)
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
    }
}
