package com.identityplatform.orchestrator.controller;

import com.identityplatform.common.exception.InvalidIdentificationRequestException;
import com.identityplatform.orchestrator.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

/**
 * Maps request-level failures to HTTP responses. Service failures never reach here: they are
 * recovered into a degraded decision.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidIdentificationRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidIdentificationRequestException ex) {
        log.warn("Rejected identification request. field={} reason={}", ex.getField(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("InvalidRequest", ex.getMessage(), ex.getField(), Instant.now()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleStatus(ResponseStatusException ex) {
        log.warn("Request failed. status={} reason={}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity
            .status(ex.getStatusCode())
            .body(new ApiError(ex.getClass().getSimpleName(), ex.getReason(), null, Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("InternalServerError", "An unexpected error occurred", null, Instant.now()));
    }
}
