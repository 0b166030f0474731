package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Error body returned by the REST surface.
 *
 * @param field request field that failed validation, {@code null} when not field-specific
 */
public record ApiError(
    @JsonProperty("error")     String error,
    @JsonProperty("message")   String message,
    @JsonProperty("field")     String field,
    @JsonProperty("timestamp") Instant timestamp
) {}
